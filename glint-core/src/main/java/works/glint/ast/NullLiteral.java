package works.glint.ast;

public record NullLiteral() implements AstValue {
	public static final NullLiteral NULL = new NullLiteral();
}
