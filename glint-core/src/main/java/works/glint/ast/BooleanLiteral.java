package works.glint.ast;

public record BooleanLiteral(boolean value) implements AstValue {
}
