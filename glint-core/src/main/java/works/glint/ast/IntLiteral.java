package works.glint.ast;

public record IntLiteral(int value) implements AstValue {
}
