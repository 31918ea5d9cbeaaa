package works.glint.ast;

public record FloatLiteral(double value) implements AstValue {
}
