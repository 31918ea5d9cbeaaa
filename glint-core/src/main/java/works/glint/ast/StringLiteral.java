package works.glint.ast;

import static java.util.Objects.requireNonNull;

public record StringLiteral(String value) implements AstValue {
	public StringLiteral {
		requireNonNull(value);
	}
}
