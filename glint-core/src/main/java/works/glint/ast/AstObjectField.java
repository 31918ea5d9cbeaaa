package works.glint.ast;

import works.glint.Name;

import static java.util.Objects.requireNonNull;

public record AstObjectField(Name name, AstValue value) {
	public AstObjectField {
		requireNonNull(name);
		requireNonNull(value);
	}
}
