package works.glint.ast;

import works.glint.Name;

import static java.util.Objects.requireNonNull;

public record EnumLiteral(Name name) implements AstValue {
	public EnumLiteral {
		requireNonNull(name);
	}
}
