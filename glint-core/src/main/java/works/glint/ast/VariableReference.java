package works.glint.ast;

import works.glint.Name;

import static java.util.Objects.requireNonNull;

/**
 * A reference to a query variable, like {@code $id}.
 * It has no literal value of its own.
 */
public record VariableReference(Name name) implements AstValue {
	public VariableReference {
		requireNonNull(name);
	}
}
