package works.glint;

import static java.util.Objects.requireNonNull;

/**
 * A single named field, the unit from which a {@link GqlObject} is built.
 */
public record ObjectField(Name name, Value value) {
	public ObjectField {
		requireNonNull(name);
		requireNonNull(value);
	}
}
