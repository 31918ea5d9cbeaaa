package works.glint;

import static java.util.Objects.requireNonNull;

public record EnumValue(Name name) implements Value {
	public EnumValue {
		requireNonNull(name);
	}
}
