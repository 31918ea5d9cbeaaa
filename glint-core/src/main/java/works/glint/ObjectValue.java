package works.glint;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

public record ObjectValue(GqlObject object) implements Value {
	public ObjectValue {
		requireNonNull(object);
	}

	@Override
	public Optional<GqlObject> toObject() {
		return Optional.of(object);
	}
}
