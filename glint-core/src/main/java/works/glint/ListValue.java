package works.glint;

import static java.util.Objects.requireNonNull;

public record ListValue(GqlList list) implements Value {
	public ListValue {
		requireNonNull(list);
	}
}
