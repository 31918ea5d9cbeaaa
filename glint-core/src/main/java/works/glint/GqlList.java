package works.glint;

import java.util.List;

/**
 * The payload of a {@link ListValue}: an immutable sequence of values.
 */
public record GqlList(List<Value> values) {
	public GqlList {
		values = List.copyOf(values);
	}

	public static GqlList of(Value... values) {
		return new GqlList(List.of(values));
	}

	public static GqlList empty() {
		return EMPTY;
	}

	public int size() {
		return values.size();
	}

	public boolean isEmpty() {
		return values.isEmpty();
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof GqlList that
			&& ValueOrdering.compareElements(this.values, that.values) == 0;
	}

	@Override
	public int hashCode() {
		return ValueOrdering.hash(new ListValue(this));
	}

	@Override
	public String toString() {
		return ValueRendering.render(new ListValue(this), TO_STRING_LIMIT);
	}

	static final int TO_STRING_LIMIT = 10_000;
	private static final GqlList EMPTY = new GqlList(List.of());
}
