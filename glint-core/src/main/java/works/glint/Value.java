package works.glint;

import java.util.Optional;

/**
 * A concrete GraphQL literal value: the form that query and response data takes
 * once every variable has been resolved.
 * <p>
 * The set of variants is closed. Values are immutable trees with structural
 * {@link Object#equals equality} and a total {@link #compareTo ordering}
 * that ranks variants in the order they appear in the {@code permits} clause,
 * then compares payloads.
 * <p>
 * Equality, hashing, ordering and {@code toString} don't recurse,
 * so they work on values nested arbitrarily deep.
 * <p>
 * Note that {@link ListValue lists} may be heterogeneous.
 * GraphQL itself forbids that, but nothing here enforces it.
 */
public sealed interface Value extends Comparable<Value> permits
	IntValue,
	FloatValue,
	BooleanValue,
	StringValue,
	EnumValue,
	ListValue,
	ObjectValue,
	NullValue
{
	/**
	 * @return the payload if this is an {@link ObjectValue}; otherwise empty.
	 */
	default Optional<GqlObject> toObject() {
		return Optional.empty();
	}

	/**
	 * @return this value in GraphQL literal syntax, cut short with "..."
	 * once it runs past <code>maxLength</code> characters
	 */
	default String toLiteral(int maxLength) {
		return ValueRendering.render(this, maxLength);
	}

	@Override
	default int compareTo(Value other) {
		return ValueOrdering.compare(this, other);
	}

	static IntValue of(int value) {
		return new IntValue(value);
	}

	static FloatValue of(double value) {
		return new FloatValue(value);
	}

	static BooleanValue of(boolean value) {
		return new BooleanValue(value);
	}

	static StringValue of(String text) {
		return new StringValue(new GqlString(text));
	}

	static EnumValue enumOf(Name name) {
		return new EnumValue(name);
	}

	static ListValue list(Value... elements) {
		return new ListValue(GqlList.of(elements));
	}

	static NullValue nullValue() {
		return NullValue.NULL;
	}
}
