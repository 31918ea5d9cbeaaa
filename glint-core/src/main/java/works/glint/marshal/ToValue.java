package works.glint.marshal;

import java.util.List;
import java.util.Optional;
import works.glint.GqlList;
import works.glint.ListValue;
import works.glint.NullValue;
import works.glint.Value;
import works.glint.util.NonEmptyList;

/**
 * Turns a native value of type {@code T} into a GraphQL {@link Value}.
 * Every {@code T} has a GraphQL representation, so this never fails.
 *
 * @see Marshallers for the built-in instances
 */
@FunctionalInterface
public interface ToValue<T> {
	Value toValue(T value);

	static <T> ToValue<List<T>> list(ToValue<? super T> elements) {
		return values -> new ListValue(new GqlList(values.stream()
			.<Value>map(elements::toValue)
			.toList()));
	}

	static <T> ToValue<NonEmptyList<T>> nonEmptyList(ToValue<? super T> elements) {
		ToValue<List<T>> asList = list(elements);
		return values -> asList.toValue(values.asList());
	}

	/**
	 * {@link Optional#empty() empty} becomes {@link NullValue#NULL null}.
	 */
	static <T> ToValue<Optional<T>> optional(ToValue<? super T> present) {
		return value -> value.<Value>map(present::toValue).orElse(NullValue.NULL);
	}
}
