package works.glint.marshal;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import works.glint.ListValue;
import works.glint.NullValue;
import works.glint.Value;
import works.glint.exceptions.EmptyListException;
import works.glint.exceptions.ValueConversionException;
import works.glint.exceptions.WrongTypeException;
import works.glint.util.NonEmptyList;

/**
 * Converts an already-parsed {@link Value} into a native value of type {@code T},
 * generally to be passed to a handler.
 * <p>
 * This is the boundary between incoming data and application types,
 * so failure is expected and always reported as a {@link ValueConversionException}.
 *
 * @see Marshallers for the built-in instances
 */
@FunctionalInterface
public interface FromValue<T> {
	T fromValue(Value value) throws ValueConversionException;

	/**
	 * Converts each element in order, stopping at the first one that fails.
	 */
	static <T> FromValue<List<T>> list(FromValue<? extends T> elements) {
		return value -> {
			if (value instanceof ListValue l) {
				List<T> result = new ArrayList<>(l.list().size());
				for (Value element : l.list().values()) {
					result.add(elements.fromValue(element));
				}
				return result;
			} else {
				throw new WrongTypeException("List", value);
			}
		};
	}

	static <T> FromValue<NonEmptyList<T>> nonEmptyList(FromValue<? extends T> elements) {
		FromValue<List<T>> asList = list(elements);
		return value -> {
			if (value instanceof ListValue l && l.list().isEmpty()) {
				throw new EmptyListException(l);
			}
			return new NonEmptyList<>(asList.fromValue(value));
		};
	}

	/**
	 * {@link NullValue null} becomes {@link Optional#empty() empty};
	 * anything else must be convertible by <code>present</code>.
	 */
	static <T> FromValue<Optional<T>> optional(FromValue<? extends T> present) {
		return value -> {
			if (value instanceof NullValue) {
				return Optional.empty();
			} else {
				return Optional.of(present.fromValue(value));
			}
		};
	}
}
