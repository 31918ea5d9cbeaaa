package works.glint.marshal;

import works.glint.Value;
import works.glint.exceptions.ValueConversionException;

/**
 * Both directions of conversion for one native type.
 * Types that implement both should round-trip:
 * {@code fromValue(toValue(x))} equals {@code x}.
 */
public interface Marshaller<T> extends ToValue<T>, FromValue<T> {

	static <T> Marshaller<T> of(ToValue<T> to, FromValue<T> from) {
		return new Marshaller<>() {
			@Override
			public Value toValue(T value) {
				return to.toValue(value);
			}

			@Override
			public T fromValue(Value value) throws ValueConversionException {
				return from.fromValue(value);
			}
		};
	}
}
