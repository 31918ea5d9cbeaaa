package works.glint.jackson;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class JacksonSerializerSettings {
	/**
	 * GraphQL floats are always finite, but a {@code double} need not be.
	 * JSON has no way to write {@code NaN} or the infinities as numbers.
	 */
	@Default NonFiniteFloatMode nonFiniteFloats = NonFiniteFloatMode.FAIL;

	/**
	 * What to do with a JSON integer that doesn't fit in a GraphQL {@code Int},
	 * which is 32 bits.
	 */
	@Default IntegerOverflowMode integerOverflow = IntegerOverflowMode.FAIL;

	public enum NonFiniteFloatMode {
		/**
		 * Refuse to serialize the value.
		 */
		FAIL,

		/**
		 * Write the value as a JSON string: {@code "NaN"}, {@code "Infinity"}, or {@code "-Infinity"}.
		 * These read back as strings, not floats.
		 */
		WRITE_AS_STRING,
	}

	public enum IntegerOverflowMode {
		FAIL,

		/**
		 * Read the number as a {@link works.glint.FloatValue FloatValue},
		 * which may lose precision for very large integers.
		 */
		READ_AS_FLOAT,
	}

	public static JacksonSerializerSettings defaults() {
		return DEFAULTS;
	}

	private static final JacksonSerializerSettings DEFAULTS = builder().build();
}
