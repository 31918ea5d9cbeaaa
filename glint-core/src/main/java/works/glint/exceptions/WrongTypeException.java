package works.glint.exceptions;

import works.glint.Value;

/**
 * The value is a different variant from the one the native type is built from.
 */
public final class WrongTypeException extends ValueConversionException {
	private final String expectedType;
	private final Value actual;

	public WrongTypeException(String expectedType, Value actual) {
		super("Wrong type, should be " + expectedType + ": " + actual.toLiteral(MESSAGE_LIMIT));
		this.expectedType = expectedType;
		this.actual = actual;
	}

	public String expectedType() {
		return expectedType;
	}

	/**
	 * @return the whole offending value; the message shows only the start of it
	 */
	public Value actual() {
		return actual;
	}

	private static final int MESSAGE_LIMIT = 200;
}
