package works.glint.exceptions;

import works.glint.ListValue;

/**
 * The value is a list, as expected, but a non-empty one was required.
 */
public final class EmptyListException extends ValueConversionException {
	private final ListValue actual;

	public EmptyListException(ListValue actual) {
		super("Cannot construct NonEmptyList from empty list");
		this.actual = actual;
	}

	public ListValue actual() {
		return actual;
	}
}
