package works.glint.exceptions;

/**
 * A {@link works.glint.Value Value} does not have the shape that a native type requires.
 * <p>
 * This is the boundary where untrusted input becomes typed application data,
 * so it's a checked exception: callers are expected to recover.
 */
public sealed abstract class ValueConversionException extends Exception permits
	WrongTypeException,
	EmptyListException
{
	protected ValueConversionException(String message) {
		super(message);
	}
}
