package works.glint;

/**
 * The GraphQL {@code null}.
 * All instances are equal; use {@link #NULL}.
 */
public record NullValue() implements Value {
	public static final NullValue NULL = new NullValue();

	@Override
	public String toString() {
		return "null";
	}
}
