package works.glint;

/**
 * Equality follows {@link Double#compare}, as it does for any record,
 * so {@code NaN} equals itself and {@code 0.0} differs from {@code -0.0}.
 */
public record FloatValue(double value) implements Value {
}
