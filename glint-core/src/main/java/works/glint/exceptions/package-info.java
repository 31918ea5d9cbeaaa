/**
 * Failures of {@link works.glint.marshal.FromValue FromValue} conversions,
 * rooted at {@link works.glint.exceptions.ValueConversionException}.
 */
package works.glint.exceptions;
