/**
 * Conversion between {@link works.glint.Value}s and application types.
 * <p>
 * A type takes part by having a {@link works.glint.marshal.ToValue},
 * a {@link works.glint.marshal.FromValue}, or both in the form of a
 * {@link works.glint.marshal.Marshaller}.
 * {@link works.glint.marshal.Marshallers} has the built-in ones,
 * from which marshallers for application types are typically composed.
 */
package works.glint.marshal;
