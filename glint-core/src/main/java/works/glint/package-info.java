/**
 * The canonical value model, rooted at {@link works.glint.Value}.
 * <p>
 * Objects are {@link works.glint.GqlObject}s: immutable, with unique field names
 * kept in insertion order.
 */
package works.glint;
