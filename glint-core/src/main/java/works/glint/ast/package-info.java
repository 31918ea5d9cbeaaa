/**
 * Value nodes as a query parser produces them, and {@link works.glint.ast.AstBridge}
 * for converting them to and from canonical values.
 */
package works.glint.ast;
