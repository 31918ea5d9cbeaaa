/**
 * Canonical GraphQL literal values and the conversions around them.
 * <p>
 * Start with {@link works.glint the root package} for the value model.
 * Additional packages provide the bridge from parsed query syntax ({@link works.glint.ast}),
 * conversion to and from application types ({@link works.glint.marshal}),
 * conversion failures ({@link works.glint.exceptions}),
 * and the collections the model is built on ({@link works.glint.util}).
 */
module works.glint.core {
	requires transitive org.jetbrains.annotations;
	requires org.pcollections;
	requires org.slf4j;

	exports works.glint;
	exports works.glint.ast;
	exports works.glint.exceptions;
	exports works.glint.marshal;
	exports works.glint.util;
}
