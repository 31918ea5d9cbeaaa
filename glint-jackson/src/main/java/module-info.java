/**
 * Serializer implementation that uses the Jackson library to convert Glint values to and from JSON.
 * <p>
 * See {@link works.glint.jackson.JacksonSerializer} for the main entry point.
 */
module works.glint.jackson {
	requires transitive tools.jackson.core;
	requires transitive tools.jackson.databind;
	requires org.slf4j;
	requires transitive works.glint.core;

	requires static lombok;

	exports works.glint.jackson;
}
