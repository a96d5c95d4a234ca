/**
 * Converts Tomlet documents to Jackson JSON trees.
 * <p>
 * See {@link works.tomlet.jackson.TomlJsonConverter}.
 */
module works.tomlet.jackson {
	requires transitive tools.jackson.databind;
	requires org.slf4j;
	requires transitive works.tomlet.core;

	exports works.tomlet.jackson;
}
