/**
 * Tomlet reads and writes a practical subset of TOML.
 * <p>
 * See {@link works.tomlet.TomlDocument} for the main entry point.
 * <p>
 * The packages are:
 *
 * <ul>
 *     <li>
 *         {@link works.tomlet}, the document tree and its parsers;
 *     </li>
 *     <li>
 *         {@link works.tomlet.codec}, the tokenizer, scalar inference, and scalar formatting;
 *     </li>
 *     <li>
 *         {@link works.tomlet.codec.io}, the cursors that feed the tokenizer; and
 *     </li>
 *     <li>
 *         {@link works.tomlet.exceptions}.
 *     </li>
 * </ul>
 */
module works.tomlet.core {
	requires org.slf4j;

	requires static lombok;

	exports works.tomlet;
	exports works.tomlet.codec;
	exports works.tomlet.codec.io;
	exports works.tomlet.exceptions;
}
