/**
 * Cursor-level plumbing for reading TOML text.
 * The main abstraction is {@link works.tomlet.codec.TomlReader};
 * this package supplies its implementation and the
 * {@link works.tomlet.codec.io.TextCursor cursors} it reads from.
 * Not really meant to be used directly;
 * {@link works.tomlet.TomlDocument#parse} is the usual entry point.
 */
package works.tomlet.codec.io;
