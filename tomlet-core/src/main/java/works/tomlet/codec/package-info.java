/**
 * Low-level TOML text handling: {@link works.tomlet.codec.TomlReader tokenizing},
 * {@link works.tomlet.codec.ValueInference deciding scalar types},
 * and {@link works.tomlet.codec.TomlFormat formatting scalars}.
 */
package works.tomlet.codec;
