/**
 * The TOML document tree.
 * <p>
 * Start with {@link works.tomlet.TomlDocument#parse(java.lang.String)} to read text,
 * or {@link works.tomlet.TomlDocument#create()} to build a document in code.
 * Every node has at most one parent; adding a node to a second one throws.
 */
package works.tomlet;
