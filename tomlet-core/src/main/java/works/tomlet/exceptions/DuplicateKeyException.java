package works.tomlet.exceptions;

/**
 * Thrown only when the parser is configured to
 * {@link works.tomlet.TomlSettings.DuplicateKeyPolicy#REJECT reject} duplicate keys.
 */
public final class DuplicateKeyException extends TomlFormatException {
	private final String key;

	public DuplicateKeyException(String key, String container, long offset) {
		super("Duplicate key `" + key + "` in " + container, offset);
		this.key = key;
	}

	public String key() {
		return key;
	}
}
