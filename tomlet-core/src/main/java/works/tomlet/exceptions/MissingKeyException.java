package works.tomlet.exceptions;

public final class MissingKeyException extends TomlAccessException {
	private final String key;

	public MissingKeyException(String key, String container) {
		super("Key `" + key + "` is missing in " + container);
		this.key = key;
	}

	public String key() {
		return key;
	}
}
