package works.tomlet.exceptions;

public final class MissingTableException extends TomlAccessException {
	private final String name;

	public MissingTableException(String name) {
		super("Table `" + name + "` is missing in TOML document");
		this.name = name;
	}

	public String name() {
		return name;
	}
}
