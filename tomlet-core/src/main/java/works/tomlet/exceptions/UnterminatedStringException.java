package works.tomlet.exceptions;

/**
 * A quoted string ran into the end of the input before its closing quote.
 */
public final class UnterminatedStringException extends TomlFormatException {
	public UnterminatedStringException(char quote, long offset) {
		super("Unterminated string literal starting with " + quote, offset);
	}
}
