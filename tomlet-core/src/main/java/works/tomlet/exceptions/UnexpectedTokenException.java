package works.tomlet.exceptions;

/**
 * The parser needed one kind of token and found another,
 * including running out of input inside a container.
 */
public final class UnexpectedTokenException extends TomlFormatException {
	public UnexpectedTokenException(String message, long offset) {
		super(message, offset);
	}
}
