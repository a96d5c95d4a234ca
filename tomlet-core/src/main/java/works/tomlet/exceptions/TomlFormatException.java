package works.tomlet.exceptions;

/**
 * The input text could not be parsed.
 * <p>
 * Parsing stops at the first offending token,
 * whose position is reported by {@link #offset()}.
 * Offsets are in the units of the underlying cursor:
 * chars for text input, bytes for UTF-8 input.
 */
public sealed abstract class TomlFormatException extends TomlException permits
	UnterminatedStringException,
	UnexpectedTokenException,
	DuplicateKeyException
{
	private final long offset;

	protected TomlFormatException(String message, long offset) {
		super(message + " at offset " + offset);
		this.offset = offset;
	}

	public long offset() {
		return offset;
	}
}
