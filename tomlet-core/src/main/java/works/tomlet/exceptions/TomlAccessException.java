package works.tomlet.exceptions;

/**
 * A strict accessor was asked for something that isn't there,
 * or for a value of the wrong type.
 * The non-throwing {@code tryGet...} variants exist for callers
 * that would rather check.
 */
public sealed abstract class TomlAccessException extends TomlException permits
	MissingKeyException,
	MissingTableException,
	TypeMismatchException
{
	protected TomlAccessException(String message) {
		super(message);
	}
}
