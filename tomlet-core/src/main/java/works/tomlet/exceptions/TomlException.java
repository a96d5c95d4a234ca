package works.tomlet.exceptions;

/**
 * Root of every exception thrown by Tomlet.
 * <p>
 * {@link TomlFormatException} covers problems with the input text;
 * {@link TomlAccessException} covers asking a document for something it doesn't have.
 */
public sealed abstract class TomlException extends RuntimeException permits TomlFormatException, TomlAccessException {
	protected TomlException(String message) {
		super(message);
	}

	protected TomlException(String message, Throwable cause) {
		super(message, cause);
	}
}
