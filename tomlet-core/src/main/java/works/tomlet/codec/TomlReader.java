package works.tomlet.codec;

import works.tomlet.codec.io.CharArrayCursor;
import works.tomlet.codec.io.CursorTomlReader;
import works.tomlet.codec.io.Utf8Cursor;
import works.tomlet.exceptions.UnexpectedTokenException;
import works.tomlet.exceptions.UnterminatedStringException;

/**
 * Splits TOML text into {@link Token tokens}, one at a time, on demand.
 * <p>
 * The only state is the position of the underlying cursor.
 * {@link #peekToken()} never moves it;
 * {@link #readToken()} moves it past exactly the token that
 * {@link #peekToken()} would have returned.
 * Parsers share one reader and take turns consuming from it.
 */
public sealed interface TomlReader extends AutoCloseable permits CursorTomlReader {
	@Override void close(); // No throws Exception

	static TomlReader create(String text) {
		return create(text.toCharArray());
	}

	static TomlReader create(char[] utf16Chars) {
		return new CursorTomlReader(new CharArrayCursor(utf16Chars));
	}

	/**
	 * Token offsets from this reader are byte offsets.
	 */
	static TomlReader create(byte[] utf8Bytes) {
		return new CursorTomlReader(new Utf8Cursor(utf8Bytes));
	}

	/**
	 * Skips whitespace and returns the next token without consuming it.
	 * Calling this repeatedly returns the same token.
	 * At the end of the input, returns a {@link Token.Kind#END_TEXT END_TEXT} token.
	 *
	 * @throws UnterminatedStringException if the next token is a quoted string with no closing quote
	 */
	Token peekToken();

	/**
	 * Returns the same token as {@link #peekToken()} and advances past it.
	 * Reading at the end of the input returns {@link Token.Kind#END_TEXT END_TEXT} again
	 * and leaves the reader where it is.
	 */
	Token readToken();

	/**
	 * Reads the next token, which must be of the given kind.
	 *
	 * @throws UnexpectedTokenException if it isn't
	 */
	default Token expect(Token.Kind expected, String context) {
		Token actual = peekToken();
		if (actual.kind() != expected) {
			throw new UnexpectedTokenException("Expected " + expected + " " + context + ", but got " + actual.kind(), actual.offset());
		}
		return readToken();
	}

	/**
	 * Consumes a {@code #} and the rest of its line.
	 */
	default void skipComment() {
		expect(Token.Kind.COMMENT_PREFIX, "to start a comment");
		skipToEndOfLine();
	}

	/**
	 * @return the text of the given token, which must have come from this reader.
	 * Quotes are not included.
	 */
	String text(Token token);

	/**
	 * Discards everything up to the end of the current line.
	 * Used to skip comments, whose text may contain punctuation.
	 */
	void skipToEndOfLine();

	/**
	 * On a best-effort basis, return the upcoming characters in the input.
	 */
	String previewString(int requestedLength);

	/**
	 * @return the cursor position. Useful for diagnostics.
	 */
	long currentOffset();
}
