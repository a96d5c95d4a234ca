package works.tomlet.codec.io;

import works.tomlet.codec.Token;

public final class Chars {
	public static final int BYTE_ORDER_MARK = 0xFEFF;

	private Chars() {}

	/**
	 * Line breaks count as whitespace; so does a byte order mark, wherever it appears.
	 */
	public static boolean isWhitespace(int codePoint) {
		return isEndOfLine(codePoint) || codePoint == ' ' || codePoint == '\t' || codePoint == BYTE_ORDER_MARK;
	}

	public static boolean isEndOfLine(int codePoint) {
		return codePoint == '\n' || codePoint == '\r';
	}

	public static boolean isPunctuation(int codePoint) {
		return Token.Kind.punctuation(codePoint) != null;
	}

	public static boolean isQuote(int codePoint) {
		return codePoint == '"' || codePoint == '\'';
	}
}
