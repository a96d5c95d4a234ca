package works.tomlet.codec;

/**
 * A syntactically significant element of TOML text.
 * <p>
 * Tokens don't carry their text; they describe where it is.
 * Use {@link TomlReader#text(Token)} to get it.
 *
 * @param offset where the token's text starts, in cursor units.
 *               For quoted text, this is just past the opening quote.
 * @param length how many cursor units of text the token covers, excluding any quotes
 * @param quoted true if the text was enclosed in single or double quotes
 */
public record Token(int offset, int length, Kind kind, boolean quoted) {
	public Token {
		if (length < 0) {
			throw new IllegalArgumentException("Token length must be non-negative, got " + length);
		}
	}

	public static Token punctuation(int offset, Kind kind) {
		return new Token(offset, 1, kind, false);
	}

	public static Token endText(int offset) {
		return new Token(offset, 0, Kind.END_TEXT, false);
	}

	public boolean is(Kind kind) {
		return this.kind == kind;
	}

	public enum Kind {
		/**
		 * Bare or quoted text. Keys, values, and table names are all text;
		 * we don't distinguish at the token level.
		 */
		TEXT,
		COMMENT_PREFIX,
		EQUALS,
		COMMA,

		/**
		 * Starts an array or a table header.
		 */
		START_ARRAY,
		END_ARRAY,
		START_INLINE_TABLE,
		END_INLINE_TABLE,
		END_TEXT;

		public static final String PUNCTUATION = "#=,[]{}";

		/**
		 * @return the single-character token starting with this code point,
		 * or null if it doesn't start one
		 */
		public static Kind punctuation(int codePoint) {
			return switch (codePoint) {
				case '#' -> COMMENT_PREFIX;
				case '=' -> EQUALS;
				case ',' -> COMMA;
				case '[' -> START_ARRAY;
				case ']' -> END_ARRAY;
				case '{' -> START_INLINE_TABLE;
				case '}' -> END_INLINE_TABLE;
				default -> null;
			};
		}

		/**
		 * @return true for tokens that are always represented with the same text
		 */
		public boolean hasFixedRepresentation() {
			return this != TEXT;
		}

		public String fixedRepresentation() {
			return switch (this) {
				case COMMENT_PREFIX -> "#";
				case EQUALS -> "=";
				case COMMA -> ",";
				case START_ARRAY -> "[";
				case END_ARRAY -> "]";
				case START_INLINE_TABLE -> "{";
				case END_INLINE_TABLE -> "}";
				case END_TEXT -> "";
				case TEXT ->
					throw new IllegalArgumentException("Token has no fixed representation: " + this);
			};
		}
	}
}
