package works.tomlet.codec.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tomlet.codec.TomlReader;
import works.tomlet.codec.Token;
import works.tomlet.exceptions.UnterminatedStringException;

import static java.lang.Math.min;
import static java.util.Objects.requireNonNull;
import static works.tomlet.codec.Token.Kind.TEXT;

/**
 * The {@link TomlReader} implementation.
 * Scans tokens from a {@link TextCursor} lazily, one at a time.
 * <p>
 * The most recently peeked token is remembered along with the cursor position
 * just past it, so {@link #readToken()} never rescans and
 * peek and read can't disagree about token boundaries.
 */
public final class CursorTomlReader implements TomlReader {
	private final TextCursor cursor;

	/**
	 * Null if we haven't peeked since the last read.
	 */
	private Token peeked = null;

	/**
	 * Where the cursor goes when {@link #peeked} is read.
	 * Not necessarily the end of the token's text:
	 * quoted text is followed by its closing quote,
	 * and text terminated by {@code =} may have had whitespace trimmed.
	 */
	private int peekedEnd;

	public CursorTomlReader(TextCursor cursor) {
		this.cursor = requireNonNull(cursor);
	}

	@Override
	public Token peekToken() {
		if (peeked == null) {
			scan();
		}
		return peeked;
	}

	@Override
	public Token readToken() {
		Token token = peekToken();
		cursor.advance(peekedEnd - cursor.position());
		peeked = null;
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("readToken {} |{}|", token, text(token));
		}
		return token;
	}

	@Override
	public String text(Token token) {
		if (token.kind().hasFixedRepresentation()) {
			return token.kind().fixedRepresentation();
		} else {
			return cursor.text(token.offset(), token.length());
		}
	}

	@Override
	public void skipToEndOfLine() {
		peeked = null;
		int pos = cursor.position();
		int length = cursor.length();
		while (pos < length) {
			int c = cursor.codePointAt(pos);
			if (Chars.isEndOfLine(c)) {
				break;
			}
			pos += cursor.widthAt(pos);
		}
		cursor.advance(pos - cursor.position());
	}

	@Override
	public String previewString(int requestedLength) {
		int start = cursor.position();
		int actualLength = min(requestedLength, cursor.length() - start);
		return cursor.text(start, actualLength);
	}

	@Override
	public long currentOffset() {
		return cursor.position();
	}

	@Override
	public void close() {

	}

	private void scan() {
		int pos = cursor.position();
		int length = cursor.length();
		while (pos < length) {
			int c = cursor.codePointAt(pos);
			int width = cursor.widthAt(pos);
			if (Chars.isWhitespace(c)) {
				pos += width;
				continue;
			}
			Token.Kind punctuation = Token.Kind.punctuation(c);
			if (punctuation != null) {
				found(Token.punctuation(pos, punctuation), pos + width);
			} else if (Chars.isQuote(c)) {
				scanQuoted(c, pos, pos + width);
			} else {
				scanBare(pos);
			}
			return;
		}
		found(Token.endText(length), length);
	}

	private void scanQuoted(int quote, int openingQuote, int start) {
		int pos = start;
		int length = cursor.length();
		while (pos < length) {
			int c = cursor.codePointAt(pos);
			int width = cursor.widthAt(pos);
			if (c == quote) {
				found(new Token(start, pos - start, TEXT, true), pos + width);
				return;
			}
			pos += width;
		}
		throw new UnterminatedStringException((char) quote, openingQuote);
	}

	/**
	 * Bare text runs to the end of the line or the next punctuation character.
	 * If that's {@code =}, the text is a key, and trailing whitespace is not part of it.
	 */
	private void scanBare(int start) {
		int pos = start;
		int significantEnd = start;
		int length = cursor.length();
		while (pos < length) {
			int c = cursor.codePointAt(pos);
			if (Chars.isEndOfLine(c) || Chars.isPunctuation(c)) {
				int end = (c == '=') ? significantEnd : pos;
				found(new Token(start, end - start, TEXT, false), pos);
				return;
			}
			pos += cursor.widthAt(pos);
			if (!Chars.isWhitespace(c)) {
				significantEnd = pos;
			}
		}
		found(new Token(start, pos - start, TEXT, false), pos);
	}

	private void found(Token token, int end) {
		peeked = token;
		peekedEnd = end;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CursorTomlReader.class);
}
