package works.tomlet.codec.io;

import static java.util.Objects.requireNonNull;

/**
 * A {@link TextCursor} over UTF-16 text that has already been loaded into memory,
 * like the contents of a String.
 */
public final class CharArrayCursor implements TextCursor {
	final char[] chars;
	int pos = 0;

	public CharArrayCursor(char[] chars) {
		this.chars = requireNonNull(chars);
	}

	@Override
	public int position() {
		return pos;
	}

	@Override
	public int length() {
		return chars.length;
	}

	@Override
	public int codePointAt(int position) {
		return Character.codePointAt(chars, position);
	}

	@Override
	public int widthAt(int position) {
		return Character.charCount(codePointAt(position));
	}

	@Override
	public void advance(int units) {
		if (units < 0 || pos + units > chars.length) {
			throw new IllegalArgumentException("Cannot advance " + units + " from " + pos + " of " + chars.length);
		}
		pos += units;
	}

	@Override
	public String text(int start, int length) {
		return new String(chars, start, length);
	}
}
