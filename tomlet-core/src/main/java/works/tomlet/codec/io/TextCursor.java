package works.tomlet.codec.io;

/**
 * A position within some encoded text, plus random-access decoding.
 * <p>
 * Positions and lengths are in "units" whose meaning depends on the encoding:
 * chars for UTF-16, bytes for UTF-8.
 * Decoding never moves the cursor; only {@link #advance} does.
 */
public sealed interface TextCursor permits CharArrayCursor, Utf8Cursor {
	int position();

	/**
	 * @return the total number of units in the text
	 */
	int length();

	/**
	 * @param position must be less than {@link #length()}
	 * @return the code point starting at the given position
	 */
	int codePointAt(int position);

	/**
	 * @return the number of units occupied by the code point starting at the given position
	 */
	int widthAt(int position);

	void advance(int units);

	/**
	 * @return the decoded text of the given range of units
	 */
	String text(int start, int length);
}
