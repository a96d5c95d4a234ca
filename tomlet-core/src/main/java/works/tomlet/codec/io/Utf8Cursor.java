package works.tomlet.codec.io;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * A {@link TextCursor} over UTF-8 bytes. Positions are byte offsets.
 * <p>
 * Malformed or truncated sequences decode as U+FFFD one byte at a time,
 * so scanning always makes progress.
 */
public final class Utf8Cursor implements TextCursor {
	static final int REPLACEMENT_CHARACTER = 0xFFFD;

	final byte[] bytes;
	int pos = 0;

	public Utf8Cursor(byte[] bytes) {
		this.bytes = requireNonNull(bytes);
	}

	@Override
	public int position() {
		return pos;
	}

	@Override
	public int length() {
		return bytes.length;
	}

	@Override
	public int codePointAt(int position) {
		int b0 = bytes[position] & 0xFF;
		int width = widthAt(position);
		return switch (width) {
			case 1 -> (b0 < 0x80) ? b0 : REPLACEMENT_CHARACTER;
			case 2 -> ((b0 & 0x1F) << 6) | continuation(position + 1);
			case 3 -> ((b0 & 0x0F) << 12) | (continuation(position + 1) << 6) | continuation(position + 2);
			case 4 -> ((b0 & 0x07) << 18) | (continuation(position + 1) << 12) | (continuation(position + 2) << 6) | continuation(position + 3);
			default -> throw new IllegalStateException("Unexpected UTF-8 width " + width);
		};
	}

	@Override
	public int widthAt(int position) {
		int b0 = bytes[position] & 0xFF;
		int width;
		if (b0 < 0x80) {
			return 1;
		} else if ((b0 & 0xE0) == 0xC0) {
			width = 2;
		} else if ((b0 & 0xF0) == 0xE0) {
			width = 3;
		} else if ((b0 & 0xF8) == 0xF0) {
			width = 4;
		} else {
			return 1; // Stray continuation byte or invalid lead byte
		}
		if (position + width > bytes.length) {
			return 1;
		}
		for (int i = 1; i < width; i++) {
			if ((bytes[position + i] & 0xC0) != 0x80) {
				return 1;
			}
		}
		return width;
	}

	private int continuation(int position) {
		return bytes[position] & 0x3F;
	}

	@Override
	public void advance(int units) {
		if (units < 0 || pos + units > bytes.length) {
			throw new IllegalArgumentException("Cannot advance " + units + " from " + pos + " of " + bytes.length);
		}
		pos += units;
	}

	@Override
	public String text(int start, int length) {
		return new String(bytes, start, length, UTF_8);
	}
}
