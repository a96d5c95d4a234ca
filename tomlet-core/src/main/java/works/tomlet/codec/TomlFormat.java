package works.tomlet.codec;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Locale;
import works.tomlet.TomlValue;
import works.tomlet.codec.io.Chars;

import static java.time.format.DateTimeFormatter.ISO_LOCAL_DATE_TIME;

/**
 * Renders keys and scalar values as TOML text that {@link TomlReader}
 * and {@link ValueInference} will read back as the same thing.
 * <p>
 * No escape sequences are produced. Text that needs quoting is wrapped in
 * double quotes, or single quotes if it contains a double quote.
 */
public final class TomlFormat {
	private TomlFormat() {}

	/**
	 * Largest magnitude at which every integer is exactly representable as a double.
	 */
	private static final double MAX_EXACT_INTEGER = 0x1p53;

	public static String scalar(TomlValue value) {
		return switch (value.type()) {
			case TEXT -> text(value.asText());
			case NUMBER -> number(value.asNumber());
			case BOOLEAN -> value.asBoolean() ? "true" : "false";
			case DATE_TIME -> dateTime(value.asDateTime());
			case TIME_SPAN -> timeSpan(value.asTimeSpan());
			case ARRAY, TABLE ->
				throw new IllegalArgumentException("Not a scalar: " + value.type());
		};
	}

	/**
	 * Text is quoted if it contains a space, or anything else that would stop it from
	 * reading back as one bare token, or if it would read back as a non-text value.
	 */
	public static String text(String text) {
		if (ValueInference.isAmbiguous(text)) {
			return quoted(text);
		} else if (needsQuotes(text)) {
			return quotedOrBare(text);
		} else {
			return text;
		}
	}

	/**
	 * Keys and table names are never inferred, so only their characters matter.
	 */
	public static String key(String key) {
		return needsQuotes(key) ? quotedOrBare(key) : key;
	}

	public static String number(double number) {
		if (Double.isNaN(number)) {
			return "nan";
		} else if (Double.isInfinite(number)) {
			return (number > 0) ? "inf" : "-inf";
		} else if (number == 0 && 1 / number < 0) {
			return "-0.0";
		} else if (number == Math.rint(number) && Math.abs(number) <= MAX_EXACT_INTEGER) {
			return Long.toString((long) number);
		} else {
			return Double.toString(number);
		}
	}

	public static String dateTime(LocalDateTime dateTime) {
		return ISO_LOCAL_DATE_TIME.format(dateTime);
	}

	/**
	 * [-][d.]hh:mm:ss[.fffffffff], with trailing zeros trimmed from the fraction.
	 */
	public static String timeSpan(Duration timeSpan) {
		StringBuilder sb = new StringBuilder();
		Duration magnitude = timeSpan;
		if (timeSpan.isNegative()) {
			sb.append('-');
			magnitude = timeSpan.negated();
		}
		long days = magnitude.toDays();
		if (days != 0) {
			sb.append(days).append('.');
		}
		appendTwoDigits(sb, magnitude.toHoursPart());
		sb.append(':');
		appendTwoDigits(sb, magnitude.toMinutesPart());
		sb.append(':');
		appendTwoDigits(sb, magnitude.toSecondsPart());
		int nanos = magnitude.toNanosPart();
		if (nanos != 0) {
			String fraction = String.format(Locale.ROOT, "%09d", nanos);
			int end = fraction.length();
			while (fraction.charAt(end - 1) == '0') {
				end--;
			}
			sb.append('.').append(fraction, 0, end);
		}
		return sb.toString();
	}

	private static void appendTwoDigits(StringBuilder sb, int value) {
		if (value < 10) {
			sb.append('0');
		}
		sb.append(value);
	}

	private static boolean needsQuotes(String text) {
		if (text.isEmpty()) {
			return true;
		}
		for (int i = 0; i < text.length(); ) {
			int c = text.codePointAt(i);
			if (Chars.isWhitespace(c) || Chars.isPunctuation(c) || Chars.isQuote(c)) {
				return true;
			}
			i += Character.charCount(c);
		}
		return false;
	}

	/**
	 * Text holding both kinds of quote can't be quoted, but it can still be written bare
	 * if the tokenizer would read it back as one bare token.
	 *
	 * @throws IllegalArgumentException if it can be written neither way
	 */
	private static String quotedOrBare(String text) {
		if (text.indexOf('"') >= 0 && text.indexOf('\'') >= 0 && isBareToken(text)) {
			return text;
		} else {
			return quoted(text);
		}
	}

	private static boolean isBareToken(String text) {
		if (text.isEmpty()
			|| Chars.isQuote(text.codePointAt(0))
			|| Chars.isWhitespace(text.codePointAt(0))
			|| Chars.isWhitespace(text.codePointBefore(text.length()))) {
			return false;
		}
		for (int i = 0; i < text.length(); ) {
			int c = text.codePointAt(i);
			if (Chars.isEndOfLine(c) || Chars.isPunctuation(c)) {
				return false;
			}
			i += Character.charCount(c);
		}
		return true;
	}

	/**
	 * @throws IllegalArgumentException if the text contains both kinds of quote,
	 * which can't be written without escape sequences
	 */
	private static String quoted(String text) {
		if (text.indexOf('"') < 0) {
			return '"' + text + '"';
		} else if (text.indexOf('\'') < 0) {
			return '\'' + text + '\'';
		} else {
			throw new IllegalArgumentException("Text containing both quote characters can't be written without escapes: " + text);
		}
	}
}
