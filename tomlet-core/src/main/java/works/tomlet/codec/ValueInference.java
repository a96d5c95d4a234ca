package works.tomlet.codec;

import java.math.BigInteger;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import works.tomlet.TomlValue;

import static java.time.ZoneOffset.UTC;
import static java.time.format.DateTimeFormatter.ISO_LOCAL_DATE;
import static java.time.format.DateTimeFormatter.ISO_LOCAL_DATE_TIME;
import static java.time.format.DateTimeFormatter.ISO_OFFSET_DATE_TIME;

/**
 * Decides what kind of scalar an untyped piece of TOML text is.
 * <p>
 * Each {@link Candidate} is tried in turn, and the first one that accepts
 * the text wins. Text that no candidate accepts is plain {@link TomlValue.TextValue text}.
 * The same literal can be classified differently by different orders,
 * so callers always say which order they want.
 */
public final class ValueInference {
	private ValueInference() {}

	public static final List<Candidate> UNIFIED_ORDER = List.of(
		Candidate.NUMBER,
		Candidate.BOOLEAN,
		Candidate.TIME_SPAN,
		Candidate.OFFSET_DATE_TIME,
		Candidate.LOCAL_DATE_TIME);

	/**
	 * Temporal types first. Bare integers like {@code 8000} still come out
	 * as numbers, since a time span needs a colon.
	 */
	public static final List<Candidate> TEMPORAL_FIRST_ORDER = List.of(
		Candidate.TIME_SPAN,
		Candidate.OFFSET_DATE_TIME,
		Candidate.LOCAL_DATE_TIME,
		Candidate.NUMBER,
		Candidate.BOOLEAN);

	/**
	 * @return the first successful interpretation of {@code text} in the given order,
	 * or a text value if none succeeds
	 */
	public static TomlValue infer(String text, List<Candidate> order) {
		for (Candidate candidate : order) {
			Optional<TomlValue> result = candidate.tryParse(text);
			if (result.isPresent()) {
				return result.get();
			}
		}
		return TomlValue.text(text);
	}

	/**
	 * @return true if some candidate would claim this text,
	 * meaning it must be quoted to be read back as text
	 */
	public static boolean isAmbiguous(String text) {
		for (Candidate candidate : Candidate.values()) {
			if (candidate.tryParse(text).isPresent()) {
				return true;
			}
		}
		return false;
	}

	public enum Candidate {
		NUMBER {
			@Override
			public Optional<TomlValue> tryParse(String text) {
				return parseNumber(text).map(TomlValue::number);
			}
		},
		BOOLEAN {
			@Override
			public Optional<TomlValue> tryParse(String text) {
				if ("true".equalsIgnoreCase(text)) {
					return Optional.of(TomlValue.bool(true));
				} else if ("false".equalsIgnoreCase(text)) {
					return Optional.of(TomlValue.bool(false));
				} else {
					return Optional.empty();
				}
			}
		},
		TIME_SPAN {
			@Override
			public Optional<TomlValue> tryParse(String text) {
				return parseTimeSpan(text).map(TomlValue::timeSpan);
			}
		},

		/**
		 * Normalized to UTC; the offset itself is not kept.
		 */
		OFFSET_DATE_TIME {
			@Override
			public Optional<TomlValue> tryParse(String text) {
				int dateLength = dateLength(text);
				if (dateLength < 0 || dateLength == text.length()) {
					return Optional.empty();
				}
				try {
					OffsetDateTime parsed = OffsetDateTime.parse(withTimeSeparator(text, dateLength), ISO_OFFSET_DATE_TIME);
					return Optional.of(TomlValue.dateTime(parsed.withOffsetSameInstant(UTC).toLocalDateTime()));
				} catch (DateTimeParseException e) {
					return Optional.empty();
				}
			}
		},

		/**
		 * A date on its own means midnight.
		 */
		LOCAL_DATE_TIME {
			@Override
			public Optional<TomlValue> tryParse(String text) {
				int dateLength = dateLength(text);
				if (dateLength < 0) {
					return Optional.empty();
				}
				try {
					if (text.length() == dateLength) {
						return Optional.of(TomlValue.dateTime(LocalDate.parse(text, ISO_LOCAL_DATE).atStartOfDay()));
					} else {
						return Optional.of(TomlValue.dateTime(LocalDateTime.parse(withTimeSeparator(text, dateLength), ISO_LOCAL_DATE_TIME)));
					}
				} catch (DateTimeParseException e) {
					return Optional.empty();
				}
			}
		};

		public abstract Optional<TomlValue> tryParse(String text);
	}

	private static final Pattern DECIMAL = Pattern.compile(
		"[+-]?[0-9](?:_?[0-9])*(?:\\.[0-9](?:_?[0-9])*)?(?:[eE][+-]?[0-9](?:_?[0-9])*)?");
	private static final Pattern PREFIXED_INTEGER = Pattern.compile(
		"([+-]?)0([xob])([0-9A-Fa-f](?:_?[0-9A-Fa-f])*)");
	private static final Pattern SPECIAL = Pattern.compile("([+-]?)(inf|nan)");

	/**
	 * [-][d.]h[h]:mm[:ss[.fffffffff]]
	 */
	private static final Pattern TIME_SPAN_PATTERN = Pattern.compile(
		"(-)?(?:([0-9]+)\\.)?([0-9]{1,2}):([0-9]{2})(?::([0-9]{2})(?:\\.([0-9]{1,9}))?)?");

	public static Optional<Double> parseNumber(String text) {
		if (DECIMAL.matcher(text).matches()) {
			return Optional.of(Double.parseDouble(text.replace("_", "")));
		}
		Matcher prefixed = PREFIXED_INTEGER.matcher(text);
		if (prefixed.matches()) {
			int radix = switch (prefixed.group(2)) {
				case "x" -> 16;
				case "o" -> 8;
				default -> 2;
			};
			try {
				BigInteger magnitude = new BigInteger(prefixed.group(3).replace("_", ""), radix);
				double value = magnitude.doubleValue();
				return Optional.of("-".equals(prefixed.group(1)) ? -value : value);
			} catch (NumberFormatException e) {
				// Digits outside the radix, like 0b12
				return Optional.empty();
			}
		}
		Matcher special = SPECIAL.matcher(text);
		if (special.matches()) {
			if ("nan".equals(special.group(2))) {
				return Optional.of(Double.NaN);
			}
			return Optional.of("-".equals(special.group(1)) ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
		}
		return Optional.empty();
	}

	public static Optional<Duration> parseTimeSpan(String text) {
		Matcher matcher = TIME_SPAN_PATTERN.matcher(text);
		if (!matcher.matches()) {
			return Optional.empty();
		}
		try {
			long days = (matcher.group(2) == null) ? 0 : Long.parseLong(matcher.group(2));
			int hours = Integer.parseInt(matcher.group(3));
			int minutes = Integer.parseInt(matcher.group(4));
			int seconds = (matcher.group(5) == null) ? 0 : Integer.parseInt(matcher.group(5));
			if (hours > 23 || minutes > 59 || seconds > 59) {
				return Optional.empty();
			}
			long nanos = 0;
			if (matcher.group(6) != null) {
				StringBuilder fraction = new StringBuilder(matcher.group(6));
				while (fraction.length() < 9) {
					fraction.append('0');
				}
				nanos = Long.parseLong(fraction.toString());
			}
			Duration result = Duration.ofDays(days)
				.plusHours(hours)
				.plusMinutes(minutes)
				.plusSeconds(seconds)
				.plusNanos(nanos);
			return Optional.of(matcher.group(1) == null ? result : result.negated());
		} catch (NumberFormatException | ArithmeticException e) {
			// Too many days for a Duration
			return Optional.empty();
		}
	}

	/**
	 * @return the length of the {@code [+-]yyyy-mm-dd} prefix of {@code text}, or -1 if it has none.
	 * Years beyond four digits need a sign, as {@link java.time.format.DateTimeFormatter#ISO_LOCAL_DATE} writes them.
	 */
	private static int dateLength(String text) {
		int start = (text.startsWith("+") || text.startsWith("-")) ? 1 : 0;
		int yearEnd = start;
		while (yearEnd < text.length() && isDigits(text, yearEnd, yearEnd + 1)) {
			yearEnd++;
		}
		int end = yearEnd + "-mm-dd".length();
		if (yearEnd - start < 4
			|| end > text.length()
			|| text.charAt(yearEnd) != '-'
			|| !isDigits(text, yearEnd + 1, yearEnd + 3)
			|| text.charAt(yearEnd + 3) != '-'
			|| !isDigits(text, yearEnd + 4, end)) {
			return -1;
		}
		return end;
	}

	/**
	 * TOML allows a space in place of the {@code T} between date and time.
	 */
	private static String withTimeSeparator(String text, int dateLength) {
		if (text.charAt(dateLength) == ' ') {
			return text.substring(0, dateLength) + 'T' + text.substring(dateLength + 1);
		} else {
			return text;
		}
	}

	private static boolean isDigits(String text, int start, int end) {
		for (int i = start; i < end; i++) {
			char c = text.charAt(i);
			if (c < '0' || c > '9') {
				return false;
			}
		}
		return true;
	}
}
