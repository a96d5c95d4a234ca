package works.tomlet;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tomlet.codec.Token;
import works.tomlet.codec.TomlReader;
import works.tomlet.exceptions.UnexpectedTokenException;

import static java.util.Objects.requireNonNull;

/**
 * An ordered, growable sequence of {@link TomlValue}s.
 * Elements may be of mixed types, including nested arrays and inline tables.
 */
public final class TomlArray extends TomlNode implements Iterable<TomlValue> {
	private final List<TomlValue> elements = new ArrayList<>(4);

	public TomlArray() { }

	public static TomlArray ofNumbers(double... numbers) {
		TomlArray result = new TomlArray();
		for (double number : numbers) {
			result.add(number);
		}
		return result;
	}

	public static TomlArray of(TomlValue... values) {
		return of(List.of(values));
	}

	public static TomlArray of(List<? extends TomlValue> values) {
		TomlArray result = new TomlArray();
		for (TomlValue value : values) {
			result.add(value);
		}
		return result;
	}

	/**
	 * @throws IllegalStateException if {@code value} wraps a container that already has a parent,
	 * or that contains this array
	 */
	public TomlArray add(TomlValue value) {
		requireNonNull(value);
		attachContents(value, this);
		elements.add(value);
		return this;
	}

	public TomlArray add(String text) { return add(TomlValue.text(text)); }
	public TomlArray add(double number) { return add(TomlValue.number(number)); }
	public TomlArray add(boolean bool) { return add(TomlValue.bool(bool)); }
	public TomlArray add(LocalDateTime dateTime) { return add(TomlValue.dateTime(dateTime)); }
	public TomlArray add(Duration timeSpan) { return add(TomlValue.timeSpan(timeSpan)); }
	public TomlArray add(TomlArray array) { return add(TomlValue.array(array)); }
	public TomlArray add(TomlTable table) { return add(TomlValue.table(table)); }

	public int size() {
		return elements.size();
	}

	public boolean isEmpty() {
		return elements.isEmpty();
	}

	public TomlValue get(int index) {
		return elements.get(index);
	}

	/**
	 * @return an unmodifiable view
	 */
	public List<TomlValue> elements() {
		return Collections.unmodifiableList(elements);
	}

	@Override
	public Iterator<TomlValue> iterator() {
		return elements().iterator();
	}

	/**
	 * Parses an array, with the reader positioned at its opening {@code [}.
	 * Stray commas are tolerated, including leading, trailing, and doubled ones.
	 * Comments may appear between elements.
	 *
	 * @throws UnexpectedTokenException if the input ends before the closing {@code ]},
	 * or if something other than an element or a comma appears
	 */
	public static TomlArray read(TomlReader reader, TomlSettings settings) {
		Token start = reader.expect(Token.Kind.START_ARRAY, "to start an array");
		TomlArray result = new TomlArray();
		while (true) {
			Token token = reader.peekToken();
			switch (token.kind()) {
				case END_ARRAY -> {
					reader.readToken();
					if (LOGGER.isTraceEnabled()) {
						LOGGER.trace("Read array of {} elements starting at offset {}", result.size(), start.offset());
					}
					return result;
				}
				case TEXT -> result.add(readScalar(reader, settings.getInferenceOrder().arrayOrder(), settings));
				case START_ARRAY -> result.add(read(reader, settings));
				case START_INLINE_TABLE -> {
					if (!settings.isInlineTables()) {
						throw new UnexpectedTokenException("Inline tables are disabled", token.offset());
					}
					result.add(TomlTable.readInline(reader, "", settings));
				}
				case COMMENT_PREFIX -> reader.skipComment();
				case COMMA -> reader.readToken();
				case END_TEXT -> throw new UnexpectedTokenException("Unterminated array starting at offset " + start.offset(), token.offset());
				default -> throw new UnexpectedTokenException("Expected an array element or COMMA, but got " + token.kind(), token.offset());
			}
		}
	}

	@Override
	public void writeTo(Appendable out) throws IOException {
		out.append('[');
		String separator = "";
		for (TomlValue element : elements) {
			out.append(separator);
			writeValue(element, out);
			separator = ", ";
		}
		out.append(']');
	}

	@Override
	String describe() {
		return "array of " + elements.size() + " elements";
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof TomlArray other && elements.equals(other.elements);
	}

	@Override
	public int hashCode() {
		return elements.hashCode();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TomlArray.class);
}
