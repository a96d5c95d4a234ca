package works.tomlet;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tomlet.codec.Token;
import works.tomlet.codec.TomlFormat;
import works.tomlet.codec.TomlReader;
import works.tomlet.exceptions.MissingKeyException;
import works.tomlet.exceptions.UnexpectedTokenException;

import static java.util.Objects.requireNonNull;

/**
 * A named, ordered sequence of key-value entries.
 * <p>
 * Appears either as a section of a document, introduced by a {@code [name]} header,
 * or as an inline value like <code>{ cpu = 79.5, case = 72.0 }</code>.
 * Inline tables parsed from a key-value are named after the key;
 * those parsed from an array element have an empty name.
 * An inline table's name is never written, so as a value it
 * compares equal to any table with the same entries.
 */
public final class TomlTable extends TomlNode {
	private final String name;
	private final List<TomlKeyValue> keyValues = new ArrayList<>();

	public TomlTable(String name) {
		this.name = requireNonNull(name);
	}

	public String name() {
		return name;
	}

	/**
	 * @return an unmodifiable view of the entries, in order, including any duplicates
	 */
	public List<TomlKeyValue> keyValues() {
		return Collections.unmodifiableList(keyValues);
	}

	public int size() {
		return keyValues.size();
	}

	/**
	 * Appends an entry. Duplicate keys are not checked.
	 *
	 * @throws IllegalStateException if {@code keyValue} already belongs to another container
	 */
	public TomlTable add(TomlKeyValue keyValue) {
		keyValue.attachTo(this);
		keyValues.add(keyValue);
		return this;
	}

	/**
	 * @throws IllegalStateException if {@code value} wraps a container that already has a parent,
	 * or that contains this one
	 */
	public TomlTable add(String key, TomlValue value) {
		checkContents(value, this);
		return add(new TomlKeyValue(key, value));
	}

	public TomlTable add(String key, String text) { return add(key, TomlValue.text(text)); }
	public TomlTable add(String key, double number) { return add(key, TomlValue.number(number)); }
	public TomlTable add(String key, boolean bool) { return add(key, TomlValue.bool(bool)); }
	public TomlTable add(String key, LocalDateTime dateTime) { return add(key, TomlValue.dateTime(dateTime)); }
	public TomlTable add(String key, Duration timeSpan) { return add(key, TomlValue.timeSpan(timeSpan)); }
	public TomlTable add(String key, TomlArray array) { return add(key, TomlValue.array(array)); }
	public TomlTable add(String key, TomlTable table) { return add(key, TomlValue.table(table)); }

	public boolean containsKey(String key) {
		return TomlKeyValue.containsKey(keyValues, key);
	}

	/**
	 * @return the value of the first entry with the given key, or empty if there is none
	 */
	public Optional<TomlValue> tryGetValue(String key) {
		return TomlKeyValue.firstValue(keyValues, key);
	}

	/**
	 * @throws MissingKeyException if there's no entry with the given key
	 */
	public TomlValue getValue(String key) {
		return tryGetValue(key)
			.orElseThrow(() -> new MissingKeyException(key, describe()));
	}

	/**
	 * Parses a {@code [name]} header and the entries after it,
	 * stopping at the next header or the end of the input.
	 */
	public static TomlTable read(TomlReader reader, TomlSettings settings) {
		reader.expect(Token.Kind.START_ARRAY, "to start a table header");
		Token nameToken = reader.expect(Token.Kind.TEXT, "for a table name");
		reader.expect(Token.Kind.END_ARRAY, "to end a table header");
		String name = nameToken.quoted()
			? reader.text(nameToken)
			: reader.text(nameToken).strip();

		TomlTable result = new TomlTable(name);
		while (true) {
			Token token = reader.peekToken();
			switch (token.kind()) {
				case END_TEXT, START_ARRAY -> {
					LOGGER.debug("Read table `{}` with {} entries", name, result.size());
					return result;
				}
				case COMMENT_PREFIX -> reader.skipComment();
				case TEXT -> result.add(TomlKeyValue.readEntry(reader, settings, result.keyValues, result.describe()));
				default -> {
					LOGGER.debug("Ignoring {} at offset {} in table `{}`", token.kind(), token.offset(), name);
					reader.readToken();
				}
			}
		}
	}

	/**
	 * Parses an inline table, with the reader positioned at its opening <code>{</code>.
	 * Entries are separated by commas.
	 *
	 * @throws UnexpectedTokenException if the input ends before the closing <code>}</code>
	 */
	public static TomlTable readInline(TomlReader reader, String name, TomlSettings settings) {
		Token start = reader.expect(Token.Kind.START_INLINE_TABLE, "to start an inline table");
		TomlTable result = new TomlTable(name);
		while (true) {
			Token token = reader.peekToken();
			switch (token.kind()) {
				case END_INLINE_TABLE -> {
					reader.readToken();
					return result;
				}
				case TEXT -> result.add(TomlKeyValue.readEntry(reader, settings, result.keyValues, result.describe()));
				case COMMA -> reader.readToken();
				case COMMENT_PREFIX -> reader.skipComment();
				case END_TEXT -> throw new UnexpectedTokenException("Unterminated inline table starting at offset " + start.offset(), token.offset());
				default -> throw new UnexpectedTokenException("Expected a key or END_INLINE_TABLE, but got " + token.kind(), token.offset());
			}
		}
	}

	/**
	 * Writes the {@code [name]} header, then each entry on its own line.
	 */
	@Override
	public void writeTo(Appendable out) throws IOException {
		out.append('[').append(TomlFormat.key(name)).append("]\n");
		for (TomlKeyValue keyValue : keyValues) {
			keyValue.writeTo(out);
			out.append('\n');
		}
	}

	/**
	 * Writes the entries in inline form. The name is not written.
	 */
	public void writeInlineTo(Appendable out) throws IOException {
		if (keyValues.isEmpty()) {
			out.append("{}");
			return;
		}
		out.append("{ ");
		String separator = "";
		for (TomlKeyValue keyValue : keyValues) {
			out.append(separator);
			keyValue.writeTo(out);
			separator = ", ";
		}
		out.append(" }");
	}

	@Override
	String describe() {
		return "table `" + name + "`";
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof TomlTable other
			&& name.equals(other.name)
			&& keyValues.equals(other.keyValues);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, keyValues);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TomlTable.class);
}
