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
import works.tomlet.TomlSettings.DuplicateKeyPolicy;
import works.tomlet.codec.Token;
import works.tomlet.codec.TomlReader;
import works.tomlet.exceptions.DuplicateKeyException;
import works.tomlet.exceptions.MissingKeyException;
import works.tomlet.exceptions.MissingTableException;
import works.tomlet.exceptions.TomlFormatException;

/**
 * The root of a TOML tree: top-level key-values, then tables.
 * <p>
 * Lookups scan in order and return the first match,
 * so later duplicates are only reachable through {@link #keyValues()} and {@link #tables()}.
 * <p>
 * Not thread-safe.
 */
public final class TomlDocument extends TomlNode {
	private final List<TomlKeyValue> keyValues = new ArrayList<>();
	private final List<TomlTable> tables = new ArrayList<>();

	private TomlDocument() { }

	public static TomlDocument create() {
		return new TomlDocument();
	}

	/**
	 * @throws TomlFormatException if the text isn't valid
	 */
	public static TomlDocument parse(String text) {
		return parse(text, TomlSettings.DEFAULT);
	}

	public static TomlDocument parse(String text, TomlSettings settings) {
		try (TomlReader reader = TomlReader.create(text)) {
			return read(reader, settings);
		}
	}

	/**
	 * @param utf8 TOML text encoded as UTF-8. Error offsets will be byte offsets.
	 */
	public static TomlDocument parse(byte[] utf8) {
		return parse(utf8, TomlSettings.DEFAULT);
	}

	public static TomlDocument parse(byte[] utf8, TomlSettings settings) {
		try (TomlReader reader = TomlReader.create(utf8)) {
			return read(reader, settings);
		}
	}

	/**
	 * Like {@link #parse(String)}, but returns empty instead of throwing.
	 */
	public static Optional<TomlDocument> tryParse(String text) {
		return tryParse(text, TomlSettings.DEFAULT);
	}

	public static Optional<TomlDocument> tryParse(String text, TomlSettings settings) {
		try {
			return Optional.of(parse(text, settings));
		} catch (TomlFormatException e) {
			LOGGER.debug("Unable to parse TOML document", e);
			return Optional.empty();
		}
	}

	/**
	 * Reads everything remaining in {@code reader}.
	 */
	public static TomlDocument read(TomlReader reader, TomlSettings settings) {
		TomlDocument result = new TomlDocument();
		while (true) {
			Token token = reader.peekToken();
			switch (token.kind()) {
				case END_TEXT -> {
					LOGGER.debug("Parsed TOML document with {} key-values and {} tables", result.keyValues.size(), result.tables.size());
					return result;
				}
				case COMMENT_PREFIX -> reader.skipComment();
				case TEXT -> result.add(TomlKeyValue.readEntry(reader, settings, result.keyValues, result.describe()));
				case START_ARRAY -> {
					TomlTable table = TomlTable.read(reader, settings);
					if (settings.getDuplicateKeys() == DuplicateKeyPolicy.REJECT && result.containsTable(table.name())) {
						throw new DuplicateKeyException(table.name(), result.describe(), token.offset());
					}
					result.add(table);
				}
				default -> {
					LOGGER.debug("Ignoring {} at offset {}", token.kind(), token.offset());
					reader.readToken();
				}
			}
		}
	}

	/**
	 * Appends a top-level entry. It is written before all tables,
	 * regardless of when it was added.
	 */
	public TomlDocument add(TomlKeyValue keyValue) {
		keyValue.attachTo(this);
		keyValues.add(keyValue);
		return this;
	}

	/**
	 * @throws IllegalStateException if {@code value} wraps a container that already has a parent,
	 * or that contains this one
	 */
	public TomlDocument add(String key, TomlValue value) {
		checkContents(value, this);
		return add(new TomlKeyValue(key, value));
	}

	public TomlDocument add(String key, String text) { return add(key, TomlValue.text(text)); }
	public TomlDocument add(String key, double number) { return add(key, TomlValue.number(number)); }
	public TomlDocument add(String key, boolean bool) { return add(key, TomlValue.bool(bool)); }
	public TomlDocument add(String key, LocalDateTime dateTime) { return add(key, TomlValue.dateTime(dateTime)); }
	public TomlDocument add(String key, Duration timeSpan) { return add(key, TomlValue.timeSpan(timeSpan)); }
	public TomlDocument add(String key, TomlArray array) { return add(key, TomlValue.array(array)); }
	public TomlDocument add(String key, TomlTable table) { return add(key, TomlValue.table(table)); }

	/**
	 * Appends a table section.
	 *
	 * @throws IllegalStateException if {@code table} already belongs to another container
	 */
	public TomlDocument add(TomlTable table) {
		table.attachTo(this);
		tables.add(table);
		return this;
	}

	public List<TomlKeyValue> keyValues() {
		return Collections.unmodifiableList(keyValues);
	}

	public List<TomlTable> tables() {
		return Collections.unmodifiableList(tables);
	}

	public boolean containsKey(String key) {
		return TomlKeyValue.containsKey(keyValues, key);
	}

	public Optional<TomlValue> tryGetValue(String key) {
		return TomlKeyValue.firstValue(keyValues, key);
	}

	/**
	 * @throws MissingKeyException if there's no top-level entry with the given key
	 */
	public TomlValue getValue(String key) {
		return tryGetValue(key)
			.orElseThrow(() -> new MissingKeyException(key, describe()));
	}

	public boolean containsTable(String name) {
		return tryGetTable(name).isPresent();
	}

	public Optional<TomlTable> tryGetTable(String name) {
		for (TomlTable table : tables) {
			if (table.name().equals(name)) {
				return Optional.of(table);
			}
		}
		return Optional.empty();
	}

	/**
	 * @throws MissingTableException if there's no table with the given name
	 */
	public TomlTable getTable(String name) {
		return tryGetTable(name)
			.orElseThrow(() -> new MissingTableException(name));
	}

	/**
	 * Writes each top-level entry on its own line,
	 * then the tables, separated by blank lines.
	 */
	@Override
	public void writeTo(Appendable out) throws IOException {
		for (TomlKeyValue keyValue : keyValues) {
			keyValue.writeTo(out);
			out.append('\n');
		}
		boolean first = keyValues.isEmpty();
		for (TomlTable table : tables) {
			if (!first) {
				out.append('\n');
			}
			table.writeTo(out);
			first = false;
		}
	}

	@Override
	String describe() {
		return "TOML document";
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof TomlDocument other
			&& keyValues.equals(other.keyValues)
			&& tables.equals(other.tables);
	}

	@Override
	public int hashCode() {
		return Objects.hash(keyValues, tables);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TomlDocument.class);
}
