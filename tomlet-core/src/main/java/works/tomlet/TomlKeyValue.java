package works.tomlet;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tomlet.codec.Token;
import works.tomlet.codec.TomlFormat;
import works.tomlet.codec.TomlReader;
import works.tomlet.TomlSettings.DuplicateKeyPolicy;
import works.tomlet.exceptions.DuplicateKeyException;
import works.tomlet.exceptions.TypeMismatchException;
import works.tomlet.exceptions.UnexpectedTokenException;

import static java.util.Objects.requireNonNull;

/**
 * One {@code key = value} entry.
 * <p>
 * The typed accessors delegate to {@link TomlValue} and throw
 * {@link TypeMismatchException} if the value is of some other type.
 */
public final class TomlKeyValue extends TomlNode {
	private final String key;
	private final TomlValue value;

	/**
	 * @throws IllegalArgumentException if {@code key} is empty
	 * @throws IllegalStateException if {@code value} wraps a container that already has a parent
	 */
	public TomlKeyValue(String key, TomlValue value) {
		this.key = requireNonNull(key);
		this.value = requireNonNull(value);
		if (key.isEmpty()) {
			throw new IllegalArgumentException("Key must not be empty");
		}
		attachContents(value, this);
	}

	public String key() { return key; }
	public TomlValue value() { return value; }
	public ValueType valueType() { return value.type(); }

	public String text() { return value.asText(); }
	public double number() { return value.asNumber(); }
	public boolean bool() { return value.asBoolean(); }
	public LocalDateTime dateTime() { return value.asDateTime(); }
	public Duration timeSpan() { return value.asTimeSpan(); }
	public TomlArray array() { return value.asArray(); }
	public TomlTable table() { return value.asTable(); }

	/**
	 * Parses {@code key = value}, with the reader positioned at the key.
	 * A <code>{</code> value is read as an inline table named after the key.
	 */
	public static TomlKeyValue read(TomlReader reader, TomlSettings settings) {
		Token keyToken = reader.expect(Token.Kind.TEXT, "for a key");
		String key = keyToken.quoted()
			? reader.text(keyToken)
			: reader.text(keyToken).strip();
		if (key.isEmpty()) {
			throw new UnexpectedTokenException("Key must not be empty", keyToken.offset());
		}
		reader.expect(Token.Kind.EQUALS, "after key `" + key + "`");

		Token valueToken = reader.peekToken();
		TomlValue value = switch (valueToken.kind()) {
			case TEXT -> readScalar(reader, settings.getInferenceOrder().keyValueOrder(), settings);
			case START_ARRAY -> TomlValue.array(TomlArray.read(reader, settings));
			case START_INLINE_TABLE -> {
				if (!settings.isInlineTables()) {
					throw new UnexpectedTokenException("Inline tables are disabled; found one for key `" + key + "`", valueToken.offset());
				}
				yield TomlValue.table(TomlTable.readInline(reader, key, settings));
			}
			default -> throw new UnexpectedTokenException("Expected a value for key `" + key + "`, but got " + valueToken.kind(), valueToken.offset());
		};
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("Read {} value for key `{}`", value.type(), key);
		}
		return new TomlKeyValue(key, value);
	}

	/**
	 * Reads the next entry of a container that already holds {@code existing},
	 * applying the {@link TomlSettings#getDuplicateKeys() duplicate key policy}.
	 */
	static TomlKeyValue readEntry(TomlReader reader, TomlSettings settings, List<TomlKeyValue> existing, String container) {
		long offset = reader.peekToken().offset();
		TomlKeyValue result = read(reader, settings);
		if (settings.getDuplicateKeys() == DuplicateKeyPolicy.REJECT && containsKey(existing, result.key)) {
			throw new DuplicateKeyException(result.key, container, offset);
		}
		return result;
	}

	@Override
	public void writeTo(Appendable out) throws IOException {
		out.append(TomlFormat.key(key)).append(" = ");
		writeValue(value, out);
	}

	@Override
	String describe() {
		return "key-value `" + key + "`";
	}

	/**
	 * @return the value of the first entry with the given key, if any
	 */
	static Optional<TomlValue> firstValue(List<TomlKeyValue> entries, String key) {
		for (TomlKeyValue entry : entries) {
			if (entry.key.equals(key)) {
				return Optional.of(entry.value);
			}
		}
		return Optional.empty();
	}

	static boolean containsKey(List<TomlKeyValue> entries, String key) {
		return firstValue(entries, key).isPresent();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof TomlKeyValue other
			&& key.equals(other.key)
			&& value.equals(other.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(key, value);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TomlKeyValue.class);
}
