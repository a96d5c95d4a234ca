package works.tomlet.jackson;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;
import works.tomlet.TomlArray;
import works.tomlet.TomlDocument;
import works.tomlet.TomlKeyValue;
import works.tomlet.TomlTable;
import works.tomlet.TomlValue;
import works.tomlet.codec.TomlFormat;

/**
 * Converts a {@link TomlDocument} to a Jackson {@link ObjectNode}.
 * <p>
 * Top-level key-values become fields, and each table becomes an object field named after the table.
 * Numbers become doubles. Date-times and time spans become strings in their TOML form.
 * Where a name occurs more than once, the first occurrence wins,
 * matching {@link TomlDocument#getValue} and {@link TomlDocument#getTable}.
 */
public final class TomlJsonConverter {
	private final ObjectMapper mapper;

	public TomlJsonConverter() {
		this(JsonMapper.builder().build());
	}

	public TomlJsonConverter(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	public ObjectNode toJsonNode(TomlDocument document) {
		ObjectNode result = mapper.createObjectNode();
		for (TomlKeyValue keyValue : document.keyValues()) {
			putIfAbsent(result, keyValue);
		}
		for (TomlTable table : document.tables()) {
			if (result.has(table.name())) {
				LOGGER.debug("Skipping table `{}`; the name is already taken", table.name());
			} else {
				fill(result.putObject(table.name()), table);
			}
		}
		return result;
	}

	/**
	 * @return compact JSON text
	 */
	public String toJson(TomlDocument document) {
		return mapper.writeValueAsString(toJsonNode(document));
	}

	private void fill(ObjectNode target, TomlTable table) {
		for (TomlKeyValue keyValue : table.keyValues()) {
			putIfAbsent(target, keyValue);
		}
	}

	private void putIfAbsent(ObjectNode target, TomlKeyValue keyValue) {
		String key = keyValue.key();
		if (target.has(key)) {
			LOGGER.debug("Skipping duplicate key `{}`", key);
			return;
		}
		TomlValue value = keyValue.value();
		switch (value.type()) {
			case TEXT -> target.put(key, value.asText());
			case NUMBER -> target.put(key, value.asNumber());
			case BOOLEAN -> target.put(key, value.asBoolean());
			case DATE_TIME, TIME_SPAN -> target.put(key, TomlFormat.scalar(value));
			case ARRAY -> fill(target.putArray(key), value.asArray());
			case TABLE -> fill(target.putObject(key), value.asTable());
		}
	}

	private void fill(ArrayNode target, TomlArray array) {
		for (TomlValue element : array) {
			switch (element.type()) {
				case TEXT -> target.add(element.asText());
				case NUMBER -> target.add(element.asNumber());
				case BOOLEAN -> target.add(element.asBoolean());
				case DATE_TIME, TIME_SPAN -> target.add(TomlFormat.scalar(element));
				case ARRAY -> fill(target.addArray(), element.asArray());
				case TABLE -> fill(target.addObject(), element.asTable());
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TomlJsonConverter.class);
}
