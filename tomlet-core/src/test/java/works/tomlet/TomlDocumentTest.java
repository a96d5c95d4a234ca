package works.tomlet;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import works.tomlet.exceptions.MissingKeyException;
import works.tomlet.exceptions.MissingTableException;
import works.tomlet.exceptions.TomlFormatException;
import works.tomlet.exceptions.UnexpectedTokenException;
import works.tomlet.exceptions.UnterminatedStringException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TomlDocumentTest {

	@Test
	void quotedTitle() {
		TomlDocument doc = TomlDocument.parse("title = \"TOML Example\"");
		assertEquals(1, doc.keyValues().size());
		TomlKeyValue kv = doc.keyValues().get(0);
		assertEquals("title", kv.key());
		assertEquals(ValueType.TEXT, kv.valueType());
		assertEquals("TOML Example", kv.text());
	}

	@Test
	void negativeAmount() {
		TomlValue value = TomlDocument.parse("amount = -3213.777").getValue("amount");
		assertEquals(ValueType.NUMBER, value.type());
		assertEquals(-3213.777, value.asNumber(), 1e-9);
	}

	@Test
	void enabledFlag() {
		TomlValue value = TomlDocument.parse("enabled = true").getValue("enabled");
		assertEquals(ValueType.BOOLEAN, value.type());
		assertTrue(value.asBoolean());
	}

	@Test
	void ports() {
		TomlValue value = TomlDocument.parse("ports = [ 8000, 8001, 8002 ]").getValue("ports");
		assertEquals(ValueType.ARRAY, value.type());
		TomlArray ports = value.asArray();
		assertEquals(3, ports.size());
		assertEquals(List.of(TomlValue.number(8000), TomlValue.number(8001), TomlValue.number(8002)), ports.elements());
	}

	@Test
	void ownerTable() {
		TomlDocument doc = TomlDocument.parse("[owner]\nname = \"Tom\"\n");
		assertEquals(0, doc.keyValues().size());
		assertEquals(1, doc.tables().size());
		TomlTable owner = doc.getTable("owner");
		assertEquals(1, owner.size());
		assertEquals("name", owner.keyValues().get(0).key());
		assertEquals(TomlValue.text("Tom"), owner.getValue("name"));
	}

	@Test
	void unterminatedTitle() {
		assertEquals(Optional.empty(), TomlDocument.tryParse("title = \"abc"));
		assertThrows(UnterminatedStringException.class, () -> TomlDocument.parse("title = \"abc"));
	}

	@Test
	void tryParseSucceeds() {
		Optional<TomlDocument> doc = TomlDocument.tryParse("a = 1");
		assertTrue(doc.isPresent());
		assertEquals(1, doc.get().getValue("a").asNumber());
	}

	@Test
	void oversizedTimeSpansParseAsText() {
		Optional<TomlDocument> doc = TomlDocument.tryParse("x = 99999999999999999999.01:02:03\ny = [200000000000000.00:00:00]");
		assertTrue(doc.isPresent());
		assertEquals("99999999999999999999.01:02:03", doc.get().getValue("x").asText());
		assertEquals("200000000000000.00:00:00", doc.get().getValue("y").asArray().get(0).asText());
	}

	@Test
	void textWithBothQuotes() {
		TomlDocument doc = TomlDocument.create().add("k", "it's \"x\"");
		assertEquals("k = it's \"x\"\n", doc.toString());
		assertEquals("it's \"x\"", TomlDocument.parse(doc.toString()).getValue("k").asText());
		assertThrows(IllegalArgumentException.class, () -> TomlDocument.create().add("k", "\"it's\"").toString());
	}

	@Test
	void tryParseFailsOnGrammarErrors() {
		assertEquals(Optional.empty(), TomlDocument.tryParse("key value"));
		assertEquals(Optional.empty(), TomlDocument.tryParse("a = [1, 2"));
		assertEquals(Optional.empty(), TomlDocument.tryParse("[table"));
	}

	@Test
	void fullDocument() {
		String toml = """
			# This is a TOML document.

			title = "TOML Example"

			[owner]
			name = "Tom Preston-Werner"
			dob = 1979-05-27T07:32:00-08:00 # First class dates

			[database]
			server = 192.168.1.1
			ports = [ 8000, 8001, 8002 ]
			connection_max = 5000
			enabled = true
			temp_targets = { cpu = 79.5, case = 72.0 }

			[servers]
			data = [ [ gamma, delta ], [ 1, 2 ] ]
			""";
		TomlDocument doc = TomlDocument.parse(toml);
		assertEquals("TOML Example", doc.getValue("title").asText());
		assertEquals(3, doc.tables().size());

		TomlTable owner = doc.getTable("owner");
		assertEquals("Tom Preston-Werner", owner.getValue("name").asText());
		assertEquals(ValueType.DATE_TIME, owner.getValue("dob").type());

		TomlTable database = doc.getTable("database");
		assertEquals("192.168.1.1", database.getValue("server").asText());
		assertEquals(5000, database.getValue("connection_max").asNumber());
		assertEquals(79.5, database.getValue("temp_targets").asTable().getValue("cpu").asNumber());

		TomlArray data = doc.getTable("servers").getValue("data").asArray();
		assertEquals(TomlArray.of(TomlValue.text("gamma"), TomlValue.text("delta")), data.get(0).asArray());
		assertEquals(TomlArray.ofNumbers(1, 2), data.get(1).asArray());
	}

	@Test
	void keyValuesAfterHeaderBelongToTable() {
		TomlDocument doc = TomlDocument.parse("a = 1\n[t]\nb = 2\n");
		assertTrue(doc.containsKey("a"));
		assertFalse(doc.containsKey("b"));
		assertTrue(doc.getTable("t").containsKey("b"));
	}

	@Test
	void strayPunctuationIsIgnored() {
		TomlDocument doc = TomlDocument.parse("] , }\na = 1");
		assertEquals(1, doc.getValue("a").asNumber());
	}

	@Test
	void utf8Input() {
		TomlDocument doc = TomlDocument.parse("\uFEFFcity = \"Tōkyō\"\n".getBytes(UTF_8));
		assertEquals("Tōkyō", doc.getValue("city").asText());
	}

	@Test
	void utf8ErrorOffsetsAreBytes() {
		TomlFormatException e = assertThrows(TomlFormatException.class,
			() -> TomlDocument.parse("é = \"abc".getBytes(UTF_8)));
		assertEquals(5, e.offset());
	}

	@Test
	void missingKey() {
		TomlDocument doc = TomlDocument.parse("a = 1");
		assertThrows(MissingKeyException.class, () -> doc.getValue("b"));
		assertEquals(Optional.empty(), doc.tryGetValue("b"));
		assertFalse(doc.containsKey("A"), "Lookup is case-sensitive");
	}

	@Test
	void missingTable() {
		TomlDocument doc = TomlDocument.parse("[a]");
		assertTrue(doc.containsTable("a"));
		assertFalse(doc.containsTable("b"));
		assertEquals(Optional.empty(), doc.tryGetTable("b"));
		MissingTableException e = assertThrows(MissingTableException.class, () -> doc.getTable("b"));
		assertEquals("b", e.name());
	}

	@Test
	void duplicatesKeptFirstMatchWins() {
		TomlDocument doc = TomlDocument.parse("a = 1\na = 2\n[t]\n[t]\nx = 1");
		assertEquals(2, doc.keyValues().size());
		assertEquals(1, doc.getValue("a").asNumber());
		assertEquals(2, doc.tables().size());
		assertEquals(0, doc.getTable("t").size());
	}

	@Test
	void unexpectedTokenMessageIncludesOffset() {
		UnexpectedTokenException e = assertThrows(UnexpectedTokenException.class, () -> TomlDocument.parse("a = 1\nb ="));
		assertEquals(9, e.offset());
		assertTrue(e.getMessage().endsWith("at offset 9"), e.getMessage());
	}

	@Test
	void write() {
		TomlDocument doc = TomlDocument.create()
			.add("title", "TOML Example")
			.add(new TomlTable("owner").add("name", "Tom"))
			.add(new TomlTable("database").add("ports", TomlArray.ofNumbers(8000, 8001)));
		assertEquals("""
			title = "TOML Example"

			[owner]
			name = Tom

			[database]
			ports = [8000, 8001]
			""", doc.toString());
	}

	@Test
	void writeTablesOnly() {
		TomlDocument doc = TomlDocument.create()
			.add(new TomlTable("a").add("x", 1))
			.add(new TomlTable("b"));
		assertEquals("[a]\nx = 1\n\n[b]\n", doc.toString());
	}

	@Test
	void topLevelKeysAreWrittenFirst() {
		TomlDocument doc = TomlDocument.create()
			.add(new TomlTable("t").add("inner", 1))
			.add("outer", 2);
		TomlDocument reparsed = TomlDocument.parse(doc.toString());
		assertEquals(2, reparsed.getValue("outer").asNumber());
		assertFalse(reparsed.getTable("t").containsKey("outer"));
	}

	@Test
	void emptyDocument() {
		assertEquals("", TomlDocument.create().toString());
		assertEquals(TomlDocument.create(), TomlDocument.parse("  # nothing here\n"));
	}
}
