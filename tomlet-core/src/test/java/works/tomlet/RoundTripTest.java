package works.tomlet;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Writing a document and parsing the result gives back an equal document.
 */
class RoundTripTest {

	static Stream<TomlValue> scalars() {
		return Stream.of(
			TomlValue.text("hello"),
			TomlValue.text("TOML Example"),
			TomlValue.text(""),
			TomlValue.text("  padded  "),
			TomlValue.text("42"),
			TomlValue.text("true"),
			TomlValue.text("07:30"),
			TomlValue.text("1979-05-27"),
			TomlValue.text("nan"),
			TomlValue.text("a = b"),
			TomlValue.text("[not an array]"),
			TomlValue.text("say \"hi\""),
			TomlValue.text("it's"),
			TomlValue.text("# not a comment"),
			TomlValue.text("Tōkyō 🗼"),
			TomlValue.text("it's \"x\""),
			TomlValue.text("99999999999999999999.01:02:03"),
			TomlValue.text("+10000-01-01"),
			TomlValue.number(0),
			TomlValue.number(-0.0),
			TomlValue.number(8000),
			TomlValue.number(-3213.777),
			TomlValue.number(6.626e-34),
			TomlValue.number(1e300),
			TomlValue.number(Double.MAX_VALUE),
			TomlValue.number(Double.MIN_VALUE),
			TomlValue.number(Double.NaN),
			TomlValue.number(Double.POSITIVE_INFINITY),
			TomlValue.number(Double.NEGATIVE_INFINITY),
			TomlValue.bool(true),
			TomlValue.bool(false),
			TomlValue.dateTime(LocalDateTime.of(1979, 5, 27, 7, 32)),
			TomlValue.dateTime(LocalDateTime.of(1979, 5, 27, 0, 0)),
			TomlValue.dateTime(LocalDateTime.of(2024, 2, 29, 23, 59, 59, 123_456_789)),
			TomlValue.dateTime(LocalDateTime.of(0, 1, 1, 0, 0)),
			TomlValue.dateTime(LocalDateTime.of(-1, 12, 31, 12, 0)),
			TomlValue.dateTime(LocalDateTime.of(10000, 1, 1, 0, 0)),
			TomlValue.dateTime(LocalDateTime.of(LocalDateTime.MAX.getYear(), 12, 31, 23, 59, 59)),
			TomlValue.timeSpan(Duration.ZERO),
			TomlValue.timeSpan(Duration.ofHours(7).plusMinutes(32)),
			TomlValue.timeSpan(Duration.ofDays(3).plusSeconds(1)),
			TomlValue.timeSpan(Duration.ofMillis(-1500)),
			TomlValue.timeSpan(Duration.ofNanos(1))
		);
	}

	@ParameterizedTest
	@MethodSource("scalars")
	void topLevelScalar(TomlValue value) {
		TomlDocument doc = TomlDocument.create().add("key", value);
		TomlValue actual = roundTrip(doc).getValue("key");
		assertEquals(value.type(), actual.type());
		assertEquals(value, actual);
	}

	@ParameterizedTest
	@MethodSource("scalars")
	void scalarInArray(TomlValue value) {
		TomlDocument doc = TomlDocument.create().add("key", TomlArray.of(value, value));
		assertEquals(doc, roundTrip(doc));
	}

	@ParameterizedTest
	@MethodSource("scalars")
	void scalarInTable(TomlValue value) {
		TomlDocument doc = TomlDocument.create().add(new TomlTable("t").add("key", value));
		assertEquals(doc, roundTrip(doc));
	}

	@ParameterizedTest
	@MethodSource("scalars")
	void scalarInInlineTable(TomlValue value) {
		TomlDocument doc = TomlDocument.create().add("inline", new TomlTable("inline").add("key", value));
		assertEquals(doc, roundTrip(doc));
	}

	@ParameterizedTest
	@ValueSource(strings = { "simple", "with space", "with = sign", "42", "true", "[x]" })
	void keys(String key) {
		TomlDocument doc = TomlDocument.create()
			.add(key, 1)
			.add(new TomlTable(key).add(key, 2));
		assertEquals(doc, roundTrip(doc));
	}

	@Test
	void nestedArraysKeepOrderAndSize() {
		TomlArray level3a = TomlArray.ofNumbers(1, 2, 3);
		TomlArray level3b = new TomlArray().add("x").add("y z");
		TomlArray level2 = new TomlArray().add(level3a).add(level3b).add(new TomlArray());
		TomlArray level1 = new TomlArray().add(level2).add(TomlArray.ofNumbers(4)).add(true);
		TomlDocument doc = TomlDocument.create().add("nested", level1);

		TomlDocument reparsed = roundTrip(doc);
		assertEquals(doc, reparsed);

		TomlArray actual1 = reparsed.getValue("nested").asArray();
		assertEquals(3, actual1.size());
		TomlArray actual2 = actual1.get(0).asArray();
		assertEquals(3, actual2.size());
		assertEquals(TomlArray.ofNumbers(1, 2, 3), actual2.get(0).asArray());
		assertEquals("y z", actual2.get(1).asArray().get(1).asText());
		assertEquals(0, actual2.get(2).asArray().size());
	}

	@Test
	void inlineTablesTakeTheirKeyAsName() {
		TomlDocument doc = TomlDocument.create()
			.add("k", new TomlTable("other").add("x", 1))
			.add("list", new TomlArray().add(new TomlTable("named").add("y", 2)));
		TomlDocument reparsed = roundTrip(doc);
		assertEquals(doc, reparsed);
		assertEquals("k", reparsed.getValue("k").asTable().name());
		assertEquals("", reparsed.getValue("list").asArray().get(0).asTable().name());
	}

	@Test
	void wholeDocument() {
		TomlDocument doc = TomlDocument.create()
			.add("title", "TOML Example")
			.add("enabled", true)
			.add(new TomlTable("owner")
				.add("name", "Tom Preston-Werner")
				.add("dob", LocalDateTime.of(1979, 5, 27, 15, 32)))
			.add(new TomlTable("database")
				.add("ports", TomlArray.ofNumbers(8000, 8001, 8002))
				.add("temp_targets", new TomlTable("temp_targets").add("cpu", 79.5).add("case", 72.0))
				.add("timeout", Duration.ofSeconds(30)));
		assertEquals(doc, roundTrip(doc));
		assertEquals(doc.toString(), roundTrip(doc).toString());
	}

	@Test
	void quotedTextWithSpaceSurvives() {
		TomlDocument doc = TomlDocument.parse("title = \"TOML Example\"");
		String written = doc.toString();
		assertEquals("title = \"TOML Example\"\n", written);
		assertEquals("TOML Example", TomlDocument.parse(written).getValue("title").asText());
	}

	private static TomlDocument roundTrip(TomlDocument doc) {
		return TomlDocument.parse(doc.toString());
	}
}
