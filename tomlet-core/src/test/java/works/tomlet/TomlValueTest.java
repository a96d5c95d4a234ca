package works.tomlet;

import java.time.Duration;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;
import works.tomlet.exceptions.TypeMismatchException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TomlValueTest {

	@Test
	void accessorsMatchingTheType() {
		assertEquals("x", TomlValue.text("x").asText());
		assertEquals(1.5, TomlValue.number(1.5).asNumber());
		assertEquals(true, TomlValue.bool(true).asBoolean());
		LocalDateTime dateTime = LocalDateTime.of(2000, 1, 1, 0, 0);
		assertEquals(dateTime, TomlValue.dateTime(dateTime).asDateTime());
		assertEquals(Duration.ofMinutes(5), TomlValue.timeSpan(Duration.ofMinutes(5)).asTimeSpan());
		TomlArray array = new TomlArray();
		assertSame(array, TomlValue.array(array).asArray());
		TomlTable table = new TomlTable("t");
		assertSame(table, TomlValue.table(table).asTable());
	}

	@Test
	void wrongAccessorThrows() {
		TomlValue number = TomlValue.number(42);
		TypeMismatchException e = assertThrows(TypeMismatchException.class, number::asText);
		assertEquals(ValueType.TEXT, e.expected());
		assertEquals(ValueType.NUMBER, e.actual());
		assertThrows(TypeMismatchException.class, number::asBoolean);
		assertThrows(TypeMismatchException.class, number::asDateTime);
		assertThrows(TypeMismatchException.class, number::asTimeSpan);
		assertThrows(TypeMismatchException.class, number::asArray);
		assertThrows(TypeMismatchException.class, number::asTable);
		assertThrows(TypeMismatchException.class, () -> TomlValue.text("42").asNumber());
	}

	@Test
	void types() {
		assertEquals(ValueType.TEXT, TomlValue.text("").type());
		assertEquals(ValueType.NUMBER, TomlValue.number(0).type());
		assertEquals(ValueType.BOOLEAN, TomlValue.bool(false).type());
		assertEquals(ValueType.DATE_TIME, TomlValue.dateTime(LocalDateTime.MIN).type());
		assertEquals(ValueType.TIME_SPAN, TomlValue.timeSpan(Duration.ZERO).type());
		assertEquals(ValueType.ARRAY, TomlValue.array(new TomlArray()).type());
		assertEquals(ValueType.TABLE, TomlValue.table(new TomlTable("")).type());
	}

	@Test
	void equality() {
		assertEquals(TomlValue.number(Double.NaN), TomlValue.number(Double.NaN));
		assertNotEquals(TomlValue.number(0.0), TomlValue.number(-0.0));
		assertNotEquals(TomlValue.text("1"), TomlValue.number(1));
		assertEquals(TomlValue.array(TomlArray.ofNumbers(1, 2)), TomlValue.array(TomlArray.ofNumbers(1, 2)));
	}

	@Test
	void inlineTableEqualityIgnoresName() {
		assertEquals(
			TomlValue.table(new TomlTable("a").add("x", 1)),
			TomlValue.table(new TomlTable("b").add("x", 1)));
		assertEquals(
			TomlValue.table(new TomlTable("a").add("x", 1)).hashCode(),
			TomlValue.table(new TomlTable("b").add("x", 1)).hashCode());
		assertNotEquals(
			TomlValue.table(new TomlTable("a").add("x", 1)),
			TomlValue.table(new TomlTable("a").add("x", 2)));
		assertNotEquals(new TomlTable("a"), new TomlTable("b"), "Table sections still compare by name");
	}
}
