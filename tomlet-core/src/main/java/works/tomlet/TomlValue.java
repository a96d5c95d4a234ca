package works.tomlet;

import java.time.Duration;
import java.time.LocalDateTime;
import works.tomlet.exceptions.TypeMismatchException;

import static java.util.Objects.requireNonNull;

/**
 * One scalar or container value: exactly one of the {@link ValueType} variants.
 * <p>
 * The accessor for the wrong variant throws {@link TypeMismatchException};
 * check {@link #type()} first if you're not sure.
 * <p>
 * Scalar values are immutable and can be shared freely.
 * An {@link ArrayValue} or {@link TableValue} wraps a container that
 * belongs to whichever parent it is added to first;
 * adding it to a second parent throws {@link IllegalStateException}.
 */
public sealed interface TomlValue permits
	TomlValue.TextValue,
	TomlValue.NumberValue,
	TomlValue.BooleanValue,
	TomlValue.DateTimeValue,
	TomlValue.TimeSpanValue,
	TomlValue.ArrayValue,
	TomlValue.TableValue
{
	ValueType type();

	static TomlValue text(String text) {
		return new TextValue(text);
	}

	static TomlValue number(double number) {
		return new NumberValue(number);
	}

	static TomlValue bool(boolean bool) {
		return new BooleanValue(bool);
	}

	static TomlValue dateTime(LocalDateTime dateTime) {
		return new DateTimeValue(dateTime);
	}

	static TomlValue timeSpan(Duration timeSpan) {
		return new TimeSpanValue(timeSpan);
	}

	static TomlValue array(TomlArray array) {
		return new ArrayValue(array);
	}

	static TomlValue table(TomlTable table) {
		return new TableValue(table);
	}

	default String asText() {
		throw new TypeMismatchException(ValueType.TEXT, type());
	}

	default double asNumber() {
		throw new TypeMismatchException(ValueType.NUMBER, type());
	}

	default boolean asBoolean() {
		throw new TypeMismatchException(ValueType.BOOLEAN, type());
	}

	default LocalDateTime asDateTime() {
		throw new TypeMismatchException(ValueType.DATE_TIME, type());
	}

	default Duration asTimeSpan() {
		throw new TypeMismatchException(ValueType.TIME_SPAN, type());
	}

	default TomlArray asArray() {
		throw new TypeMismatchException(ValueType.ARRAY, type());
	}

	default TomlTable asTable() {
		throw new TypeMismatchException(ValueType.TABLE, type());
	}

	record TextValue(String text) implements TomlValue {
		public TextValue {
			requireNonNull(text);
		}

		@Override public ValueType type() { return ValueType.TEXT; }
		@Override public String asText() { return text; }
	}

	record NumberValue(double number) implements TomlValue {
		@Override public ValueType type() { return ValueType.NUMBER; }
		@Override public double asNumber() { return number; }
	}

	record BooleanValue(boolean bool) implements TomlValue {
		@Override public ValueType type() { return ValueType.BOOLEAN; }
		@Override public boolean asBoolean() { return bool; }
	}

	record DateTimeValue(LocalDateTime dateTime) implements TomlValue {
		public DateTimeValue {
			requireNonNull(dateTime);
		}

		@Override public ValueType type() { return ValueType.DATE_TIME; }
		@Override public LocalDateTime asDateTime() { return dateTime; }
	}

	record TimeSpanValue(Duration timeSpan) implements TomlValue {
		public TimeSpanValue {
			requireNonNull(timeSpan);
		}

		@Override public ValueType type() { return ValueType.TIME_SPAN; }
		@Override public Duration asTimeSpan() { return timeSpan; }
	}

	record ArrayValue(TomlArray array) implements TomlValue {
		public ArrayValue {
			requireNonNull(array);
		}

		@Override public ValueType type() { return ValueType.ARRAY; }
		@Override public TomlArray asArray() { return array; }
	}

	/**
	 * An inline table, like {@code { cpu = 79.5, case = 72.0 }}.
	 * <p>
	 * Inline tables are written without their name, so equality looks only at the entries.
	 */
	record TableValue(TomlTable table) implements TomlValue {
		public TableValue {
			requireNonNull(table);
		}

		@Override public ValueType type() { return ValueType.TABLE; }
		@Override public TomlTable asTable() { return table; }

		@Override
		public boolean equals(Object obj) {
			return obj instanceof TableValue other
				&& table.keyValues().equals(other.table.keyValues());
		}

		@Override
		public int hashCode() {
			return table.keyValues().hashCode();
		}
	}
}
