package works.tomlet;

/**
 * The kinds of value a {@link TomlValue} can hold.
 */
public enum ValueType {
	TEXT,

	/**
	 * All numbers are doubles. Integers and floats are not distinguished.
	 */
	NUMBER,
	BOOLEAN,

	/**
	 * A date and time with no offset. Offset date-times are normalized to UTC.
	 */
	DATE_TIME,

	/**
	 * A duration, like {@code 07:32:00} or {@code 1.02:03:04}.
	 */
	TIME_SPAN,
	ARRAY,
	TABLE,
}
