package works.tomlet.exceptions;

import works.tomlet.ValueType;

public final class TypeMismatchException extends TomlAccessException {
	private final ValueType expected;
	private final ValueType actual;

	public TypeMismatchException(ValueType expected, ValueType actual) {
		super("Expected value type `" + expected + "`, but got `" + actual + "`");
		this.expected = expected;
		this.actual = actual;
	}

	public ValueType expected() {
		return expected;
	}

	public ValueType actual() {
		return actual;
	}
}
