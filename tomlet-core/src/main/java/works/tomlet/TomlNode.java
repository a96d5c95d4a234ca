package works.tomlet;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import works.tomlet.codec.Token;
import works.tomlet.codec.TomlFormat;
import works.tomlet.codec.TomlReader;
import works.tomlet.codec.ValueInference;
import works.tomlet.codec.ValueInference.Candidate;

import static java.util.Objects.requireNonNull;

/**
 * Common ownership bookkeeping for the mutable parts of a document tree.
 * <p>
 * Each node belongs to at most one parent, fixed the first time it is added
 * to one. That keeps the tree free of aliasing and cycles:
 * a node added a second time, or added beneath itself, is rejected.
 */
abstract sealed class TomlNode permits TomlArray, TomlTable, TomlKeyValue, TomlDocument {
	private TomlNode owner = null;

	final void attachTo(TomlNode parent) {
		checkAttachable(parent);
		owner = parent;
	}

	/**
	 * @throws IllegalStateException if {@link #attachTo} would reject {@code parent}
	 */
	final void checkAttachable(TomlNode parent) {
		requireNonNull(parent);
		if (owner != null) {
			throw new IllegalStateException(describe() + " already belongs to " + owner.describe());
		}
		for (TomlNode ancestor = parent; ancestor != null; ancestor = ancestor.owner) {
			if (ancestor == this) {
				throw new IllegalStateException("Adding " + describe() + " to " + parent.describe() + " would create a cycle");
			}
		}
	}

	/**
	 * Short human-readable identification for error messages.
	 */
	abstract String describe();

	/**
	 * Appends this node's TOML text.
	 * <p>
	 * There are no escape sequences, so text holding both {@code '} and {@code "}
	 * is written bare. Where that isn't possible either, because the text also has
	 * punctuation, a line break, or whitespace at either end, this throws.
	 *
	 * @throws IllegalArgumentException if some text can't be written
	 */
	public abstract void writeTo(Appendable out) throws IOException;

	/**
	 * Checks a value before it is wrapped in a new {@link TomlKeyValue} destined for {@code container},
	 * so a rejected add leaves the value free to go elsewhere.
	 */
	static void checkContents(TomlValue value, TomlNode container) {
		switch (value.type()) {
			case ARRAY -> value.asArray().checkAttachable(container);
			case TABLE -> value.asTable().checkAttachable(container);
			default -> { }
		}
	}

	static void attachContents(TomlValue value, TomlNode parent) {
		switch (value.type()) {
			case ARRAY -> value.asArray().attachTo(parent);
			case TABLE -> value.asTable().attachTo(parent);
			default -> { }
		}
	}

	/**
	 * Consumes a {@link Token.Kind#TEXT TEXT} token and decides what scalar it holds.
	 * Bare text is stripped first. Quoted text stays literal unless
	 * {@link TomlSettings#isInferQuotedText()} says otherwise.
	 */
	static TomlValue readScalar(TomlReader reader, List<Candidate> order, TomlSettings settings) {
		Token token = reader.expect(Token.Kind.TEXT, "for a value");
		String raw = reader.text(token);
		if (token.quoted()) {
			if (settings.isInferQuotedText()) {
				return ValueInference.infer(raw, order);
			} else {
				return TomlValue.text(raw);
			}
		}
		return ValueInference.infer(raw.strip(), order);
	}

	static void writeValue(TomlValue value, Appendable out) throws IOException {
		switch (value.type()) {
			case ARRAY -> value.asArray().writeTo(out);
			case TABLE -> value.asTable().writeInlineTo(out);
			default -> out.append(TomlFormat.scalar(value));
		}
	}

	/**
	 * @return the text {@link #writeTo} would append
	 * @throws IllegalArgumentException if some text can't be written
	 */
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		try {
			writeTo(sb);
		} catch (IOException e) {
			throw new UncheckedIOException("StringBuilder does not throw IOException", e);
		}
		return sb.toString();
	}
}
