package works.tomlet;

import java.util.List;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import works.tomlet.codec.ValueInference;
import works.tomlet.codec.ValueInference.Candidate;
import works.tomlet.exceptions.DuplicateKeyException;
import works.tomlet.exceptions.UnexpectedTokenException;

/**
 * Options that control how TOML text is parsed.
 * Serialization is not affected.
 */
@Value
@Builder(toBuilder = true)
public class TomlSettings {
	public static final TomlSettings DEFAULT = TomlSettings.builder().build();

	/**
	 * Which scalar interpretations to try, and in what order,
	 * for unquoted values.
	 */
	@Default InferenceOrder inferenceOrder = InferenceOrder.UNIFIED;

	@Default DuplicateKeyPolicy duplicateKeys = DuplicateKeyPolicy.KEEP_ALL;

	/**
	 * If true, quoted values go through type inference just like bare ones,
	 * so {@code "true"} is a boolean and {@code "42"} is a number.
	 * If false, quoted values are always text.
	 */
	@Default boolean inferQuotedText = false;

	/**
	 * If false, an inline table value (<code>{ ... }</code>) is rejected
	 * with {@link UnexpectedTokenException}.
	 */
	@Default boolean inlineTables = true;

	public enum InferenceOrder {
		/**
		 * Arrays and key-values both use {@link ValueInference#UNIFIED_ORDER}.
		 */
		UNIFIED(ValueInference.UNIFIED_ORDER, ValueInference.UNIFIED_ORDER),

		/**
		 * Arrays use {@link ValueInference#UNIFIED_ORDER};
		 * key-values use {@link ValueInference#TEMPORAL_FIRST_ORDER}.
		 * The same literal can then mean different things in different places.
		 */
		CONTEXTUAL(ValueInference.UNIFIED_ORDER, ValueInference.TEMPORAL_FIRST_ORDER);

		private final List<Candidate> arrayOrder;
		private final List<Candidate> keyValueOrder;

		InferenceOrder(List<Candidate> arrayOrder, List<Candidate> keyValueOrder) {
			this.arrayOrder = arrayOrder;
			this.keyValueOrder = keyValueOrder;
		}

		public List<Candidate> arrayOrder() {
			return arrayOrder;
		}

		public List<Candidate> keyValueOrder() {
			return keyValueOrder;
		}
	}

	public enum DuplicateKeyPolicy {
		/**
		 * Duplicates are kept in order. Lookups find the first one;
		 * later ones are reachable only by iterating.
		 */
		KEEP_ALL,

		/**
		 * A repeated key within one table (or at the top level),
		 * or a repeated table name, fails the parse with {@link DuplicateKeyException}.
		 */
		REJECT,
	}
}
