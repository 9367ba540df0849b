package works.tally.coercion;

/**
 * Conversions for one {@link works.tally.FieldType}.
 * <p>
 * None of these methods is ever called with null; {@link TypeCoercion} handles that.
 * Implementations signal an unconvertible value by throwing
 * {@link IllegalArgumentException} (including {@link NumberFormatException}),
 * {@link java.time.DateTimeException}, or {@link ArithmeticException},
 * which {@link TypeCoercion} turns into a {@link works.tally.exceptions.TypeCastException}.
 */
public interface Coercer {
	/**
	 * Converts an application-supplied value into the field's domain type.
	 */
	Object cast(Object value);

	/**
	 * Converts a domain value into its wire representation.
	 */
	Object dump(Object value, WireForm form);

	/**
	 * Converts anything the store might return for this type back into the domain type.
	 */
	Object load(Object wireValue);

	enum WireForm {
		/**
		 * The store's own representation: numbers for temporal types, booleans for booleans.
		 */
		NATIVE,

		/**
		 * Text: ISO-8601 for temporal types, {@code "t"}/{@code "f"} for booleans.
		 */
		STRING
	}
}
