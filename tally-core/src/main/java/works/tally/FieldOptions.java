package works.tally;

import java.util.function.Supplier;
import lombok.Builder;
import lombok.Value;
import works.tally.coercion.FieldSerializer;

/**
 * Optional settings attached to a {@link FieldDeclaration}.
 * Unset wire-format options fall back to the corresponding {@link TallyConfig} settings.
 */
@Value
@Builder(toBuilder = true)
public class FieldOptions {
	public static final FieldOptions NONE = FieldOptions.builder().build();

	DefaultValue defaultValue;

	/**
	 * Replaces the structured codec for a {@link FieldType#SERIALIZED serialized} field.
	 */
	FieldSerializer<?> serializer;

	/**
	 * The attribute name used on the wire, if different from the field name.
	 */
	String storeAs;

	/**
	 * For datetime and date fields: ISO-8601 text instead of numbers.
	 */
	Boolean storeAsString;

	/**
	 * For boolean fields: native booleans instead of {@code "t"}/{@code "f"}.
	 */
	Boolean storeAsNativeBoolean;

	public static FieldOptions withDefault(Object value) {
		return builder().defaultValue(DefaultValue.of(value)).build();
	}

	public static FieldOptions withComputedDefault(Supplier<?> producer) {
		return builder().defaultValue(DefaultValue.computed(producer)).build();
	}

	public static FieldOptions storedAs(String wireName) {
		return builder().storeAs(wireName).build();
	}

	public static FieldOptions withSerializer(FieldSerializer<?> serializer) {
		return builder().serializer(serializer).build();
	}
}
