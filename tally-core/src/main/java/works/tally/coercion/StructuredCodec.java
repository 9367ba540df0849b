package works.tally.coercion;

/**
 * Turns arbitrary structured values (maps, lists, scalars) into text and back.
 * Used for {@link works.tally.FieldType#SERIALIZED serialized} fields.
 */
public interface StructuredCodec {
	/**
	 * @throws works.tally.exceptions.SerializationException if the value can't be encoded
	 */
	String encode(Object value);

	/**
	 * @throws works.tally.exceptions.SerializationException if the text can't be decoded
	 */
	Object decode(String text);
}
