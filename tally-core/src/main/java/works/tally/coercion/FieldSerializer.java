package works.tally.coercion;

/**
 * A user-supplied, bidirectional conversion for a single
 * {@link works.tally.FieldType#SERIALIZED serialized} field,
 * taking precedence over the configured {@link StructuredCodec}.
 * <p>
 * Neither method is called with null. Exceptions are not caught:
 * they reach the caller exactly as thrown.
 *
 * @param <T> the domain type of the field
 */
public interface FieldSerializer<T> {
	Object dump(T value);

	T load(Object wireValue);
}
