package works.tally.exceptions;

/**
 * The structured codec could not encode or decode a serialized field.
 * <p>
 * Exceptions thrown by a field's own {@link works.tally.coercion.FieldSerializer FieldSerializer}
 * are not wrapped in this; they reach the caller unchanged.
 */
public class SerializationException extends RuntimeException {
	public SerializationException(String message) {
		super(message);
	}

	public SerializationException(String message, Throwable cause) {
		super(message, cause);
	}

	public SerializationException(Throwable cause) {
		super(cause);
	}
}
