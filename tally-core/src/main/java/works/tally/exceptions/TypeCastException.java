package works.tally.exceptions;

import works.tally.FieldType;

/**
 * A value could not be interpreted as the type declared for its field.
 */
public class TypeCastException extends IllegalArgumentException {
	private final String fieldName;
	private final FieldType fieldType;
	private final transient Object value;

	public String fieldName() {
		return this.fieldName;
	}

	public FieldType fieldType() {
		return this.fieldType;
	}

	public Object value() {
		return this.value;
	}

	public TypeCastException(String fieldName, FieldType fieldType, Object value, String message) {
		super(fullMessage(fieldName, fieldType, value, message));
		this.fieldName = fieldName;
		this.fieldType = fieldType;
		this.value = value;
	}

	public TypeCastException(String fieldName, FieldType fieldType, Object value, String message, Throwable cause) {
		super(fullMessage(fieldName, fieldType, value, message), cause);
		this.fieldName = fieldName;
		this.fieldType = fieldType;
		this.value = value;
	}

	private static String fullMessage(String fieldName, FieldType fieldType, Object value, String message) {
		return "Cannot cast " + describe(value) + " to " + fieldType.tag() + " for field \"" + fieldName + "\": " + message;
	}

	private static String describe(Object value) {
		if (value instanceof CharSequence) {
			return "\"" + value + "\" (" + value.getClass().getSimpleName() + ")";
		} else {
			return value + " (" + value.getClass().getSimpleName() + ")";
		}
	}
}
