package works.tally.exceptions;

/**
 * A read or write named a field that is not in the document class's field set.
 */
public class UnknownFieldException extends IllegalArgumentException {
	private final Class<?> documentClass;
	private final String fieldName;

	public Class<?> documentClass() {
		return this.documentClass;
	}

	public String fieldName() {
		return this.fieldName;
	}

	public UnknownFieldException(Class<?> documentClass, String fieldName) {
		super("Unknown field " + documentClass.getSimpleName() + "." + fieldName);
		this.documentClass = documentClass;
		this.fieldName = fieldName;
	}
}
