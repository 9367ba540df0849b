package works.tally.exceptions;

public class InvalidDeclarationException extends IllegalArgumentException {
	private final Class<?> documentClass;
	private final String fieldName;

	public Class<?> documentClass() {
		return this.documentClass;
	}

	public String fieldName() {
		return this.fieldName;
	}

	public InvalidDeclarationException(String message) {
		super(message);
		this.documentClass = null;
		this.fieldName = null;
	}

	public InvalidDeclarationException(Class<?> documentClass, String fieldName, String message) {
		super("Invalid declaration of " + documentClass.getSimpleName() + "." + fieldName + ": " + message);
		this.documentClass = documentClass;
		this.fieldName = fieldName;
	}
}
