package works.tally.exceptions;

/**
 * Thrown when an operation requires an item that the store no longer has.
 */
public class DocumentNotFoundException extends RuntimeException {
	public DocumentNotFoundException(String message) {
		super(message);
	}
}
