package works.tally.exceptions;

/**
 * Thrown by an {@link works.tally.store.ItemStore ItemStore} when a written item
 * exceeds the store's per-item size ceiling.
 * Nothing in the core checks item sizes; the store is the only source of this signal.
 */
public class ItemTooLargeException extends RuntimeException {
	public ItemTooLargeException(String message) {
		super(message);
	}

	public ItemTooLargeException(String message, Throwable cause) {
		super(message, cause);
	}
}
