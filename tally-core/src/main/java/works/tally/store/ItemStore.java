package works.tally.store;

import java.util.Map;
import java.util.Optional;

/**
 * The narrow interface through which tally reaches a key-value store.
 * <p>
 * Items are maps from wire attribute names to wire values, exactly as produced by
 * {@link works.tally.Marshaller#attributesForWrite Marshaller.attributesForWrite}.
 * Implementations own everything about transport: connections, retries, throttling.
 * None of these methods may silently drop or truncate attributes; an item the
 * store can't accept must cause an exception, such as
 * {@link works.tally.exceptions.ItemTooLargeException}.
 */
public interface ItemStore {
	/**
	 * Replaces the whole item. Null-valued attributes are not stored.
	 */
	void putItem(String table, ItemKey key, Map<String, Object> item);

	/**
	 * Merges {@code changes} into the item, creating it if it doesn't exist.
	 * A null value removes the attribute.
	 */
	void updateItem(String table, ItemKey key, Map<String, Object> changes);

	Optional<Map<String, Object>> getItem(String table, ItemKey key);

	void deleteItem(String table, ItemKey key);
}
