package works.tally.store;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tally.exceptions.ItemTooLargeException;

/**
 * An {@link ItemStore} held in memory, for tests and local development.
 * <p>
 * Enforces a per-item size ceiling like a real store would,
 * by default the 400KB limit of DynamoDB.
 * Values are copied on the way in and on the way out,
 * so callers can't reach into stored items.
 */
public final class InMemoryItemStore implements ItemStore {
	public static final int DEFAULT_MAX_ITEM_BYTES = 400 * 1024;

	private final int maxItemBytes;
	private final Map<String, Map<ItemKey, Map<String, Object>>> tables = new ConcurrentHashMap<>();

	public InMemoryItemStore() {
		this(DEFAULT_MAX_ITEM_BYTES);
	}

	public InMemoryItemStore(int maxItemBytes) {
		this.maxItemBytes = maxItemBytes;
	}

	@Override
	public void putItem(String table, ItemKey key, Map<String, Object> item) {
		Map<String, Object> stored = new LinkedHashMap<>();
		item.forEach((name, value) -> {
			if (value != null) {
				stored.put(name, copy(value));
			}
		});
		checkSize(table, key, stored);
		table(table).put(key, stored);
		LOGGER.trace("put {}/{}: {}", table, key, stored);
	}

	@Override
	public void updateItem(String table, ItemKey key, Map<String, Object> changes) {
		table(table).compute(key, (k, existing) -> {
			Map<String, Object> updated = (existing == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(existing);
			changes.forEach((name, value) -> {
				if (value == null) {
					updated.remove(name);
				} else {
					updated.put(name, copy(value));
				}
			});
			checkSize(table, key, updated);
			return updated;
		});
		LOGGER.trace("update {}/{}: {}", table, key, changes);
	}

	@Override
	public Optional<Map<String, Object>> getItem(String table, ItemKey key) {
		Map<String, Object> item = table(table).get(key);
		if (item == null) {
			return Optional.empty();
		}
		@SuppressWarnings("unchecked")
		Map<String, Object> result = (Map<String, Object>) copy(item);
		return Optional.of(result);
	}

	@Override
	public void deleteItem(String table, ItemKey key) {
		table(table).remove(key);
		LOGGER.trace("delete {}/{}", table, key);
	}

	public int size(String table) {
		return table(table).size();
	}

	private Map<ItemKey, Map<String, Object>> table(String name) {
		return tables.computeIfAbsent(name, n -> new ConcurrentHashMap<>());
	}

	private void checkSize(String table, ItemKey key, Map<String, Object> item) {
		long size = 0;
		for (var entry: item.entrySet()) {
			size += utf8Length(entry.getKey()) + sizeOf(entry.getValue());
		}
		if (size > maxItemBytes) {
			LOGGER.debug("Rejecting {}/{}: {} bytes exceeds {}", table, key, size, maxItemBytes);
			throw new ItemTooLargeException("Item size has exceeded the maximum allowed size");
		}
	}

	/**
	 * Roughly follows DynamoDB's accounting: strings by UTF-8 length,
	 * numbers by digit count, containers by their contents plus a little overhead.
	 */
	private static long sizeOf(Object value) {
		if (value == null || value instanceof Boolean) {
			return 1;
		} else if (value instanceof CharSequence s) {
			return utf8Length(s.toString());
		} else if (value instanceof BigDecimal d) {
			return 1 + (d.precision() + 1) / 2;
		} else if (value instanceof Number n) {
			return 1 + (n.toString().length() + 1) / 2;
		} else if (value instanceof byte[] bytes) {
			return bytes.length;
		} else if (value instanceof Map<?, ?> m) {
			long size = 3;
			for (var entry: m.entrySet()) {
				size += 1 + utf8Length(String.valueOf(entry.getKey())) + sizeOf(entry.getValue());
			}
			return size;
		} else if (value instanceof Collection<?> c) {
			long size = 3;
			for (Object element: c) {
				size += 1 + sizeOf(element);
			}
			return size;
		} else {
			return utf8Length(value.toString());
		}
	}

	private static long utf8Length(String s) {
		return s.getBytes(StandardCharsets.UTF_8).length;
	}

	private static Object copy(Object value) {
		if (value instanceof Map<?, ?> m) {
			Map<Object, Object> result = new LinkedHashMap<>();
			m.forEach((k, v) -> result.put(k, copy(v)));
			return result;
		} else if (value instanceof List<?> l) {
			List<Object> result = new ArrayList<>(l.size());
			l.forEach(e -> result.add(copy(e)));
			return result;
		} else if (value instanceof Set<?> s) {
			Set<Object> result = new LinkedHashSet<>();
			s.forEach(e -> result.add(copy(e)));
			return result;
		} else if (value instanceof byte[] bytes) {
			return bytes.clone();
		} else {
			return value;
		}
	}

	@Override
	public String toString() {
		Map<String, Integer> sizes = new HashMap<>();
		tables.forEach((name, items) -> sizes.put(name, items.size()));
		return "InMemoryItemStore" + sizes;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryItemStore.class);
}
