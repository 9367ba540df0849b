package works.tally;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tracks which fields of one document differ from their values at the last clean point.
 * <p>
 * A {@link Change} is allocated for a field only when it's first written after a clean point,
 * and is discarded as soon as the field's value is once again equal to the clean value.
 * Equality is by value ({@link FieldType#sameValue}), not identity.
 * Not thread-safe.
 */
public final class DirtyLedger {
	private final AttributeStore store;
	private final Map<String, Change> pending = new LinkedHashMap<>();
	private Map<String, Change> previous = Map.of();

	DirtyLedger(AttributeStore store) {
		this.store = store;
	}

	void recordWrite(FieldDeclaration field, Object previousValue, Object currentValue) {
		Change existing = pending.get(field.name());
		Object clean = (existing == null) ? previousValue : existing.before();
		if (field.type().sameValue(clean, currentValue)) {
			pending.remove(field.name());
		} else {
			pending.put(field.name(), new Change(clean, currentValue));
		}
	}

	/**
	 * Establishes {@code value} as the clean value of the named field.
	 */
	public void markClean(String name, Object value) {
		FieldDeclaration field = store.declaration(name);
		Object current = store.peek(name);
		if (field.type().sameValue(value, current)) {
			pending.remove(name);
		} else {
			pending.put(name, new Change(value, current));
		}
	}

	/**
	 * Makes every field's current value its clean value.
	 */
	void markAllClean() {
		pending.clear();
	}

	/**
	 * Like {@link #markAllClean}, after remembering the outstanding
	 * changes as the {@link #previousChanges() previous changes}.
	 */
	void commit() {
		previous = Collections.unmodifiableMap(new LinkedHashMap<>(liveChanges()));
		pending.clear();
	}

	void forget(String name) {
		pending.remove(name);
	}

	public Set<String> changedFields() {
		return Collections.unmodifiableSet(new LinkedHashSet<>(liveChanges().keySet()));
	}

	public boolean isChanged(String name) {
		store.declaration(name);
		return pending.containsKey(name);
	}

	public Optional<Change> changeFor(String name) {
		store.declaration(name);
		return Optional.ofNullable(pending.get(name));
	}

	public Map<String, Change> changes() {
		return Collections.unmodifiableMap(liveChanges());
	}

	/**
	 * @return the changes written by the most recent synchronization.
	 */
	public Map<String, Change> previousChanges() {
		return previous;
	}

	/**
	 * Changes to fields that have since been removed from the class don't count.
	 */
	private Map<String, Change> liveChanges() {
		FieldSet fields = store.documentClass().fieldSet();
		Map<String, Change> result = new LinkedHashMap<>();
		pending.forEach((name, change) -> {
			if (fields.contains(name)) {
				result.put(name, change);
			}
		});
		return result;
	}
}
