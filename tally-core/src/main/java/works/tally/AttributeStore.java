package works.tally;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import works.tally.coercion.TypeCoercion;
import works.tally.exceptions.UnknownFieldException;

/**
 * The current values of one document's fields.
 * <p>
 * Names are checked against the live {@link FieldSet} of the owning
 * {@link DocumentClass}, so a field removed from the class after this
 * store was created can no longer be read or written.
 * Not thread-safe.
 */
public final class AttributeStore {
	private final DocumentClass<?> documentClass;
	private final Map<String, Object> values = new HashMap<>();
	private long schemaVersion;

	AttributeStore(DocumentClass<?> documentClass) {
		this.documentClass = documentClass;
		this.schemaVersion = documentClass.schemaVersion();
	}

	public DocumentClass<?> documentClass() {
		return documentClass;
	}

	/**
	 * @throws UnknownFieldException if {@code name} isn't in the field set
	 */
	public Object get(String name) {
		declaration(name);
		return values.get(name);
	}

	/**
	 * Casts {@code value} to the field's type and stores it.
	 *
	 * @return the value as stored
	 * @throws UnknownFieldException if {@code name} isn't in the field set
	 * @throws works.tally.exceptions.TypeCastException if the value can't be cast
	 */
	public Object set(String name, Object value) {
		FieldDeclaration field = declaration(name);
		Object cast = TypeCoercion.global().cast(field, value);
		values.put(name, cast);
		return cast;
	}

	/**
	 * Like {@link #get} but without the field-set check.
	 */
	Object peek(String name) {
		return values.get(name);
	}

	/**
	 * @return every field in field-set order, including those that are null.
	 */
	public Map<String, Object> asMap() {
		pruneIfSchemaChanged();
		Map<String, Object> result = new LinkedHashMap<>();
		for (FieldDeclaration field: documentClass.fieldSet()) {
			result.put(field.name(), values.get(field.name()));
		}
		return Collections.unmodifiableMap(result);
	}

	FieldDeclaration declaration(String name) {
		pruneIfSchemaChanged();
		return documentClass.fieldSet().get(name)
			.orElseThrow(() -> new UnknownFieldException(documentClass.type(), name));
	}

	/**
	 * Values of fields that have been removed are dropped, so that a field
	 * removed and then declared again doesn't resurrect a stale value.
	 */
	private void pruneIfSchemaChanged() {
		long current = documentClass.schemaVersion();
		if (current != schemaVersion) {
			FieldSet fields = documentClass.fieldSet();
			long seen = schemaVersion;
			values.keySet().removeIf(name -> !fields.contains(name) || documentClass.removedSince(name, seen));
			schemaVersion = current;
		}
	}
}
