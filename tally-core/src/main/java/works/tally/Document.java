package works.tally;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import works.tally.exceptions.UnknownFieldException;

import static works.tally.DocumentClass.CREATED_AT;
import static works.tally.DocumentClass.ID;
import static works.tally.DocumentClass.UPDATED_AT;

/**
 * Base class for objects mapped to items in a key-value store.
 * <p>
 * A subclass must be {@link DocumentClass#define defined} before it's instantiated,
 * and must pass its initial attributes to {@link #Document(Map)}.
 * Fields are accessed by name:
 *
 * <ul>
 *     <li>
 *         {@link #get}, {@link #set}, and {@link #is} go through the field's accessors,
 *         including any {@link DocumentClass#overrideReader overrides};
 *     </li>
 *     <li>
 *         {@link #readAttribute} and {@link #writeAttribute} go directly to the attribute values.
 *     </li>
 * </ul>
 *
 * Subclasses typically add typed accessor methods on top of these.
 * <p>
 * Instances are not thread-safe.
 */
public abstract class Document {
	private final DocumentClass<?> documentClass;
	private final AttributeStore attributes;
	private final DirtyLedger ledger;
	private boolean newRecord = true;
	private boolean destroyed = false;

	protected Document() {
		this(Map.of());
	}

	/**
	 * Fields named in {@code initialValues} take those values, even if null;
	 * all others take their {@link DefaultValue defaults}, if any.
	 * Values are assigned as if by {@link #writeAttribute}.
	 *
	 * @throws UnknownFieldException if {@code initialValues} names a field this class doesn't have
	 */
	protected Document(Map<String, ?> initialValues) {
		this.documentClass = DocumentClass.lookup(getClass());
		this.attributes = new AttributeStore(documentClass);
		this.ledger = new DirtyLedger(attributes);

		FieldSet fields = documentClass.fieldSet();
		for (String name: initialValues.keySet()) {
			if (!fields.contains(name)) {
				throw new UnknownFieldException(documentClass.type(), name);
			}
		}
		for (FieldDeclaration field: fields) {
			if (initialValues.containsKey(field.name())) {
				writeAttribute(field.name(), initialValues.get(field.name()));
			} else if (field.hasDefault()) {
				writeAttribute(field.name(), DefaultValueResolver.resolve(field));
			}
		}

		String inheritanceField = TallyConfig.global().inheritanceField();
		if (fields.contains(inheritanceField) && attributes.get(inheritanceField) == null) {
			writeAttribute(inheritanceField, documentClass.discriminator());
		}
	}

	public final DocumentClass<?> documentClass() {
		return documentClass;
	}

	// Accessors

	/**
	 * Reads a field through its accessor.
	 *
	 * @throws UnknownFieldException if the class has no such field
	 */
	public final Object get(String name) {
		return documentClass.reader(name).read(this);
	}

	public final <T> T get(String name, Class<T> type) {
		return type.cast(get(name));
	}

	/**
	 * Writes a field through its accessor.
	 *
	 * @throws UnknownFieldException if the class has no such field
	 * @throws works.tally.exceptions.TypeCastException if the value can't be cast to the field's type
	 */
	public final Document set(String name, Object value) {
		documentClass.writer(name).write(this, value);
		return this;
	}

	/**
	 * @return false if the field's value is null or false; true otherwise.
	 */
	public final boolean is(String name) {
		Object value = get(name);
		return value != null && !Boolean.FALSE.equals(value);
	}

	public final boolean respondsTo(String name) {
		return documentClass.respondsTo(name);
	}

	public final Object readAttribute(String name) {
		return attributes.get(name);
	}

	/**
	 * Casts and stores {@code value}, bypassing accessor overrides.
	 */
	public final Document writeAttribute(String name, Object value) {
		FieldDeclaration field = attributes.declaration(name);
		Object previous = attributes.peek(name);
		Object current = attributes.set(name, value);
		ledger.recordWrite(field, previous, current);
		return this;
	}

	/**
	 * @return every field's current value, in declaration order
	 */
	public final Map<String, Object> attributes() {
		return attributes.asMap();
	}

	public final String id() {
		return (String) readAttribute(ID);
	}

	/**
	 * @return the creation time, or null if not yet saved or if the class has no timestamps
	 */
	public final Instant createdAt() {
		return timestamp(CREATED_AT);
	}

	/**
	 * @return the last update time, or null if not yet saved or if the class has no timestamps
	 */
	public final Instant updatedAt() {
		return timestamp(UPDATED_AT);
	}

	private Instant timestamp(String name) {
		if (documentClass.fieldSet().contains(name)) {
			return (Instant) readAttribute(name);
		} else {
			return null;
		}
	}

	// Dirty tracking

	public final boolean isChanged() {
		return !ledger.changedFields().isEmpty();
	}

	public final boolean isChanged(String name) {
		return ledger.isChanged(name);
	}

	public final Set<String> changedFields() {
		return ledger.changedFields();
	}

	public final Optional<Change> changeFor(String name) {
		return ledger.changeFor(name);
	}

	public final Map<String, Change> changes() {
		return ledger.changes();
	}

	public final Map<String, Change> previousChanges() {
		return ledger.previousChanges();
	}

	/**
	 * @return the value of the field at the last clean point
	 */
	public final Object attributeWas(String name) {
		return ledger.changeFor(name)
			.map(Change::before)
			.orElseGet(() -> readAttribute(name));
	}

	/**
	 * Puts every changed field back to its clean value.
	 */
	public final void restoreAttributes() {
		Map<String, Change> changes = new LinkedHashMap<>(ledger.changes());
		changes.forEach((name, change) -> writeAttribute(name, change.before()));
	}

	/**
	 * Accepts the current values of the named fields as clean, without synchronizing.
	 */
	public final void clearAttributeChanges(String... names) {
		for (String name: names) {
			attributes.declaration(name);
			ledger.forget(name);
		}
	}

	// Lifecycle

	public final boolean isNewRecord() {
		return newRecord;
	}

	public final boolean isPersisted() {
		return !newRecord && !destroyed;
	}

	public final boolean isDestroyed() {
		return destroyed;
	}

	final DirtyLedger ledger() {
		return ledger;
	}

	final void markPersisted() {
		newRecord = false;
	}

	final void markDestroyed() {
		destroyed = true;
	}

	/**
	 * Documents are equal if they're of the same class and have the same non-null {@link #id()}.
	 */
	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		Document that = (Document) o;
		String id = this.id();
		return id != null
			&& id.equals(that.id())
			&& Objects.equals(rangeKeyValue(), that.rangeKeyValue());
	}

	private Object rangeKeyValue() {
		return documentClass.rangeKeyName().map(this::readAttribute).orElse(null);
	}

	@Override
	public int hashCode() {
		String id = this.id();
		return (id == null) ? System.identityHashCode(this) : Objects.hash(getClass(), id);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + attributes();
	}
}
