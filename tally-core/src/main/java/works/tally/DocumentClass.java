package works.tally;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tally.exceptions.InvalidDeclarationException;

import static java.util.Objects.requireNonNull;
import static works.tally.FieldType.DATETIME;
import static works.tally.FieldType.SERIALIZED;
import static works.tally.FieldType.STRING;

/**
 * The field registry of one {@link Document} subclass: its {@link FieldSet},
 * its accessors, and where its items live in the store.
 * <p>
 * Define each document class once, before creating instances:
 *
 * <pre>
 * public class Address extends Document {
 *     public static final DocumentClass&lt;Address&gt; ADDRESSES = DocumentClass.define(Address.class, Address::new)
 *         .field("city")
 *         .field("deliverable", BOOLEAN);
 *
 *     public Address(Map&lt;String, ?&gt; attributes) { super(attributes); }
 * }
 * </pre>
 *
 * Every document class has a string {@link #ID id} hash key, and, if
 * {@link TallyConfig#timestamps() timestamps} are on when it's defined,
 * {@link #CREATED_AT created_at} and {@link #UPDATED_AT updated_at} datetime fields.
 *
 * <h2>Single-table inheritance</h2>
 *
 * If the Java superclass of {@code type} has its own {@code DocumentClass},
 * the new one starts from a snapshot of the parent's fields, accessors, table, and keys,
 * and then diverges: fields added to the parent afterward do not appear in the child,
 * and fields declared on the child never appear in the parent or its other children.
 * Define parents before children.
 *
 * <h2>Threading</h2>
 *
 * Declarations are meant to happen during startup.
 * They must not run concurrently with each other or with construction of instances
 * of the same class; nothing here locks to prevent that.
 * Once declarations are done, a {@code DocumentClass} can be shared freely.
 */
public final class DocumentClass<D extends Document> {
	public static final String ID = "id";
	public static final String CREATED_AT = "created_at";
	public static final String UPDATED_AT = "updated_at";

	private final Class<D> type;
	private final Function<Map<String, ?>, D> factory;
	private final @Nullable DocumentClass<?> parent;
	private final List<DocumentClass<?>> children = new CopyOnWriteArrayList<>();
	private final boolean timestamped;
	private final AtomicLong schemaVersion = new AtomicLong();

	private volatile FieldSet fieldSet;
	private volatile AccessorTable accessors;
	private volatile String tableName;
	private volatile @Nullable String rangeKey;
	private volatile String discriminator;
	private volatile PMap<String, Long> removals = HashTreePMap.empty();

	private DocumentClass(Class<D> type, Function<Map<String, ?>, D> factory, @Nullable DocumentClass<?> parent, TallyConfig config) {
		this.type = type;
		this.factory = factory;
		this.parent = parent;
		this.discriminator = type.getSimpleName();
		if (parent == null) {
			this.timestamped = config.timestamps();
			this.fieldSet = FieldSet.empty();
			this.accessors = AccessorTable.empty();
			this.tableName = defaultTableName(type);
			this.rangeKey = null;
			declare(FieldDeclaration.of(ID, STRING));
			if (timestamped) {
				declare(FieldDeclaration.of(CREATED_AT, DATETIME));
				declare(FieldDeclaration.of(UPDATED_AT, DATETIME));
			}
		} else {
			this.timestamped = parent.timestamped;
			this.fieldSet = parent.fieldSet;
			this.accessors = parent.accessors;
			this.tableName = parent.tableName;
			this.rangeKey = parent.rangeKey;
		}
	}

	/**
	 * Registers {@code type} as a document class, replacing any previous definition.
	 *
	 * @param factory creates instances given their initial attribute values;
	 *                usually a constructor that passes them to {@link Document#Document(Map)}.
	 */
	public static <D extends Document> DocumentClass<D> define(Class<D> type, Function<Map<String, ?>, D> factory) {
		requireNonNull(type);
		requireNonNull(factory);
		DocumentClass<?> parent = registeredAncestor(type.getSuperclass()).orElse(null);
		DocumentClass<D> result = new DocumentClass<>(type, factory, parent, TallyConfig.global());
		DocumentClass<?> old = REGISTRY.put(type, result);
		if (old != null) {
			LOGGER.debug("Redefining {}", type.getSimpleName());
			if (old.parent != null) {
				old.parent.children.remove(old);
			}
		}
		if (parent == null) {
			LOGGER.debug("Defined {} with table \"{}\"", type.getSimpleName(), result.tableName);
		} else {
			parent.children.add(result);
			LOGGER.debug("Defined {} inheriting {} fields from {}", type.getSimpleName(), result.fieldSet.size(), parent.type.getSimpleName());
		}
		return result;
	}

	/**
	 * @throws InvalidDeclarationException if {@code type} hasn't been {@link #define defined}
	 */
	@SuppressWarnings("unchecked")
	public static <D extends Document> DocumentClass<D> of(Class<D> type) {
		DocumentClass<?> result = REGISTRY.get(type);
		if (result == null) {
			throw new InvalidDeclarationException("No document class defined for " + type.getName());
		}
		return (DocumentClass<D>) result;
	}

	public static FieldSet fieldSet(Class<? extends Document> type) {
		return of(type).fieldSet();
	}

	/**
	 * Finds the document class for an instance of {@code type}, which may be
	 * an undefined subclass (such as an anonymous class) of a defined one.
	 */
	static DocumentClass<?> lookup(Class<?> type) {
		return registeredAncestor(type).orElseThrow(() ->
			new InvalidDeclarationException("No document class defined for " + type.getName()));
	}

	private static Optional<DocumentClass<?>> registeredAncestor(@Nullable Class<?> type) {
		for (Class<?> c = type; c != null && c != Document.class; c = c.getSuperclass()) {
			DocumentClass<?> result = REGISTRY.get(c);
			if (result != null) {
				return Optional.of(result);
			}
		}
		return Optional.empty();
	}

	// Declarations

	public DocumentClass<D> field(String name) {
		return field(name, STRING, FieldOptions.NONE);
	}

	public DocumentClass<D> field(String name, FieldType fieldType) {
		return field(name, fieldType, FieldOptions.NONE);
	}

	/**
	 * Declares a field, replacing any existing declaration with the same name.
	 */
	public DocumentClass<D> field(String name, FieldType fieldType, FieldOptions options) {
		FieldDeclaration declaration = new FieldDeclaration(name, fieldType, options);
		validate(declaration);
		if (fieldType == FieldType.FLOAT) {
			warnFloatDeprecated(name);
		}
		declare(declaration);
		return this;
	}

	/**
	 * Declares a field and makes it the range key, completing the primary key with {@link #ID id}.
	 */
	public DocumentClass<D> rangeKey(String name, FieldType fieldType, FieldOptions options) {
		field(name, fieldType, options);
		this.rangeKey = name;
		return this;
	}

	/**
	 * Removes a field and its accessors from this class only.
	 * Subclasses defined earlier keep the field, and so does the parent.
	 */
	public DocumentClass<D> removeField(String name) {
		if (name.equals(ID) || name.equals(rangeKey)) {
			throw new InvalidDeclarationException(type, name, "key fields can't be removed");
		}
		if (!fieldSet.contains(name)) {
			LOGGER.debug("{} has no field \"{}\" to remove", type.getSimpleName(), name);
			return this;
		}
		fieldSet = fieldSet.minus(name);
		accessors = accessors.remove(name);
		removals = removals.plus(name, schemaVersion.incrementAndGet());
		LOGGER.debug("Removed field {}.{}", type.getSimpleName(), name);
		return this;
	}

	public DocumentClass<D> table(String tableName) {
		this.tableName = requireNonNull(tableName);
		return this;
	}

	/**
	 * Sets the value stored in the {@link TallyConfig#inheritanceField() inheritance field}
	 * to identify this class. Defaults to the simple class name.
	 */
	public DocumentClass<D> discriminator(String discriminator) {
		this.discriminator = requireNonNull(discriminator);
		return this;
	}

	/**
	 * Wraps the reader of the named field. The override receives the
	 * previously effective reader as its {@code base}.
	 * Overrides survive redeclaration of the field, and are inherited by
	 * subclasses defined afterward.
	 */
	public DocumentClass<D> overrideReader(String name, ReaderOverride override) {
		accessors = accessors.plusReaderOverride(name, requireNonNull(override));
		return this;
	}

	/**
	 * @see #overrideReader
	 */
	public DocumentClass<D> overrideWriter(String name, WriterOverride override) {
		accessors = accessors.plusWriterOverride(name, requireNonNull(override));
		return this;
	}

	private void declare(FieldDeclaration declaration) {
		fieldSet = fieldSet.plus(declaration);
		accessors = accessors.generate(declaration);
		schemaVersion.incrementAndGet();
		LOGGER.debug("Declared field {}.{} as {}", type.getSimpleName(), declaration.name(), declaration.type());
	}

	private void validate(FieldDeclaration declaration) {
		String name = declaration.name();
		if (name.isBlank()) {
			throw new InvalidDeclarationException(type, name, "field name can't be blank");
		}
		if (name.equals(ID) && declaration.type() != STRING) {
			throw new InvalidDeclarationException(type, name, "hash key must be a string");
		}
		if (declaration.options().serializer() != null && declaration.type() != SERIALIZED) {
			throw new InvalidDeclarationException(type, name, "only serialized fields can have a serializer");
		}
		String wireName = declaration.wireName();
		for (FieldDeclaration other: fieldSet) {
			if (!other.name().equals(name) && (other.wireName().equals(wireName) || other.name().equals(wireName))) {
				throw new InvalidDeclarationException(type, name, "attribute name \"" + wireName + "\" is already used by " + other.name());
			}
		}
	}

	private static void warnFloatDeprecated(String name) {
		if (FLOAT_WARNING_ISSUED.compareAndSet(false, true)) {
			LOGGER.warn("Field type float, which you declared for '{}', is deprecated in favor of number.", name);
		}
	}

	static void resetDeprecationWarnings() {
		FLOAT_WARNING_ISSUED.set(false);
	}

	private static String defaultTableName(Class<?> type) {
		String simpleName = type.getSimpleName();
		String base = Character.toLowerCase(simpleName.charAt(0)) + simpleName.substring(1);
		if (base.endsWith("s") || base.endsWith("x") || base.endsWith("ch") || base.endsWith("sh")) {
			return base + "es";
		} else {
			return base + "s";
		}
	}

	// Instances

	public D newInstance() {
		return newInstance(Map.of());
	}

	/**
	 * Fields absent from {@code attributes} get their defaults;
	 * fields present with a null value are null.
	 */
	public D newInstance(Map<String, ?> attributes) {
		D result = factory.apply(attributes);
		if (result.documentClass() != this) {
			throw new IllegalStateException("Factory for " + type.getSimpleName() + " produced a " + result.getClass().getSimpleName());
		}
		return result;
	}

	// Introspection

	public Class<D> type() {
		return type;
	}

	public Optional<DocumentClass<?>> parent() {
		return Optional.ofNullable(parent);
	}

	public List<DocumentClass<?>> children() {
		return List.copyOf(children);
	}

	public FieldSet fieldSet() {
		return fieldSet;
	}

	public Optional<FieldDeclaration> declaration(String name) {
		return fieldSet.get(name);
	}

	/**
	 * @return every field declaration in order, keyed by name
	 */
	public Map<String, FieldDeclaration> attributes() {
		Map<String, FieldDeclaration> result = new LinkedHashMap<>();
		for (FieldDeclaration field: fieldSet) {
			result.put(field.name(), field);
		}
		return result;
	}

	/**
	 * Changes whenever a field is declared or removed.
	 */
	public long schemaVersion() {
		return schemaVersion.get();
	}

	/**
	 * @return true if {@code name} has been removed since {@code version},
	 * even if it has been declared again afterward
	 */
	boolean removedSince(String name, long version) {
		Long removedAt = removals.get(name);
		return removedAt != null && removedAt > version;
	}

	public String tableName() {
		return tableName;
	}

	public String hashKey() {
		return ID;
	}

	public Optional<String> rangeKeyName() {
		return Optional.ofNullable(rangeKey);
	}

	public String discriminator() {
		return discriminator;
	}

	public boolean isTimestamped() {
		return timestamped;
	}

	public boolean respondsTo(String name) {
		return accessors.responds(name);
	}

	AttributeReader reader(String name) {
		return accessors.reader(type, name);
	}

	AttributeWriter writer(String name) {
		return accessors.writer(type, name);
	}

	/**
	 * @return this class or the descendant whose {@link #discriminator()} matches
	 */
	@SuppressWarnings("unchecked")
	public Optional<DocumentClass<? extends D>> resolve(String discriminator) {
		if (this.discriminator.equals(discriminator)) {
			return Optional.of(this);
		}
		for (DocumentClass<?> child: children) {
			Optional<? extends DocumentClass<?>> found = child.resolve(discriminator);
			if (found.isPresent()) {
				return Optional.of((DocumentClass<? extends D>) found.get());
			}
		}
		return Optional.empty();
	}

	@Override
	public String toString() {
		return "DocumentClass(" + type.getSimpleName() + ")";
	}

	private static final Map<Class<?>, DocumentClass<?>> REGISTRY = new ConcurrentHashMap<>();
	private static final AtomicBoolean FLOAT_WARNING_ISSUED = new AtomicBoolean(false);
	private static final Logger LOGGER = LoggerFactory.getLogger(DocumentClass.class);
}
