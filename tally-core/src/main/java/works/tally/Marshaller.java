package works.tally;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tally.coercion.TypeCoercion;
import works.tally.store.ItemKey;

import static java.util.stream.Collectors.toList;
import static works.tally.DocumentClass.CREATED_AT;
import static works.tally.DocumentClass.UPDATED_AT;

/**
 * Converts between {@link Document}s and the wire-level items exchanged with an
 * {@link works.tally.store.ItemStore ItemStore}.
 * <p>
 * Items are keyed by {@link FieldDeclaration#wireName() wire name}.
 * When {@link TallyConfig#timestamps() timestamps} are off, the timestamp fields
 * are left out in both directions.
 */
public final class Marshaller {
	private final TypeCoercion coercion;

	public Marshaller(TypeCoercion coercion) {
		this.coercion = coercion;
	}

	public static Marshaller using(TallyConfig config) {
		return new Marshaller(TypeCoercion.using(config));
	}

	public static Marshaller global() {
		return new Marshaller(TypeCoercion.global());
	}

	public Map<String, Object> attributesForWrite(Document document, WriteMode mode) {
		DocumentClass<?> documentClass = document.documentClass();
		Set<String> included = (mode == WriteMode.FULL)
			? null
			: document.changedFields();
		Map<String, Object> result = new LinkedHashMap<>();
		for (FieldDeclaration field: documentClass.fieldSet()) {
			if (included != null && !included.contains(field.name())) {
				continue;
			}
			if (isSuppressedTimestamp(field)) {
				continue;
			}
			result.put(field.wireName(), coercion.dump(field, document.readAttribute(field.name())));
		}
		LOGGER.trace("{} attributes for {}: {}", mode, documentClass, result);
		return result;
	}

	/**
	 * Builds a document from a stored item. If the class declares the
	 * {@link TallyConfig#inheritanceField() inheritance field}, the item's discriminator
	 * selects which subclass of {@code documentClass} to instantiate.
	 * The result is clean and {@link Document#isPersisted() persisted}.
	 */
	public <D extends Document> D hydrate(DocumentClass<D> documentClass, Map<String, ?> item) {
		DocumentClass<? extends D> target = resolveSubclass(documentClass, item);
		D result = target.newInstance(load(target, item));
		result.ledger().markAllClean();
		result.markPersisted();
		return result;
	}

	public List<FieldMetadata> fieldMetadata(DocumentClass<?> documentClass) {
		return documentClass.fieldSet().stream()
			.map(FieldMetadata::of)
			.collect(toList());
	}

	/**
	 * @return the wire-level key of {@code document}
	 * @throws IllegalStateException if a key field is null
	 */
	public ItemKey keyOf(Document document) {
		DocumentClass<?> documentClass = document.documentClass();
		Object hashKey = document.readAttribute(documentClass.hashKey());
		if (hashKey == null) {
			throw new IllegalStateException("Hash key of " + documentClass.type().getSimpleName() + " is not set");
		}
		Object rangeKey = null;
		if (documentClass.rangeKeyName().isPresent()) {
			String rangeKeyName = documentClass.rangeKeyName().get();
			rangeKey = document.readAttribute(rangeKeyName);
			if (rangeKey == null) {
				throw new IllegalStateException("Range key " + documentClass.type().getSimpleName() + "." + rangeKeyName + " is not set");
			}
		}
		return keyFor(documentClass, hashKey, rangeKey);
	}

	/**
	 * @param hashKey in domain representation
	 * @param rangeKey in domain representation; ignored if the class has no range key
	 */
	public ItemKey keyFor(DocumentClass<?> documentClass, Object hashKey, Object rangeKey) {
		FieldDeclaration hashField = documentClass.declaration(documentClass.hashKey()).orElseThrow();
		Object wireHash = coercion.dump(hashField, coercion.cast(hashField, hashKey));
		if (documentClass.rangeKeyName().isEmpty()) {
			return ItemKey.of(wireHash);
		}
		FieldDeclaration rangeField = documentClass.declaration(documentClass.rangeKeyName().get()).orElseThrow();
		Object wireRange = coercion.dump(rangeField, coercion.cast(rangeField, rangeKey));
		return ItemKey.of(wireHash, wireRange);
	}

	private <D extends Document> DocumentClass<? extends D> resolveSubclass(DocumentClass<D> documentClass, Map<String, ?> item) {
		String inheritanceField = coercion.config().inheritanceField();
		var declaration = documentClass.declaration(inheritanceField);
		if (declaration.isEmpty()) {
			return documentClass;
		}
		Object discriminator = coercion.load(declaration.get(), item.get(declaration.get().wireName()));
		if (discriminator == null) {
			return documentClass;
		}
		return documentClass.resolve(discriminator.toString()).orElseGet(() -> {
			LOGGER.debug("No subclass of {} has discriminator \"{}\"; using {}", documentClass, discriminator, documentClass);
			return documentClass;
		});
	}

	private Map<String, Object> load(DocumentClass<?> documentClass, Map<String, ?> item) {
		Map<String, Object> result = new LinkedHashMap<>();
		Set<String> unused = new HashSet<>(item.keySet());
		for (FieldDeclaration field: documentClass.fieldSet()) {
			String wireName = field.wireName();
			unused.remove(wireName);
			if (isSuppressedTimestamp(field) || !item.containsKey(wireName)) {
				continue;
			}
			result.put(field.name(), coercion.load(field, item.get(wireName)));
		}
		if (!unused.isEmpty()) {
			LOGGER.debug("Ignoring unknown attributes for {}: {}", documentClass, unused);
		}
		return result;
	}

	private boolean isSuppressedTimestamp(FieldDeclaration field) {
		return !coercion.config().timestamps()
			&& (field.name().equals(CREATED_AT) || field.name().equals(UPDATED_AT));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Marshaller.class);
}
