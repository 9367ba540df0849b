package works.tally;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tally.exceptions.DocumentNotFoundException;
import works.tally.store.ItemKey;
import works.tally.store.ItemStore;

import static java.util.Objects.requireNonNull;
import static works.tally.DocumentClass.CREATED_AT;
import static works.tally.DocumentClass.ID;
import static works.tally.DocumentClass.UPDATED_AT;

/**
 * Synchronizes {@link Document}s with an {@link ItemStore}.
 * <p>
 * A new document is written with a full put; a persisted one with a partial update
 * of just its changed fields. Every successful synchronization is a clean point:
 * the document's changes become its {@link Document#previousChanges() previous changes}.
 * <p>
 * The global {@link TallyConfig} is consulted on each call.
 */
public final class DocumentRepository {
	private final ItemStore store;

	public DocumentRepository(ItemStore store) {
		this.store = requireNonNull(store);
	}

	public <D extends Document> D create(DocumentClass<D> documentClass, Map<String, ?> attributes) {
		D result = documentClass.newInstance(attributes);
		save(result);
		return result;
	}

	/**
	 * @return false if the document is persisted and unchanged, so nothing was written
	 * @throws IllegalStateException if the document has been deleted,
	 * or if a key field of a persisted document has changed
	 */
	public boolean save(Document document) {
		if (document.isDestroyed()) {
			throw new IllegalStateException("Can't save deleted " + document.documentClass().type().getSimpleName() + " " + document.id());
		}
		TallyConfig config = TallyConfig.global();
		Marshaller marshaller = Marshaller.global();
		DocumentClass<?> documentClass = document.documentClass();
		if (document.isNewRecord()) {
			if (document.id() == null) {
				document.writeAttribute(ID, UUID.randomUUID().toString());
			}
			touch(document, config, true);
			ItemKey key = marshaller.keyOf(document);
			store.putItem(documentClass.tableName(), key, marshaller.attributesForWrite(document, WriteMode.FULL));
			LOGGER.debug("Created {} {}", documentClass, key);
		} else {
			if (!document.isChanged()) {
				LOGGER.trace("{} {} unchanged; not saving", documentClass, document.id());
				return false;
			}
			checkKeysUnchanged(document);
			touch(document, config, false);
			ItemKey key = marshaller.keyOf(document);
			store.updateItem(documentClass.tableName(), key, marshaller.attributesForWrite(document, WriteMode.CHANGED));
			LOGGER.debug("Updated {} {}: {}", documentClass, key, document.changedFields());
		}
		document.ledger().commit();
		document.markPersisted();
		return true;
	}

	/**
	 * Writes one field through its accessor and saves.
	 */
	public void updateAttribute(Document document, String name, Object value) {
		document.set(name, value);
		save(document);
	}

	/**
	 * Writes several fields through their accessors and saves.
	 * If any write fails, nothing is saved.
	 */
	public void updateAttributes(Document document, Map<String, ?> values) {
		values.forEach(document::set);
		save(document);
	}

	/**
	 * Replaces every field of {@code document} with the stored values, discarding unsaved changes.
	 *
	 * @throws DocumentNotFoundException if the item no longer exists
	 */
	public <D extends Document> D reload(D document) {
		@SuppressWarnings("unchecked")
		DocumentClass<D> documentClass = (DocumentClass<D>) document.documentClass();
		Marshaller marshaller = Marshaller.global();
		ItemKey key = marshaller.keyOf(document);
		Map<String, Object> item = store.getItem(documentClass.tableName(), key)
			.orElseThrow(() -> new DocumentNotFoundException("No item " + key + " in table \"" + documentClass.tableName() + "\""));
		Map<String, Object> fresh = marshaller.hydrate(documentClass, item).attributes();
		for (FieldDeclaration field: documentClass.fieldSet()) {
			document.writeAttribute(field.name(), fresh.get(field.name()));
		}
		document.ledger().markAllClean();
		document.markPersisted();
		LOGGER.debug("Reloaded {} {}", documentClass, key);
		return document;
	}

	public <D extends Document> Optional<D> find(DocumentClass<D> documentClass, Object hashKey) {
		if (documentClass.rangeKeyName().isPresent()) {
			throw new IllegalArgumentException(documentClass + " requires a range key");
		}
		return find(documentClass, hashKey, null);
	}

	/**
	 * @return the document, which may be an instance of a subclass
	 * of {@code documentClass} if the table uses single-table inheritance
	 */
	public <D extends Document> Optional<D> find(DocumentClass<D> documentClass, Object hashKey, Object rangeKey) {
		Marshaller marshaller = Marshaller.global();
		ItemKey key = marshaller.keyFor(documentClass, hashKey, rangeKey);
		return store.getItem(documentClass.tableName(), key)
			.map(item -> marshaller.hydrate(documentClass, item));
	}

	public void delete(Document document) {
		ItemKey key = Marshaller.global().keyOf(document);
		store.deleteItem(document.documentClass().tableName(), key);
		document.markDestroyed();
		LOGGER.debug("Deleted {} {}", document.documentClass(), key);
	}

	/**
	 * An explicit change to {@code updated_at} wins over the clock.
	 */
	private static void touch(Document document, TallyConfig config, boolean creating) {
		if (!config.timestamps() || !document.documentClass().isTimestamped()) {
			return;
		}
		Instant now = config.clock().instant();
		if (creating && document.readAttribute(CREATED_AT) == null) {
			document.writeAttribute(CREATED_AT, now);
		}
		if (!document.isChanged(UPDATED_AT)) {
			document.writeAttribute(UPDATED_AT, now);
		}
	}

	private static void checkKeysUnchanged(Document document) {
		DocumentClass<?> documentClass = document.documentClass();
		if (document.isChanged(ID)) {
			throw new IllegalStateException("Hash key of persisted " + documentClass.type().getSimpleName() + " can't be changed");
		}
		documentClass.rangeKeyName().ifPresent(name -> {
			if (document.isChanged(name)) {
				throw new IllegalStateException("Range key of persisted " + documentClass.type().getSimpleName() + " can't be changed");
			}
		});
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DocumentRepository.class);
}
