package works.tally;

import org.pcollections.HashTreePMap;
import org.pcollections.PMap;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import works.tally.exceptions.UnknownFieldException;

/**
 * The name-to-accessor dispatch table of a {@link DocumentClass}.
 * <p>
 * Each declared field has a generated accessor that goes straight to the
 * document's {@link AttributeStore}. Overrides are kept separately, keyed by name,
 * so they outlive redeclaration of the field; they're layered on top of
 * the generated accessor at lookup time, most recently added outermost.
 * <p>
 * Immutable. Like {@link FieldSet}, a subclass starts from a snapshot of its parent's table.
 */
final class AccessorTable {
	private static final AccessorTable EMPTY = new AccessorTable(HashTreePMap.empty(), HashTreePMap.empty(), HashTreePMap.empty());

	private final PMap<String, GeneratedAccessor> generated;
	private final PMap<String, PVector<ReaderOverride>> readerOverrides;
	private final PMap<String, PVector<WriterOverride>> writerOverrides;

	private AccessorTable(
		PMap<String, GeneratedAccessor> generated,
		PMap<String, PVector<ReaderOverride>> readerOverrides,
		PMap<String, PVector<WriterOverride>> writerOverrides
	) {
		this.generated = generated;
		this.readerOverrides = readerOverrides;
		this.writerOverrides = writerOverrides;
	}

	static AccessorTable empty() {
		return EMPTY;
	}

	AccessorTable generate(FieldDeclaration field) {
		return new AccessorTable(generated.plus(field.name(), new GeneratedAccessor(field.name())), readerOverrides, writerOverrides);
	}

	AccessorTable remove(String name) {
		return new AccessorTable(generated.minus(name), readerOverrides, writerOverrides);
	}

	AccessorTable plusReaderOverride(String name, ReaderOverride override) {
		PVector<ReaderOverride> existing = readerOverrides.getOrDefault(name, TreePVector.empty());
		return new AccessorTable(generated, readerOverrides.plus(name, existing.plus(override)), writerOverrides);
	}

	AccessorTable plusWriterOverride(String name, WriterOverride override) {
		PVector<WriterOverride> existing = writerOverrides.getOrDefault(name, TreePVector.empty());
		return new AccessorTable(generated, readerOverrides, writerOverrides.plus(name, existing.plus(override)));
	}

	boolean responds(String name) {
		return generated.containsKey(name);
	}

	AttributeReader reader(Class<?> owner, String name) {
		AttributeReader result = generatedAccessor(owner, name);
		for (ReaderOverride override: readerOverrides.getOrDefault(name, TreePVector.empty())) {
			AttributeReader base = result;
			result = document -> override.read(document, base);
		}
		return result;
	}

	AttributeWriter writer(Class<?> owner, String name) {
		AttributeWriter result = generatedAccessor(owner, name);
		for (WriterOverride override: writerOverrides.getOrDefault(name, TreePVector.empty())) {
			AttributeWriter base = result;
			result = (document, value) -> override.write(document, value, base);
		}
		return result;
	}

	private GeneratedAccessor generatedAccessor(Class<?> owner, String name) {
		GeneratedAccessor result = generated.get(name);
		if (result == null) {
			throw new UnknownFieldException(owner, name);
		}
		return result;
	}

	private record GeneratedAccessor(String name) implements AttributeReader, AttributeWriter {
		@Override
		public Object read(Document document) {
			return document.readAttribute(name);
		}

		@Override
		public void write(Document document, Object value) {
			document.writeAttribute(name, value);
		}
	}
}
