package works.tally;

/**
 * Wraps the reader of a field.
 * The {@code base} reader is whatever was in place before this override was added,
 * and the override decides whether and how to call it.
 *
 * <pre>
 * addresses.overrideReader("name", (doc, base) -&gt; ((String) base.read(doc)).toUpperCase());
 * </pre>
 *
 * @see DocumentClass#overrideReader
 */
@FunctionalInterface
public interface ReaderOverride {
	Object read(Document document, AttributeReader base);
}
