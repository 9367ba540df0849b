package works.tally;

/**
 * Reads one field of a document.
 */
@FunctionalInterface
public interface AttributeReader {
	Object read(Document document);
}
