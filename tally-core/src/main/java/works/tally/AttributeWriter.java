package works.tally;

/**
 * Writes one field of a document.
 */
@FunctionalInterface
public interface AttributeWriter {
	void write(Document document, Object value);
}
