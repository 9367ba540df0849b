package works.tally;

/**
 * Wraps the writer of a field.
 * The {@code base} writer is whatever was in place before this override was added.
 *
 * @see DocumentClass#overrideWriter
 * @see ReaderOverride
 */
@FunctionalInterface
public interface WriterOverride {
	void write(Document document, Object value, AttributeWriter base);
}
