package works.tally.testing.state;

import java.util.Map;
import works.tally.Document;
import works.tally.DocumentClass;
import works.tally.FieldOptions;

import static works.tally.FieldType.INTEGER;

/**
 * A document with a composite key: the stream {@link #id()} and a {@link #SEQUENCE} number.
 */
public class TestEvent extends Document {
	public static final String SEQUENCE = "sequence";
	public static final String BODY = "body";

	public static final DocumentClass<TestEvent> EVENTS = DocumentClass.define(TestEvent.class, TestEvent::new)
		.table("test_events")
		.rangeKey(SEQUENCE, INTEGER, FieldOptions.NONE)
		.field(BODY);

	public TestEvent(Map<String, ?> attributes) {
		super(attributes);
	}

	public Long sequence() {
		return (Long) readAttribute(SEQUENCE);
	}
}
