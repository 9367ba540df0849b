package works.tally.coercion;

import java.util.UUID;

final class StringCoercer implements Coercer {
	static final StringCoercer INSTANCE = new StringCoercer();

	private StringCoercer() { }

	@Override
	public Object cast(Object value) {
		if (value instanceof String) {
			return value;
		} else if (value instanceof Enum<?> e) {
			return e.name();
		} else if (value instanceof CharSequence
			|| value instanceof Number
			|| value instanceof Boolean
			|| value instanceof Character
			|| value instanceof UUID) {
			return value.toString();
		} else {
			throw new IllegalArgumentException("not a textual value");
		}
	}

	@Override
	public Object dump(Object value, WireForm form) {
		return value;
	}

	@Override
	public Object load(Object wireValue) {
		return wireValue.toString();
	}
}
