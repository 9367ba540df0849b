package works.tally.coercion;

import java.util.Locale;

/**
 * Only true and false: no numbers, and in particular not 0 and 1.
 */
final class BooleanCoercer implements Coercer {
	static final BooleanCoercer INSTANCE = new BooleanCoercer();

	private BooleanCoercer() { }

	@Override
	public Object cast(Object value) {
		if (value instanceof Boolean) {
			return value;
		} else if (value instanceof CharSequence text) {
			switch (text.toString().trim().toLowerCase(Locale.ROOT)) {
				case "true": return true;
				case "false": return false;
				default: throw new IllegalArgumentException("expected \"true\" or \"false\"");
			}
		} else {
			throw new IllegalArgumentException("not a boolean value");
		}
	}

	@Override
	public Object dump(Object value, WireForm form) {
		if (form == WireForm.STRING) {
			return ((Boolean) value) ? "t" : "f";
		} else {
			return value;
		}
	}

	@Override
	public Object load(Object wireValue) {
		if (wireValue instanceof Boolean) {
			return wireValue;
		} else if ("t".equals(wireValue)) {
			return true;
		} else if ("f".equals(wireValue)) {
			return false;
		} else {
			return cast(wireValue);
		}
	}
}
