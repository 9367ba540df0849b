package works.tally.coercion;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Integers are {@link Long}s in the domain and numbers on the wire.
 * Text is parsed strictly: {@code "101"} is fine, {@code "101abc"} and {@code "1.5"} are not.
 */
final class IntegerCoercer implements Coercer {
	static final IntegerCoercer INSTANCE = new IntegerCoercer();

	private IntegerCoercer() { }

	@Override
	public Object cast(Object value) {
		if (value instanceof Long) {
			return value;
		} else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
			return ((Number) value).longValue();
		} else if (value instanceof BigInteger b) {
			return b.longValueExact();
		} else if (value instanceof BigDecimal d) {
			return d.longValueExact();
		} else if (value instanceof Double || value instanceof Float) {
			double d = ((Number) value).doubleValue();
			if (Double.isNaN(d) || Double.isInfinite(d)) {
				throw new IllegalArgumentException("not a finite number");
			}
			return BigDecimal.valueOf(d).longValueExact();
		} else if (value instanceof CharSequence text) {
			return Long.parseLong(text.toString().trim());
		} else {
			throw new IllegalArgumentException("not an integral value");
		}
	}

	@Override
	public Object dump(Object value, WireForm form) {
		return value;
	}

	@Override
	public Object load(Object wireValue) {
		return cast(wireValue);
	}
}
