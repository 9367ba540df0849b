package works.tally.coercion;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Numbers are {@link BigDecimal}s both in the domain and on the wire.
 * Doubles are converted via their shortest decimal representation,
 * so {@code 5.33} becomes exactly {@code 5.33}.
 */
final class NumberCoercer implements Coercer {
	static final NumberCoercer INSTANCE = new NumberCoercer();

	private NumberCoercer() { }

	@Override
	public Object cast(Object value) {
		if (value instanceof BigDecimal) {
			return value;
		} else if (value instanceof BigInteger b) {
			return new BigDecimal(b);
		} else if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
			return BigDecimal.valueOf(((Number) value).longValue());
		} else if (value instanceof Float f) {
			requireFinite(f);
			return new BigDecimal(f.toString());
		} else if (value instanceof Double d) {
			requireFinite(d);
			return BigDecimal.valueOf(d);
		} else if (value instanceof CharSequence text) {
			return new BigDecimal(text.toString().trim());
		} else {
			throw new IllegalArgumentException("not a numeric value");
		}
	}

	private static void requireFinite(double d) {
		if (Double.isNaN(d) || Double.isInfinite(d)) {
			throw new IllegalArgumentException("not a finite number");
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
