package works.tally.coercion;

/**
 * No conversion at all. Whatever the store accepts is fine.
 */
final class RawCoercer implements Coercer {
	static final RawCoercer INSTANCE = new RawCoercer();

	private RawCoercer() { }

	@Override
	public Object cast(Object value) {
		return value;
	}

	@Override
	public Object dump(Object value, WireForm form) {
		return value;
	}

	@Override
	public Object load(Object wireValue) {
		return wireValue;
	}
}
