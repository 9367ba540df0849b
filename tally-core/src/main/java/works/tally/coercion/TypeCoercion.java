package works.tally.coercion;

import java.time.DateTimeException;
import java.util.EnumMap;
import java.util.Map;
import works.tally.FieldDeclaration;
import works.tally.FieldOptions;
import works.tally.FieldType;
import works.tally.TallyConfig;
import works.tally.coercion.Coercer.WireForm;
import works.tally.exceptions.TypeCastException;

import static works.tally.FieldType.BOOLEAN;
import static works.tally.FieldType.DATE;
import static works.tally.FieldType.DATETIME;
import static works.tally.FieldType.INTEGER;
import static works.tally.FieldType.NUMBER;
import static works.tally.FieldType.RAW;
import static works.tally.FieldType.SERIALIZED;
import static works.tally.FieldType.STRING;

/**
 * Converts field values between the application's types and the store's.
 * <p>
 * Every operation maps null to null.
 * Failures are reported as {@link TypeCastException}s naming the field,
 * except those thrown by a field's own {@link FieldSerializer},
 * which propagate unchanged.
 */
public final class TypeCoercion {
	private final TallyConfig config;
	private final Map<FieldType, Coercer> coercers = new EnumMap<>(FieldType.class);

	private TypeCoercion(TallyConfig config) {
		this.config = config;
		coercers.put(STRING, StringCoercer.INSTANCE);
		coercers.put(INTEGER, IntegerCoercer.INSTANCE);
		coercers.put(NUMBER, NumberCoercer.INSTANCE);
		coercers.put(BOOLEAN, BooleanCoercer.INSTANCE);
		coercers.put(DATETIME, new DateTimeCoercer(config.timeZone()));
		coercers.put(DATE, new DateCoercer(config.timeZone()));
		coercers.put(RAW, RawCoercer.INSTANCE);
	}

	private static volatile TypeCoercion lastGlobal;

	public static TypeCoercion using(TallyConfig config) {
		return new TypeCoercion(config);
	}

	/**
	 * @return a {@link TypeCoercion} for the current {@link TallyConfig#global() global} config.
	 */
	public static TypeCoercion global() {
		TallyConfig config = TallyConfig.global();
		TypeCoercion cached = lastGlobal;
		if (cached == null || cached.config != config) {
			cached = new TypeCoercion(config);
			lastGlobal = cached;
		}
		return cached;
	}

	public TallyConfig config() {
		return config;
	}

	/**
	 * Converts an incoming value to the field's domain type.
	 * Serialized and raw fields accept anything as-is.
	 */
	public Object cast(FieldDeclaration field, Object value) {
		if (value == null || !field.type().isCastOnWrite()) {
			return value;
		}
		Coercer coercer = coercerFor(field.type());
		try {
			return coercer.cast(value);
		} catch (IllegalArgumentException | DateTimeException | ArithmeticException e) {
			throw new TypeCastException(field.name(), field.type(), value, e.getMessage(), e);
		}
	}

	public Object dump(FieldDeclaration field, Object value) {
		if (value == null) {
			return null;
		}
		if (field.type() == SERIALIZED) {
			return dumpSerialized(field, value);
		}
		Coercer coercer = coercerFor(field.type());
		try {
			return coercer.dump(coercer.cast(value), wireFormOf(field));
		} catch (IllegalArgumentException | DateTimeException | ArithmeticException | ClassCastException e) {
			throw new TypeCastException(field.name(), field.type(), value, e.getMessage(), e);
		}
	}

	public Object load(FieldDeclaration field, Object wireValue) {
		if (wireValue == null) {
			return null;
		}
		if (field.type() == SERIALIZED) {
			return loadSerialized(field, wireValue);
		}
		try {
			return coercerFor(field.type()).load(wireValue);
		} catch (IllegalArgumentException | DateTimeException | ArithmeticException e) {
			throw new TypeCastException(field.name(), field.type(), wireValue, e.getMessage(), e);
		}
	}

	@SuppressWarnings("unchecked")
	private Object dumpSerialized(FieldDeclaration field, Object value) {
		FieldSerializer<Object> serializer = (FieldSerializer<Object>) field.options().serializer();
		if (serializer == null) {
			return config.structuredCodec().encode(value);
		} else {
			return serializer.dump(value);
		}
	}

	private Object loadSerialized(FieldDeclaration field, Object wireValue) {
		FieldSerializer<?> serializer = field.options().serializer();
		if (serializer != null) {
			return serializer.load(wireValue);
		} else if (wireValue instanceof String text) {
			return config.structuredCodec().decode(text);
		} else {
			// Already structured; some stores hand back documents rather than text
			return wireValue;
		}
	}

	private Coercer coercerFor(FieldType type) {
		return coercers.get(type.canonical());
	}

	private WireForm wireFormOf(FieldDeclaration field) {
		FieldOptions options = field.options();
		switch (field.type()) {
			case BOOLEAN:
				boolean nativeBoolean = (options.storeAsNativeBoolean() != null)
					? options.storeAsNativeBoolean()
					: config.storeBooleanAsNative();
				return nativeBoolean ? WireForm.NATIVE : WireForm.STRING;
			case DATETIME:
				return asString(options, config.storeDatetimeAsString());
			case DATE:
				return asString(options, config.storeDateAsString());
			default:
				return WireForm.NATIVE;
		}
	}

	private static WireForm asString(FieldOptions options, boolean fallback) {
		boolean asString = (options.storeAsString() != null) ? options.storeAsString() : fallback;
		return asString ? WireForm.STRING : WireForm.NATIVE;
	}
}
