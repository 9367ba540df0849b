package works.tally;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;
import works.tally.exceptions.InvalidDeclarationException;

/**
 * The declared type of a field, which determines how its values
 * are cast on write and how they are represented on the wire.
 */
public enum FieldType {
	STRING("string", String.class),
	INTEGER("integer", Long.class),
	NUMBER("number", BigDecimal.class),
	BOOLEAN("boolean", Boolean.class),
	DATETIME("datetime", Instant.class),
	DATE("date", LocalDate.class),
	SERIALIZED("serialized", Object.class),
	RAW("raw", Object.class),

	/**
	 * Behaves exactly like {@link #NUMBER}.
	 * Declaring a field with this type logs a deprecation warning once per process.
	 */
	@Deprecated
	FLOAT("float", BigDecimal.class);

	private final String tag;
	private final Class<?> domainClass;

	FieldType(String tag, Class<?> domainClass) {
		this.tag = tag;
		this.domainClass = domainClass;
	}

	public String tag() {
		return tag;
	}

	/**
	 * @return the class of the values held in an {@link AttributeStore} for fields of this type.
	 */
	public Class<?> domainClass() {
		return domainClass;
	}

	/**
	 * @return the type whose coercion rules this type uses.
	 */
	@SuppressWarnings("deprecation")
	public FieldType canonical() {
		return (this == FLOAT) ? NUMBER : this;
	}

	/**
	 * Writes to fields of these types are cast and validated eagerly.
	 */
	public boolean isCastOnWrite() {
		return this != SERIALIZED && this != RAW;
	}

	/**
	 * Value equality as used by dirty tracking.
	 * Numbers compare by magnitude, so {@code 1.0} and {@code 1.00} are the same value.
	 */
	public boolean sameValue(Object a, Object b) {
		if (a instanceof BigDecimal x && b instanceof BigDecimal y) {
			return x.compareTo(y) == 0;
		}
		return Objects.equals(a, b);
	}

	public static FieldType forTag(String tag) {
		String normalized = tag.toLowerCase(Locale.ROOT);
		for (FieldType t: values()) {
			if (t.tag.equals(normalized)) {
				return t;
			}
		}
		throw new InvalidDeclarationException("Unknown field type \"" + tag + "\"");
	}

	@Override
	public String toString() {
		return tag;
	}
}
