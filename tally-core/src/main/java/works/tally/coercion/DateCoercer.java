package works.tally.coercion;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Date;

import static java.time.format.DateTimeFormatter.ISO_DATE_TIME;
import static java.util.Objects.requireNonNull;

/**
 * Dates are {@link LocalDate}s in the domain; any time of day is dropped.
 * On the wire, they're either epoch days or ISO-8601 text.
 */
final class DateCoercer implements Coercer {
	private final ZoneId zone;

	DateCoercer(ZoneId zone) {
		this.zone = requireNonNull(zone);
	}

	@Override
	public Object cast(Object value) {
		if (value instanceof LocalDate) {
			return value;
		} else if (value instanceof LocalDateTime t) {
			return t.toLocalDate();
		} else if (value instanceof OffsetDateTime t) {
			return t.toLocalDate();
		} else if (value instanceof ZonedDateTime t) {
			return t.toLocalDate();
		} else if (value instanceof Instant i) {
			return LocalDate.ofInstant(i, zone);
		} else if (value instanceof Date d) {
			return LocalDate.ofInstant(d.toInstant(), zone);
		} else if (value instanceof CharSequence text) {
			return parse(text.toString().trim());
		} else {
			throw new IllegalArgumentException("not a date value");
		}
	}

	private static LocalDate parse(String text) {
		if (text.indexOf('T') < 0) {
			return LocalDate.parse(text);
		} else {
			return LocalDate.from(ISO_DATE_TIME.parse(text));
		}
	}

	@Override
	public Object dump(Object value, WireForm form) {
		LocalDate date = (LocalDate) value;
		if (form == WireForm.STRING) {
			return date.toString();
		} else {
			return date.toEpochDay();
		}
	}

	@Override
	public Object load(Object wireValue) {
		if (wireValue instanceof Number n) {
			return LocalDate.ofEpochDay((Long) IntegerCoercer.INSTANCE.cast(n));
		} else {
			return cast(wireValue);
		}
	}
}
