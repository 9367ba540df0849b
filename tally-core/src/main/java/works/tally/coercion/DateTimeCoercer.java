package works.tally.coercion;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAccessor;
import java.util.Date;

import static java.time.format.DateTimeFormatter.ISO_DATE_TIME;
import static java.util.Objects.requireNonNull;

/**
 * Datetimes are {@link Instant}s in the domain.
 * On the wire, they're either epoch seconds as a {@link BigDecimal}
 * (with as many fractional digits as needed to be exact)
 * or ISO-8601 text.
 */
final class DateTimeCoercer implements Coercer {
	private final ZoneId zone;

	DateTimeCoercer(ZoneId zone) {
		this.zone = requireNonNull(zone);
	}

	@Override
	public Object cast(Object value) {
		if (value instanceof Instant) {
			return value;
		} else if (value instanceof OffsetDateTime t) {
			return t.toInstant();
		} else if (value instanceof ZonedDateTime t) {
			return t.toInstant();
		} else if (value instanceof LocalDateTime t) {
			return t.atZone(zone).toInstant();
		} else if (value instanceof LocalDate d) {
			return d.atStartOfDay(zone).toInstant();
		} else if (value instanceof Date d) {
			return d.toInstant();
		} else if (value instanceof Number n) {
			return fromEpochSeconds(n);
		} else if (value instanceof CharSequence text) {
			return parse(text.toString().trim());
		} else {
			throw new IllegalArgumentException("not a date-time value");
		}
	}

	private Instant parse(String text) {
		if (text.indexOf('T') < 0) {
			int space = text.indexOf(' ');
			if (space < 0) {
				return LocalDate.parse(text).atStartOfDay(zone).toInstant();
			}
			// "2024-03-01 12:34:56" as written by SQL-style tools
			text = text.substring(0, space) + 'T' + text.substring(space + 1);
		}
		TemporalAccessor parsed = ISO_DATE_TIME.parseBest(text, ZonedDateTime::from, LocalDateTime::from);
		if (parsed instanceof ZonedDateTime z) {
			return z.toInstant();
		} else {
			return ((LocalDateTime) parsed).atZone(zone).toInstant();
		}
	}

	@Override
	public Object dump(Object value, WireForm form) {
		Instant instant = (Instant) value;
		if (form == WireForm.STRING) {
			return instant.toString();
		} else if (instant.getNano() == 0) {
			return BigDecimal.valueOf(instant.getEpochSecond());
		} else {
			return BigDecimal.valueOf(instant.getEpochSecond())
				.add(BigDecimal.valueOf(instant.getNano(), 9))
				.stripTrailingZeros();
		}
	}

	@Override
	public Object load(Object wireValue) {
		return cast(wireValue);
	}

	static Instant fromEpochSeconds(Number n) {
		BigDecimal seconds = (n instanceof BigDecimal d) ? d : new BigDecimal(n.toString());
		BigDecimal whole = seconds.setScale(0, RoundingMode.FLOOR);
		int nanos = seconds.subtract(whole).movePointRight(9).setScale(0, RoundingMode.HALF_UP).intValueExact();
		return Instant.ofEpochSecond(whole.longValueExact(), nanos);
	}
}
