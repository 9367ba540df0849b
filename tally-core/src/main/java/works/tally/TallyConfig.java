package works.tally;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import works.tally.coercion.JacksonStructuredCodec;
import works.tally.coercion.StructuredCodec;

import static java.util.Objects.requireNonNull;

/**
 * Process-wide settings.
 * <p>
 * Most settings are read at the moment they're needed, so changing the
 * {@link #global() global} config affects subsequent operations on existing classes.
 * The exception is {@link #timestamps}: whether a class <em>declares</em>
 * timestamp fields is decided once, when the class is {@link DocumentClass#define defined}.
 */
@Value
@Builder(toBuilder = true)
public class TallyConfig {
	/**
	 * Whether documents carry {@link DocumentClass#CREATED_AT created_at}
	 * and {@link DocumentClass#UPDATED_AT updated_at} fields that are filled
	 * in on synchronization.
	 * When off, those fields take no part in writes or hydration, and so remain null.
	 */
	@Default boolean timestamps = true;

	/**
	 * If false, booleans are stored as the strings {@code "t"} and {@code "f"}.
	 * Either way, they can't be confused with the integers 0 and 1.
	 */
	@Default boolean storeBooleanAsNative = true;

	/**
	 * Datetimes are stored as epoch seconds unless this is set,
	 * in which case they're stored as ISO-8601 instants.
	 */
	@Default boolean storeDatetimeAsString = false;

	/**
	 * Dates are stored as epoch days unless this is set,
	 * in which case they're stored as ISO-8601 local dates.
	 */
	@Default boolean storeDateAsString = false;

	/**
	 * Name of the discriminator field for single-table inheritance.
	 * Classes that don't declare a field by this name don't participate.
	 */
	@Default String inheritanceField = "type";

	/**
	 * Encodes {@link FieldType#SERIALIZED serialized} fields that have no serializer of their own.
	 */
	@Default StructuredCodec structuredCodec = new JacksonStructuredCodec();

	@Default Clock clock = Clock.systemUTC();

	/**
	 * Applied when casting date-times that carry no zone or offset.
	 */
	@Default ZoneId timeZone = ZoneOffset.UTC;

	public static TallyConfig defaults() {
		return DEFAULTS;
	}

	public static TallyConfig global() {
		return GLOBAL.get();
	}

	/**
	 * @return the previous global config, so callers can put it back.
	 */
	public static TallyConfig setGlobal(TallyConfig config) {
		return GLOBAL.getAndSet(requireNonNull(config));
	}

	private static final TallyConfig DEFAULTS = TallyConfig.builder().build();
	private static final AtomicReference<TallyConfig> GLOBAL = new AtomicReference<>(DEFAULTS);
}
