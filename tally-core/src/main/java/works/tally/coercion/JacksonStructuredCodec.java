package works.tally.coercion;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.tally.exceptions.SerializationException;

import static java.util.Objects.requireNonNull;

/**
 * The default {@link StructuredCodec}: JSON via Jackson.
 * Objects decode as {@link java.util.LinkedHashMap}s, arrays as {@link java.util.ArrayList}s,
 * integers as {@link Long}s and other numbers as {@link java.math.BigDecimal}s,
 * matching the domain types of integer and number fields.
 * JSON has no set type, so a {@link java.util.Set} loads back as a list.
 */
public final class JacksonStructuredCodec implements StructuredCodec {
	private final ObjectMapper mapper;

	public JacksonStructuredCodec() {
		this(JsonMapper.builder()
			.enable(DeserializationFeature.USE_LONG_FOR_INTS)
			.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
			.build());
	}

	public JacksonStructuredCodec(ObjectMapper mapper) {
		this.mapper = requireNonNull(mapper);
	}

	@Override
	public String encode(Object value) {
		try {
			return mapper.writeValueAsString(value);
		} catch (JacksonException e) {
			throw new SerializationException("Unable to encode " + value.getClass().getSimpleName(), e);
		}
	}

	@Override
	public Object decode(String text) {
		try {
			return mapper.readValue(text, Object.class);
		} catch (JacksonException e) {
			throw new SerializationException("Unable to decode serialized value", e);
		}
	}

	@Override
	public String toString() {
		return "JacksonStructuredCodec";
	}
}
