package works.tally.coercion;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;
import works.tally.FieldDeclaration;
import works.tally.FieldOptions;
import works.tally.FieldType;
import works.tally.TallyConfig;
import works.tally.exceptions.SerializationException;
import works.tally.exceptions.TypeCastException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.tally.FieldType.BOOLEAN;
import static works.tally.FieldType.DATE;
import static works.tally.FieldType.DATETIME;
import static works.tally.FieldType.INTEGER;
import static works.tally.FieldType.NUMBER;
import static works.tally.FieldType.RAW;
import static works.tally.FieldType.SERIALIZED;
import static works.tally.FieldType.STRING;

class TypeCoercionTest {
	private final TypeCoercion coercion = TypeCoercion.using(TallyConfig.defaults());

	@ParameterizedTest
	@MethodSource("domainValues")
	void dumpThenLoad_sameValue(FieldType type, Object value) {
		FieldDeclaration field = FieldDeclaration.of("f", type);
		assertEquals(value, coercion.load(field, coercion.dump(field, value)));
	}

	static Stream<Arguments> domainValues() {
		return Stream.of(
			Arguments.of(STRING, "hello"),
			Arguments.of(STRING, ""),
			Arguments.of(INTEGER, 101L),
			Arguments.of(INTEGER, Long.MIN_VALUE),
			Arguments.of(NUMBER, new BigDecimal("5.33")),
			Arguments.of(BOOLEAN, true),
			Arguments.of(BOOLEAN, false),
			Arguments.of(DATETIME, Instant.parse("2024-03-01T12:34:56Z")),
			Arguments.of(DATETIME, Instant.parse("1969-07-20T20:17:40.123456789Z")),
			Arguments.of(DATE, LocalDate.of(2000, 2, 29)),
			Arguments.of(SERIALIZED, Map.of("a", List.of("x", "y"))),
			Arguments.of(SERIALIZED, Map.of("count", 5L, "ratio", new BigDecimal("1.5"))),
			Arguments.of(SERIALIZED, List.of(Long.MAX_VALUE, new BigDecimal("0.1"))),
			Arguments.of(RAW, List.of("unchanged"))
		);
	}

	@ParameterizedTest
	@EnumSource(FieldType.class)
	void null_alwaysNull(FieldType type) {
		FieldDeclaration field = FieldDeclaration.of("f", type);
		assertNull(coercion.cast(field, null));
		assertNull(coercion.dump(field, null));
		assertNull(coercion.load(field, null));
	}

	@Test
	void integer_parsesText() {
		assertEquals(101L, coercion.cast(FieldDeclaration.of("count", INTEGER), "101"));
		assertEquals(7L, coercion.cast(FieldDeclaration.of("count", INTEGER), 7));
		assertEquals(3L, coercion.cast(FieldDeclaration.of("count", INTEGER), new BigDecimal("3.00")));
	}

	@Test
	void integer_nonNumericText_throwsWithDetails() {
		TypeCastException e = assertThrows(TypeCastException.class,
			() -> coercion.cast(FieldDeclaration.of("count", INTEGER), "101abc"));
		assertEquals("count", e.fieldName());
		assertEquals(INTEGER, e.fieldType());
		assertEquals("101abc", e.value());
		assertThat(e.getMessage(), containsString("count"));
	}

	@Test
	void integer_fraction_throws() {
		assertThrows(TypeCastException.class, () -> coercion.cast(FieldDeclaration.of("count", INTEGER), "1.5"));
		assertThrows(TypeCastException.class, () -> coercion.cast(FieldDeclaration.of("count", INTEGER), 1.5));
	}

	@Test
	@SuppressWarnings("deprecation")
	void number_doubleBecomesShortestDecimal() {
		assertEquals(new BigDecimal("5.33"), coercion.cast(FieldDeclaration.of("latitude", NUMBER), 5.33));
		assertEquals(new BigDecimal("5.33"), coercion.cast(FieldDeclaration.of("latitude", FieldType.FLOAT), 5.33));
		assertEquals(new BigDecimal("5.33"), coercion.load(FieldDeclaration.of("latitude", FieldType.FLOAT), new BigDecimal("5.33")));
	}

	@Test
	void boolean_rejectsIntegers() {
		FieldDeclaration field = FieldDeclaration.of("deliverable", BOOLEAN);
		assertThrows(TypeCastException.class, () -> coercion.cast(field, 1));
		assertThrows(TypeCastException.class, () -> coercion.cast(field, 0));
		assertThrows(TypeCastException.class, () -> coercion.cast(field, "1"));
		assertEquals(true, coercion.cast(field, "true"));
	}

	@Test
	void boolean_stringWireForm() {
		TypeCoercion stringBooleans = TypeCoercion.using(TallyConfig.builder().storeBooleanAsNative(false).build());
		FieldDeclaration field = FieldDeclaration.of("deliverable", BOOLEAN);
		assertEquals("t", stringBooleans.dump(field, true));
		assertEquals("f", stringBooleans.dump(field, false));
		assertEquals(true, stringBooleans.load(field, "t"));
		assertEquals(false, coercion.load(field, "f"));
		assertEquals(true, coercion.dump(field, true));
	}

	@Test
	void boolean_fieldOptionOverridesConfig() {
		FieldDeclaration field = new FieldDeclaration("deliverable", BOOLEAN,
			FieldOptions.builder().storeAsNativeBoolean(false).build());
		assertEquals("t", coercion.dump(field, true));
	}

	@Test
	void datetime_epochSecondsExact() {
		FieldDeclaration field = FieldDeclaration.of("seen_at", DATETIME);
		assertEquals(new BigDecimal("1709296496"), coercion.dump(field, Instant.parse("2024-03-01T12:34:56Z")));
		assertEquals(new BigDecimal("1709296496.5"), coercion.dump(field, Instant.parse("2024-03-01T12:34:56.5Z")));
		assertEquals(Instant.parse("2024-03-01T12:34:56.5Z"), coercion.load(field, new BigDecimal("1709296496.5")));
		assertEquals(Instant.parse("2024-03-01T12:34:56Z"), coercion.load(field, 1709296496L));
	}

	@Test
	void datetime_stringWireForm() {
		FieldDeclaration field = new FieldDeclaration("seen_at", DATETIME,
			FieldOptions.builder().storeAsString(true).build());
		assertEquals("2024-03-01T12:34:56Z", coercion.dump(field, Instant.parse("2024-03-01T12:34:56Z")));
		assertEquals(Instant.parse("2024-03-01T12:34:56Z"), coercion.load(field, "2024-03-01T12:34:56Z"));
	}

	@Test
	void datetime_castsOtherTemporals() {
		FieldDeclaration field = FieldDeclaration.of("seen_at", DATETIME);
		Instant expected = Instant.parse("2024-03-01T12:00:00Z");
		assertEquals(expected, coercion.cast(field, OffsetDateTime.of(2024, 3, 1, 14, 0, 0, 0, ZoneOffset.ofHours(2))));
		assertEquals(expected, coercion.cast(field, LocalDateTime.of(2024, 3, 1, 12, 0)));
		assertEquals(expected, coercion.cast(field, "2024-03-01T12:00:00Z"));
		assertEquals(expected, coercion.cast(field, "2024-03-01T07:00:00-05:00"));
	}

	@Test
	void datetime_zonelessUsesConfiguredZone() {
		TypeCoercion toronto = TypeCoercion.using(TallyConfig.builder().timeZone(ZoneId.of("America/Toronto")).build());
		FieldDeclaration field = FieldDeclaration.of("seen_at", DATETIME);
		assertEquals(Instant.parse("2024-03-01T17:00:00Z"), toronto.cast(field, "2024-03-01T12:00:00"));
	}

	@Test
	void datetime_spaceSeparatedTextLoads() {
		FieldDeclaration field = FieldDeclaration.of("seen_at", DATETIME);
		assertEquals(Instant.parse("2024-03-01T12:34:56Z"), coercion.load(field, "2024-03-01 12:34:56"));
		assertEquals(Instant.parse("2024-03-01T10:34:56Z"), coercion.load(field, "2024-03-01 12:34:56+02:00"));
	}

	@Test
	void datetime_garbage_throws() {
		assertThrows(TypeCastException.class, () -> coercion.cast(FieldDeclaration.of("seen_at", DATETIME), "yesterday"));
	}

	@Test
	void date_dropsTimeOfDay() {
		FieldDeclaration field = FieldDeclaration.of("registered_on", DATE);
		assertEquals(LocalDate.of(2024, 3, 1), coercion.cast(field, Instant.parse("2024-03-01T23:59:59Z")));
		assertEquals(LocalDate.of(2024, 3, 1), coercion.cast(field, "2024-03-01T10:00:00Z"));
	}

	@Test
	void date_wireForms() {
		FieldDeclaration numeric = FieldDeclaration.of("registered_on", DATE);
		assertEquals(0L, coercion.dump(numeric, LocalDate.of(1970, 1, 1)));
		assertEquals(LocalDate.of(1970, 1, 2), coercion.load(numeric, new BigDecimal("1")));

		TypeCoercion textual = TypeCoercion.using(TallyConfig.builder().storeDateAsString(true).build());
		assertEquals("2000-02-29", textual.dump(numeric, LocalDate.of(2000, 2, 29)));
	}

	@Test
	void serialized_defaultCodecProducesText() {
		FieldDeclaration field = FieldDeclaration.of("options", SERIALIZED);
		Object wire = coercion.dump(field, Map.of("answer", 42L));
		assertEquals("{\"answer\":42}", wire);
		assertEquals(Map.of("answer", 42L), coercion.load(field, wire));
	}

	@Test
	void serialized_setLoadsAsList() {
		FieldDeclaration field = FieldDeclaration.of("options", SERIALIZED);
		assertEquals(List.of("a"), coercion.load(field, coercion.dump(field, Set.of("a"))));
	}

	@Test
	void serialized_structuredWireValuePassesThrough() {
		FieldDeclaration field = FieldDeclaration.of("options", SERIALIZED);
		Map<String, Object> structured = Map.of("already", "decoded");
		assertSame(structured, coercion.load(field, structured));
	}

	@Test
	void serialized_badText_throwsSerializationException() {
		FieldDeclaration field = FieldDeclaration.of("options", SERIALIZED);
		SerializationException e = assertThrows(SerializationException.class, () -> coercion.load(field, "{not json"));
		assertThat(e.getCause(), instanceOf(Exception.class));
	}

	@Test
	void serialized_customSerializerTakesPrecedence() {
		FieldDeclaration field = new FieldDeclaration("point", SERIALIZED, FieldOptions.withSerializer(new PointSerializer()));
		assertEquals("3,4", coercion.dump(field, new Point(3, 4)));
		assertEquals(new Point(5, 6), coercion.load(field, "5,6"));
	}

	@Test
	void serialized_customSerializerExceptionPropagatesUnchanged() {
		FieldDeclaration field = new FieldDeclaration("point", SERIALIZED, FieldOptions.withSerializer(new PointSerializer()));
		IllegalStateException e = assertThrows(IllegalStateException.class, () -> coercion.load(field, "garbage"));
		assertEquals("Not a point: garbage", e.getMessage());
	}

	@Test
	void serializedAndRaw_notCastOnWrite() {
		Object anything = new Object();
		assertSame(anything, coercion.cast(FieldDeclaration.of("options", SERIALIZED), anything));
		assertSame(anything, coercion.cast(FieldDeclaration.of("config", RAW), anything));
	}

	@Test
	void string_castsScalars() {
		FieldDeclaration field = FieldDeclaration.of("city", STRING);
		assertEquals("101", coercion.cast(field, 101));
		assertThrows(TypeCastException.class, () -> coercion.cast(field, List.of("no")));
	}

	record Point(int x, int y) { }

	static final class PointSerializer implements FieldSerializer<Point> {
		@Override
		public Object dump(Point value) {
			return value.x() + "," + value.y();
		}

		@Override
		public Point load(Object wireValue) {
			String[] parts = wireValue.toString().split(",");
			if (parts.length != 2) {
				throw new IllegalStateException("Not a point: " + wireValue);
			}
			return new Point(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
		}
	}
}
