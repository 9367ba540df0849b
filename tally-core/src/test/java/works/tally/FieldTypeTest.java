package works.tally;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;
import works.tally.exceptions.InvalidDeclarationException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FieldTypeTest {

	@Test
	@SuppressWarnings("deprecation")
	void forTag_findsEveryType() {
		for (FieldType type: FieldType.values()) {
			assertEquals(type, FieldType.forTag(type.tag()));
		}
		assertEquals(FieldType.FLOAT, FieldType.forTag("float"));
	}

	@Test
	void forTag_unknown_throws() {
		assertThrows(InvalidDeclarationException.class, () -> FieldType.forTag("decimal"));
	}

	@Test
	@SuppressWarnings("deprecation")
	void float_isNumber() {
		assertEquals(FieldType.NUMBER, FieldType.FLOAT.canonical());
		assertEquals(FieldType.NUMBER.domainClass(), FieldType.FLOAT.domainClass());
	}

	@Test
	void sameValue_numbersIgnoreScale() {
		assertTrue(FieldType.NUMBER.sameValue(new BigDecimal("1.0"), new BigDecimal("1.00")));
		assertFalse(FieldType.NUMBER.sameValue(new BigDecimal("1.0"), new BigDecimal("1.01")));
		assertTrue(FieldType.STRING.sameValue(null, null));
		assertFalse(FieldType.STRING.sameValue(null, "x"));
	}

	@Test
	void castOnWrite_notForSerializedOrRaw() {
		assertFalse(FieldType.SERIALIZED.isCastOnWrite());
		assertFalse(FieldType.RAW.isCastOnWrite());
		assertTrue(FieldType.INTEGER.isCastOnWrite());
	}
}
