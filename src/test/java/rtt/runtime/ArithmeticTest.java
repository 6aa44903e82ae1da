package rtt.runtime;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ArithmeticTest {
	@Test
	void trueDivisionAlwaysYieldsFloat() {
		assertEquals(new FloatValue(3.5), Arithmetic.binary("/", IntValue.of(7), IntValue.of(2)));
		assertEquals(new FloatValue(2.0), Arithmetic.binary("/", IntValue.of(4), IntValue.of(2)));
	}

	@Test
	void floorDivisionAndModuloRoundTowardNegativeInfinity() {
		assertEquals(IntValue.of(-4), Arithmetic.binary("//", IntValue.of(-7), IntValue.of(2)));
		assertEquals(IntValue.of(2), Arithmetic.binary("%", IntValue.of(-7), IntValue.of(3)));
		assertEquals(IntValue.of(-2), Arithmetic.binary("%", IntValue.of(7), IntValue.of(-3)));
		assertEquals(new FloatValue(-4.0), Arithmetic.binary("//", new FloatValue(-7.0), IntValue.of(2)));
	}

	@Test
	void mixesIntsFloatsAndBools() {
		assertEquals(new FloatValue(3.5), Arithmetic.binary("+", IntValue.of(1), new FloatValue(2.5)));
		assertEquals(IntValue.of(2), Arithmetic.binary("+", BoolValue.TRUE, IntValue.of(1)));
		assertEquals(IntValue.of(1024), Arithmetic.binary("**", IntValue.of(2), IntValue.of(10)));
		assertEquals(new FloatValue(0.5), Arithmetic.binary("**", IntValue.of(2), IntValue.of(-1)));
	}

	@Test
	void comparesAcrossNumericTypes() {
		assertTrue(Arithmetic.valueEquals(IntValue.of(1), new FloatValue(1.0)));
		assertTrue(Arithmetic.valueEquals(BoolValue.TRUE, IntValue.of(1)));
		assertTrue(Arithmetic.compare("<", IntValue.of(2), new FloatValue(2.5)));
		assertFalse(Arithmetic.compare(">=", IntValue.of(2), new FloatValue(2.5)));
	}

	@Test
	void nanIsUnorderedAndUnequal() {
		FloatValue nan = new FloatValue(Double.NaN);

		assertFalse(Arithmetic.valueEquals(nan, nan));
		assertFalse(Arithmetic.compare("<", nan, IntValue.of(1)));
		assertFalse(Arithmetic.compare(">", nan, IntValue.of(1)));
		assertTrue(Arithmetic.compare("!=", nan, nan));
	}

	@Test
	void divisionByZeroRaises() {
		assertThrows(EvaluationException.class, () -> Arithmetic.binary("/", IntValue.of(1), IntValue.of(0)));
		assertThrows(EvaluationException.class, () -> Arithmetic.binary("%", IntValue.of(1), IntValue.of(0)));
		assertThrows(EvaluationException.class, () -> Arithmetic.binary("/", new FloatValue(1.0), new FloatValue(0.0)));
	}

	@Test
	void rejectsMismatchedOperands() {
		var ex = assertThrows(EvaluationException.class,
				() -> Arithmetic.binary("-", new StrValue("a"), IntValue.of(1)));
		assertEquals("unsupported operand type(s) for -: 'str' and 'int'", ex.getMessage());
		assertEquals(new StrValue("ab"), Arithmetic.binary("+", new StrValue("a"), new StrValue("b")));
	}

	@Test
	void followsPyTruthiness() {
		assertFalse(Arithmetic.isTruthy(IntValue.of(0)));
		assertFalse(Arithmetic.isTruthy(new FloatValue(0.0)));
		assertFalse(Arithmetic.isTruthy(new StrValue("")));
		assertFalse(Arithmetic.isTruthy(NoneValue.INSTANCE));
		assertTrue(Arithmetic.isTruthy(IntValue.of(-1)));
	}

	@Test
	void floatReprMatchesPy() {
		assertEquals("2.0", new FloatValue(2.0).repr());
		assertEquals("3.5", new FloatValue(3.5).repr());
		assertEquals("inf", new FloatValue(Double.POSITIVE_INFINITY).repr());
	}
}
