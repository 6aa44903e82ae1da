package rtt.runtime;

import org.junit.jupiter.api.Test;
import rtt.parse.py.PyParser;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EvaluatorTest {
	private static final String MODULE = "LIMIT = 10\n" +
			"\n" +
			"def clamp(x, hi=LIMIT):\n" +
			"    if x > hi:\n" +
			"        return hi\n" +
			"    return x\n" +
			"\n" +
			"def fact(n):\n" +
			"    if n <= 1:\n" +
			"        return 1\n" +
			"    else:\n" +
			"        return n * fact(n - 1)\n" +
			"\n" +
			"def forever(n):\n" +
			"    return forever(n + 1)\n" +
			"\n" +
			"def nothing():\n" +
			"    pass\n";

	private final ModuleHandle module = new ModuleLoader().load("m", MODULE);

	@Test
	void evaluatesArithmeticWithPySemantics() {
		assertEquals(new FloatValue(3.5), eval("7 / 2"));
		assertEquals(IntValue.of(-4), eval("-7 // 2"));
		assertEquals(IntValue.of(-4), eval("-2 ** 2"));
		assertEquals(IntValue.of(14), eval("2 + 3 * 4"));
	}

	@Test
	void readsAllIntegerSpellings() {
		assertEquals(IntValue.of(1016), eval("0x10 + 1_000"));
		assertEquals(IntValue.of(20), eval("0o17 + 0b101"));
		assertEquals(new FloatValue(1500.5), eval("1_500.5"));

		var ex = assertThrows(EvaluationException.class, () -> eval("1j"));
		assertTrue(ex.getMessage().contains("complex"));
	}

	@Test
	void chainsComparisons() {
		assertEquals(BoolValue.TRUE, eval("1 < 2 < 3"));
		assertEquals(BoolValue.FALSE, eval("3 > 2 > 2"));
	}

	@Test
	void booleanOperatorsReturnDecidingOperand() {
		assertEquals(IntValue.of(5), eval("0 or 5"));
		assertEquals(IntValue.of(0), eval("1 and 0"));
		assertEquals(BoolValue.TRUE, eval("not None"));
	}

	@Test
	void callsBuiltins() {
		assertEquals(IntValue.of(3), eval("int(3.9)"));
		assertEquals(IntValue.of(-3), eval("int(-3.9)"));
		assertEquals(new FloatValue(2.0), eval("float(2)"));
		assertEquals(IntValue.of(4), eval("abs(-4)"));
		assertEquals(IntValue.of(1), eval("min(3, 1, 2)"));
		assertEquals(new FloatValue(5.5), eval("max(1, 5.5)"));
	}

	@Test
	void callsUserFunctionsWithDefaultsAndRecursion() {
		assertEquals(IntValue.of(10), eval("clamp(12)"));
		assertEquals(IntValue.of(3), eval("clamp(3, 5)"));
		assertEquals(IntValue.of(120), eval("fact(5)"));
		assertEquals(NoneValue.INSTANCE, eval("nothing()"));
	}

	@Test
	void stopsRunawayRecursion() {
		var ex = assertThrows(EvaluationException.class, () -> eval("forever(0)"));
		assertEquals("maximum recursion depth exceeded", ex.getMessage());
	}

	@Test
	void reportsArityErrors() {
		var ex = assertThrows(EvaluationException.class, () -> eval("fact()"));
		assertTrue(ex.getMessage().contains("missing required positional argument: 'n'"));

		ex = assertThrows(EvaluationException.class, () -> eval("fact(1, 2)"));
		assertTrue(ex.getMessage().contains("takes 1 positional arguments but 2 were given"));
	}

	@Test
	void reportsUnknownNamesAndNonCallables() {
		var ex = assertThrows(EvaluationException.class, () -> eval("missing + 1"));
		assertEquals("name 'missing' is not defined", ex.getMessage());

		assertThrows(EvaluationException.class, () -> eval("LIMIT(1)"));
		assertThrows(EvaluationException.class, () -> eval("min(1)"));
	}

	@Test
	void callsFunctionValuesDirectly() {
		Value fact = module.lookup("fact").orElseThrow();

		assertInstanceOf(FunctionValue.class, fact);
		assertEquals(IntValue.of(6), new Evaluator().call(fact, List.of(IntValue.of(3))));
	}

	private Value eval(String expression) {
		return new Evaluator().evaluate(new PyParser().parseExpression(expression), module);
	}
}
