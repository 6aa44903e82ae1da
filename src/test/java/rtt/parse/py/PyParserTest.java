package rtt.parse.py;

import org.junit.jupiter.api.Test;
import rtt.ast.py.PyBinaryExpr;
import rtt.ast.py.PyBoolOp;
import rtt.ast.py.PyCall;
import rtt.ast.py.PyCompare;
import rtt.ast.py.PyExprStmt;
import rtt.ast.py.PyFunctionDef;
import rtt.ast.py.PyIf;
import rtt.ast.py.PyModule;
import rtt.ast.py.PyName;
import rtt.ast.py.PyNumber;
import rtt.ast.py.PyParamKind;
import rtt.ast.py.PyReturn;
import rtt.ast.py.PyUnaryExpr;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PyParserTest {
	@Test
	void parsesScenarioModule() throws Exception {
		String input = Files.readString(Path.of("src", "test", "resources", "scenarios", "original.py"));

		PyModule module = new PyParser().parseModule(input);

		assertEquals(List.of("add_mul", "is_sum_even"), module.functions().stream().map(PyFunctionDef::name).toList());

		PyFunctionDef addMul = module.function("add_mul").orElseThrow();
		assertEquals(2, addMul.params().size());
		assertEquals("a", addMul.params().get(0).name());
		assertEquals(PyParamKind.POSITIONAL, addMul.params().get(1).kind());

		PyExprStmt doc = assertInstanceOf(PyExprStmt.class, addMul.body().get(0));
		assertTrue(doc.isDocstring());

		PyIf conditional = assertInstanceOf(PyIf.class, addMul.body().get(1));
		PyCompare test = assertInstanceOf(PyCompare.class, conditional.test());
		assertEquals(List.of(">"), test.ops());

		PyReturn whenTrue = assertInstanceOf(PyReturn.class, conditional.body().get(0));
		PyBinaryExpr sum = assertInstanceOf(PyBinaryExpr.class, whenTrue.value());
		assertEquals("+", sum.op());
		PyBinaryExpr product = assertInstanceOf(PyBinaryExpr.class, sum.left());
		assertEquals("*", product.op());
	}

	@Test
	void followsPrecedence() {
		PyBinaryExpr sum = assertInstanceOf(PyBinaryExpr.class, new PyParser().parseExpression("1 + 2 * 3"));
		assertEquals("+", sum.op());
		assertInstanceOf(PyBinaryExpr.class, sum.right());

		PyUnaryExpr negated = assertInstanceOf(PyUnaryExpr.class, new PyParser().parseExpression("-2 ** 2"));
		PyBinaryExpr power = assertInstanceOf(PyBinaryExpr.class, negated.operand());
		assertEquals("**", power.op());

		PyBoolOp or = assertInstanceOf(PyBoolOp.class, new PyParser().parseExpression("a or b and not c"));
		assertEquals("or", or.op());
		PyBoolOp and = assertInstanceOf(PyBoolOp.class, or.values().get(1));
		assertInstanceOf(PyUnaryExpr.class, and.values().get(1));
	}

	@Test
	void parenthesesOnlyGroup() {
		PyBinaryExpr product = assertInstanceOf(PyBinaryExpr.class, new PyParser().parseExpression("(a + b) * c"));
		assertEquals("*", product.op());
		PyBinaryExpr sum = assertInstanceOf(PyBinaryExpr.class, product.left());
		assertEquals("+", sum.op());
	}

	@Test
	void keepsComparisonChains() {
		PyCompare chain = assertInstanceOf(PyCompare.class, new PyParser().parseExpression("0 < x <= 10"));
		assertTrue(chain.isChained());
		assertEquals(List.of("<", "<="), chain.ops());
	}

	@Test
	void parsesCallsWithArguments() {
		PyCall call = assertInstanceOf(PyCall.class, new PyParser().parseExpression("add_mul(5, -2)"));
		assertEquals("add_mul", assertInstanceOf(PyName.class, call.callee()).name());
		assertEquals(2, call.args().size());
		assertEquals("5", assertInstanceOf(PyNumber.class, call.args().get(0)).text());
	}

	@Test
	void elifBecomesNestedIf() {
		String input = "def f(a):\n" +
				"    if a > 0:\n" +
				"        return 1\n" +
				"    elif a < 0:\n" +
				"        return -1\n" +
				"    else:\n" +
				"        return 0\n";

		PyFunctionDef f = new PyParser().parseModule(input).functions().get(0);
		PyIf outer = assertInstanceOf(PyIf.class, f.body().get(0));
		PyIf inner = assertInstanceOf(PyIf.class, outer.orElse().get(0));
		assertEquals(1, inner.orElse().size());
	}

	@Test
	void classifiesParameters() {
		String input = "def f(a, b=2, *rest, c=3, **extra) -> int:\n" +
				"    return a\n";

		PyFunctionDef f = new PyParser().parseModule(input).functions().get(0);

		assertEquals(List.of(PyParamKind.POSITIONAL, PyParamKind.POSITIONAL, PyParamKind.VARIADIC,
				PyParamKind.KEYWORD_ONLY, PyParamKind.VARIADIC_KEYWORD),
				f.params().stream().map(p -> p.kind()).toList());
		assertTrue(f.params().get(1).hasDefault());
		assertNull(f.params().get(0).defaultValue());
	}

	@Test
	void acceptsSingleLineSuites() {
		PyFunctionDef f = new PyParser().parseModule("def f(a): return a\n").functions().get(0);
		assertInstanceOf(PyReturn.class, f.body().get(0));
	}

	@Test
	void rejectsDuplicateParameters() {
		assertThrows(SourceSyntaxException.class, () -> new PyParser().parseModule("def f(a, a):\n    pass\n"));
	}

	@Test
	void rejectsUnsupportedStatements() {
		var ex = assertThrows(SourceSyntaxException.class,
				() -> new PyParser().parseModule("while x:\n    pass\n"));
		assertTrue(ex.getMessage().contains("while"));
	}

	@Test
	void rejectsTrailingTokensInExpression() {
		assertThrows(SourceSyntaxException.class, () -> new PyParser().parseExpression("add_mul(1, 2) 3"));
	}
}
