package rtt.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rtt.PipelineError;
import rtt.ast.py.PyBinaryExpr;
import rtt.ast.py.PyBoolOp;
import rtt.ast.py.PyCall;
import rtt.ast.py.PyCompare;
import rtt.ast.py.PyExpr;
import rtt.ast.py.PyExprStmt;
import rtt.ast.py.PyFunctionDef;
import rtt.ast.py.PyIf;
import rtt.ast.py.PyModule;
import rtt.ast.py.PyName;
import rtt.ast.py.PyNumber;
import rtt.ast.py.PyParam;
import rtt.ast.py.PyParamKind;
import rtt.ast.py.PyReturn;
import rtt.ast.py.PyStmt;
import rtt.ast.py.PyString;
import rtt.ast.py.PyUnaryExpr;
import rtt.model.BinaryOp;
import rtt.model.Expression;
import rtt.model.FunctionShape;
import rtt.model.Identifier;
import rtt.model.NumberLiteral;
import rtt.model.Operator;
import rtt.parse.py.PyParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Py AST -> {@link FunctionShape} for the translatable subset.
 */
public final class StructuralExtractor {
	private static final Logger LOG = LoggerFactory.getLogger(StructuralExtractor.class);
	private static final Set<String> CONSTANT_NAMES = Set.of("True", "False", "None");

	/**
	 * Extracts the named function, or the first top-level function when {@code functionName} is null.
	 */
	public FunctionShape extract(String source, String functionName) {
		return extract(new PyParser().parseModule(source), functionName);
	}

	public FunctionShape extract(PyModule module, String functionName) {
		PyFunctionDef def = select(module, functionName);
		LOG.debug("Extracting shape of '{}'", def.name());

		List<String> params = lowerParams(def);
		PyIf conditional = singleConditional(def);
		Expression condition = lowerExpr(conditional.test(), def);
		Expression whenTrue = lowerExpr(singleReturn(conditional.body(), def, "if").value(), def);
		Expression whenFalse = lowerExpr(singleReturn(conditional.orElse(), def, "else").value(), def);
		return new FunctionShape(def.name(), params, condition, whenTrue, whenFalse);
	}

	private PyFunctionDef select(PyModule module, String functionName) {
		List<PyFunctionDef> functions = module.functions();
		if (functionName == null) {
			if (functions.isEmpty()) {
				throw new ExtractionException(PipelineError.NO_FUNCTION_FOUND, "No function found in source");
			}
			return functions.get(0);
		}
		return module.function(functionName)
				.orElseThrow(() -> new ExtractionException(PipelineError.NOT_FOUND,
						"Function '" + functionName + "' not found in source"));
	}

	private List<String> lowerParams(PyFunctionDef def) {
		List<String> names = new ArrayList<>();
		for (PyParam param : def.params()) {
			if (param.kind() != PyParamKind.POSITIONAL) {
				throw new ExtractionException(PipelineError.UNSUPPORTED_SIGNATURE,
						"Parameter '" + param.name() + "' of '" + def.name() + "' is " + describe(param.kind()));
			}
			if (param.hasDefault()) {
				throw new ExtractionException(PipelineError.UNSUPPORTED_SIGNATURE,
						"Parameter '" + param.name() + "' of '" + def.name() + "' has a default value");
			}
			names.add(param.name());
		}
		return names;
	}

	private PyIf singleConditional(PyFunctionDef def) {
		List<PyStmt> body = def.body();
		int start = 0;
		// a leading docstring is documentation, not behaviour
		if (!body.isEmpty() && body.get(0) instanceof PyExprStmt stmt && stmt.isDocstring()) {
			start = 1;
		}
		if (body.size() - start != 1 || !(body.get(start) instanceof PyIf conditional)) {
			throw new ExtractionException(PipelineError.UNSUPPORTED_BODY_SHAPE,
					"Body of '" + def.name() + "' must be a single if/else statement");
		}
		return conditional;
	}

	private PyReturn singleReturn(List<PyStmt> branch, PyFunctionDef def, String branchName) {
		if (branch.size() != 1 || !(branch.get(0) instanceof PyReturn ret) || ret.value() == null) {
			throw new ExtractionException(PipelineError.UNSUPPORTED_BODY_SHAPE,
					"The " + branchName + " branch of '" + def.name() + "' must be a single 'return <expr>'");
		}
		return ret;
	}

	private Expression lowerExpr(PyExpr expr, PyFunctionDef def) {
		if (expr instanceof PyName name) {
			if (CONSTANT_NAMES.contains(name.name())) {
				throw unsupported(def, "constant " + name.name());
			}
			return new Identifier(name.name());
		}
		if (expr instanceof PyNumber number) {
			return new NumberLiteral(literal(number, def));
		}
		if (expr instanceof PyUnaryExpr unary && unary.op().equals("-") && unary.operand() instanceof PyNumber number) {
			return new NumberLiteral("-" + literal(number, def));
		}
		if (expr instanceof PyBinaryExpr binary) {
			Operator op = Operator.fromToken(binary.op())
					.filter(o -> !o.isComparison())
					.orElseThrow(() -> unsupported(def, "operator '" + binary.op() + "'"));
			return new BinaryOp(op, lowerExpr(binary.left(), def), lowerExpr(binary.right(), def));
		}
		if (expr instanceof PyCompare compare) {
			if (compare.isChained()) {
				throw unsupported(def, "chained comparison");
			}
			Operator op = Operator.fromToken(compare.ops().get(0))
					.orElseThrow(() -> unsupported(def, "comparison '" + compare.ops().get(0) + "'"));
			return new BinaryOp(op, lowerExpr(compare.left(), def), lowerExpr(compare.comparators().get(0), def));
		}
		throw unsupported(def, describe(expr));
	}

	private static String literal(PyNumber number, PyFunctionDef def) {
		if (!number.isPlainDecimal()) {
			throw unsupported(def, "number literal " + number.text());
		}
		return number.text();
	}

	private static ExtractionException unsupported(PyFunctionDef def, String what) {
		return new ExtractionException(PipelineError.UNSUPPORTED_EXPRESSION,
				"Unsupported " + what + " in '" + def.name() + "'");
	}

	private static String describe(PyExpr expr) {
		if (expr instanceof PyCall) {
			return "function call";
		}
		if (expr instanceof PyUnaryExpr unary) {
			return "unary operator '" + unary.op() + "'";
		}
		if (expr instanceof PyBoolOp boolOp) {
			return "boolean operator '" + boolOp.op() + "'";
		}
		if (expr instanceof PyString) {
			return "string literal";
		}
		return "expression";
	}

	private static String describe(PyParamKind kind) {
		return switch (kind) {
			case VARIADIC -> "variadic";
			case VARIADIC_KEYWORD -> "a variadic keyword parameter";
			case KEYWORD_ONLY -> "keyword-only";
			case POSITIONAL -> "positional";
		};
	}
}
