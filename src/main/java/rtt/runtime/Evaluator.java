package rtt.runtime;

import rtt.ast.py.PyAssign;
import rtt.ast.py.PyBinaryExpr;
import rtt.ast.py.PyBoolOp;
import rtt.ast.py.PyCall;
import rtt.ast.py.PyCompare;
import rtt.ast.py.PyExpr;
import rtt.ast.py.PyExprStmt;
import rtt.ast.py.PyFunctionDef;
import rtt.ast.py.PyIf;
import rtt.ast.py.PyName;
import rtt.ast.py.PyNumber;
import rtt.ast.py.PyParam;
import rtt.ast.py.PyParamKind;
import rtt.ast.py.PyPass;
import rtt.ast.py.PyReturn;
import rtt.ast.py.PyStmt;
import rtt.ast.py.PyString;
import rtt.ast.py.PyUnaryExpr;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tree-walking interpreter for the Py subset.
 *
 * One instance per thread of execution; the call depth counter is not shared.
 */
public final class Evaluator {
	static final int MAX_DEPTH = 200;

	private int depth;

	/**
	 * Runs module-level statements, binding definitions and assignments into {@code module}.
	 */
	public void execModule(List<PyStmt> body, ModuleHandle module) {
		execBlock(body, Scope.moduleLevel(module));
	}

	/**
	 * Evaluates a free-standing expression against a module's globals.
	 */
	public Value evaluate(PyExpr expr, ModuleHandle module) {
		return evaluate(expr, Scope.moduleLevel(module));
	}

	public Value call(Value callee, List<Value> args) {
		if (callee instanceof BuiltinValue b) {
			return b.impl().apply(List.copyOf(args));
		}
		if (!(callee instanceof FunctionValue f)) {
			throw new EvaluationException("'" + callee.typeName() + "' object is not callable");
		}
		if (depth >= MAX_DEPTH) {
			throw new EvaluationException("maximum recursion depth exceeded");
		}
		Scope scope = Scope.functionLevel(f.module(), bind(f, args));
		depth++;
		try {
			execBlock(f.def().body(), scope);
			return NoneValue.INSTANCE;
		} catch (ReturnSignal r) {
			return r.value;
		} finally {
			depth--;
		}
	}

	FunctionValue define(PyFunctionDef def, Scope scope) {
		Map<String, Value> defaults = new HashMap<>();
		for (PyParam p : def.params()) {
			if (p.hasDefault()) {
				defaults.put(p.name(), evaluate(p.defaultValue(), scope));
			}
		}
		return new FunctionValue(def, scope.module(), defaults);
	}

	private Map<String, Value> bind(FunctionValue f, List<Value> args) {
		PyFunctionDef def = f.def();
		Map<String, Value> bound = new LinkedHashMap<>();
		List<Value> extra = new ArrayList<>();
		int next = 0;
		for (PyParam p : def.params()) {
			switch (p.kind()) {
				case POSITIONAL -> {
					if (next < args.size()) {
						bound.put(p.name(), args.get(next++));
					} else if (p.hasDefault()) {
						bound.put(p.name(), f.defaults().get(p.name()));
					} else {
						throw new EvaluationException(def.name() + "() missing required positional argument: '"
								+ p.name() + "'");
					}
				}
				case VARIADIC -> {
					while (next < args.size()) {
						extra.add(args.get(next++));
					}
					// there is no tuple type, so surplus positionals are rejected below
					bound.put(p.name(), NoneValue.INSTANCE);
				}
				case KEYWORD_ONLY -> {
					if (!p.hasDefault()) {
						throw new EvaluationException(def.name() + "() missing required keyword-only argument: '"
								+ p.name() + "'");
					}
					bound.put(p.name(), f.defaults().get(p.name()));
				}
				case VARIADIC_KEYWORD -> bound.put(p.name(), NoneValue.INSTANCE);
			}
		}
		if (next < args.size() || !extra.isEmpty()) {
			long positional = def.params().stream().filter(p -> p.kind() == PyParamKind.POSITIONAL).count();
			throw new EvaluationException(def.name() + "() takes " + positional + " positional arguments but "
					+ args.size() + " were given");
		}
		return bound;
	}

	private void execBlock(List<PyStmt> body, Scope scope) {
		for (PyStmt stmt : body) {
			exec(stmt, scope);
		}
	}

	private void exec(PyStmt stmt, Scope scope) {
		if (stmt instanceof PyFunctionDef def) {
			scope.assign(def.name(), define(def, scope));
		} else if (stmt instanceof PyIf ifStmt) {
			if (Arithmetic.isTruthy(evaluate(ifStmt.test(), scope))) {
				execBlock(ifStmt.body(), scope);
			} else {
				execBlock(ifStmt.orElse(), scope);
			}
		} else if (stmt instanceof PyReturn ret) {
			if (scope.isModuleLevel()) {
				throw new EvaluationException("'return' outside function");
			}
			throw new ReturnSignal(ret.value() == null ? NoneValue.INSTANCE : evaluate(ret.value(), scope));
		} else if (stmt instanceof PyAssign assign) {
			scope.assign(assign.target(), evaluate(assign.value(), scope));
		} else if (stmt instanceof PyExprStmt exprStmt) {
			evaluate(exprStmt.value(), scope);
		} else if (!(stmt instanceof PyPass)) {
			throw new EvaluationException("unsupported statement " + stmt.getClass().getSimpleName());
		}
	}

	private Value evaluate(PyExpr expr, Scope scope) {
		if (expr instanceof PyNumber n) {
			return number(n);
		}
		if (expr instanceof PyString s) {
			return new StrValue(s.value());
		}
		if (expr instanceof PyName name) {
			return scope.lookup(name.name())
					.orElseThrow(() -> new EvaluationException("name '" + name.name() + "' is not defined"));
		}
		if (expr instanceof PyBinaryExpr bin) {
			Value left = evaluate(bin.left(), scope);
			Value right = evaluate(bin.right(), scope);
			return Arithmetic.binary(bin.op(), left, right);
		}
		if (expr instanceof PyUnaryExpr un) {
			Value operand = evaluate(un.operand(), scope);
			return switch (un.op()) {
				case "-" -> Arithmetic.negate(operand);
				case "+" -> Arithmetic.plus(operand);
				case "not" -> BoolValue.of(!Arithmetic.isTruthy(operand));
				default -> throw new EvaluationException("unsupported unary operator " + un.op());
			};
		}
		if (expr instanceof PyCompare cmp) {
			Value left = evaluate(cmp.left(), scope);
			for (int i = 0; i < cmp.ops().size(); i++) {
				Value right = evaluate(cmp.comparators().get(i), scope);
				if (!Arithmetic.compare(cmp.ops().get(i), left, right)) {
					return BoolValue.FALSE;
				}
				left = right;
			}
			return BoolValue.TRUE;
		}
		if (expr instanceof PyBoolOp boolOp) {
			// short-circuits and yields the deciding operand, not a bool
			boolean isAnd = boolOp.op().equals("and");
			Value result = null;
			for (PyExpr operand : boolOp.values()) {
				result = evaluate(operand, scope);
				if (Arithmetic.isTruthy(result) != isAnd) {
					return result;
				}
			}
			return result;
		}
		if (expr instanceof PyCall c) {
			Value callee = evaluate(c.callee(), scope);
			List<Value> args = new ArrayList<>();
			for (PyExpr a : c.args()) {
				args.add(evaluate(a, scope));
			}
			return call(callee, args);
		}
		throw new EvaluationException("unsupported expression " + expr.getClass().getSimpleName());
	}

	private static Value number(PyNumber n) {
		if (n.isImaginary()) {
			throw new EvaluationException("complex literal " + n.text() + " is not supported");
		}
		if (n.isFloat()) {
			return new FloatValue(Double.parseDouble(n.digits()));
		}
		return new IntValue(new BigInteger(n.digits(), n.radix()));
	}
}
