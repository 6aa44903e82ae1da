package rtt.runtime;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Names visible in every module without definition.
 */
final class Builtins {
	private static final Map<String, Value> BUILTINS;

	static {
		final var m = new HashMap<String, Value>();
		m.put("True", BoolValue.TRUE);
		m.put("False", BoolValue.FALSE);
		m.put("None", NoneValue.INSTANCE);
		register(m, "int", Builtins::toInt);
		register(m, "float", Builtins::toFloat);
		register(m, "abs", Builtins::abs);
		register(m, "min", args -> extreme("min", args, "<"));
		register(m, "max", args -> extreme("max", args, ">"));
		BUILTINS = Map.copyOf(m);
	}

	private Builtins() {
	}

	static Optional<Value> lookup(String name) {
		return Optional.ofNullable(BUILTINS.get(name));
	}

	private static void register(Map<String, Value> m, String name, Function<List<Value>, Value> impl) {
		m.put(name, new BuiltinValue(name, impl));
	}

	private static Value toInt(List<Value> args) {
		Value arg = single("int", args);
		if (arg instanceof IntValue) {
			return arg;
		}
		if (arg instanceof BoolValue b) {
			return IntValue.of(b.value() ? 1 : 0);
		}
		if (arg instanceof FloatValue f) {
			if (Double.isNaN(f.value()) || Double.isInfinite(f.value())) {
				throw new EvaluationException("cannot convert float " + f.repr() + " to integer");
			}
			// truncates toward zero
			return new IntValue(new BigDecimal(f.value()).toBigInteger());
		}
		if (arg instanceof StrValue s) {
			try {
				return new IntValue(new BigInteger(s.value().strip()));
			} catch (NumberFormatException e) {
				throw new EvaluationException("invalid literal for int() with base 10: " + s.repr(), e);
			}
		}
		throw new EvaluationException("int() argument must be a string or a number, not '" + arg.typeName() + "'");
	}

	private static Value toFloat(List<Value> args) {
		Value arg = single("float", args);
		if (arg instanceof StrValue s) {
			try {
				return new FloatValue(Double.parseDouble(s.value().strip()));
			} catch (NumberFormatException e) {
				throw new EvaluationException("could not convert string to float: " + s.repr(), e);
			}
		}
		if (!Arithmetic.isNumeric(arg)) {
			throw new EvaluationException("float() argument must be a string or a number, not '" + arg.typeName() + "'");
		}
		return new FloatValue(Arithmetic.toDouble(arg));
	}

	private static Value abs(List<Value> args) {
		Value arg = single("abs", args);
		if (arg instanceof FloatValue f) {
			return new FloatValue(Math.abs(f.value()));
		}
		if (!Arithmetic.isNumeric(arg)) {
			throw new EvaluationException("bad operand type for abs(): '" + arg.typeName() + "'");
		}
		return new IntValue(Arithmetic.toBigInteger(arg).abs());
	}

	private static Value extreme(String name, List<Value> args, String op) {
		if (args.size() < 2) {
			throw new EvaluationException(name + "() expected at least 2 arguments, got " + args.size());
		}
		Value best = args.get(0);
		for (Value candidate : args.subList(1, args.size())) {
			if (Arithmetic.compare(op, candidate, best)) {
				best = candidate;
			}
		}
		return best;
	}

	private static Value single(String name, List<Value> args) {
		if (args.size() != 1) {
			throw new EvaluationException(name + "() takes exactly one argument (" + args.size() + " given)");
		}
		return args.get(0);
	}
}
