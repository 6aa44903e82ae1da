package rtt.runtime;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Py operator semantics over {@link Value}s.
 *
 * Ints are arbitrary precision, {@code /} always yields a float, {@code //} and {@code %} floor toward
 * negative infinity, and bools take part in arithmetic as 0 and 1.
 */
public final class Arithmetic {
	private static final int MAX_INT_EXPONENT = 100_000;

	private Arithmetic() {
		// utility class
	}

	public static Value binary(String op, Value left, Value right) {
		if (op.equals("+") && left instanceof StrValue l && right instanceof StrValue r) {
			return new StrValue(l.value() + r.value());
		}
		if (!isNumeric(left) || !isNumeric(right)) {
			throw new EvaluationException("unsupported operand type(s) for " + op + ": '" + left.typeName()
					+ "' and '" + right.typeName() + "'");
		}
		if (left instanceof FloatValue || right instanceof FloatValue) {
			return floatBinary(op, toDouble(left), toDouble(right));
		}
		return intBinary(op, toBigInteger(left), toBigInteger(right));
	}

	private static Value intBinary(String op, BigInteger l, BigInteger r) {
		switch (op) {
			case "+":
				return new IntValue(l.add(r));
			case "-":
				return new IntValue(l.subtract(r));
			case "*":
				return new IntValue(l.multiply(r));
			case "/":
				requireNonZero(r.signum() == 0, "division by zero");
				return new FloatValue(l.doubleValue() / r.doubleValue());
			case "//":
				requireNonZero(r.signum() == 0, "integer division or modulo by zero");
				return new IntValue(floorDiv(l, r));
			case "%":
				requireNonZero(r.signum() == 0, "integer division or modulo by zero");
				return new IntValue(l.subtract(r.multiply(floorDiv(l, r))));
			case "**":
				if (r.signum() < 0) {
					return floatBinary(op, l.doubleValue(), r.doubleValue());
				}
				if (r.compareTo(BigInteger.valueOf(MAX_INT_EXPONENT)) > 0) {
					throw new EvaluationException("exponent too large: " + r);
				}
				return new IntValue(l.pow(r.intValue()));
			default:
				throw new EvaluationException("unsupported operator " + op);
		}
	}

	private static Value floatBinary(String op, double l, double r) {
		switch (op) {
			case "+":
				return new FloatValue(l + r);
			case "-":
				return new FloatValue(l - r);
			case "*":
				return new FloatValue(l * r);
			case "/":
				requireNonZero(r == 0.0, "float division by zero");
				return new FloatValue(l / r);
			case "//":
				requireNonZero(r == 0.0, "float floor division by zero");
				return new FloatValue(Math.floor(l / r));
			case "%":
				requireNonZero(r == 0.0, "float modulo");
				return new FloatValue(l - r * Math.floor(l / r));
			case "**":
				requireNonZero(l == 0.0 && r < 0, "0.0 cannot be raised to a negative power");
				return new FloatValue(Math.pow(l, r));
			default:
				throw new EvaluationException("unsupported operator " + op);
		}
	}

	public static Value negate(Value operand) {
		if (operand instanceof FloatValue f) {
			return new FloatValue(-f.value());
		}
		if (isNumeric(operand)) {
			return new IntValue(toBigInteger(operand).negate());
		}
		throw new EvaluationException("bad operand type for unary -: '" + operand.typeName() + "'");
	}

	public static Value plus(Value operand) {
		if (operand instanceof FloatValue) {
			return operand;
		}
		if (isNumeric(operand)) {
			return new IntValue(toBigInteger(operand));
		}
		throw new EvaluationException("bad operand type for unary +: '" + operand.typeName() + "'");
	}

	/**
	 * A single comparison step, e.g. {@code compare("<", a, b)}.
	 */
	public static boolean compare(String op, Value left, Value right) {
		if (op.equals("==")) {
			return valueEquals(left, right);
		}
		if (op.equals("!=")) {
			return !valueEquals(left, right);
		}
		int cmp = order(op, left, right);
		return switch (op) {
			case "<" -> cmp < 0;
			case "<=" -> cmp <= 0;
			case ">" -> cmp > 0;
			case ">=" -> cmp >= 0;
			default -> throw new EvaluationException("unsupported comparison " + op);
		};
	}

	public static boolean valueEquals(Value left, Value right) {
		if (isNumeric(left) && isNumeric(right)) {
			if (isNaN(left) || isNaN(right)) {
				return false;
			}
			return numericCompare(left, right) == 0;
		}
		if (left instanceof StrValue l && right instanceof StrValue r) {
			return l.value().equals(r.value());
		}
		if (left instanceof NoneValue && right instanceof NoneValue) {
			return true;
		}
		return left == right;
	}

	public static boolean isTruthy(Value value) {
		if (value instanceof BoolValue b) {
			return b.value();
		}
		if (value instanceof IntValue i) {
			return i.value().signum() != 0;
		}
		if (value instanceof FloatValue f) {
			return f.value() != 0.0;
		}
		if (value instanceof StrValue s) {
			return !s.value().isEmpty();
		}
		return !(value instanceof NoneValue);
	}

	static boolean isNumeric(Value value) {
		return value instanceof IntValue || value instanceof FloatValue || value instanceof BoolValue;
	}

	static double toDouble(Value value) {
		if (value instanceof FloatValue f) {
			return f.value();
		}
		return toBigInteger(value).doubleValue();
	}

	static BigInteger toBigInteger(Value value) {
		if (value instanceof IntValue i) {
			return i.value();
		}
		if (value instanceof BoolValue b) {
			return b.value() ? BigInteger.ONE : BigInteger.ZERO;
		}
		throw new EvaluationException("expected an integer but got '" + value.typeName() + "'");
	}

	private static int order(String op, Value left, Value right) {
		if (isNumeric(left) && isNumeric(right)) {
			if (isNaN(left) || isNaN(right)) {
				// every ordering with NaN is false
				return op.startsWith("<") ? 1 : -1;
			}
			return numericCompare(left, right);
		}
		if (left instanceof StrValue l && right instanceof StrValue r) {
			return l.value().compareTo(r.value());
		}
		throw new EvaluationException("'" + op + "' not supported between instances of '" + left.typeName()
				+ "' and '" + right.typeName() + "'");
	}

	private static int numericCompare(Value left, Value right) {
		if (!(left instanceof FloatValue) && !(right instanceof FloatValue)) {
			return toBigInteger(left).compareTo(toBigInteger(right));
		}
		double l = toDouble(left);
		double r = toDouble(right);
		if (Double.isInfinite(l) || Double.isInfinite(r)) {
			return Double.compare(l, r);
		}
		return exact(left).compareTo(exact(right));
	}

	private static BigDecimal exact(Value value) {
		if (value instanceof FloatValue f) {
			return new BigDecimal(f.value());
		}
		return new BigDecimal(toBigInteger(value));
	}

	private static boolean isNaN(Value value) {
		return value instanceof FloatValue f && Double.isNaN(f.value());
	}

	private static BigInteger floorDiv(BigInteger l, BigInteger r) {
		BigInteger[] qr = l.divideAndRemainder(r);
		if (qr[1].signum() != 0 && qr[1].signum() != r.signum()) {
			return qr[0].subtract(BigInteger.ONE);
		}
		return qr[0];
	}

	private static void requireNonZero(boolean isZero, String message) {
		if (isZero) {
			throw new EvaluationException(message);
		}
	}
}
