package rtt.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Operators shared by Py, C and Java for the supported subset.
 *
 * Binding strength follows Py: all comparisons share one level.
 */
public enum Operator {
	ADD("+", 2),
	SUBTRACT("-", 2),
	MULTIPLY("*", 3),
	DIVIDE("/", 3),
	GREATER(">", 1),
	GREATER_EQUAL(">=", 1),
	LESS("<", 1),
	LESS_EQUAL("<=", 1),
	EQUAL("==", 1),
	NOT_EQUAL("!=", 1);

	private final String token;
	private final int strength;

	Operator(String token, int strength) {
		this.token = token;
		this.strength = strength;
	}

	public String token() {
		return token;
	}

	public int strength() {
		return strength;
	}

	public boolean isComparison() {
		return strength == 1;
	}

	public static Optional<Operator> fromToken(String token) {
		return Arrays.stream(values()).filter(op -> op.token.equals(token)).findFirst();
	}
}
