package rtt.model;

import java.util.Objects;

public record BinaryOp(Operator operator, Expression left, Expression right) implements Expression {
	public BinaryOp {
		Objects.requireNonNull(operator, "operator");
		Objects.requireNonNull(left, "left");
		Objects.requireNonNull(right, "right");
	}
}
