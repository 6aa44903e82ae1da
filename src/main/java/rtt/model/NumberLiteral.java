package rtt.model;

import java.util.Objects;

/**
 * A numeric literal kept as its source lexeme, e.g. {@code 1}, {@code 2.5} or {@code -3}.
 */
public record NumberLiteral(String text) implements Expression {
	public NumberLiteral {
		Objects.requireNonNull(text, "text");
	}
}
