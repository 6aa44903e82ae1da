package rtt.model;

import java.util.Objects;

public record Identifier(String name) implements Expression {
	public Identifier {
		Objects.requireNonNull(name, "name");
	}
}
