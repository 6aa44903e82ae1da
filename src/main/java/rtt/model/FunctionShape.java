package rtt.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * A function whose body is a single {@code if/else}, each branch returning one expression.
 */
public record FunctionShape(String name, List<String> parameters, Expression condition, Expression trueResult,
		Expression falseResult) {
	public FunctionShape {
		Objects.requireNonNull(name, "name");
		Objects.requireNonNull(condition, "condition");
		Objects.requireNonNull(trueResult, "trueResult");
		Objects.requireNonNull(falseResult, "falseResult");
		parameters = List.copyOf(parameters);
		if (new HashSet<>(parameters).size() != parameters.size()) {
			throw new IllegalArgumentException("duplicate parameter in " + parameters);
		}
	}
}
