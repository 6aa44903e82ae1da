package rtt.runtime;

import java.util.List;
import java.util.function.Function;

public record BuiltinValue(String name, Function<List<Value>, Value> impl) implements Value {
	@Override
	public String typeName() {
		return "builtin_function_or_method";
	}

	@Override
	public String repr() {
		return "<built-in function " + name + ">";
	}
}
