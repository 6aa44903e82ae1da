package rtt.runtime;

import rtt.ast.py.PyFunctionDef;

import java.util.Map;

/**
 * A user-defined function. Global names resolve through {@code module} at call time.
 *
 * @param defaults default values by parameter name, evaluated when the definition ran
 */
public record FunctionValue(PyFunctionDef def, ModuleHandle module, Map<String, Value> defaults) implements Value {
	public FunctionValue {
		defaults = Map.copyOf(defaults);
	}

	@Override
	public String typeName() {
		return "function";
	}

	@Override
	public String repr() {
		return "<function " + def.name() + ">";
	}

	@Override
	public boolean equals(Object o) {
		return this == o;
	}

	@Override
	public int hashCode() {
		return System.identityHashCode(this);
	}
}
