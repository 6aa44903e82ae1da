package rtt.runtime;

/**
 * A run-time Py value.
 */
public sealed interface Value
		permits IntValue, FloatValue, BoolValue, StrValue, NoneValue, FunctionValue, BuiltinValue {
	String typeName();

	/**
	 * Text as Py's {@code repr} would show it, used in test reports.
	 */
	String repr();
}
