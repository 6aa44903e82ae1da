package rtt.runtime;

/**
 * Unwinds a function body on {@code return}.
 */
final class ReturnSignal extends RuntimeException {
	final Value value;

	ReturnSignal(Value value) {
		super(null, null, false, false);
		this.value = value;
	}
}
