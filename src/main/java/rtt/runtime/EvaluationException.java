package rtt.runtime;

/**
 * Exception thrown when evaluating Py code fails at run time (the analogue of a raised Py exception).
 */
public class EvaluationException extends RuntimeException {
	public EvaluationException(String message) {
		super(message);
	}

	public EvaluationException(String message, Throwable cause) {
		super(message, cause);
	}
}
