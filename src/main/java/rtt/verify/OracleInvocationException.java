package rtt.verify;

import rtt.PipelineError;
import rtt.PipelineException;

/**
 * The oracle could not be run at all, as opposed to running and reporting failures.
 */
public class OracleInvocationException extends PipelineException {
	public OracleInvocationException(String message) {
		super(PipelineError.ORACLE_INVOCATION, message);
	}

	public OracleInvocationException(String message, Throwable cause) {
		super(PipelineError.ORACLE_INVOCATION, message, cause);
	}
}
