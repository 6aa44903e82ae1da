package rtt.extract;

import rtt.PipelineError;
import rtt.PipelineException;

/**
 * Raised when the requested function is missing or lies outside the translatable subset.
 */
public class ExtractionException extends PipelineException {
	public ExtractionException(PipelineError kind, String message) {
		super(kind, message);
	}
}
