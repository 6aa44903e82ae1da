package rtt.parse.py;

import rtt.PipelineError;
import rtt.PipelineException;
import rtt.ast.SourceSpan;

/**
 * Raised when Py source text cannot be tokenized or parsed.
 */
public class SourceSyntaxException extends PipelineException {
	private final SourceSpan span;

	public SourceSyntaxException(String message, SourceSpan span) {
		super(PipelineError.SYNTAX_ERROR, message + " at offset " + span.startOffset());
		this.span = span;
	}

	public SourceSpan span() {
		return span;
	}
}
