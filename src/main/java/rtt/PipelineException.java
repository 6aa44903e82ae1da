package rtt;

/**
 * Base class for errors that abort a round-trip run.
 *
 * A failing test suite is not one of these; it is reported as a result.
 */
public class PipelineException extends RuntimeException {
	private final PipelineError kind;

	public PipelineException(PipelineError kind, String message) {
		super(message);
		this.kind = kind;
	}

	public PipelineException(PipelineError kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
	}

	public PipelineError kind() {
		return kind;
	}
}
