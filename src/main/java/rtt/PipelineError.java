package rtt;

/**
 * Kinds of errors that abort a round-trip run.
 */
public enum PipelineError {
	NOT_FOUND,
	NO_FUNCTION_FOUND,
	UNSUPPORTED_BODY_SHAPE,
	UNSUPPORTED_SIGNATURE,
	UNSUPPORTED_EXPRESSION,
	PATTERN_NOT_MATCHED,
	ORACLE_INVOCATION,
	SYNTAX_ERROR,
	MODULE_LOAD_FAILED
}
