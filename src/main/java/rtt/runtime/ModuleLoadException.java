package rtt.runtime;

import rtt.PipelineError;
import rtt.PipelineException;

/**
 * Raised when a module cannot be parsed or initialised, or a patch cannot be applied.
 */
public class ModuleLoadException extends PipelineException {
	public ModuleLoadException(String message) {
		super(PipelineError.MODULE_LOAD_FAILED, message);
	}

	public ModuleLoadException(String message, Throwable cause) {
		super(PipelineError.MODULE_LOAD_FAILED, message, cause);
	}
}
