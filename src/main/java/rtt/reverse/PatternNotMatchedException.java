package rtt.reverse;

import rtt.PipelineError;
import rtt.PipelineException;
import rtt.model.TargetSyntax;

public class PatternNotMatchedException extends PipelineException {
	private final TargetSyntax target;

	public PatternNotMatchedException(TargetSyntax target) {
		super(PipelineError.PATTERN_NOT_MATCHED, "Could not parse " + target.displayName() + " text");
		this.target = target;
	}

	public TargetSyntax target() {
		return target;
	}
}
