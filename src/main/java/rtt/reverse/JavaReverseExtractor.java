package rtt.reverse;

import rtt.model.RecoveredShape;
import rtt.model.TargetSyntax;

public final class JavaReverseExtractor implements ReverseExtractor {
	@Override
	public TargetSyntax target() {
		return TargetSyntax.JAVA;
	}

	@Override
	public RecoveredShape extract(String text, String functionName) {
		return IfReturnTemplate.match(text, functionName)
				.orElseThrow(() -> new PatternNotMatchedException(TargetSyntax.JAVA));
	}
}
