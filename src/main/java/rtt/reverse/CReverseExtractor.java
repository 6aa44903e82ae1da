package rtt.reverse;

import rtt.model.RecoveredShape;
import rtt.model.TargetSyntax;

public final class CReverseExtractor implements ReverseExtractor {
	@Override
	public TargetSyntax target() {
		return TargetSyntax.C;
	}

	@Override
	public RecoveredShape extract(String text, String functionName) {
		return IfReturnTemplate.match(text, functionName)
				.orElseThrow(() -> new PatternNotMatchedException(TargetSyntax.C));
	}
}
