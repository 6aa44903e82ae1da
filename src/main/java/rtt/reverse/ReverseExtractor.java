package rtt.reverse;

import rtt.model.RecoveredShape;
import rtt.model.TargetSyntax;

/**
 * Recovers condition and branch results from text produced by the matching emitter.
 */
public interface ReverseExtractor {
	TargetSyntax target();

	/**
	 * @param functionName name given to the recovered shape; it is not read from {@code text}
	 * @throws PatternNotMatchedException if the text does not contain the if/else return template
	 */
	RecoveredShape extract(String text, String functionName);
}
