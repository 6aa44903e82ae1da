package rtt.emit;

import rtt.model.FunctionShape;
import rtt.model.GeneratedText;
import rtt.model.TargetSyntax;

/**
 * Renders a {@link FunctionShape} into the fixed if/else template of one target syntax.
 */
public interface TargetEmitter {
	TargetSyntax target();

	GeneratedText emit(FunctionShape shape);
}
