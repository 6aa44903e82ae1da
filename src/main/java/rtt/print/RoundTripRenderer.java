package rtt.print;

import rtt.model.RecoveredShape;

import java.util.List;

/**
 * Renders a recovered shape back into a minimal Py function definition.
 *
 * The parameter list is always {@code (a, b)}: reverse extraction does not recover parameters.
 */
public final class RoundTripRenderer {
	public static final List<String> FIXED_PARAMETERS = List.of("a", "b");

	private static final String INDENT = "    ";

	public String render(RecoveredShape shape) {
		StringBuilder out = new StringBuilder();
		out.append("def ").append(shape.name())
				.append("(").append(String.join(", ", FIXED_PARAMETERS)).append("):\n");
		out.append(INDENT).append("if ").append(shape.condition()).append(":\n");
		out.append(INDENT).append(INDENT).append("return ").append(shape.trueResult()).append("\n");
		out.append(INDENT).append("else:\n");
		out.append(INDENT).append(INDENT).append("return ").append(shape.falseResult()).append("\n");
		return out.toString();
	}
}
