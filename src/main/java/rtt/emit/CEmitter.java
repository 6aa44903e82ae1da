package rtt.emit;

import rtt.model.FunctionShape;
import rtt.model.GeneratedText;
import rtt.model.TargetSyntax;

import java.util.stream.Collectors;

public final class CEmitter implements TargetEmitter {
	private final ExpressionRenderer renderer = new ExpressionRenderer();

	@Override
	public TargetSyntax target() {
		return TargetSyntax.C;
	}

	@Override
	public GeneratedText emit(FunctionShape shape) {
		String params = shape.parameters().isEmpty()
				? "void"
				: shape.parameters().stream().map(p -> "double " + p).collect(Collectors.joining(", "));

		StringBuilder sb = new StringBuilder();
		sb.append("#include <stdio.h>\n")
				.append("\n")
				.append("double ").append(shape.name()).append("(").append(params).append(") {\n")
				.append("    if (").append(renderer.render(shape.condition())).append(") {\n")
				.append("        return ").append(renderer.render(shape.trueResult())).append(";\n")
				.append("    } else {\n")
				.append("        return ").append(renderer.render(shape.falseResult())).append(";\n")
				.append("    }\n")
				.append("}\n")
				.append("\n")
				.append("int main(void) {\n")
				.append("    // Example driver (not used by the round trip)\n")
				.append("    return 0;\n")
				.append("}\n");
		return new GeneratedText(TargetSyntax.C, sb.toString());
	}
}
