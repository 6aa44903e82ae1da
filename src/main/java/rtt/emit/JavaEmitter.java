package rtt.emit;

import rtt.model.FunctionShape;
import rtt.model.GeneratedText;
import rtt.model.TargetSyntax;

import java.util.stream.Collectors;

public final class JavaEmitter implements TargetEmitter {
	public static final String DEFAULT_CLASS_NAME = "Original";

	private final ExpressionRenderer renderer = new ExpressionRenderer();
	private final String className;

	public JavaEmitter() {
		this(DEFAULT_CLASS_NAME);
	}

	public JavaEmitter(String className) {
		this.className = className;
	}

	@Override
	public TargetSyntax target() {
		return TargetSyntax.JAVA;
	}

	@Override
	public GeneratedText emit(FunctionShape shape) {
		String params = shape.parameters().stream().map(p -> "double " + p).collect(Collectors.joining(", "));

		StringBuilder sb = new StringBuilder();
		sb.append("public class ").append(className).append(" {\n")
				.append("    public static double ").append(shape.name()).append("(").append(params).append(") {\n")
				.append("        if (").append(renderer.render(shape.condition())).append(") {\n")
				.append("            return ").append(renderer.render(shape.trueResult())).append(";\n")
				.append("        } else {\n")
				.append("            return ").append(renderer.render(shape.falseResult())).append(";\n")
				.append("        }\n")
				.append("    }\n")
				.append("}\n");
		return new GeneratedText(TargetSyntax.JAVA, sb.toString());
	}
}
