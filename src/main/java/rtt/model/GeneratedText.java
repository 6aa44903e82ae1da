package rtt.model;

import java.util.Objects;

public record GeneratedText(TargetSyntax target, String text) {
	public GeneratedText {
		Objects.requireNonNull(target, "target");
		Objects.requireNonNull(text, "text");
	}
}
