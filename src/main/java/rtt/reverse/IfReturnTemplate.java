package rtt.reverse;

import rtt.model.RecoveredShape;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixed matcher for {@code if (COND) { return TRUE; } else { return FALSE; }}.
 *
 * Whitespace between the literal tokens is free. The captures may not contain braces or semicolons, so nested
 * blocks and extra statements in a branch never match. This is text recovery, not parsing: it is only
 * guaranteed to invert the emitters of this project.
 */
final class IfReturnTemplate {
	private static final Pattern IF_RETURN = Pattern.compile(
			"\\bif\\s*\\(\\s*(?<cond>[^{};]+?)\\s*\\)\\s*"
					+ "\\{\\s*return\\s+(?<whenTrue>[^{};]+?)\\s*;\\s*\\}"
					+ "\\s*else\\s*\\{\\s*return\\s+(?<whenFalse>[^{};]+?)\\s*;\\s*\\}");

	private IfReturnTemplate() {
	}

	/**
	 * Matches the first occurrence of the template in {@code text}.
	 */
	static Optional<RecoveredShape> match(String text, String functionName) {
		Matcher m = IF_RETURN.matcher(text);
		if (!m.find()) {
			return Optional.empty();
		}
		return Optional.of(new RecoveredShape(functionName,
				m.group("cond").strip(),
				m.group("whenTrue").strip(),
				m.group("whenFalse").strip()));
	}
}
