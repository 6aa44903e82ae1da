package rtt.ast.py;

import rtt.ast.SourceSpan;

/**
 * A declared parameter. {@code defaultValue} is null when the parameter has none.
 */
public record PyParam(String name, PyParamKind kind, PyExpr defaultValue, SourceSpan span) implements PyNode {
	public boolean hasDefault() {
		return defaultValue != null;
	}
}
