package rtt.ast.py;

import rtt.ast.SourceSpan;

import java.util.List;

/**
 * A comparison chain such as {@code a < b <= c}: {@code ops.size() == comparators.size()}.
 */
public record PyCompare(PyExpr left, List<String> ops, List<PyExpr> comparators, SourceSpan span) implements PyExpr {
	public boolean isChained() {
		return ops.size() > 1;
	}
}
