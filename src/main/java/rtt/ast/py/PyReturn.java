package rtt.ast.py;

import rtt.ast.SourceSpan;

/**
 * {@code value} is null for a bare {@code return}.
 */
public record PyReturn(PyExpr value, SourceSpan span) implements PyStmt {
}
