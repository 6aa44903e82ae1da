package rtt.ast.py;

import rtt.ast.SourceSpan;

import java.util.List;

/**
 * {@code if}/{@code elif}/{@code else}. An {@code elif} is a single nested PyIf in {@code orElse}.
 */
public record PyIf(PyExpr test, List<PyStmt> body, List<PyStmt> orElse, SourceSpan span) implements PyStmt {
}
