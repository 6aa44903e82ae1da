package rtt.ast.py;

import rtt.ast.SourceSpan;

import java.util.List;

/**
 * {@code and} / {@code or} over two or more operands.
 */
public record PyBoolOp(String op, List<PyExpr> values, SourceSpan span) implements PyExpr {
}
