package rtt.ast.py;

import rtt.ast.SourceSpan;

public record PyBinaryExpr(PyExpr left, String op, PyExpr right, SourceSpan span) implements PyExpr {
}
