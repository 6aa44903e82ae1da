package rtt.ast.py;

import rtt.ast.SourceSpan;

public record PyUnaryExpr(String op, PyExpr operand, SourceSpan span) implements PyExpr {
}
