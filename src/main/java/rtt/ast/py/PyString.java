package rtt.ast.py;

import rtt.ast.SourceSpan;

public record PyString(String value, SourceSpan span) implements PyExpr {
}
