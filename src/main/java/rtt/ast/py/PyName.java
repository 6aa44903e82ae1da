package rtt.ast.py;

import rtt.ast.SourceSpan;

public record PyName(String name, SourceSpan span) implements PyExpr {
}
