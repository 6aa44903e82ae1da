package rtt.ast.py;

import rtt.ast.SourceSpan;

public record PyAssign(String target, PyExpr value, SourceSpan span) implements PyStmt {
}
