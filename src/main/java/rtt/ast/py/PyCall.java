package rtt.ast.py;

import rtt.ast.SourceSpan;

import java.util.List;

public record PyCall(PyExpr callee, List<PyExpr> args, SourceSpan span) implements PyExpr {
}
