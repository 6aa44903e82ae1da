package rtt.ast.py;

import rtt.ast.SourceSpan;

public record PyExprStmt(PyExpr value, SourceSpan span) implements PyStmt {
	public boolean isDocstring() {
		return value instanceof PyString;
	}
}
