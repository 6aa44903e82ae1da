package rtt.ast.py;

import rtt.ast.SourceSpan;

public sealed interface PyNode permits PyModule, PyStmt, PyExpr, PyParam {
	SourceSpan span();
}
