package rtt.ast.py;

import rtt.ast.SourceSpan;

import java.util.List;

public record PyFunctionDef(String name, List<PyParam> params, List<PyStmt> body, SourceSpan span) implements PyStmt {
}
