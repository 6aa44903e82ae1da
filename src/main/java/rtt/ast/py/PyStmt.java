package rtt.ast.py;

public sealed interface PyStmt extends PyNode permits PyFunctionDef, PyIf, PyReturn, PyAssign, PyExprStmt, PyPass {
}
