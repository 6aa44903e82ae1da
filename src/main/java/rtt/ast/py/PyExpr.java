package rtt.ast.py;

public sealed interface PyExpr extends PyNode
		permits PyName, PyNumber, PyString, PyBinaryExpr, PyUnaryExpr, PyCompare, PyBoolOp, PyCall {
}
