package rtt.parse.py;

import rtt.ast.SourceSpan;

public record PyToken(PyTokenType type, String lexeme, SourceSpan span) {
}
