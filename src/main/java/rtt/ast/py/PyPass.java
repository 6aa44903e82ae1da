package rtt.ast.py;

import rtt.ast.SourceSpan;

public record PyPass(SourceSpan span) implements PyStmt {
}
