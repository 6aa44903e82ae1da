package rtt.ast.py;

public enum PyParamKind {
	POSITIONAL,
	VARIADIC,
	KEYWORD_ONLY,
	VARIADIC_KEYWORD
}
