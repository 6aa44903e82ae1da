package rtt.parse.py;

import rtt.ast.SourceSpan;
import rtt.ast.py.PyAssign;
import rtt.ast.py.PyBinaryExpr;
import rtt.ast.py.PyBoolOp;
import rtt.ast.py.PyCall;
import rtt.ast.py.PyCompare;
import rtt.ast.py.PyExpr;
import rtt.ast.py.PyExprStmt;
import rtt.ast.py.PyFunctionDef;
import rtt.ast.py.PyIf;
import rtt.ast.py.PyModule;
import rtt.ast.py.PyName;
import rtt.ast.py.PyNumber;
import rtt.ast.py.PyParam;
import rtt.ast.py.PyParamKind;
import rtt.ast.py.PyPass;
import rtt.ast.py.PyReturn;
import rtt.ast.py.PyStmt;
import rtt.ast.py.PyString;
import rtt.ast.py.PyUnaryExpr;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the Py subset.
 *
 * Precedence, loosest first: or, and, not, comparisons, + -, * / // %, unary - +, **, calls and atoms.
 */
public final class PyParser {
	private static final Set<String> COMPARISON_OPS = Set.of("<", ">", "<=", ">=", "==", "!=");
	private static final Set<String> KEYWORDS = Set.of(
			"def", "if", "elif", "else", "return", "pass", "and", "or", "not", "lambda", "while", "for", "in", "is",
			"import", "from", "class", "with", "try", "except", "finally", "raise", "yield", "global", "nonlocal",
			"del", "assert", "break", "continue", "async", "await", "as");

	public PyModule parseModule(String source) {
		Cursor c = new Cursor(new PyLexer().lex(source));
		List<PyStmt> body = new ArrayList<>();
		while (!c.isAtEnd()) {
			if (c.peekIs(PyTokenType.NEWLINE)) {
				c.next();
				continue;
			}
			if (c.peekIs(PyTokenType.INDENT)) {
				throw new SourceSyntaxException("unexpected indent", c.peek().span());
			}
			body.add(parseStatement(c));
		}
		return new PyModule(body, new SourceSpan(0, source.length()));
	}

	/**
	 * Parses a single expression, e.g. a test-case call such as {@code add_mul(5, 2)}.
	 */
	public PyExpr parseExpression(String source) {
		Cursor c = new Cursor(new PyLexer().lex(source.strip()));
		PyExpr expr = parseExpr(c);
		if (c.peekIs(PyTokenType.NEWLINE)) {
			c.next();
		}
		if (!c.isAtEnd()) {
			throw new SourceSyntaxException("unexpected '" + c.peek().lexeme() + "' after expression", c.peek().span());
		}
		return expr;
	}

	private PyStmt parseStatement(Cursor c) {
		if (c.peekIsName("def")) {
			return parseFunctionDef(c);
		}
		if (c.peekIsName("if")) {
			return parseIf(c);
		}
		PyStmt stmt = parseSimpleStatement(c);
		c.expect(PyTokenType.NEWLINE, "end of line");
		return stmt;
	}

	private PyFunctionDef parseFunctionDef(Cursor c) {
		PyToken start = c.expectName("def");
		PyToken name = c.expectIdentifier("function name");
		c.expectOp("(");

		List<PyParam> params = new ArrayList<>();
		Set<String> seen = new HashSet<>();
		boolean keywordOnly = false;
		while (!c.peekIsOp(")")) {
			PyParam param;
			if (c.peekIsOp("**")) {
				PyToken star = c.next();
				PyToken paramName = c.expectIdentifier("parameter name");
				skipAnnotation(c);
				param = new PyParam(paramName.lexeme(), PyParamKind.VARIADIC_KEYWORD, null, star.span().to(paramName.span()));
			} else if (c.peekIsOp("*")) {
				PyToken star = c.next();
				keywordOnly = true;
				if (c.peekIsOp(",") || c.peekIsOp(")")) {
					// bare '*' only switches the following parameters to keyword-only
					if (c.peekIsOp(",")) {
						c.next();
					}
					continue;
				}
				PyToken paramName = c.expectIdentifier("parameter name");
				skipAnnotation(c);
				param = new PyParam(paramName.lexeme(), PyParamKind.VARIADIC, null, star.span().to(paramName.span()));
			} else {
				PyToken paramName = c.expectIdentifier("parameter name");
				skipAnnotation(c);
				PyExpr defaultValue = null;
				if (c.peekIsOp("=")) {
					c.next();
					defaultValue = parseExpr(c);
				}
				SourceSpan span = defaultValue == null ? paramName.span() : paramName.span().to(defaultValue.span());
				param = new PyParam(paramName.lexeme(), keywordOnly ? PyParamKind.KEYWORD_ONLY : PyParamKind.POSITIONAL,
						defaultValue, span);
			}

			if (!seen.add(param.name())) {
				throw new SourceSyntaxException("duplicate argument '" + param.name() + "'", param.span());
			}
			params.add(param);
			if (!c.peekIsOp(",")) {
				break;
			}
			c.next();
		}
		c.expectOp(")");

		if (c.peekIsOp("->")) {
			c.next();
			parseExpr(c);
		}
		c.expectOp(":");
		List<PyStmt> body = parseSuite(c);
		return new PyFunctionDef(name.lexeme(), params, body, start.span().to(lastSpan(body, name.span())));
	}

	private void skipAnnotation(Cursor c) {
		if (c.peekIsOp(":")) {
			c.next();
			parseExpr(c);
		}
	}

	private PyIf parseIf(Cursor c) {
		PyToken start = c.next(); // 'if' or 'elif'
		PyExpr test = parseExpr(c);
		c.expectOp(":");
		List<PyStmt> body = parseSuite(c);

		List<PyStmt> orElse = List.of();
		if (c.peekIsName("elif")) {
			orElse = List.of(parseIf(c));
		} else if (c.peekIsName("else")) {
			c.next();
			c.expectOp(":");
			orElse = parseSuite(c);
		}
		SourceSpan end = lastSpan(orElse, lastSpan(body, test.span()));
		return new PyIf(test, body, orElse, start.span().to(end));
	}

	private List<PyStmt> parseSuite(Cursor c) {
		List<PyStmt> stmts = new ArrayList<>();
		if (!c.peekIs(PyTokenType.NEWLINE)) {
			// simple statement on the header line
			stmts.add(parseSimpleStatement(c));
			c.expect(PyTokenType.NEWLINE, "end of line");
			return stmts;
		}

		c.next();
		c.expect(PyTokenType.INDENT, "indented block");
		while (!c.peekIs(PyTokenType.DEDENT) && !c.isAtEnd()) {
			stmts.add(parseStatement(c));
		}
		c.expect(PyTokenType.DEDENT, "end of indented block");
		return stmts;
	}

	private PyStmt parseSimpleStatement(Cursor c) {
		PyToken t = c.peek();
		if (c.peekIsName("return")) {
			c.next();
			if (c.peekIs(PyTokenType.NEWLINE)) {
				return new PyReturn(null, t.span());
			}
			PyExpr value = parseExpr(c);
			return new PyReturn(value, t.span().to(value.span()));
		}
		if (c.peekIsName("pass")) {
			c.next();
			return new PyPass(t.span());
		}
		if (t.type() == PyTokenType.NAME && c.peekAheadIsOp(1, "=") && !KEYWORDS.contains(t.lexeme())) {
			c.next();
			c.next();
			PyExpr value = parseExpr(c);
			return new PyAssign(t.lexeme(), value, t.span().to(value.span()));
		}
		if (t.type() == PyTokenType.NAME && KEYWORDS.contains(t.lexeme()) && !t.lexeme().equals("not")) {
			throw new SourceSyntaxException("unsupported statement '" + t.lexeme() + "'", t.span());
		}
		PyExpr value = parseExpr(c);
		return new PyExprStmt(value, value.span());
	}

	private PyExpr parseExpr(Cursor c) {
		return parseOr(c);
	}

	private PyExpr parseOr(Cursor c) {
		PyExpr first = parseAnd(c);
		if (!c.peekIsName("or")) {
			return first;
		}
		List<PyExpr> values = new ArrayList<>();
		values.add(first);
		while (c.peekIsName("or")) {
			c.next();
			values.add(parseAnd(c));
		}
		return new PyBoolOp("or", values, first.span().to(values.get(values.size() - 1).span()));
	}

	private PyExpr parseAnd(Cursor c) {
		PyExpr first = parseNot(c);
		if (!c.peekIsName("and")) {
			return first;
		}
		List<PyExpr> values = new ArrayList<>();
		values.add(first);
		while (c.peekIsName("and")) {
			c.next();
			values.add(parseNot(c));
		}
		return new PyBoolOp("and", values, first.span().to(values.get(values.size() - 1).span()));
	}

	private PyExpr parseNot(Cursor c) {
		if (c.peekIsName("not")) {
			PyToken t = c.next();
			PyExpr operand = parseNot(c);
			return new PyUnaryExpr("not", operand, t.span().to(operand.span()));
		}
		return parseComparison(c);
	}

	private PyExpr parseComparison(Cursor c) {
		PyExpr left = parseArith(c);
		List<String> ops = new ArrayList<>();
		List<PyExpr> comparators = new ArrayList<>();
		while (c.peek().type() == PyTokenType.OP && COMPARISON_OPS.contains(c.peek().lexeme())) {
			ops.add(c.next().lexeme());
			comparators.add(parseArith(c));
		}
		if (ops.isEmpty()) {
			return left;
		}
		return new PyCompare(left, ops, comparators, left.span().to(comparators.get(comparators.size() - 1).span()));
	}

	private PyExpr parseArith(Cursor c) {
		PyExpr left = parseTerm(c);
		while (c.peekIsOp("+") || c.peekIsOp("-")) {
			String op = c.next().lexeme();
			PyExpr right = parseTerm(c);
			left = new PyBinaryExpr(left, op, right, left.span().to(right.span()));
		}
		return left;
	}

	private PyExpr parseTerm(Cursor c) {
		PyExpr left = parseUnary(c);
		while (c.peekIsOp("*") || c.peekIsOp("/") || c.peekIsOp("//") || c.peekIsOp("%")) {
			String op = c.next().lexeme();
			PyExpr right = parseUnary(c);
			left = new PyBinaryExpr(left, op, right, left.span().to(right.span()));
		}
		return left;
	}

	private PyExpr parseUnary(Cursor c) {
		if (c.peekIsOp("-") || c.peekIsOp("+")) {
			PyToken t = c.next();
			PyExpr operand = parseUnary(c);
			return new PyUnaryExpr(t.lexeme(), operand, t.span().to(operand.span()));
		}
		return parsePower(c);
	}

	private PyExpr parsePower(Cursor c) {
		PyExpr base = parsePostfix(c);
		if (c.peekIsOp("**")) {
			c.next();
			// right associative, and binds tighter than a unary minus on its left only
			PyExpr exponent = parseUnary(c);
			return new PyBinaryExpr(base, "**", exponent, base.span().to(exponent.span()));
		}
		return base;
	}

	private PyExpr parsePostfix(Cursor c) {
		PyExpr expr = parseAtom(c);
		while (c.peekIsOp("(")) {
			c.next();
			List<PyExpr> args = new ArrayList<>();
			while (!c.peekIsOp(")")) {
				args.add(parseExpr(c));
				if (!c.peekIsOp(",")) {
					break;
				}
				c.next();
			}
			PyToken end = c.expectOp(")");
			expr = new PyCall(expr, args, expr.span().to(end.span()));
		}
		return expr;
	}

	private PyExpr parseAtom(Cursor c) {
		PyToken t = c.peek();
		if (t.type() == PyTokenType.NUMBER) {
			c.next();
			return new PyNumber(t.lexeme(), t.span());
		}
		if (t.type() == PyTokenType.STRING) {
			return parseStrings(c);
		}
		if (t.type() == PyTokenType.NAME) {
			if (KEYWORDS.contains(t.lexeme())) {
				throw new SourceSyntaxException("unexpected keyword '" + t.lexeme() + "'", t.span());
			}
			c.next();
			return new PyName(t.lexeme(), t.span());
		}
		if (t.type() == PyTokenType.OP && t.lexeme().equals("(")) {
			c.next();
			PyExpr inner = parseExpr(c);
			c.expectOp(")");
			return inner; // grouping is implied by the tree shape
		}
		throw new SourceSyntaxException("unexpected " + describe(t), t.span());
	}

	private PyExpr parseStrings(Cursor c) {
		// adjacent literals concatenate
		PyToken first = c.next();
		StringBuilder value = new StringBuilder(unquote(first.lexeme()));
		SourceSpan span = first.span();
		while (c.peekIs(PyTokenType.STRING)) {
			PyToken next = c.next();
			value.append(unquote(next.lexeme()));
			span = span.to(next.span());
		}
		return new PyString(value.toString(), span);
	}

	static String unquote(String literal) {
		int quoteLength = literal.length() >= 6 && (literal.startsWith("\"\"\"") || literal.startsWith("'''")) ? 3 : 1;
		String body = literal.substring(quoteLength, literal.length() - quoteLength);
		StringBuilder out = new StringBuilder(body.length());
		for (int i = 0; i < body.length(); i++) {
			char ch = body.charAt(i);
			if (ch != '\\' || i + 1 >= body.length()) {
				out.append(ch);
				continue;
			}
			char escaped = body.charAt(++i);
			switch (escaped) {
				case 'n' -> out.append('\n');
				case 't' -> out.append('\t');
				case 'r' -> out.append('\r');
				case '\\', '\'', '"' -> out.append(escaped);
				case '\n' -> {
					// line continuation inside the literal
				}
				default -> out.append('\\').append(escaped);
			}
		}
		return out.toString();
	}

	private static SourceSpan lastSpan(List<PyStmt> stmts, SourceSpan fallback) {
		return stmts.isEmpty() ? fallback : stmts.get(stmts.size() - 1).span();
	}

	private static String describe(PyToken t) {
		return switch (t.type()) {
			case NEWLINE -> "end of line";
			case INDENT -> "indent";
			case DEDENT -> "dedent";
			case EOF -> "end of input";
			default -> "'" + t.lexeme() + "'";
		};
	}

	private static final class Cursor {
		private final List<PyToken> tokens;
		private int pos;

		Cursor(List<PyToken> tokens) {
			this.tokens = tokens;
			this.pos = 0;
		}

		boolean isAtEnd() {
			return peek().type() == PyTokenType.EOF;
		}

		PyToken peek() {
			return tokens.get(pos);
		}

		PyToken next() {
			PyToken t = tokens.get(pos);
			if (t.type() != PyTokenType.EOF) {
				pos++;
			}
			return t;
		}

		boolean peekIs(PyTokenType type) {
			return peek().type() == type;
		}

		boolean peekIsName(String lexeme) {
			PyToken t = peek();
			return t.type() == PyTokenType.NAME && t.lexeme().equals(lexeme);
		}

		boolean peekIsOp(String lexeme) {
			PyToken t = peek();
			return t.type() == PyTokenType.OP && t.lexeme().equals(lexeme);
		}

		boolean peekAheadIsOp(int offset, String lexeme) {
			int index = Math.min(pos + offset, tokens.size() - 1);
			PyToken t = tokens.get(index);
			return t.type() == PyTokenType.OP && t.lexeme().equals(lexeme);
		}

		PyToken expectName(String lexeme) {
			PyToken t = peek();
			if (t.type() != PyTokenType.NAME || !t.lexeme().equals(lexeme)) {
				throw new SourceSyntaxException("expected '" + lexeme + "' but got " + describe(t), t.span());
			}
			return next();
		}

		PyToken expectIdentifier(String what) {
			PyToken t = peek();
			if (t.type() != PyTokenType.NAME || KEYWORDS.contains(t.lexeme())) {
				throw new SourceSyntaxException("expected " + what + " but got " + describe(t), t.span());
			}
			return next();
		}

		PyToken expectOp(String lexeme) {
			PyToken t = peek();
			if (t.type() != PyTokenType.OP || !t.lexeme().equals(lexeme)) {
				throw new SourceSyntaxException("expected '" + lexeme + "' but got " + describe(t), t.span());
			}
			return next();
		}

		PyToken expect(PyTokenType type, String what) {
			PyToken t = peek();
			if (t.type() != type) {
				throw new SourceSyntaxException("expected " + what + " but got " + describe(t), t.span());
			}
			return next();
		}
	}
}
