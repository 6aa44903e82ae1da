package rtt.parse.py;

import rtt.ast.SourceSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Lexer for the Py subset: indentation becomes INDENT/DEDENT tokens.
 *
 * Notes:
 * - Skips # comments and blank lines.
 * - Lines are joined inside (), [] and {} and after a trailing backslash.
 * - Tabs advance the column to the next multiple of 8.
 * - String prefixes (r"", b"", f"") are NOT supported.
 */
public final class PyLexer {
	private static final Set<String> TWO_CHAR_OPS = Set.of("**", "//", "==", "!=", "<=", ">=", "->");

	public List<PyToken> lex(String input) {
		List<PyToken> tokens = new ArrayList<>();
		Deque<Integer> indents = new ArrayDeque<>();
		indents.push(0);
		int depth = 0;
		boolean atLineStart = true;
		int i = 0;

		while (i < input.length()) {
			if (atLineStart && depth == 0) {
				int col = 0;
				int j = i;
				while (j < input.length() && (input.charAt(j) == ' ' || input.charAt(j) == '\t' || input.charAt(j) == '\f')) {
					col = input.charAt(j) == '\t' ? (col / 8 + 1) * 8 : col + 1;
					j++;
				}
				if (j >= input.length()) {
					i = j;
					break;
				}

				char first = input.charAt(j);
				// blank or comment-only line
				if (first == '\n' || first == '\r' || first == '#') {
					i = consumeLineEnd(input, skipToLineEnd(input, j));
					continue;
				}

				if (col > indents.peek()) {
					indents.push(col);
					tokens.add(new PyToken(PyTokenType.INDENT, "", new SourceSpan(i, j)));
				}
				while (col < indents.peek()) {
					indents.pop();
					tokens.add(new PyToken(PyTokenType.DEDENT, "", new SourceSpan(j, j)));
				}
				if (col != indents.peek()) {
					throw new SourceSyntaxException("unindent does not match any outer indentation level",
							new SourceSpan(i, j));
				}
				i = j;
				atLineStart = false;
				continue;
			}

			char c = input.charAt(i);

			if (c == ' ' || c == '\t' || c == '\f') {
				i++;
				continue;
			}

			if (c == '#') {
				i = skipToLineEnd(input, i);
				continue;
			}

			// explicit line joining
			if (c == '\\' && i + 1 < input.length() && (input.charAt(i + 1) == '\n' || input.charAt(i + 1) == '\r')) {
				i = consumeLineEnd(input, i + 1);
				continue;
			}

			if (c == '\n' || c == '\r') {
				int start = i;
				i = consumeLineEnd(input, i);
				if (depth == 0) {
					addNewline(tokens, new SourceSpan(start, i));
					atLineStart = true;
				}
				continue;
			}

			if (c == '"' || c == '\'') {
				int start = i;
				i = consumeString(input, i);
				tokens.add(new PyToken(PyTokenType.STRING, input.substring(start, i), new SourceSpan(start, i)));
				continue;
			}

			if (Character.isLetter(c) || c == '_') {
				int start = i;
				i++;
				while (i < input.length() && (Character.isLetterOrDigit(input.charAt(i)) || input.charAt(i) == '_')) {
					i++;
				}
				tokens.add(new PyToken(PyTokenType.NAME, input.substring(start, i), new SourceSpan(start, i)));
				continue;
			}

			if (Character.isDigit(c) || (c == '.' && i + 1 < input.length() && Character.isDigit(input.charAt(i + 1)))) {
				int start = i;
				i = consumeNumber(input, i);
				tokens.add(new PyToken(PyTokenType.NUMBER, input.substring(start, i), new SourceSpan(start, i)));
				continue;
			}

			String two = (i + 1 < input.length()) ? input.substring(i, i + 2) : "";
			if (TWO_CHAR_OPS.contains(two)) {
				int start = i;
				i += 2;
				tokens.add(new PyToken(PyTokenType.OP, two, new SourceSpan(start, i)));
				continue;
			}

			if (c == '(' || c == '[' || c == '{') {
				depth++;
			} else if (c == ')' || c == ']' || c == '}') {
				if (depth == 0) {
					throw new SourceSyntaxException("unmatched '" + c + "'", new SourceSpan(i, i + 1));
				}
				depth--;
			} else if ("+-*/%<>=,:.".indexOf(c) < 0) {
				throw new SourceSyntaxException("invalid character '" + c + "'", new SourceSpan(i, i + 1));
			}
			tokens.add(new PyToken(PyTokenType.OP, String.valueOf(c), new SourceSpan(i, i + 1)));
			i++;
		}

		if (depth != 0) {
			throw new SourceSyntaxException("unexpected end of input inside brackets",
					new SourceSpan(input.length(), input.length()));
		}

		SourceSpan end = new SourceSpan(input.length(), input.length());
		addNewline(tokens, end);
		while (indents.peek() > 0) {
			indents.pop();
			tokens.add(new PyToken(PyTokenType.DEDENT, "", end));
		}
		tokens.add(new PyToken(PyTokenType.EOF, "", end));
		return tokens;
	}

	private static void addNewline(List<PyToken> tokens, SourceSpan span) {
		if (tokens.isEmpty()) {
			return;
		}
		PyTokenType last = tokens.get(tokens.size() - 1).type();
		if (last == PyTokenType.NEWLINE || last == PyTokenType.DEDENT || last == PyTokenType.INDENT) {
			return;
		}
		tokens.add(new PyToken(PyTokenType.NEWLINE, "", span));
	}

	private static int skipToLineEnd(String input, int start) {
		int i = start;
		while (i < input.length() && input.charAt(i) != '\n' && input.charAt(i) != '\r') {
			i++;
		}
		return i;
	}

	private static int consumeLineEnd(String input, int start) {
		if (start >= input.length()) {
			return start;
		}
		// handle CRLF
		if (input.charAt(start) == '\r' && start + 1 < input.length() && input.charAt(start + 1) == '\n') {
			return start + 2;
		}
		return start + 1;
	}

	private static int consumeNumber(String input, int start) {
		int i = start;
		int radix = radixAt(input, start);
		if (radix != 10) {
			i += 2;
			if (i < input.length() && input.charAt(i) == '_') {
				i++;
			}
			int digitsEnd = consumeDigits(input, i, radix);
			if (digitsEnd == i) {
				throw new SourceSyntaxException("invalid number literal", new SourceSpan(start, i));
			}
			return rejectTrailingName(input, start, digitsEnd);
		}

		i = consumeDigits(input, i, 10);
		boolean integer = true;
		if (i < input.length() && input.charAt(i) == '.') {
			integer = false;
			i = consumeDigits(input, i + 1, 10);
		}
		if (i < input.length() && (input.charAt(i) == 'e' || input.charAt(i) == 'E')) {
			int j = i + 1;
			if (j < input.length() && (input.charAt(j) == '+' || input.charAt(j) == '-')) {
				j++;
			}
			if (j < input.length() && Character.isDigit(input.charAt(j))) {
				integer = false;
				i = consumeDigits(input, j, 10);
			}
		}
		if (i < input.length() && (input.charAt(i) == 'j' || input.charAt(i) == 'J')) {
			return rejectTrailingName(input, start, i + 1);
		}
		if (integer && hasLeadingZero(input.substring(start, i))) {
			throw new SourceSyntaxException("leading zeros in decimal integer literals are not permitted",
					new SourceSpan(start, i));
		}
		return rejectTrailingName(input, start, i);
	}

	private static int radixAt(String input, int start) {
		if (input.charAt(start) != '0' || start + 1 >= input.length()) {
			return 10;
		}
		return switch (input.charAt(start + 1)) {
			case 'x', 'X' -> 16;
			case 'o', 'O' -> 8;
			case 'b', 'B' -> 2;
			default -> 10;
		};
	}

	/**
	 * Reads digits of the given radix; a single '_' is allowed between two digits.
	 */
	private static int consumeDigits(String input, int start, int radix) {
		int i = start;
		while (i < input.length()) {
			char c = input.charAt(i);
			if (Character.digit(c, radix) >= 0) {
				i++;
			} else if (c == '_' && i > start && i + 1 < input.length() && Character.digit(input.charAt(i + 1), radix) >= 0) {
				i++;
			} else {
				break;
			}
		}
		return i;
	}

	private static boolean hasLeadingZero(String literal) {
		String digits = literal.replace("_", "");
		return digits.length() > 1 && digits.charAt(0) == '0' && digits.chars().anyMatch(d -> d != '0');
	}

	private static int rejectTrailingName(String input, int start, int end) {
		if (end < input.length() && (Character.isLetterOrDigit(input.charAt(end)) || input.charAt(end) == '_')) {
			throw new SourceSyntaxException("invalid number literal", new SourceSpan(start, end + 1));
		}
		return end;
	}

	private static int consumeString(String input, int start) {
		char quote = input.charAt(start);
		String triple = String.valueOf(quote).repeat(3);
		if (input.startsWith(triple, start)) {
			int end = input.indexOf(triple, start + 3);
			while (end > 0 && isEscaped(input, end)) {
				end = input.indexOf(triple, end + 1);
			}
			if (end < 0) {
				throw new SourceSyntaxException("unterminated triple-quoted string", new SourceSpan(start, input.length()));
			}
			return end + 3;
		}

		int i = start + 1;
		while (i < input.length()) {
			char c = input.charAt(i);
			if (c == '\\') {
				// skip escaped character if present
				i = Math.min(i + 2, input.length());
				continue;
			}
			if (c == '\n' || c == '\r') {
				break;
			}
			if (c == quote) {
				return i + 1;
			}
			i++;
		}
		throw new SourceSyntaxException("unterminated string literal", new SourceSpan(start, i));
	}

	private static boolean isEscaped(String input, int index) {
		int backslashes = 0;
		int i = index - 1;
		while (i >= 0 && input.charAt(i) == '\\') {
			backslashes++;
			i--;
		}
		return backslashes % 2 == 1;
	}
}
