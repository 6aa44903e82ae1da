package rtt.parse.py;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PyLexerTest {
	@Test
	void emitsIndentAndDedentAroundBlocks() {
		String input = "def f(a):\n" +
				"    if a:\n" +
				"        return 1\n" +
				"    return 2\n";

		assertEquals(
				"NAME NAME OP NAME OP OP NEWLINE INDENT NAME NAME OP NEWLINE INDENT NAME NUMBER NEWLINE DEDENT "
						+ "NAME NUMBER NEWLINE DEDENT EOF",
				types(new PyLexer().lex(input)));
	}

	@Test
	void skipsCommentsAndBlankLines() {
		String input = "# header\n" +
				"\n" +
				"x = 1  # trailing\n" +
				"   \n" +
				"y = 2\n";

		String lexemes = new PyLexer().lex(input).stream()
				.filter(t -> t.type() != PyTokenType.NEWLINE && t.type() != PyTokenType.EOF)
				.map(PyToken::lexeme)
				.collect(Collectors.joining("|"));

		assertEquals("x|=|1|y|=|2", lexemes);
	}

	@Test
	void joinsLinesInsideBrackets() {
		String input = "f(1,\n" +
				"  2)\n";

		assertEquals("NAME OP NUMBER OP NUMBER OP NEWLINE EOF", types(new PyLexer().lex(input)));
	}

	@Test
	void readsTwoCharacterOperatorsAndNumbers() {
		String lexemes = new PyLexer().lex("a ** 2 // 3.5e1 != .5").stream()
				.filter(t -> t.type() == PyTokenType.OP || t.type() == PyTokenType.NUMBER)
				.map(PyToken::lexeme)
				.collect(Collectors.joining("|"));

		assertEquals("**|2|//|3.5e1|!=|.5", lexemes);
	}

	@Test
	void readsPrefixedSeparatedAndImaginaryNumbers() {
		String lexemes = new PyLexer().lex("0x1F + 1_000 + 0o17 + 0b1_01 + 2.5j + 00 + 1e5J").stream()
				.filter(t -> t.type() == PyTokenType.NUMBER)
				.map(PyToken::lexeme)
				.collect(Collectors.joining("|"));

		assertEquals("0x1F|1_000|0o17|0b1_01|2.5j|00|1e5J", lexemes);
	}

	@Test
	void rejectsMalformedNumbers() {
		var ex = assertThrows(SourceSyntaxException.class, () -> new PyLexer().lex("x = 010\n"));
		assertTrue(ex.getMessage().contains("leading zeros"), ex.getMessage());

		assertThrows(SourceSyntaxException.class, () -> new PyLexer().lex("x = 1__0\n"));
		assertThrows(SourceSyntaxException.class, () -> new PyLexer().lex("x = 1_\n"));
		assertThrows(SourceSyntaxException.class, () -> new PyLexer().lex("x = 0x\n"));
		assertThrows(SourceSyntaxException.class, () -> new PyLexer().lex("x = 0b12\n"));
		assertThrows(SourceSyntaxException.class, () -> new PyLexer().lex("x = 12abc\n"));
	}

	@Test
	void keepsTripleQuotedStringAsOneToken() {
		List<PyToken> tokens = new PyLexer().lex("\"\"\"one\ntwo\"\"\"\n");

		assertEquals(PyTokenType.STRING, tokens.get(0).type());
		assertEquals("\"\"\"one\ntwo\"\"\"", tokens.get(0).lexeme());
	}

	@Test
	void rejectsInconsistentDedent() {
		String input = "if a:\n" +
				"        x = 1\n" +
				"    y = 2\n";

		var ex = assertThrows(SourceSyntaxException.class, () -> new PyLexer().lex(input));
		assertEquals(20, ex.span().startOffset());
	}

	@Test
	void rejectsUnterminatedString() {
		assertThrows(SourceSyntaxException.class, () -> new PyLexer().lex("x = 'abc\n"));
	}

	private static String types(List<PyToken> tokens) {
		return tokens.stream().map(t -> t.type().name()).collect(Collectors.joining(" "));
	}
}
