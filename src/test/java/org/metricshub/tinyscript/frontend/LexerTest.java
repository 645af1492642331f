package org.metricshub.tinyscript.frontend;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.tinyscript.frontend.ast.LexerException;

public class LexerTest {

	private static List<Token> tokens(String script) throws Exception {
		return new Lexer(script).tokenize();
	}

	@Test
	public void testStatement() throws Exception {
		assertEquals(
				Arrays
						.asList(
								new Token(TokenType.LET, "let", 1),
								new Token(TokenType.IDENTIFIER, "x", 1),
								new Token(TokenType.EQUALS, "=", 1),
								new Token(TokenType.NUMBER, "10", 10L, 1),
								new Token(TokenType.SEMICOLON, ";", 1)),
				tokens("let x = 10;"));
	}

	@Test
	public void testOperators() throws Exception {
		assertEquals(
				"[PLUS, MINUS, STAR, SLASH, DOUBLE_EQUALS, EQUALS, LESS_THAN, GREATER_THAN, OPEN_PAREN, CLOSE_PAREN, SEMICOLON]",
				tokens("+-*/===<>();").toString());
		assertEquals("[EQUALS, EQUALS]", tokens("= =").toString());
	}

	@Test
	public void testKeywordsAndIdentifiers() throws Exception {
		assertEquals("[LET, IF, ELSE, WHILE, PRINT]", tokens("let if else while print").toString());
		assertEquals(
				"[IDENTIFIER(lets), IDENTIFIER(If), IDENTIFIER(_x1), IDENTIFIER(printer)]",
				tokens("lets If _x1 printer").toString());
		for (Token token : tokens("let if else while print")) {
			assertTrue(token.getType().isKeyword());
		}
		assertFalse(TokenType.IDENTIFIER.isKeyword());
	}

	@Test
	public void testNoSeparatorNeeded() throws Exception {
		assertEquals("[IDENTIFIER(x), EQUALS, IDENTIFIER(x), PLUS, NUMBER(1), SEMICOLON]", tokens("x=x+1;").toString());
		// a digit run ends the number, letters start a new token
		assertEquals("[NUMBER(12), IDENTIFIER(ab)]", tokens("12ab").toString());
	}

	@Test
	public void testNumbers() throws Exception {
		assertEquals(0L, tokens("0").get(0).getValue());
		assertEquals(7L, tokens("007").get(0).getValue());
		assertEquals(Long.MAX_VALUE, tokens("9223372036854775807").get(0).getValue());
		LexerException e = assertThrows(LexerException.class, () -> tokens("9223372036854775808"));
		assertTrue(e.getMessage(), e.getMessage().startsWith("Integer literal out of range: 9223372036854775808"));
	}

	@Test
	public void testLineNumbers() throws Exception {
		List<Token> tokens = tokens("let x = 1;\n\nprint\r\n x;");
		assertEquals(1, tokens.get(0).getLineNumber());
		assertEquals(3, tokens.get(5).getLineNumber());
		assertEquals(4, tokens.get(6).getLineNumber());
	}

	@Test
	public void testInvalidCharacter() throws Exception {
		LexerException e = assertThrows(LexerException.class, () -> tokens("let x = 1;\nprint x $ 2;"));
		assertEquals(2, e.getLineNumber());
		assertEquals("<inline-script>", e.getSourceDescription());
		assertTrue(e.getMessage(), e.getMessage().contains("Invalid character (36): $"));
		assertThrows(LexerException.class, () -> tokens("x != 1"));
		assertThrows(LexerException.class, () -> tokens("{"));
	}

	@Test
	public void testEof() throws Exception {
		Lexer lexer = new Lexer("  ");
		assertEquals(TokenType.EOF, lexer.nextToken().getType());
		assertEquals(TokenType.EOF, lexer.nextToken().getType());
		assertTrue(tokens("").isEmpty());
	}
}
