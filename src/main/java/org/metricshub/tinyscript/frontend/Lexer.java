package org.metricshub.tinyscript.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * TinyScript
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.tinyscript.frontend.ast.LexerException;
import org.metricshub.tinyscript.util.ScriptSource;

/**
 * Converts the text of a script into tokens, one at a time.
 * <p>
 * The lexer keeps one character of lookahead and produces tokens lazily,
 * on each call to {@link #nextToken()}. Once the input is exhausted, it
 * keeps returning an {@link TokenType#EOF} token. A character that starts no
 * token raises a {@link LexerException}, which is never confused with the
 * end of the input.
 * <p>
 * A lexer cannot be rewound; to tokenize the same text again, create a new
 * lexer over it.
 */
public class Lexer {

	private static final Map<String, TokenType> KEYWORDS;

	static {
		Map<String, TokenType> keywords = new HashMap<String, TokenType>();
		keywords.put("let", TokenType.LET);
		keywords.put("if", TokenType.IF);
		keywords.put("else", TokenType.ELSE);
		keywords.put("while", TokenType.WHILE);
		keywords.put("print", TokenType.PRINT);
		KEYWORDS = Collections.unmodifiableMap(keywords);
	}

	private final String sourceDescription;
	private final Reader reader;
	private int c;
	private int lineNumber = 1;
	private Token eof;

	private final StringBuilder text = new StringBuilder();

	/**
	 * Creates a lexer over the given source; nothing is read until the
	 * first call to {@link #nextToken()}.
	 *
	 * @param source script to tokenize
	 * @throws IOException if the source reader cannot be obtained
	 */
	public Lexer(ScriptSource source) throws IOException {
		this.sourceDescription = source.getDescription();
		this.reader = source.getReader();
		this.c = -2;
	}

	/**
	 * @param script script text to tokenize
	 * @throws IOException never for an in-memory script
	 */
	public Lexer(String script) throws IOException {
		this(ScriptSource.fromString(script));
	}

	/**
	 * @return name of the source, for error messages
	 */
	public String getSourceDescription() {
		return sourceDescription;
	}

	/**
	 * @return 1-based line of the next unread character
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	private void read() throws IOException {
		if (c >= 0) {
			text.append((char) c);
			if (c == '\n') {
				lineNumber++;
			}
		}
		c = reader.read();
	}

	private LexerException lexerException(String msg) {
		return new LexerException(msg, sourceDescription, lineNumber);
	}

	private static boolean isDigit(int ch) {
		return ch >= '0' && ch <= '9';
	}

	private static boolean isIdentifierStart(int ch) {
		return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch == '_';
	}

	private static boolean isIdentifierPart(int ch) {
		return isIdentifierStart(ch) || isDigit(ch);
	}

	/**
	 * Reads the next token.
	 *
	 * @return the next token, or an EOF token when the input is exhausted
	 * @throws IOException upon an error of the underlying reader
	 * @throws LexerException on an unrecognized character or an integer
	 *         literal out of the signed 64-bit range
	 */
	public Token nextToken() throws IOException {
		if (eof != null) {
			return eof;
		}
		if (c == -2) {
			c = reader.read();
		}
		// clear whitespace
		while (c >= 0 && Character.isWhitespace(c)) {
			read();
		}
		text.setLength(0);
		int tokenLine = lineNumber;
		if (c < 0) {
			eof = new Token(TokenType.EOF, "", tokenLine);
			return eof;
		}

		if (isDigit(c)) {
			while (isDigit(c)) {
				read();
			}
			try {
				return new Token(TokenType.NUMBER, text.toString(), Long.parseLong(text.toString()), tokenLine);
			} catch (NumberFormatException e) {
				throw lexerException("Integer literal out of range: " + text);
			}
		}

		if (isIdentifierStart(c)) {
			while (isIdentifierPart(c)) {
				read();
			}
			String word = text.toString();
			TokenType keyword = KEYWORDS.get(word);
			if (keyword != null) {
				return new Token(keyword, word, tokenLine);
			}
			return new Token(TokenType.IDENTIFIER, word, tokenLine);
		}

		TokenType type;
		switch (c) {
		case '+':
			type = TokenType.PLUS;
			break;
		case '-':
			type = TokenType.MINUS;
			break;
		case '*':
			type = TokenType.STAR;
			break;
		case '/':
			type = TokenType.SLASH;
			break;
		case '(':
			type = TokenType.OPEN_PAREN;
			break;
		case ')':
			type = TokenType.CLOSE_PAREN;
			break;
		case ';':
			type = TokenType.SEMICOLON;
			break;
		case '<':
			type = TokenType.LESS_THAN;
			break;
		case '>':
			type = TokenType.GREATER_THAN;
			break;
		case '=':
			read();
			if (c == '=') {
				read();
				return new Token(TokenType.DOUBLE_EQUALS, text.toString(), tokenLine);
			}
			return new Token(TokenType.EQUALS, text.toString(), tokenLine);
		default:
			throw lexerException("Invalid character (" + c + "): " + ((char) c));
		}
		read();
		return new Token(type, text.toString(), tokenLine);
	}

	/**
	 * Reads all the remaining tokens.
	 *
	 * @return the tokens up to, but excluding, the EOF token
	 * @throws IOException upon an error of the underlying reader
	 */
	public List<Token> tokenize() throws IOException {
		List<Token> tokens = new ArrayList<Token>();
		Token token = nextToken();
		while (token.getType() != TokenType.EOF) {
			tokens.add(token);
			token = nextToken();
		}
		return tokens;
	}
}
