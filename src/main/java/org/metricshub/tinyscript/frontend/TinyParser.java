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
import java.util.ArrayList;
import java.util.List;
import org.metricshub.tinyscript.frontend.ast.BinaryOperator;
import org.metricshub.tinyscript.frontend.ast.Expression;
import org.metricshub.tinyscript.frontend.ast.ParserException;
import org.metricshub.tinyscript.frontend.ast.Statement;
import org.metricshub.tinyscript.util.ScriptSource;

/**
 * Converts a TinyScript program into a syntax tree.
 * <p>
 * Recursive descent over the tokens of a {@link Lexer}, with one token of
 * lookahead. The first mismatch aborts the parse with a
 * {@link ParserException}; there is no recovery and no partial result.
 * <p>
 * A parser instance parses one source; create a new one per script.
 */
public class TinyParser {

	private Lexer lexer;
	private Token token;

	/**
	 * Parse the script streamed by the source.
	 *
	 * @param source the script
	 * @return the top-level statements of the script, in source order
	 * @throws IOException upon an IO error
	 */
	public List<Statement> parse(ScriptSource source) throws IOException {
		lexer = new Lexer(source);
		lexer();
		return SCRIPT();
	}

	/**
	 * Parse a single expression, which must make up the whole source.
	 *
	 * @param source the expression to parse (not a statement)
	 * @return the expression tree
	 * @throws IOException upon an IO error
	 */
	public Expression parseExpression(ScriptSource source) throws IOException {
		lexer = new Lexer(source);
		lexer();
		Expression expression = EXPRESSION();
		lexer(TokenType.EOF);
		return expression;
	}

	private Token lexer(TokenType expectedToken) throws IOException {
		if (token.getType() != expectedToken) {
			throw parserException("Expecting " + expectedToken.name() + ". Found: " + describe(token));
		}
		return lexer();
	}

	private Token lexer() throws IOException {
		token = lexer.nextToken();
		return token;
	}

	private static String describe(Token t) {
		if (t.getType() == TokenType.EOF) {
			return "EOF";
		}
		return t.getType().name() + " (" + t.getText() + ")";
	}

	private ParserException parserException(String msg) {
		return new ParserException(msg, lexer.getSourceDescription(), token.getLineNumber());
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName

	// SCRIPT : STATEMENT* EOF
	List<Statement> SCRIPT() throws IOException {
		List<Statement> statements = new ArrayList<Statement>();
		while (token.getType() != TokenType.EOF) {
			statements.add(STATEMENT());
		}
		return statements;
	}

	// STATEMENT :
	// let ID = EXPRESSION ;
	// | ID = EXPRESSION ;
	// | if EXPRESSION BLOCK [else BLOCK]
	// | while EXPRESSION BLOCK
	// | print EXPRESSION ;
	Statement STATEMENT() throws IOException {
		int line = token.getLineNumber();
		switch (token.getType()) {
		case LET: {
			lexer();
			String name = token.getText();
			lexer(TokenType.IDENTIFIER);
			lexer(TokenType.EQUALS);
			Expression value = EXPRESSION();
			lexer(TokenType.SEMICOLON);
			return new Statement.LetStatement(name, value, line);
		}
		case IDENTIFIER: {
			String name = token.getText();
			lexer();
			lexer(TokenType.EQUALS);
			Expression value = EXPRESSION();
			lexer(TokenType.SEMICOLON);
			return new Statement.AssignStatement(name, value, line);
		}
		case IF: {
			lexer();
			Expression condition = EXPRESSION();
			List<Statement> thenBlock = BLOCK();
			List<Statement> elseBlock;
			if (token.getType() == TokenType.ELSE) {
				lexer();
				elseBlock = BLOCK();
			} else {
				elseBlock = new ArrayList<Statement>();
			}
			return new Statement.IfStatement(condition, thenBlock, elseBlock, line);
		}
		case WHILE: {
			lexer();
			Expression condition = EXPRESSION();
			List<Statement> body = BLOCK();
			return new Statement.WhileStatement(condition, body, line);
		}
		case PRINT: {
			lexer();
			Expression value = EXPRESSION();
			lexer(TokenType.SEMICOLON);
			return new Statement.PrintStatement(value, line);
		}
		default:
			throw parserException("Expecting statement. Found: " + describe(token));
		}
	}

	// BLOCK : STATEMENT | ( STATEMENT* )
	List<Statement> BLOCK() throws IOException {
		List<Statement> statements = new ArrayList<Statement>();
		if (token.getType() == TokenType.OPEN_PAREN) {
			lexer();
			while (token.getType() != TokenType.CLOSE_PAREN && token.getType() != TokenType.EOF) {
				statements.add(STATEMENT());
			}
			lexer(TokenType.CLOSE_PAREN);
		} else {
			statements.add(STATEMENT());
		}
		return statements;
	}

	// EXPRESSION : COMPARISON
	Expression EXPRESSION() throws IOException {
		return COMPARISON();
	}

	// COMPARISON : ADDITIVE ((== | < | >) ADDITIVE)*
	Expression COMPARISON() throws IOException {
		Expression expression = ADDITIVE();
		while (true) {
			BinaryOperator op;
			switch (token.getType()) {
			case DOUBLE_EQUALS:
				op = BinaryOperator.EQUALS;
				break;
			case LESS_THAN:
				op = BinaryOperator.LESS_THAN;
				break;
			case GREATER_THAN:
				op = BinaryOperator.GREATER_THAN;
				break;
			default:
				return expression;
			}
			int line = token.getLineNumber();
			lexer();
			expression = new Expression.BinaryOperation(expression, op, ADDITIVE(), line);
		}
	}

	// ADDITIVE : MULTIPLICATIVE ((+ | -) MULTIPLICATIVE)*
	Expression ADDITIVE() throws IOException {
		Expression expression = MULTIPLICATIVE();
		while (token.getType() == TokenType.PLUS || token.getType() == TokenType.MINUS) {
			BinaryOperator op = token.getType() == TokenType.PLUS ? BinaryOperator.ADD : BinaryOperator.SUB;
			int line = token.getLineNumber();
			lexer();
			expression = new Expression.BinaryOperation(expression, op, MULTIPLICATIVE(), line);
		}
		return expression;
	}

	// MULTIPLICATIVE : PRIMARY ((* | /) PRIMARY)*
	Expression MULTIPLICATIVE() throws IOException {
		Expression expression = PRIMARY();
		while (token.getType() == TokenType.STAR || token.getType() == TokenType.SLASH) {
			BinaryOperator op = token.getType() == TokenType.STAR ? BinaryOperator.MUL : BinaryOperator.DIV;
			int line = token.getLineNumber();
			lexer();
			expression = new Expression.BinaryOperation(expression, op, PRIMARY(), line);
		}
		return expression;
	}

	// PRIMARY : NUMBER | ID | ( EXPRESSION )
	Expression PRIMARY() throws IOException {
		int line = token.getLineNumber();
		switch (token.getType()) {
		case NUMBER: {
			long value = token.getValue();
			lexer();
			return new Expression.NumberLiteral(value, line);
		}
		case IDENTIFIER: {
			String name = token.getText();
			lexer();
			return new Expression.VariableReference(name, line);
		}
		case OPEN_PAREN: {
			lexer();
			Expression expression = EXPRESSION();
			lexer(TokenType.CLOSE_PAREN);
			return expression;
		}
		default:
			throw parserException("Expecting expression. Found: " + describe(token));
		}
	}

	// CHECKSTYLE.ON: MethodName
}
