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

/** Lexer token values. */
public enum TokenType {
	EOF,
	NUMBER,
	IDENTIFIER,

	// keywords
	LET,
	IF,
	ELSE,
	WHILE,
	PRINT,

	PLUS,
	MINUS,
	STAR,
	SLASH,
	/** Assignment, a lone <code>=</code>. */
	EQUALS,
	/** Equality comparison, <code>==</code>. */
	DOUBLE_EQUALS,
	LESS_THAN,
	GREATER_THAN,

	OPEN_PAREN,
	CLOSE_PAREN,
	SEMICOLON;

	/**
	 * @return whether this token is one of the five reserved words
	 */
	public boolean isKeyword() {
		return this == LET || this == IF || this == ELSE || this == WHILE || this == PRINT;
	}
}
