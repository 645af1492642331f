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

import java.util.Objects;

/**
 * A token produced by the {@link Lexer}. Immutable.
 * <p>
 * NUMBER tokens carry their value, IDENTIFIER tokens their name (the text);
 * every other token is fully described by its type.
 */
public final class Token {

	private final TokenType type;
	private final String text;
	private final long value;
	private final int lineNumber;

	Token(TokenType type, String text, long value, int lineNumber) {
		this.type = Objects.requireNonNull(type);
		this.text = text;
		this.value = value;
		this.lineNumber = lineNumber;
	}

	Token(TokenType type, String text, int lineNumber) {
		this(type, text, 0L, lineNumber);
	}

	public TokenType getType() {
		return type;
	}

	/**
	 * @return the source text of the token (empty for EOF)
	 */
	public String getText() {
		return text;
	}

	/**
	 * @return the literal value of a NUMBER token, 0 for any other token
	 */
	public long getValue() {
		return value;
	}

	public int getLineNumber() {
		return lineNumber;
	}

	/** Equality ignores the line number. */
	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Token)) {
			return false;
		}
		Token other = (Token) o;
		return type == other.type && value == other.value && Objects.equals(text, other.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, text, value);
	}

	@Override
	public String toString() {
		switch (type) {
		case NUMBER:
		case IDENTIFIER:
			return type.name() + "(" + text + ")";
		default:
			return type.name();
		}
	}
}
