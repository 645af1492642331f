package org.metricshub.tinyscript.frontend.ast;

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

/**
 * Thrown when the lexer meets input it cannot turn into a token:
 * an unrecognized character, or an integer literal that does not fit
 * into a signed 64-bit value.
 */
public class LexerException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String sourceDescription;
	private final int lineNumber;

	/**
	 * @param msg description of the lexical problem
	 * @param sourceDescription name of the script source being read
	 * @param lineNumber 1-based line where the problem was found
	 */
	public LexerException(String msg, String sourceDescription, int lineNumber) {
		super(msg + " (" + sourceDescription + ":" + lineNumber + ")");
		this.sourceDescription = sourceDescription;
		this.lineNumber = lineNumber;
	}

	public String getSourceDescription() {
		return sourceDescription;
	}

	public int getLineNumber() {
		return lineNumber;
	}
}
