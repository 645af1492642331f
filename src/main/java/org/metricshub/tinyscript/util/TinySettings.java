package org.metricshub.tinyscript.util;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;

/**
 * A simple container for the parameters of a single TinyScript invocation.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking TinyScript programmatically, from within Java code.
 */
public class TinySettings {

	/** Operand stack capacity used when none is specified. */
	public static final int DEFAULT_STACK_CAPACITY = 1024;

	/**
	 * Output stream receiving the <code>print</code> statements;
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Maximum number of values the VM operand stack may hold.
	 */
	private int stackCapacity = DEFAULT_STACK_CAPACITY;

	/**
	 * Whether reading a variable that was never assigned is rejected
	 * before compilation; <code>false</code> by default, in which case
	 * such variables are allocated silently and read as zero.
	 */
	private boolean strictVariables = false;

	/**
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("stackCapacity = ").append(getStackCapacity()).append(newLine);
		desc.append("strictVariables = ").append(isStrictVariables()).append(newLine);

		return desc.toString();
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(PrintStream pOutputStream) {
		this.outputStream = pOutputStream;
	}

	public int getStackCapacity() {
		return stackCapacity;
	}

	/**
	 * @param pStackCapacity maximum operand stack depth, must be positive
	 */
	public void setStackCapacity(int pStackCapacity) {
		if (pStackCapacity <= 0) {
			throw new IllegalArgumentException("Stack capacity must be positive: " + pStackCapacity);
		}
		this.stackCapacity = pStackCapacity;
	}

	public boolean isStrictVariables() {
		return strictVariables;
	}

	public void setStrictVariables(boolean pStrictVariables) {
		this.strictVariables = pStrictVariables;
	}
}
