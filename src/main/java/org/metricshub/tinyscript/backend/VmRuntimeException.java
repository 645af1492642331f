package org.metricshub.tinyscript.backend;

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
 * A fatal error of the virtual machine. Execution stops where the error
 * occurred; nothing is rolled back.
 */
public class VmRuntimeException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/**
	 * The kinds of fatal errors.
	 */
	public enum Kind {
		STACK_UNDERFLOW,
		STACK_OVERFLOW,
		/** Unknown opcode byte; see {@link VmRuntimeException#getValue()}. */
		INVALID_OPCODE,
		/**
		 * Jump target outside the program, negative memory address, or the
		 * program counter running past the end of the program; see
		 * {@link VmRuntimeException#getValue()}.
		 */
		INVALID_ADDRESS,
		DIVISION_BY_ZERO
	}

	private final Kind kind;
	private final int programCounter;
	private final long value;

	/**
	 * @param kind what went wrong
	 * @param programCounter offset of the failing instruction
	 * @param value offending opcode byte or address, 0 when irrelevant
	 * @param msg description of the error
	 */
	public VmRuntimeException(Kind kind, int programCounter, long value, String msg) {
		super(msg + " (at offset " + programCounter + ")");
		this.kind = kind;
		this.programCounter = programCounter;
		this.value = value;
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return offset of the instruction that failed
	 */
	public int getProgramCounter() {
		return programCounter;
	}

	/**
	 * @return the offending opcode byte (0-255) for INVALID_OPCODE, the
	 *         offending address for INVALID_ADDRESS, 0 otherwise
	 */
	public long getValue() {
		return value;
	}
}
