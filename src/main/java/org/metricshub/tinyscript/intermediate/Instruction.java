package org.metricshub.tinyscript.intermediate;

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
 * One decoded instruction of a program.
 */
public final class Instruction {

	private final int offset;
	private final Opcode opcode;
	private final long operand;

	public Instruction(int offset, Opcode opcode, long operand) {
		this.offset = offset;
		this.opcode = opcode;
		this.operand = operand;
	}

	/**
	 * @return byte offset of the opcode within the program
	 */
	public int getOffset() {
		return offset;
	}

	public Opcode getOpcode() {
		return opcode;
	}

	/**
	 * @return the PUSH operand; 0 for the other opcodes
	 */
	public long getOperand() {
		return operand;
	}

	/**
	 * @return offset of the instruction that follows this one
	 */
	public int getNextOffset() {
		return offset + opcode.size();
	}

	@Override
	public String toString() {
		String s = String.format("%04d : %s", offset, opcode.name());
		if (opcode.hasOperand()) {
			s += " " + operand;
		}
		return s;
	}
}
