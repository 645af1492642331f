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
 * Instruction set of the TinyScript virtual machine.
 * <p>
 * Each instruction is encoded as one opcode byte. Only {@link #PUSH} is
 * followed by an operand: 8 bytes, little-endian, two's-complement signed
 * 64-bit integer. Branch instructions take their target from the operand
 * stack, as an absolute byte offset into the program.
 * <p>
 * In the stack descriptions below, the top of the stack is on the left.
 */
public enum Opcode {
	/**
	 * Pushes the 64-bit operand following the opcode.
	 * <p>
	 * Stack before: ...<br/>
	 * Stack after: x ...
	 */
	PUSH(0x01, true),
	/**
	 * Pops an item off the operand stack.
	 * <p>
	 * Stack before: x ...<br/>
	 * Stack after: ...
	 */
	POP(0x02),
	/**
	 * Stack before: b a ...<br/>
	 * Stack after: (a + b) ...
	 */
	ADD(0x03),
	/**
	 * Stack before: b a ...<br/>
	 * Stack after: (a - b) ...
	 */
	SUB(0x04),
	/**
	 * Stack before: b a ...<br/>
	 * Stack after: (a * b) ...
	 */
	MUL(0x05),
	/**
	 * Integer division, truncating toward zero. Division by zero is fatal.
	 * <p>
	 * Stack before: b a ...<br/>
	 * Stack after: (a / b) ...
	 */
	DIV(0x06),
	/**
	 * Replaces an address with the value stored there (0 if never written).
	 * <p>
	 * Stack before: address ...<br/>
	 * Stack after: value ...
	 */
	LOAD(0x07),
	/**
	 * Writes a value at an address.
	 * <p>
	 * Stack before: value address ...<br/>
	 * Stack after: ...
	 */
	STORE(0x08),
	/**
	 * Jumps to the target popped off the stack.
	 * <p>
	 * Stack before: target ...<br/>
	 * Stack after: ...
	 */
	JUMP(0x09),
	/**
	 * Jumps to the target if the condition is non-zero.
	 * <p>
	 * Stack before: target condition ...<br/>
	 * Stack after: ...
	 */
	JUMP_IF(0x0A),
	/**
	 * Stack before: b a ...<br/>
	 * Stack after: (a == b ? 1 : 0) ...
	 */
	EQUAL(0x0B),
	/**
	 * Stack before: b a ...<br/>
	 * Stack after: (a &lt; b ? 1 : 0) ...
	 */
	LESS(0x0C),
	/**
	 * Pops a value and prints it as <code>Output: value</code>.
	 * <p>
	 * Stack before: x ...<br/>
	 * Stack after: ...
	 */
	PRINT(0x0D),
	/**
	 * Stack before: b a ...<br/>
	 * Stack after: (a &lt;= b ? 1 : 0) ...
	 */
	LESS_EQUAL(0x0E),
	/**
	 * Stack before: b a ...<br/>
	 * Stack after: (a &gt;= b ? 1 : 0) ...
	 */
	GREATER_EQUAL(0x0F),
	/**
	 * Stops the machine. Every compiled program ends with it.
	 */
	HALT(0xFF);

	/** Size in bytes of the {@link #PUSH} operand. */
	public static final int OPERAND_SIZE = 8;

	private static final Opcode[] BY_CODE = new Opcode[256];

	static {
		for (Opcode opcode : values()) {
			BY_CODE[opcode.code & 0xFF] = opcode;
		}
	}

	private final byte code;
	private final boolean hasOperand;

	Opcode(int code) {
		this(code, false);
	}

	Opcode(int code, boolean hasOperand) {
		this.code = (byte) code;
		this.hasOperand = hasOperand;
	}

	/**
	 * @return the byte encoding of this opcode
	 */
	public byte code() {
		return code;
	}

	/**
	 * @return whether an 8-byte operand follows the opcode byte
	 */
	public boolean hasOperand() {
		return hasOperand;
	}

	/**
	 * @return encoded size of the instruction, opcode and operand included
	 */
	public int size() {
		return hasOperand ? 1 + OPERAND_SIZE : 1;
	}

	/**
	 * Decodes an opcode byte.
	 *
	 * @param code the byte read from a program
	 * @return the opcode, or {@code null} if the byte encodes no instruction
	 */
	public static Opcode fromCode(byte code) {
		return BY_CODE[code & 0xFF];
	}
}
