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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Decodes a program back into its instructions.
 * <p>
 * Used to dump programs and to validate bytecode loaded from a file.
 */
public final class Disassembler {

	private Disassembler() {}

	/**
	 * @param program the bytecode
	 * @return the instructions, in program order
	 * @throws IllegalArgumentException on an unknown opcode or a truncated operand
	 */
	public static List<Instruction> disassemble(byte[] program) {
		List<Instruction> instructions = new ArrayList<Instruction>();
		int offset = 0;
		while (offset < program.length) {
			Opcode opcode = Opcode.fromCode(program[offset]);
			if (opcode == null) {
				throw new IllegalArgumentException(
						String.format("Invalid opcode 0x%02X at offset %d", program[offset] & 0xFF, offset));
			}
			long operand = 0;
			if (opcode.hasOperand()) {
				if (offset + opcode.size() > program.length) {
					throw new IllegalArgumentException("Truncated " + opcode + " operand at offset " + offset);
				}
				operand = Bytecode.readOperand(program, offset + 1);
			}
			instructions.add(new Instruction(offset, opcode, operand));
			offset += opcode.size();
		}
		return instructions;
	}

	/**
	 * Lists the targets of the branches of a compiled program, i.e. the
	 * operands of the PUSH instructions immediately preceding a JUMP or
	 * JUMP_IF.
	 *
	 * @param instructions a disassembled program
	 * @return the branch targets, in program order
	 */
	public static List<Long> branchTargets(List<Instruction> instructions) {
		List<Long> targets = new ArrayList<Long>();
		for (int i = 1; i < instructions.size(); i++) {
			Opcode opcode = instructions.get(i).getOpcode();
			Instruction previous = instructions.get(i - 1);
			if ((opcode == Opcode.JUMP || opcode == Opcode.JUMP_IF) && previous.getOpcode() == Opcode.PUSH) {
				targets.add(previous.getOperand());
			}
		}
		return targets;
	}

	/**
	 * Checks that a program decodes, ends with HALT, and that every branch
	 * target lands at the start of an instruction.
	 *
	 * @param program the bytecode
	 * @throws IllegalArgumentException if the program is malformed
	 */
	public static void verify(byte[] program) {
		List<Instruction> instructions = disassemble(program);
		if (instructions.isEmpty() || instructions.get(instructions.size() - 1).getOpcode() != Opcode.HALT) {
			throw new IllegalArgumentException("Program does not end with HALT");
		}
		Set<Long> boundaries = new HashSet<Long>();
		for (Instruction instruction : instructions) {
			boundaries.add((long) instruction.getOffset());
		}
		for (long target : branchTargets(instructions)) {
			if (!boundaries.contains(target)) {
				throw new IllegalArgumentException("Branch target " + target + " is not an instruction boundary");
			}
		}
	}
}
