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

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

/**
 * Growable buffer in which the compiler emits a program, one instruction
 * at a time.
 * <p>
 * Forward jump targets are not known when the branch is emitted. The
 * compiler creates an {@link Address}, pushes it with
 * {@link #pushAddress(Address)} (which writes a placeholder operand when the
 * address is still unresolved), and later marks the target location with
 * {@link #address(Address)}, which overwrites every placeholder waiting for
 * that address.
 */
public class Bytecode {

	/** Address manager */
	private final AddressManager addressManager = new AddressManager();

	private byte[] buffer = new byte[256];
	private int size;

	/**
	 * Encodes a value as 8 little-endian bytes.
	 *
	 * @param dest destination array
	 * @param offset where to write the first (least significant) byte
	 * @param value the value
	 */
	public static void writeOperand(byte[] dest, int offset, long value) {
		for (int i = 0; i < Opcode.OPERAND_SIZE; i++) {
			dest[offset + i] = (byte) (value >>> (8 * i));
		}
	}

	/**
	 * Decodes 8 little-endian bytes.
	 *
	 * @param src source array
	 * @param offset offset of the first (least significant) byte
	 * @return the decoded signed value
	 */
	public static long readOperand(byte[] src, int offset) {
		long value = 0;
		for (int i = Opcode.OPERAND_SIZE - 1; i >= 0; i--) {
			value = (value << 8) | (src[offset + i] & 0xFFL);
		}
		return value;
	}

	private void ensureCapacity(int extra) {
		if (size + extra > buffer.length) {
			buffer = Arrays.copyOf(buffer, Math.max(buffer.length * 2, size + extra));
		}
	}

	private void emit(Opcode opcode) {
		ensureCapacity(1);
		buffer[size++] = opcode.code();
	}

	private int emitPush(long value) {
		emit(Opcode.PUSH);
		ensureCapacity(Opcode.OPERAND_SIZE);
		int operandOffset = size;
		writeOperand(buffer, operandOffset, value);
		size += Opcode.OPERAND_SIZE;
		return operandOffset;
	}

	/**
	 * @return the offset at which the next instruction will be emitted
	 */
	public int size() {
		return size;
	}

	public void push(long value) {
		emitPush(value);
	}

	/**
	 * Pushes the offset of an address, to be consumed by a branch.
	 * If the address is not resolved yet, a placeholder operand is written
	 * and patched when {@link #address(Address)} resolves it.
	 *
	 * @param address jump target
	 */
	public void pushAddress(Address address) {
		if (address.isResolved()) {
			emitPush(address.offset());
		} else {
			int operandOffset = emitPush(0L);
			addressManager.addPatchSite(address, operandOffset);
		}
	}

	public void pop() {
		emit(Opcode.POP);
	}

	public void add() {
		emit(Opcode.ADD);
	}

	public void subtract() {
		emit(Opcode.SUB);
	}

	public void multiply() {
		emit(Opcode.MUL);
	}

	public void divide() {
		emit(Opcode.DIV);
	}

	public void load() {
		emit(Opcode.LOAD);
	}

	public void store() {
		emit(Opcode.STORE);
	}

	public void jump() {
		emit(Opcode.JUMP);
	}

	public void jumpIf() {
		emit(Opcode.JUMP_IF);
	}

	public void equal() {
		emit(Opcode.EQUAL);
	}

	public void less() {
		emit(Opcode.LESS);
	}

	public void lessEqual() {
		emit(Opcode.LESS_EQUAL);
	}

	public void greaterEqual() {
		emit(Opcode.GREATER_EQUAL);
	}

	public void print() {
		emit(Opcode.PRINT);
	}

	public void halt() {
		emit(Opcode.HALT);
	}

	/**
	 * @param label name of the address, suffixed with a counter
	 * @return a new, unresolved address
	 */
	public Address createAddress(String label) {
		return addressManager.createAddress(label);
	}

	/**
	 * Resolves the address to the current offset, i.e. to the next
	 * instruction emitted, and backpatches the pushes waiting for it.
	 *
	 * @param address address to resolve
	 * @return this
	 */
	public Bytecode address(Address address) {
		List<Integer> sites = addressManager.resolveAddress(address, size);
		for (int operandOffset : sites) {
			writeOperand(buffer, operandOffset, size);
		}
		return this;
	}

	/**
	 * @return a copy of the emitted program
	 * @throws Error if an address was pushed but never resolved
	 */
	public byte[] toByteArray() {
		addressManager.checkAllResolved();
		return Arrays.copyOf(buffer, size);
	}

	/**
	 * Dumps the emitted instructions, with the labels of resolved addresses.
	 *
	 * @param ps destination stream for the listing
	 */
	public void dump(PrintStream ps) {
		for (Instruction instruction : Disassembler.disassemble(Arrays.copyOf(buffer, size))) {
			Address address = addressManager.getAddress(instruction.getOffset());
			if (address == null) {
				ps.println(instruction);
			} else {
				ps.println(instruction + "    [" + address + "]");
			}
		}
	}
}
