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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import org.metricshub.tinyscript.intermediate.Bytecode;
import org.metricshub.tinyscript.intermediate.Opcode;
import org.metricshub.tinyscript.util.TinyLogger;
import org.metricshub.tinyscript.util.TinySettings;
import org.slf4j.Logger;

/**
 * The TinyScript virtual machine.
 * <p>
 * It executes a program produced by the
 * {@link org.metricshub.tinyscript.intermediate.BytecodeCompiler}, one
 * instruction per {@link #step()}, against an operand stack of bounded
 * capacity and a sparse memory where every address reads as zero until
 * written. The only observable effect besides the final state is the output
 * of the PRINT instruction.
 * <p>
 * A VM owns its program, stack and memory, and runs a program once:
 * it starts NOT_STARTED, becomes RUNNING on the first step, and HALTED when
 * it executes HALT. Any error is fatal and thrown as a
 * {@link VmRuntimeException}; the state reached at that point remains
 * readable.
 * <p>
 * A VM is not thread-safe, but separate instances share nothing.
 */
public class VM {

	private static final Logger LOG = TinyLogger.getLogger(VM.class);

	/**
	 * Execution state.
	 */
	public enum State {
		NOT_STARTED,
		RUNNING,
		HALTED
	}

	private static final long ONE = 1L;
	private static final long ZERO = 0L;

	private final byte[] program;
	private final OperandStack operandStack;
	private final Map<Long, Long> memory = new HashMap<Long, Long>();
	private final PrintStream out;

	private int pc;
	private int instructionStart;
	private State state = State.NOT_STARTED;
	private long executedInstructions;

	/**
	 * Construct a VM printing to <code>System.out</code>.
	 *
	 * @param program the bytecode, copied
	 * @param stackCapacity maximum operand stack depth, must be positive
	 */
	public VM(byte[] program, int stackCapacity) {
		this(program, stackCapacity, System.out);
	}

	/**
	 * @param program the bytecode, copied
	 * @param stackCapacity maximum operand stack depth, must be positive
	 * @param out destination of the PRINT instruction
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "the output stream is shared with the caller on purpose")
	public VM(byte[] program, int stackCapacity, PrintStream out) {
		if (program == null) {
			throw new IllegalArgumentException("Program must not be null");
		}
		if (stackCapacity <= 0) {
			throw new IllegalArgumentException("Stack capacity must be positive: " + stackCapacity);
		}
		this.program = program.clone();
		this.operandStack = new OperandStack(stackCapacity);
		this.out = out;
	}

	/**
	 * @param program the bytecode, copied
	 * @param settings provides the stack capacity and the output stream
	 */
	public VM(byte[] program, TinySettings settings) {
		this(program, settings.getStackCapacity(), settings.getOutputStream());
	}

	// stack methods
	private long pop() {
		if (operandStack.isEmpty()) {
			throw error(VmRuntimeException.Kind.STACK_UNDERFLOW, ZERO, "Stack underflow");
		}
		return operandStack.pop();
	}

	private void push(long value) {
		if (operandStack.isFull()) {
			throw error(
					VmRuntimeException.Kind.STACK_OVERFLOW,
					ZERO,
					"Stack overflow (capacity " + operandStack.capacity() + ")");
		}
		operandStack.push(value);
	}

	private VmRuntimeException error(VmRuntimeException.Kind kind, long value, String msg) {
		return new VmRuntimeException(kind, instructionStart, value, msg);
	}

	private Opcode fetch() {
		if (pc >= program.length) {
			throw error(VmRuntimeException.Kind.INVALID_ADDRESS, pc, "Program counter ran past the end of the program");
		}
		byte code = program[pc];
		Opcode opcode = Opcode.fromCode(code);
		if (opcode == null) {
			throw error(VmRuntimeException.Kind.INVALID_OPCODE, code & 0xFF, String.format("Invalid opcode: 0x%02X", code & 0xFF));
		}
		pc++;
		return opcode;
	}

	private long fetchOperand() {
		if (pc + Opcode.OPERAND_SIZE > program.length) {
			throw error(VmRuntimeException.Kind.INVALID_ADDRESS, pc, "Truncated operand");
		}
		long value = Bytecode.readOperand(program, pc);
		pc += Opcode.OPERAND_SIZE;
		return value;
	}

	private int checkJumpTarget(long target) {
		if (target < 0 || target >= program.length) {
			throw error(VmRuntimeException.Kind.INVALID_ADDRESS, target, "Jump target out of the program: " + target);
		}
		return (int) target;
	}

	private long checkMemoryAddress(long address) {
		if (address < 0) {
			throw error(VmRuntimeException.Kind.INVALID_ADDRESS, address, "Negative memory address: " + address);
		}
		return address;
	}

	/**
	 * Executes the next instruction.
	 *
	 * @return {@code false} once HALT has been executed, {@code true} otherwise
	 * @throws VmRuntimeException upon any execution error
	 */
	public boolean step() {
		if (state == State.HALTED) {
			return false;
		}
		state = State.RUNNING;
		instructionStart = pc;
		Opcode opcode = fetch();
		executedInstructions++;
		switch (opcode) {
		case PUSH: {
			// arg = constant to push onto the stack
			push(fetchOperand());
			break;
		}
		case POP: {
			pop();
			break;
		}
		case ADD: {
			// stack[0] = item2
			// stack[1] = item1
			long b = pop();
			long a = pop();
			push(a + b);
			break;
		}
		case SUB: {
			long b = pop();
			long a = pop();
			push(a - b);
			break;
		}
		case MUL: {
			long b = pop();
			long a = pop();
			push(a * b);
			break;
		}
		case DIV: {
			long b = pop();
			long a = pop();
			if (b == 0) {
				throw error(VmRuntimeException.Kind.DIVISION_BY_ZERO, ZERO, "Division by zero");
			}
			push(a / b);
			break;
		}
		case LOAD: {
			// stack[0] = address
			long address = checkMemoryAddress(pop());
			Long value = memory.get(address);
			push(value == null ? ZERO : value);
			break;
		}
		case STORE: {
			// stack[0] = value
			// stack[1] = address
			long value = pop();
			long address = checkMemoryAddress(pop());
			memory.put(address, value);
			break;
		}
		case JUMP: {
			// stack[0] = target
			pc = checkJumpTarget(pop());
			break;
		}
		case JUMP_IF: {
			// stack[0] = target
			// stack[1] = condition
			long target = pop();
			long condition = pop();
			if (condition != 0) {
				pc = checkJumpTarget(target);
			}
			break;
		}
		case EQUAL: {
			long b = pop();
			long a = pop();
			push(a == b ? ONE : ZERO);
			break;
		}
		case LESS: {
			long b = pop();
			long a = pop();
			push(a < b ? ONE : ZERO);
			break;
		}
		case LESS_EQUAL: {
			long b = pop();
			long a = pop();
			push(a <= b ? ONE : ZERO);
			break;
		}
		case GREATER_EQUAL: {
			long b = pop();
			long a = pop();
			push(a >= b ? ONE : ZERO);
			break;
		}
		case PRINT: {
			out.println("Output: " + pop());
			break;
		}
		case HALT: {
			state = State.HALTED;
			LOG.debug("Halted after {} instructions, stack {}", executedInstructions, operandStack);
			return false;
		}
		default:
			throw new Error("invalid opcode: " + opcode);
		}
		if (LOG.isTraceEnabled()) {
			LOG.trace("{} {} -> stack {}", instructionStart, opcode, operandStack);
		}
		return true;
	}

	/**
	 * Executes instructions until HALT.
	 *
	 * @throws VmRuntimeException upon any execution error
	 */
	public void run() {
		while (step()) {
			// keep going
		}
	}

	/**
	 * @return the operand stack, bottom first
	 */
	public long[] getStack() {
		return operandStack.toArray();
	}

	/**
	 * @return the written memory cells, by increasing address
	 */
	public Map<Long, Long> getMemory() {
		return Collections.unmodifiableMap(new TreeMap<Long, Long>(memory));
	}

	public int getProgramCounter() {
		return pc;
	}

	public State getState() {
		return state;
	}

	public int getStackCapacity() {
		return operandStack.capacity();
	}

	/**
	 * @return number of instructions fetched so far, including a failing one
	 */
	public long getExecutedInstructions() {
		return executedInstructions;
	}
}
