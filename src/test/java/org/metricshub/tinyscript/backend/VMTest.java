package org.metricshub.tinyscript.backend;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.tinyscript.intermediate.Address;
import org.metricshub.tinyscript.intermediate.Bytecode;

public class VMTest {

	private ByteArrayOutputStream out;
	private PrintStream ps;

	@Before
	public void setUp() {
		out = new ByteArrayOutputStream();
		ps = new PrintStream(out, true, StandardCharsets.UTF_8);
	}

	private VM vm(Bytecode bytecode, int capacity) {
		return new VM(bytecode.toByteArray(), capacity, ps);
	}

	private VM vm(Bytecode bytecode) {
		return vm(bytecode, 16);
	}

	private String output() {
		return out.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
	}

	private static VmRuntimeException failure(VM vm) {
		return assertThrows(VmRuntimeException.class, vm::run);
	}

	@Test
	public void testPushPop() {
		Bytecode b = new Bytecode();
		b.push(10);
		b.push(20);
		b.pop();
		b.halt();
		VM vm = vm(b);
		vm.run();
		assertArrayEquals(new long[] { 10 }, vm.getStack());
	}

	@Test
	public void testArithmetic() {
		Bytecode b = new Bytecode();
		b.push(10);
		b.push(3);
		b.subtract();
		b.push(4);
		b.multiply();
		b.push(5);
		b.divide();
		b.push(100);
		b.add();
		b.halt();
		VM vm = vm(b);
		vm.run();
		// ((10 - 3) * 4) / 5 + 100
		assertArrayEquals(new long[] { 105 }, vm.getStack());
	}

	@Test
	public void testComparisons() {
		Bytecode b = new Bytecode();
		b.push(2);
		b.push(3);
		b.less();
		b.push(3);
		b.push(2);
		b.less();
		b.push(4);
		b.push(4);
		b.equal();
		b.push(4);
		b.push(4);
		b.lessEqual();
		b.push(3);
		b.push(4);
		b.greaterEqual();
		b.halt();
		VM vm = vm(b);
		vm.run();
		assertArrayEquals(new long[] { 1, 0, 1, 1, 0 }, vm.getStack());
	}

	@Test
	public void testLoadStore() {
		Bytecode b = new Bytecode();
		b.push(3);
		b.push(42);
		b.store();
		b.push(3);
		b.load();
		b.push(99);
		b.load();
		b.halt();
		VM vm = vm(b);
		vm.run();
		assertArrayEquals(new long[] { 42, 0 }, vm.getStack());
		assertEquals(1, vm.getMemory().size());
		assertEquals(Long.valueOf(42), vm.getMemory().get(3L));
	}

	@Test
	public void testPrint() {
		Bytecode b = new Bytecode();
		b.push(-5);
		b.print();
		b.push(Long.MAX_VALUE);
		b.print();
		b.halt();
		VM vm = vm(b);
		vm.run();
		assertEquals("Output: -5\nOutput: 9223372036854775807\n", output());
		assertEquals(0, vm.getStack().length);
	}

	@Test
	public void testJumps() {
		Bytecode b = new Bytecode();
		Address skip = b.createAddress("skip");
		Address end = b.createAddress("end");
		b.push(0);
		b.pushAddress(end);
		b.jumpIf(); // not taken: zero
		b.push(7);
		b.pushAddress(skip);
		b.jumpIf(); // taken: non-zero
		b.push(1);
		b.print();
		b.address(skip);
		b.push(2);
		b.print();
		b.pushAddress(end);
		b.jump();
		b.push(3);
		b.print();
		b.address(end);
		b.halt();
		VM vm = vm(b);
		vm.run();
		assertEquals("Output: 2\n", output());
		assertEquals(0, vm.getStack().length);
	}

	@Test
	public void testDivisionByZero() {
		Bytecode b = new Bytecode();
		b.push(1);
		b.push(10);
		b.push(0);
		b.divide();
		b.halt();
		VM vm = vm(b);
		VmRuntimeException e = failure(vm);
		assertEquals(VmRuntimeException.Kind.DIVISION_BY_ZERO, e.getKind());
		assertEquals(27, e.getProgramCounter());
		// both operands popped, nothing else touched
		assertArrayEquals(new long[] { 1 }, vm.getStack());
		assertEquals(VM.State.RUNNING, vm.getState());
	}

	@Test
	public void testOverflowKeepsStack() {
		Bytecode b = new Bytecode();
		b.push(1);
		b.push(2);
		b.push(3);
		b.halt();
		VM vm = vm(b, 2);
		VmRuntimeException e = failure(vm);
		assertEquals(VmRuntimeException.Kind.STACK_OVERFLOW, e.getKind());
		assertEquals(18, e.getProgramCounter());
		assertArrayEquals(new long[] { 1, 2 }, vm.getStack());
		assertEquals(2, vm.getStackCapacity());
	}

	@Test
	public void testUnderflow() {
		Bytecode b = new Bytecode();
		b.push(1);
		b.add();
		b.halt();
		VmRuntimeException e = failure(vm(b));
		assertEquals(VmRuntimeException.Kind.STACK_UNDERFLOW, e.getKind());

		Bytecode empty = new Bytecode();
		empty.print();
		empty.halt();
		assertEquals(VmRuntimeException.Kind.STACK_UNDERFLOW, failure(vm(empty)).getKind());
	}

	@Test
	public void testInvalidOpcode() {
		VM vm = new VM(new byte[] { 0x02, 0x42 }, 4, ps);
		// POP underflows first
		assertEquals(VmRuntimeException.Kind.STACK_UNDERFLOW, failure(vm).getKind());

		vm = new VM(new byte[] { 0x42 }, 4, ps);
		VmRuntimeException e = failure(vm);
		assertEquals(VmRuntimeException.Kind.INVALID_OPCODE, e.getKind());
		assertEquals(0x42, e.getValue());
		assertEquals(0, e.getProgramCounter());
	}

	@Test
	public void testInvalidAddresses() {
		// jump past the end
		Bytecode b = new Bytecode();
		b.push(1000);
		b.jump();
		b.halt();
		VmRuntimeException e = failure(vm(b));
		assertEquals(VmRuntimeException.Kind.INVALID_ADDRESS, e.getKind());
		assertEquals(1000, e.getValue());

		// negative jump target
		b = new Bytecode();
		b.push(1);
		b.push(-1);
		b.jumpIf();
		b.halt();
		assertEquals(VmRuntimeException.Kind.INVALID_ADDRESS, failure(vm(b)).getKind());

		// negative memory address
		b = new Bytecode();
		b.push(-3);
		b.load();
		b.halt();
		e = failure(vm(b));
		assertEquals(VmRuntimeException.Kind.INVALID_ADDRESS, e.getKind());
		assertEquals(-3, e.getValue());

		// no HALT
		b = new Bytecode();
		b.push(1);
		assertEquals(VmRuntimeException.Kind.INVALID_ADDRESS, failure(vm(b)).getKind());

		// truncated operand
		VM vm = new VM(new byte[] { 0x01, 1, 2, 3 }, 4, ps);
		assertEquals(VmRuntimeException.Kind.INVALID_ADDRESS, failure(vm).getKind());
	}

	@Test
	public void testSteps() {
		Bytecode b = new Bytecode();
		b.push(4);
		b.push(5);
		b.add();
		b.halt();
		VM vm = vm(b);
		assertEquals(VM.State.NOT_STARTED, vm.getState());
		assertTrue(vm.step());
		assertEquals(VM.State.RUNNING, vm.getState());
		assertEquals(9, vm.getProgramCounter());
		assertArrayEquals(new long[] { 4 }, vm.getStack());
		assertTrue(vm.step());
		assertTrue(vm.step());
		assertArrayEquals(new long[] { 9 }, vm.getStack());
		assertFalse(vm.step());
		assertEquals(VM.State.HALTED, vm.getState());
		assertEquals(4, vm.getExecutedInstructions());
		// halted for good
		assertFalse(vm.step());
		assertEquals(4, vm.getExecutedInstructions());
	}

	@Test
	public void testWrapAround() {
		Bytecode b = new Bytecode();
		b.push(Long.MIN_VALUE);
		b.push(-1);
		b.multiply();
		b.push(Long.MIN_VALUE);
		b.push(-1);
		b.divide();
		b.halt();
		VM vm = vm(b);
		vm.run();
		assertArrayEquals(new long[] { Long.MIN_VALUE, Long.MIN_VALUE }, vm.getStack());
	}

	@Test
	public void testProgramIsCopied() {
		Bytecode b = new Bytecode();
		b.push(1);
		b.halt();
		byte[] program = b.toByteArray();
		VM vm = new VM(program, 4, ps);
		program[0] = 0x42;
		vm.run();
		assertArrayEquals(new long[] { 1 }, vm.getStack());
	}

	@Test
	public void testInvalidConstruction() {
		assertThrows(IllegalArgumentException.class, () -> new VM(null, 4, ps));
		assertThrows(IllegalArgumentException.class, () -> new VM(new byte[] { (byte) 0xFF }, 0, ps));
	}
}
