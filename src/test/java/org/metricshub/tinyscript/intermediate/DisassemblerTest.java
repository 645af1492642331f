package org.metricshub.tinyscript.intermediate;

import static org.junit.Assert.*;

import java.io.File;
import java.nio.file.Files;
import java.util.List;
import org.junit.Test;

public class DisassemblerTest {

	@Test
	public void testDisassemble() {
		byte[] program = { 0x01, 5, 0, 0, 0, 0, 0, 0, 0, 0x0D, (byte) 0xFF };
		List<Instruction> instructions = Disassembler.disassemble(program);
		assertEquals(3, instructions.size());
		assertEquals(Opcode.PUSH, instructions.get(0).getOpcode());
		assertEquals(5L, instructions.get(0).getOperand());
		assertEquals(9, instructions.get(0).getNextOffset());
		assertEquals(9, instructions.get(1).getOffset());
		assertEquals("0010 : HALT", instructions.get(2).toString());
	}

	@Test
	public void testMalformed() {
		IllegalArgumentException e = assertThrows(
				IllegalArgumentException.class,
				() -> Disassembler.disassemble(new byte[] { 0x02, 0x42 }));
		assertEquals("Invalid opcode 0x42 at offset 1", e.getMessage());
		e = assertThrows(IllegalArgumentException.class, () -> Disassembler.disassemble(new byte[] { 0x01, 1, 2 }));
		assertEquals("Truncated PUSH operand at offset 0", e.getMessage());
	}

	@Test
	public void testVerify() {
		e("Program does not end with HALT", new byte[] { 0x02 });
		e("Program does not end with HALT", new byte[0]);
		// PUSH 3; JUMP; HALT: 3 falls inside the PUSH operand
		e("Branch target 3 is not an instruction boundary", new byte[] { 0x01, 3, 0, 0, 0, 0, 0, 0, 0, 0x09, (byte) 0xFF });
		Disassembler.verify(new byte[] { 0x01, 10, 0, 0, 0, 0, 0, 0, 0, 0x09, (byte) 0xFF });
	}

	private static void e(String message, byte[] program) {
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Disassembler.verify(program));
		assertEquals(message, e.getMessage());
	}

	@Test
	public void testBytecodeFile() throws Exception {
		File file = File.createTempFile("tinyscript", ".tsc");
		file.deleteOnExit();
		byte[] program = { 0x01, 2, 0, 0, 0, 0, 0, 0, 0, 0x0D, (byte) 0xFF };
		BytecodeFile.write(program, file);
		assertArrayEquals(program, BytecodeFile.read(file));

		Files.write(file.toPath(), new byte[] { 0x0D });
		assertThrows(IllegalArgumentException.class, () -> BytecodeFile.read(file));
	}
}
