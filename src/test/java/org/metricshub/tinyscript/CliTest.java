package org.metricshub.tinyscript;

import static org.junit.Assert.*;
import static org.metricshub.tinyscript.TinyScriptTestSupport.cliTest;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Test;
import org.metricshub.tinyscript.util.ScriptFileSource;

public class CliTest {

	@Test
	public void testInlineScript() throws Exception {
		cliTest("inline script").script("let x = 10; let y = 5; print x + y * 2;").expectPrinted(20).runAndAssert();
	}

	@Test
	public void testScriptFile() throws Exception {
		Path script = TinyScriptTestSupport.tempFile("loop.tiny", "let x = 0;\nwhile x < 3 (\n  print x;\n  x = x + 1;\n)\n");
		cliTest("script file").argument("-f", script.toString()).expectPrinted(0, 1, 2).runAndAssert();
	}

	@Test
	public void testCompileAndLoad() throws Exception {
		Path bytecode = TinyScriptTestSupport.tempPath("gt.tsc");
		cliTest("compile only")
				.argument("-K", bytecode.toString())
				.script("let a = 7; let b = 3; print a > b;")
				.expectLines()
				.runAndAssert();
		assertTrue(Files.size(bytecode) > 0);
		cliTest("load compiled program").argument("-L", bytecode.toString()).expectPrinted(1).runAndAssert();
		cliTest("dump loaded program")
				.argument("-L", bytecode.toString(), "--dump-intermediate")
				.expectLines(
						"0000 : PUSH 0",
						"0009 : PUSH 7",
						"0018 : STORE",
						"0019 : PUSH 1",
						"0028 : PUSH 3",
						"0037 : STORE",
						"0038 : PUSH 1",
						"0047 : LOAD",
						"0048 : PUSH 0",
						"0057 : LOAD",
						"0058 : LESS",
						"0059 : PRINT",
						"0060 : HALT")
				.runAndAssert();
	}

	@Test
	public void testDumpSyntax() throws Exception {
		cliTest("dump syntax tree")
				.argument("--dump-syntax")
				.script("print 1 + 2;")
				.expectLines("Print", "  Binary +", "    Number 1", "    Number 2")
				.runAndAssert();
	}

	@Test
	public void testDumpIntermediate() throws Exception {
		cliTest("dump bytecode with labels")
				.argument("--dump-intermediate")
				.script("while 0 print 1;")
				.expectLines(
						"0000 : PUSH 0    [loop_0]",
						"0009 : PUSH 0",
						"0018 : EQUAL",
						"0019 : PUSH 49",
						"0028 : JUMP_IF",
						"0029 : PUSH 1",
						"0038 : PRINT",
						"0039 : PUSH 0",
						"0048 : JUMP",
						"0049 : HALT    [breakAddress_0]")
				.runAndAssert();
	}

	@Test
	public void testOptions() throws Exception {
		cliTest("small stack").argument("--stack-size", "1").script("print 1 + 2;").expectExit(1).expectError("STACK_OVERFLOW").runAndAssert();
		cliTest("large enough stack").argument("--stack-size", "2").script("print 1 + 2;").expectPrinted(3).runAndAssert();
		cliTest("strict mode").argument("--strict").script("print y;").expectExit(1).expectError("SemanticException: Variable 'y'").runAndAssert();
		cliTest("non-strict mode").script("print y;").expectPrinted(0).runAndAssert();
	}

	@Test
	public void testUsage() throws Exception {
		TinyScriptTestSupport.TestResult result = cliTest("help").argument("-h").run();
		assertEquals(0, result.exitCode());
		assertEquals("Usage:", result.lines().get(0));
		assertEquals(0, cliTest("no argument").run().exitCode());
	}

	@Test
	public void testErrors() throws Exception {
		cliTest("division by zero")
				.script("print 1; print 1 / 0;")
				.expectPrinted(1)
				.expectExit(1)
				.expectError("VmRuntimeException [DIVISION_BY_ZERO]: Division by zero")
				.runAndAssert();
		cliTest("syntax error")
				.script("print 1;\nprint 2")
				.expectLines()
				.expectExit(1)
				.expectError("ParserException (line 2)")
				.runAndAssert();
		cliTest("invalid character")
				.script("print 1 # 2;")
				.expectExit(1)
				.expectError("LexerException (line 1)")
				.runAndAssert();
		cliTest("unknown option").argument("--nope").script("print 1;").expectExit(1).expectError("Unknown parameter: --nope").runAndAssert();
		cliTest("missing option value").argument("-f").expectExit(1).expectError("Need additional argument for -f").runAndAssert();
		cliTest("bad stack size").argument("--stack-size", "0").script("print 1;").expectExit(1).expectError("IllegalArgumentException").runAndAssert();
		cliTest("extra argument").argument("print 1;", "print 2;").expectExit(1).expectError("Unexpected argument").runAndAssert();
		cliTest("missing script file")
				.argument("-f", TinyScriptTestSupport.tempPath("missing.tiny").toString())
				.expectExit(1)
				.runAndAssert();
		cliTest("malformed bytecode")
				.argument("-L", TinyScriptTestSupport.tempFile("bad.tsc", "junk").toString())
				.expectExit(1)
				.expectError("Invalid opcode")
				.runAndAssert();
	}

	@Test
	public void testParseCommandLineArguments() throws Exception {
		Path script = TinyScriptTestSupport.tempFile("parse.tiny", "print 1;");
		Cli cli = Cli.parseCommandLineArguments(new String[] { "--strict", "--stack-size", "8", "-f", script.toString() });
		assertTrue(cli.getSettings().isStrictVariables());
		assertEquals(8, cli.getSettings().getStackCapacity());
		assertTrue(cli.getScriptSource() instanceof ScriptFileSource);
		assertEquals(script.toString(), ((ScriptFileSource) cli.getScriptSource()).getFilePath());

		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "-h", "print 1;" }));
	}
}
