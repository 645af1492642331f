package org.metricshub.tinyscript;

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
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.util.List;
import org.metricshub.tinyscript.backend.VM;
import org.metricshub.tinyscript.frontend.AstDumper;
import org.metricshub.tinyscript.frontend.ast.Statement;
import org.metricshub.tinyscript.intermediate.BytecodeCompiler;
import org.metricshub.tinyscript.intermediate.BytecodeFile;
import org.metricshub.tinyscript.intermediate.Disassembler;
import org.metricshub.tinyscript.intermediate.Instruction;
import org.metricshub.tinyscript.util.ScriptFileSource;
import org.metricshub.tinyscript.util.ScriptSource;
import org.metricshub.tinyscript.util.TinyLogger;
import org.metricshub.tinyscript.util.TinySettings;
import org.slf4j.Logger;

/**
 * Command-line interface for TinyScript.
 */
public final class Cli {

	private static final Logger LOG = TinyLogger.getLogger(Cli.class);

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "tinyscript.jar";
		}
		JAR_NAME = myName;
	}

	private final TinySettings settings = new TinySettings();
	private final PrintStream out;

	private ScriptSource scriptSource;
	private byte[] precompiledProgram;

	private boolean dumpSyntaxTree;
	private boolean dumpIntermediateCode;
	private File compileOutputFile;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output stream.
	 */
	public Cli() {
		this(System.out);
	}

	/**
	 * @param out stream where program output (and dumps) are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out) {
		this.out = out;
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link TinySettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public TinySettings getSettings() {
		return settings;
	}

	/**
	 * @return the script given with <code>-f</code> or inline, {@code null} with <code>-L</code>
	 */
	public ScriptSource getScriptSource() {
		return scriptSource;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 * @throws IllegalArgumentException on an invalid command line
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options: the inline script follows
				break;
			} else if (arg.equals("-")) {
				++argIdx;
				break;
			} else if (arg.equals("-f")) {
				// -f filename : load script from file
				checkParameterHasArgument(args, argIdx);
				checkSingleProgram();
				scriptSource = new ScriptFileSource(args[++argIdx]);
			} else if (arg.equals("-L")) {
				// -L filename : load precompiled bytecode
				checkParameterHasArgument(args, argIdx);
				checkSingleProgram();
				String file = args[++argIdx];
				try {
					precompiledProgram = BytecodeFile.read(new File(file));
				} catch (IOException ex) {
					throw new IllegalArgumentException("Failed to read bytecode '" + file + "': " + ex.getMessage(), ex);
				}
			} else if (arg.equals("-K")) {
				// -K filename : compile the script to bytecode and exit
				checkParameterHasArgument(args, argIdx);
				compileOutputFile = new File(args[++argIdx]);
			} else if (arg.equals("--dump-syntax")) {
				dumpSyntaxTree = true;
			} else if (arg.equals("--dump-intermediate")) {
				dumpIntermediateCode = true;
			} else if (arg.equals("--stack-size")) {
				checkParameterHasArgument(args, argIdx);
				String value = args[++argIdx];
				try {
					settings.setStackCapacity(Integer.parseInt(value));
				} catch (NumberFormatException ex) {
					throw new IllegalArgumentException("Invalid stack size: " + value, ex);
				}
			} else if (arg.equals("--strict")) {
				settings.setStrictVariables(true);
			} else if (arg.equals("-h") || arg.equals("-?")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (scriptSource == null && precompiledProgram == null) {
			if (argIdx >= args.length) {
				throw new IllegalArgumentException("TinyScript script not provided.");
			}
			scriptSource = new ScriptSource(
					ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT,
					new StringReader(args[argIdx++]));
		}
		if (argIdx < args.length) {
			throw new IllegalArgumentException("Unexpected argument: " + args[argIdx]);
		}
		if (precompiledProgram != null && (dumpSyntaxTree || compileOutputFile != null)) {
			throw new IllegalArgumentException("--dump-syntax and -K need a script, not precompiled bytecode.");
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	private void checkSingleProgram() {
		if (scriptSource != null || precompiledProgram != null) {
			throw new IllegalArgumentException("Only one of -f and -L may be given, once.");
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws IOException if the script or the bytecode file cannot be read or written
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			return;
		}

		if (LOG.isDebugEnabled()) {
			LOG.debug("Settings:\n{}", settings.toDescriptionString());
		}
		TinyScript tinyScript = new TinyScript(settings);
		byte[] program;
		if (precompiledProgram != null) {
			program = precompiledProgram;
			if (dumpIntermediateCode) {
				for (Instruction instruction : Disassembler.disassemble(program)) {
					out.println(instruction);
				}
			}
		} else {
			List<Statement> statements = tinyScript.parse(scriptSource);
			if (dumpSyntaxTree) {
				AstDumper.dump(statements, out);
			}
			BytecodeCompiler compiler = new BytecodeCompiler();
			program = compiler.compile(statements);
			if (dumpIntermediateCode) {
				compiler.getBytecode().dump(out);
			}
		}

		if (compileOutputFile != null) {
			BytecodeFile.write(program, compileOutputFile);
			LOG.info("Wrote {} bytes of bytecode to {}", program.length, compileOutputFile);
			return;
		}
		if (dumpSyntaxTree || dumpIntermediateCode) {
			// If only dumping information, no need to execute the script
			return;
		}
		VM vm = tinyScript.invoke(program);
		out.flush();
		LOG.debug("Final memory: {}", vm.getMemory());
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-f script-filename | -L bytecode-filename]" +
								" [-K bytecode-filename]" +
								" [--dump-syntax]" +
								" [--dump-intermediate]" +
								" [--stack-size n]" +
								" [--strict]" +
								" [script]");
		dest.println();
		dest.println(" -f filename = Use contents of filename for script.");
		dest.println(" -L filename = Load precompiled bytecode from filename.");
		dest.println(" -K filename = Compile to bytecode file and halt.");
		dest.println(" --dump-syntax = Print the syntax tree.");
		dest.println(" --dump-intermediate = Print the bytecode listing.");
		dest.println(" --stack-size n = Operand stack capacity (default " + TinySettings.DEFAULT_STACK_CAPACITY + ").");
		dest.println(" --strict = Reject variables read before being assigned.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param os output stream for program output
	 * @return configured and executed CLI instance
	 * @throws IOException if execution fails on an IO error
	 */
	public static Cli create(String[] args, PrintStream os) throws IOException {
		Cli cli = new Cli(os);
		cli.parse(args);
		cli.run();
		return cli;
	}
}
