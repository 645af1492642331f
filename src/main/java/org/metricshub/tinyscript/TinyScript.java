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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import org.metricshub.tinyscript.backend.VM;
import org.metricshub.tinyscript.frontend.Lexer;
import org.metricshub.tinyscript.frontend.TinyParser;
import org.metricshub.tinyscript.frontend.Token;
import org.metricshub.tinyscript.frontend.VariableChecker;
import org.metricshub.tinyscript.frontend.ast.Expression;
import org.metricshub.tinyscript.frontend.ast.Statement;
import org.metricshub.tinyscript.intermediate.BytecodeCompiler;
import org.metricshub.tinyscript.util.ScriptSource;
import org.metricshub.tinyscript.util.TinyLogger;
import org.metricshub.tinyscript.util.TinySettings;
import org.slf4j.Logger;

/**
 * Entry point into the parsing, compilation and execution of a TinyScript
 * program.
 * This entry point is used both when TinyScript is used as a library and
 * when invoked from the command line.
 * <p>
 * The overall process to execute a script is as follows:
 * <ul>
 * <li>Tokenize and parse the script, producing a syntax tree.
 * <li>Optionally check that no variable is read before being assigned
 * ({@link TinySettings#isStrictVariables()}).
 * <li>Walk the syntax tree, producing the bytecode.
 * <li>Execute the bytecode on a fresh {@link VM}.
 * </ul>
 * Every stage can also be invoked on its own.
 *
 * @see org.metricshub.tinyscript.backend.VM
 */
public class TinyScript {

	private static final Logger LOG = TinyLogger.getLogger(TinyScript.class);

	private final TinySettings settings;

	/**
	 * Create a new instance with default settings.
	 */
	public TinyScript() {
		this(new TinySettings());
	}

	/**
	 * @param settings stack capacity, output stream, strictness
	 */
	public TinyScript(TinySettings settings) {
		this.settings = settings;
	}

	public TinySettings getSettings() {
		return settings;
	}

	/**
	 * @param script the script
	 * @return all the tokens of the script, EOF excluded
	 * @throws IOException never for an in-memory script
	 */
	public List<Token> tokenize(String script) throws IOException {
		return new Lexer(script).tokenize();
	}

	/**
	 * @param script the script
	 * @return the top-level statements
	 * @throws IOException never for an in-memory script
	 */
	public List<Statement> parse(String script) throws IOException {
		return parse(ScriptSource.fromString(script));
	}

	/**
	 * Parses the script and, in strict mode, checks its variables.
	 *
	 * @param source the script
	 * @return the top-level statements
	 * @throws IOException upon an IO error
	 */
	public List<Statement> parse(ScriptSource source) throws IOException {
		List<Statement> statements = new TinyParser().parse(source);
		if (settings.isStrictVariables()) {
			VariableChecker.check(statements);
		}
		LOG.debug("Parsed {} top-level statements from {}", statements.size(), source.getDescription());
		return statements;
	}

	/**
	 * @param script the script
	 * @return the bytecode
	 * @throws IOException never for an in-memory script
	 */
	public byte[] compile(String script) throws IOException {
		return compile(ScriptSource.fromString(script));
	}

	/**
	 * @param source the script
	 * @return the bytecode
	 * @throws IOException upon an IO error
	 */
	public byte[] compile(ScriptSource source) throws IOException {
		return compile(parse(source));
	}

	/**
	 * @param statements a parsed program
	 * @return the bytecode
	 */
	public byte[] compile(List<Statement> statements) {
		return new BytecodeCompiler().compile(statements);
	}

	/**
	 * Compiles a single expression so that running the result leaves the
	 * value of the expression on top of the stack.
	 *
	 * @param expression the expression, e.g. <code>1 + 2 * 3</code>
	 * @return the bytecode
	 * @throws IOException never for an in-memory expression
	 */
	public byte[] compileForEval(String expression) throws IOException {
		Expression tree = new TinyParser().parseExpression(ScriptSource.fromString(expression));
		if (settings.isStrictVariables()) {
			VariableChecker.check(Collections.<Statement>singletonList(new Statement.PrintStatement(tree, 1)));
		}
		return new BytecodeCompiler().compileForEval(tree);
	}

	/**
	 * Runs a compiled program on a fresh VM, printing to the configured
	 * output stream.
	 *
	 * @param program the bytecode
	 * @return the halted VM, for inspection of its stack and memory
	 */
	public VM invoke(byte[] program) {
		VM vm = new VM(program, settings);
		vm.run();
		return vm;
	}

	/**
	 * Compiles and runs a script, printing to the configured output stream.
	 *
	 * @param script the script
	 * @return the halted VM, for inspection of its stack and memory
	 * @throws IOException never for an in-memory script
	 */
	public VM invoke(String script) throws IOException {
		return invoke(compile(script));
	}

	/**
	 * Compiles and runs a script, returning what it printed.
	 *
	 * @param script the script
	 * @return the printed output
	 * @throws IOException never for an in-memory script
	 */
	public String run(String script) throws IOException {
		return run(compile(script));
	}

	/**
	 * Runs a compiled program, returning what it printed.
	 *
	 * @param program the bytecode
	 * @return the printed output
	 */
	public String run(byte[] program) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		PrintStream ps = new PrintStream(out, true, StandardCharsets.UTF_8);
		new VM(program, settings.getStackCapacity(), ps).run();
		ps.flush();
		return out.toString(StandardCharsets.UTF_8);
	}

	/**
	 * Evaluates a single expression. Variables read as 0, as nothing
	 * assigns them.
	 *
	 * @param expression the expression, e.g. <code>(1 + 2) * 3</code>
	 * @return the value of the expression
	 * @throws IOException never for an in-memory expression
	 */
	public long eval(String expression) throws IOException {
		VM vm = new VM(compileForEval(expression), settings);
		vm.run();
		long[] stack = vm.getStack();
		return stack[stack.length - 1];
	}
}
