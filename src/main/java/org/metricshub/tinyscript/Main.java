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
import java.io.PrintStream;
import org.metricshub.tinyscript.backend.VmRuntimeException;
import org.metricshub.tinyscript.frontend.ast.LexerException;
import org.metricshub.tinyscript.frontend.ast.ParserException;

/**
 * Stand-alone entry point of TinyScript.
 * If you want to use TinyScript as a library, please use {@link TinyScript}.
 */
public final class Main {

	private Main() {}

	/**
	 * Runs the command line and reports errors on <code>System.err</code>.
	 *
	 * @param args Command line arguments to the VM.
	 */
	public static void main(String[] args) {
		System.exit(invoke(args, System.out, System.err));
	}

	/**
	 * Runs the command line without exiting the JVM.
	 *
	 * @param args command-line arguments
	 * @param out stream for program output
	 * @param err stream for error messages
	 * @return the exit status: 0 on success, 1 on any error
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static int invoke(String[] args, PrintStream out, PrintStream err) {
		try {
			Cli.create(args, out);
			return 0;
		} catch (LexerException e) {
			err.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
		} catch (ParserException e) {
			err.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
		} catch (VmRuntimeException e) {
			err.printf("%s [%s]: %s\n", e.getClass().getSimpleName(), e.getKind(), e.getMessage());
		} catch (IllegalArgumentException e) {
			err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
		} catch (Exception e) {
			err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
		}
		return 1;
	}
}
