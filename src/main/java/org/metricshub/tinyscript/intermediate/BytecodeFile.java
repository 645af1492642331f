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

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

/**
 * Reads and writes compiled programs. The file holds the raw bytecode,
 * with no header.
 */
public final class BytecodeFile {

	private BytecodeFile() {}

	/**
	 * @param program compiled program
	 * @param file destination, overwritten if it exists
	 * @throws IOException upon an IO error
	 */
	public static void write(byte[] program, File file) throws IOException {
		Files.write(file.toPath(), program);
	}

	/**
	 * @param file a file written by {@link #write(byte[], File)}
	 * @return the program
	 * @throws IOException upon an IO error
	 * @throws IllegalArgumentException if the content is not a well-formed program
	 */
	public static byte[] read(File file) throws IOException {
		byte[] program = Files.readAllBytes(file.toPath());
		Disassembler.verify(program);
		return program;
	}
}
