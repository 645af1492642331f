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

/**
 * A jump target within the bytecode.
 * Addresses are used for jumps, especially in reaction to
 * conditional checks (i.e., if false, jump to else block, etc.).
 * <p>
 * Addresses have the following properties:
 * <ul>
 * <li>A name (label).
 * <li>A byte offset into the program.
 * </ul>
 * An address is usually created before the code it points to is emitted,
 * so its offset is assigned later on. Once the program is complete, all
 * addresses must point to the start of an instruction.
 */
public class Address {

	private final String lbl;
	private int offset = -1;

	public Address(String lbl) {
		this.lbl = lbl;
	}

	/**
	 * The label of the address.
	 * It is particularly useful when dumping the bytecode.
	 *
	 * @return The label of the address.
	 */
	public String label() {
		return lbl;
	}

	/**
	 * Set the byte offset of this address.
	 *
	 * @param pOffset offset of the instruction this address points to
	 */
	void assignOffset(int pOffset) {
		this.offset = pOffset;
	}

	/**
	 * @return the byte offset, or -1 while unresolved
	 */
	public int offset() {
		return offset;
	}

	public boolean isResolved() {
		return offset >= 0;
	}

	@Override
	public String toString() {
		return label();
	}
}
