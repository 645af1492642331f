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

import java.util.Arrays;

/**
 * Operand stack of the VM: signed 64-bit values, bounded capacity.
 * <p>
 * The VM checks {@link #isFull()} and {@link #isEmpty()} before pushing or
 * popping and raises the error itself, so a refused push or pop leaves the
 * stack unchanged.
 */
class OperandStack {

	private final long[] values;
	private int depth;

	OperandStack(int capacity) {
		this.values = new long[capacity];
	}

	int capacity() {
		return values.length;
	}

	int depth() {
		return depth;
	}

	boolean isFull() {
		return depth == values.length;
	}

	boolean isEmpty() {
		return depth == 0;
	}

	/** Caller checks {@link #isFull()} first. */
	void push(long value) {
		assert !isFull();
		values[depth++] = value;
	}

	/** Caller checks {@link #isEmpty()} first. */
	long pop() {
		assert !isEmpty();
		return values[--depth];
	}

	/**
	 * @return the values, bottom first
	 */
	long[] toArray() {
		return Arrays.copyOf(values, depth);
	}

	@Override
	public String toString() {
		return Arrays.toString(toArray());
	}
}
