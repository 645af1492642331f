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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps variable names to memory addresses.
 * <p>
 * Addresses are dense and handed out in order of first reference, starting
 * at 0. There is a single, global namespace: declaring and assigning the
 * same name resolve to the same address.
 */
public class VariableTable {

	private final Map<String, Long> addresses = new LinkedHashMap<String, Long>();

	/**
	 * @param name variable name
	 * @return the address of the variable, allocated if it is new
	 */
	public long addressOf(String name) {
		Long address = addresses.get(name);
		if (address == null) {
			address = (long) addresses.size();
			addresses.put(name, address);
		}
		return address;
	}

	public int size() {
		return addresses.size();
	}

	/**
	 * @return name to address, in allocation order
	 */
	public Map<String, Long> asMap() {
		return Collections.unmodifiableMap(addresses);
	}
}
