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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Manages creation and resolution of {@link Address} instances for
 * {@link Bytecode}, and the operand slots waiting for them.
 * <p>
 * Pushing an unresolved address records the offset of the placeholder
 * operand. When the address gets resolved, the manager hands the recorded
 * offsets back so the placeholders can be overwritten.
 */
class AddressManager {

	private final Map<Address, List<Integer>> unresolvedAddresses = new LinkedHashMap<Address, List<Integer>>();
	private final Map<Integer, Address> addressOffsets = new HashMap<Integer, Address>();
	private final Map<String, Integer> addressLabelCounts = new HashMap<String, Integer>();

	Address createAddress(String label) {
		Integer count = addressLabelCounts.get(label);
		if (count == null) {
			count = 0;
		} else {
			count = count + 1;
		}
		addressLabelCounts.put(label, count);
		Address address = new Address(label + "_" + count);
		unresolvedAddresses.put(address, new ArrayList<Integer>());
		return address;
	}

	void addPatchSite(Address address, int operandOffset) {
		List<Integer> sites = unresolvedAddresses.get(address);
		if (sites == null) {
			throw new Error(address + " is already resolved, or unresolved from another program.");
		}
		sites.add(operandOffset);
	}

	/**
	 * @return the operand offsets to patch with the new offset
	 */
	List<Integer> resolveAddress(Address address, int offset) {
		List<Integer> sites = unresolvedAddresses.remove(address);
		if (sites == null) {
			throw new Error(address + " is already resolved, or unresolved from another program.");
		}
		address.assignOffset(offset);
		addressOffsets.put(offset, address);
		return sites;
	}

	Address getAddress(int offset) {
		return addressOffsets.get(offset);
	}

	void checkAllResolved() {
		if (!unresolvedAddresses.isEmpty()) {
			throw new Error("Unresolved addresses: " + unresolvedAddresses.keySet());
		}
	}
}
