package org.metricshub.jpoly.backend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jpoly
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
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
import org.metricshub.jpoly.jrt.PolyRuntimeException;

/**
 * Symbol table and memory used by the {@link PVM} interpreter.
 * <p>
 * A variable gets the next free slot the first time it is referenced at
 * runtime, so the slot index is the table size at insertion time.
 * Slots start at zero.
 */
class MemoryStore {

	private final Map<String, Integer> symbolTable = new LinkedHashMap<String, Integer>();
	private final int[] memory;

	MemoryStore(int capacity) {
		memory = new int[capacity];
	}

	/**
	 * Returns the slot of a variable, allocating one if the variable is new.
	 *
	 * @param name the variable
	 * @param lineNumber line of the statement referencing it, for diagnostics
	 * @return the slot index
	 */
	int slotOf(String name, int lineNumber) {
		Integer slot = symbolTable.get(name);
		if (slot == null) {
			if (symbolTable.size() >= memory.length) {
				throw new PolyRuntimeException(
						lineNumber,
						"Memory exhausted: cannot allocate variable " + name + " beyond " + memory.length + " slots");
			}
			slot = symbolTable.size();
			symbolTable.put(name, slot);
		}
		return slot;
	}

	int get(int slot) {
		return memory[slot];
	}

	void set(int slot, int value) {
		memory[slot] = value;
	}

	/**
	 * @return every allocated variable with its current value, in allocation order
	 */
	Map<String, Integer> snapshot() {
		Map<String, Integer> environment = new LinkedHashMap<String, Integer>();
		for (Map.Entry<String, Integer> entry : symbolTable.entrySet()) {
			environment.put(entry.getKey(), memory[entry.getValue()]);
		}
		return environment;
	}

	/**
	 * @return the symbol table (read-only)
	 */
	Map<String, Integer> getSymbolTable() {
		return Collections.unmodifiableMap(symbolTable);
	}
}
