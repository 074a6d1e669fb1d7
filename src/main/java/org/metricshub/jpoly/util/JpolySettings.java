package org.metricshub.jpoly.util;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;

/**
 * A simple container for the parameters of a single Jpoly invocation.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking Jpoly programmatically, from within Java code.
 */
public class JpolySettings {

	/** Memory capacity used when none is configured. */
	public static final int DEFAULT_MEMORY_CAPACITY = 1000;

	/**
	 * Output stream;
	 * <code>System.out</code> by default,
	 * which means we will print to stdout by default
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Number of memory slots available to the variables of
	 * the execution script.
	 */
	private int memoryCapacity = DEFAULT_MEMORY_CAPACITY;

	/**
	 * Behavior of an <code>INPUT</code> statement when the
	 * <code>INPUTS</code> list is exhausted;
	 * {@link InputExhaustionPolicy#FAIL} by default.
	 */
	private InputExhaustionPolicy inputExhaustionPolicy = InputExhaustionPolicy.FAIL;

	/**
	 * Output stream;
	 * <code>System.out</code> by default,
	 * which means we will print to stdout by default
	 *
	 * @return the output stream
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "OutputStream reference is intentionally shared so callers can control output.")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * Sets the OutputStream to print to (instead of System.out by default)
	 *
	 * @param pOutputStream OutputStream to use for program output
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller-supplied PrintStream must be used directly; no defensive copy possible.")
	public void setOutputStream(PrintStream pOutputStream) {
		outputStream = pOutputStream;
	}

	/**
	 * @return the number of memory slots available to script variables
	 */
	public int getMemoryCapacity() {
		return memoryCapacity;
	}

	/**
	 * @param memoryCapacity the number of memory slots, at least 1
	 */
	public void setMemoryCapacity(int memoryCapacity) {
		if (memoryCapacity < 1) {
			throw new IllegalArgumentException("Memory capacity must be positive: " + memoryCapacity);
		}
		this.memoryCapacity = memoryCapacity;
	}

	public InputExhaustionPolicy getInputExhaustionPolicy() {
		return inputExhaustionPolicy;
	}

	public void setInputExhaustionPolicy(InputExhaustionPolicy inputExhaustionPolicy) {
		this.inputExhaustionPolicy = inputExhaustionPolicy;
	}
}
