package org.metricshub.jpoly.analysis;

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

import java.util.List;

/**
 * Advisory findings reported by the static analyses of the execution script.
 */
public enum WarningCode {

	/** A variable read by an assignment before anything stored a value in it. */
	UNINITIALIZED_USE(1),

	/** An assignment whose value is overwritten or dropped before being read. */
	USELESS_ASSIGNMENT(2);

	private final int code;

	WarningCode(int code) {
		this.code = code;
	}

	public int getCode() {
		return code;
	}

	/**
	 * @param lineNumbers the lines to report, in the order to print them
	 * @return the warning line, e.g. {@code Warning Code 1: 2 4}
	 */
	public String format(List<Integer> lineNumbers) {
		StringBuilder sb = new StringBuilder("Warning Code ").append(code).append(':');
		for (Integer line : lineNumbers) {
			sb.append(' ').append(line);
		}
		return sb.toString();
	}
}
