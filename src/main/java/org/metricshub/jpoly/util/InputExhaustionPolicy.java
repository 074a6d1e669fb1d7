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

import java.util.Locale;

/**
 * What an {@code INPUT} statement does once every value of the
 * {@code INPUTS} section has been consumed.
 */
public enum InputExhaustionPolicy {

	/** Abort execution with a {@link org.metricshub.jpoly.jrt.PolyRuntimeException}. */
	FAIL,

	/** Store zero in the target variable and keep going. */
	ZERO;

	/**
	 * Parses a command-line value ({@code fail} or {@code zero}, case-insensitive).
	 *
	 * @param value the text to parse
	 * @return the matching policy
	 * @throws IllegalArgumentException if the value names no policy
	 */
	public static InputExhaustionPolicy fromString(String value) {
		try {
			return valueOf(value.toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Unknown input exhaustion policy: " + value, e);
		}
	}
}
