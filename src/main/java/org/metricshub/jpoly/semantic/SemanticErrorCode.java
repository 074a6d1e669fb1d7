package org.metricshub.jpoly.semantic;

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

/**
 * Classes of semantic errors, in the priority order of the semantic gate.
 */
public enum SemanticErrorCode {

	/** A polynomial name declared more than once. */
	DUPLICATE_DECLARATION(1),

	/** An identifier in a polynomial body that is not one of its parameters. */
	INVALID_MONOMIAL(2),

	/** A call to a polynomial that was never declared. */
	UNDECLARED_POLYNOMIAL(3),

	/** A call whose argument count differs from the parameter count. */
	ARITY_MISMATCH(4);

	private final int code;

	SemanticErrorCode(int code) {
		this.code = code;
	}

	public int getCode() {
		return code;
	}

	/**
	 * @return the fixed label that starts the diagnostic line
	 */
	public String getLabel() {
		return "Semantic Error Code " + code + ":";
	}
}
