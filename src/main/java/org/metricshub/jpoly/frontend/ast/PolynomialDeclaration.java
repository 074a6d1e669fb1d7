package org.metricshub.jpoly.frontend.ast;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A polynomial as it was first declared: name, parameters, declaration line and body.
 */
public final class PolynomialDeclaration {

	private final String name;
	private final List<String> parameters;
	private final int lineNumber;
	private final Expr body;

	public PolynomialDeclaration(String name, List<String> parameters, int lineNumber, Expr body) {
		this.name = name;
		this.parameters = Collections.unmodifiableList(new ArrayList<String>(parameters));
		this.lineNumber = lineNumber;
		this.body = body;
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the parameter names in declaration order (read-only)
	 */
	public List<String> getParameters() {
		return parameters;
	}

	public int getLineNumber() {
		return lineNumber;
	}

	public Expr getBody() {
		return body;
	}

	@Override
	public String toString() {
		return name + "(" + String.join(", ", parameters) + ") = " + body;
	}
}
