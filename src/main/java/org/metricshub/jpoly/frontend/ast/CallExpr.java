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
 * Evaluation of a declared polynomial on a list of argument expressions.
 */
public final class CallExpr extends Expr {

	private final String polynomialName;
	private final int lineNumber;
	private final List<Expr> arguments;

	public CallExpr(String polynomialName, int lineNumber, List<Expr> arguments) {
		this.polynomialName = polynomialName;
		this.lineNumber = lineNumber;
		this.arguments = Collections.unmodifiableList(new ArrayList<Expr>(arguments));
	}

	public String getPolynomialName() {
		return polynomialName;
	}

	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @return the arguments, in call order (read-only)
	 */
	public List<Expr> getArguments() {
		return arguments;
	}

	@Override
	public <R> R accept(ExprVisitor<R> visitor) {
		return visitor.visitCall(this);
	}
}
