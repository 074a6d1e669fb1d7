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

/**
 * A reference to a variable: a polynomial parameter inside a polynomial body,
 * a script variable inside the execution section.
 */
public final class VarExpr extends Expr {

	private final String name;
	private final int lineNumber;

	public VarExpr(String name, int lineNumber) {
		this.name = name;
		this.lineNumber = lineNumber;
	}

	public String getName() {
		return name;
	}

	/**
	 * @return line of the identifier token, used by diagnostics and warnings
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	@Override
	public <R> R accept(ExprVisitor<R> visitor) {
		return visitor.visitVariable(this);
	}
}
