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
 * Exponentiation. The exponent is the literal read after {@code ^},
 * never an expression.
 */
public final class PowExpr extends Expr {

	private final Expr base;
	private final int exponent;

	public PowExpr(Expr base, int exponent) {
		if (exponent < 0) {
			throw new IllegalArgumentException("Negative exponent: " + exponent);
		}
		this.base = base;
		this.exponent = exponent;
	}

	public Expr getBase() {
		return base;
	}

	public int getExponent() {
		return exponent;
	}

	@Override
	public <R> R accept(ExprVisitor<R> visitor) {
		return visitor.visitPower(this);
	}
}
