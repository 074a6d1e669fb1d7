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

import java.util.LinkedHashMap;
import java.util.Map;
import org.metricshub.jpoly.frontend.CompiledProgram;
import org.metricshub.jpoly.frontend.ast.AddExpr;
import org.metricshub.jpoly.frontend.ast.CallExpr;
import org.metricshub.jpoly.frontend.ast.ConstExpr;
import org.metricshub.jpoly.frontend.ast.Expr;
import org.metricshub.jpoly.frontend.ast.ExprVisitor;
import org.metricshub.jpoly.frontend.ast.MulExpr;
import org.metricshub.jpoly.frontend.ast.PolynomialDeclaration;
import org.metricshub.jpoly.frontend.ast.PowExpr;
import org.metricshub.jpoly.frontend.ast.SubExpr;
import org.metricshub.jpoly.frontend.ast.VarExpr;

/**
 * Computes the degree of a polynomial body from its syntax tree.
 * Calls count as constants, whatever the callee.
 * <p>
 * Degrees are {@code int} values and wrap around on overflow, like every
 * other integer in the language: {@code (x^65536)^65536} has degree 0.
 */
public class DegreeCalculator implements ExprVisitor<Integer> {

	/**
	 * @param expr a polynomial body
	 * @return its degree
	 */
	public int degree(Expr expr) {
		return expr.accept(this);
	}

	/**
	 * @param program a compiled program
	 * @return the degree of every polynomial, keyed by name, in declaration line order
	 */
	public Map<String, Integer> degrees(CompiledProgram program) {
		Map<String, Integer> result = new LinkedHashMap<String, Integer>();
		for (PolynomialDeclaration declaration : program.getDeclarations()) {
			result.put(declaration.getName(), degree(declaration.getBody()));
		}
		return result;
	}

	@Override
	public Integer visitConstant(ConstExpr expr) {
		return 0;
	}

	@Override
	public Integer visitVariable(VarExpr expr) {
		return 1;
	}

	@Override
	public Integer visitAdd(AddExpr expr) {
		return Math.max(degree(expr.getLeft()), degree(expr.getRight()));
	}

	@Override
	public Integer visitSubtract(SubExpr expr) {
		return Math.max(degree(expr.getLeft()), degree(expr.getRight()));
	}

	@Override
	public Integer visitMultiply(MulExpr expr) {
		return degree(expr.getLeft()) + degree(expr.getRight());
	}

	@Override
	public Integer visitPower(PowExpr expr) {
		// wraps around, see the class comment
		return degree(expr.getBase()) * expr.getExponent();
	}

	@Override
	public Integer visitCall(CallExpr expr) {
		return 0;
	}
}
