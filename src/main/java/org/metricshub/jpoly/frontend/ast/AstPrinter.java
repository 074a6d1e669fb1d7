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
import java.util.List;

/**
 * Renders an expression as text, with every binary operation parenthesized
 * so that the tree shape (and the right associativity of {@code -}) is visible.
 */
public class AstPrinter implements ExprVisitor<String> {

	@Override
	public String visitConstant(ConstExpr expr) {
		return Integer.toString(expr.getValue());
	}

	@Override
	public String visitVariable(VarExpr expr) {
		return expr.getName();
	}

	@Override
	public String visitAdd(AddExpr expr) {
		return binary(expr, "+");
	}

	@Override
	public String visitSubtract(SubExpr expr) {
		return binary(expr, "-");
	}

	@Override
	public String visitMultiply(MulExpr expr) {
		return binary(expr, "*");
	}

	@Override
	public String visitPower(PowExpr expr) {
		return expr.getBase().accept(this) + "^" + expr.getExponent();
	}

	@Override
	public String visitCall(CallExpr expr) {
		List<String> args = new ArrayList<String>();
		for (Expr arg : expr.getArguments()) {
			args.add(arg.accept(this));
		}
		return expr.getPolynomialName() + "(" + String.join(", ", args) + ")";
	}

	private String binary(BinaryExpr expr, String operator) {
		return "(" + expr.getLeft().accept(this) + " " + operator + " " + expr.getRight().accept(this) + ")";
	}
}
