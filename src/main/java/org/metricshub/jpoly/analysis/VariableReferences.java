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

import java.util.ArrayList;
import java.util.List;
import org.metricshub.jpoly.frontend.ast.AddExpr;
import org.metricshub.jpoly.frontend.ast.BinaryExpr;
import org.metricshub.jpoly.frontend.ast.CallExpr;
import org.metricshub.jpoly.frontend.ast.ConstExpr;
import org.metricshub.jpoly.frontend.ast.Expr;
import org.metricshub.jpoly.frontend.ast.ExprVisitor;
import org.metricshub.jpoly.frontend.ast.MulExpr;
import org.metricshub.jpoly.frontend.ast.PowExpr;
import org.metricshub.jpoly.frontend.ast.SubExpr;
import org.metricshub.jpoly.frontend.ast.VarExpr;

/**
 * Collects the variable references of an expression, left to right,
 * including those inside call arguments. Bodies of called polynomials are
 * not entered: they only see their own parameters.
 */
final class VariableReferences implements ExprVisitor<Void> {

	private final List<VarExpr> references = new ArrayList<VarExpr>();

	private VariableReferences() {}

	/**
	 * @param expr the expression to scan
	 * @return every variable reference, one entry per occurrence
	 */
	static List<VarExpr> of(Expr expr) {
		VariableReferences collector = new VariableReferences();
		expr.accept(collector);
		return collector.references;
	}

	/**
	 * @return {@code true} if the expression reads {@code name} anywhere
	 */
	static boolean reads(Expr expr, String name) {
		for (VarExpr reference : of(expr)) {
			if (reference.getName().equals(name)) {
				return true;
			}
		}
		return false;
	}

	@Override
	public Void visitConstant(ConstExpr expr) {
		return null;
	}

	@Override
	public Void visitVariable(VarExpr expr) {
		references.add(expr);
		return null;
	}

	@Override
	public Void visitAdd(AddExpr expr) {
		return binary(expr);
	}

	@Override
	public Void visitSubtract(SubExpr expr) {
		return binary(expr);
	}

	@Override
	public Void visitMultiply(MulExpr expr) {
		return binary(expr);
	}

	@Override
	public Void visitPower(PowExpr expr) {
		return expr.getBase().accept(this);
	}

	@Override
	public Void visitCall(CallExpr expr) {
		for (Expr argument : expr.getArguments()) {
			argument.accept(this);
		}
		return null;
	}

	private Void binary(BinaryExpr expr) {
		expr.getLeft().accept(this);
		return expr.getRight().accept(this);
	}
}
