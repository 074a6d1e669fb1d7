package org.metricshub.jpoly.backend;

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
import java.util.HashMap;
import java.util.List;
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
 * Computes the value of an expression in a given environment.
 * <p>
 * Arithmetic is plain {@code int} arithmetic and wraps around on overflow.
 * Variables missing from the environment read as zero. A call evaluates its
 * arguments here, then the body of the callee in an environment holding only
 * its parameters; missing trailing arguments are zero and a call to an
 * unknown polynomial is zero.
 */
public class Evaluator implements ExprVisitor<Integer> {

	private final CompiledProgram program;
	private final Map<String, Integer> environment;

	/**
	 * @param program where called polynomials are looked up
	 * @param environment variable values visible to the expression
	 */
	public Evaluator(CompiledProgram program, Map<String, Integer> environment) {
		this.program = program;
		this.environment = environment;
	}

	/**
	 * @param expr the expression to evaluate
	 * @return its value
	 */
	public int evaluate(Expr expr) {
		return expr.accept(this);
	}

	@Override
	public Integer visitConstant(ConstExpr expr) {
		return expr.getValue();
	}

	@Override
	public Integer visitVariable(VarExpr expr) {
		Integer value = environment.get(expr.getName());
		return value != null ? value : 0;
	}

	@Override
	public Integer visitAdd(AddExpr expr) {
		return evaluate(expr.getLeft()) + evaluate(expr.getRight());
	}

	@Override
	public Integer visitSubtract(SubExpr expr) {
		return evaluate(expr.getLeft()) - evaluate(expr.getRight());
	}

	@Override
	public Integer visitMultiply(MulExpr expr) {
		return evaluate(expr.getLeft()) * evaluate(expr.getRight());
	}

	@Override
	public Integer visitPower(PowExpr expr) {
		return power(evaluate(expr.getBase()), expr.getExponent());
	}

	@Override
	public Integer visitCall(CallExpr expr) {
		List<Integer> values = new ArrayList<Integer>();
		for (Expr argument : expr.getArguments()) {
			values.add(evaluate(argument));
		}
		PolynomialDeclaration callee = program.getDeclaration(expr.getPolynomialName());
		if (callee == null) {
			return 0;
		}
		List<String> parameters = callee.getParameters();
		Map<String, Integer> bindings = new HashMap<String, Integer>();
		for (int i = 0; i < parameters.size(); i++) {
			bindings.put(parameters.get(i), i < values.size() ? values.get(i) : 0);
		}
		return new Evaluator(program, bindings).evaluate(callee.getBody());
	}

	/**
	 * Raises {@code base} to a non-negative power with wraparound, by squaring.
	 * The result equals repeated multiplication, and {@code power(b, 0)} is 1.
	 */
	static int power(int base, int exponent) {
		int result = 1;
		int factor = base;
		int e = exponent;
		while (e > 0) {
			if ((e & 1) != 0) {
				result *= factor;
			}
			factor *= factor;
			e >>= 1;
		}
		return result;
	}
}
