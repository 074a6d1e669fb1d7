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
 * Base class of the expression syntax tree.
 * <p>
 * The set of subclasses is closed: every operation over expressions is an
 * {@link ExprVisitor}, so adding a node type means adding a visitor method,
 * which every traversal then has to implement. Nodes are immutable and own
 * their children exclusively.
 */
public abstract class Expr {

	Expr() {}

	/**
	 * Dispatches to the visitor method matching the concrete node type.
	 *
	 * @param visitor the operation to apply
	 * @param <R> result type of the operation
	 * @return the visitor's result for this node
	 */
	public abstract <R> R accept(ExprVisitor<R> visitor);

	@Override
	public String toString() {
		return accept(new AstPrinter());
	}
}
