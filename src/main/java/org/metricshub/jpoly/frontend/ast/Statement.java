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
 * Base class of the statements of the execution section.
 * Every statement names exactly one script variable.
 */
public abstract class Statement {

	private final String variable;
	private final int lineNumber;

	Statement(String variable, int lineNumber) {
		this.variable = variable;
		this.lineNumber = lineNumber;
	}

	/**
	 * @return the variable read, written or printed by this statement
	 */
	public final String getVariable() {
		return variable;
	}

	/**
	 * @return line of the token naming the variable
	 */
	public final int getLineNumber() {
		return lineNumber;
	}

	/**
	 * Dispatches to the visitor method matching the concrete statement type.
	 *
	 * @param visitor the operation to apply
	 * @param <R> result type of the operation
	 * @return the visitor's result for this statement
	 */
	public abstract <R> R accept(StatementVisitor<R> visitor);
}
