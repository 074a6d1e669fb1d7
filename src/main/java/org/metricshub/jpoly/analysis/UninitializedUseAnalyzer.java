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
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.jpoly.frontend.CompiledProgram;
import org.metricshub.jpoly.frontend.ast.AssignStatement;
import org.metricshub.jpoly.frontend.ast.InputStatement;
import org.metricshub.jpoly.frontend.ast.OutputStatement;
import org.metricshub.jpoly.frontend.ast.Statement;
import org.metricshub.jpoly.frontend.ast.StatementVisitor;
import org.metricshub.jpoly.frontend.ast.VarExpr;

/**
 * Finds the variables read by an assignment before any earlier statement
 * initialized them.
 * <p>
 * {@code INPUT v} initializes {@code v}, and so does {@code v = ...} once its
 * right-hand side has been checked. {@code OUTPUT v} is not checked.
 */
public class UninitializedUseAnalyzer {

	/**
	 * @param program a compiled program
	 * @return the line of every uninitialized reference, sorted ascending;
	 *         a line appears once per offending reference
	 */
	public List<Integer> analyze(CompiledProgram program) {
		final Set<String> initialized = new HashSet<String>();
		final List<Integer> warnings = new ArrayList<Integer>();
		StatementVisitor<Void> scanner = new StatementVisitor<Void>() {
			@Override
			public Void visitInput(InputStatement statement) {
				initialized.add(statement.getVariable());
				return null;
			}

			@Override
			public Void visitOutput(OutputStatement statement) {
				return null;
			}

			@Override
			public Void visitAssign(AssignStatement statement) {
				for (VarExpr reference : VariableReferences.of(statement.getValue())) {
					if (!initialized.contains(reference.getName())) {
						warnings.add(reference.getLineNumber());
					}
				}
				initialized.add(statement.getVariable());
				return null;
			}
		};
		for (Statement statement : program.getStatements()) {
			statement.accept(scanner);
		}
		Collections.sort(warnings);
		return warnings;
	}
}
