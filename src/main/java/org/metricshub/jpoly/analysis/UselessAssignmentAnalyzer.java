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
import java.util.List;
import org.metricshub.jpoly.frontend.CompiledProgram;
import org.metricshub.jpoly.frontend.ast.AssignStatement;
import org.metricshub.jpoly.frontend.ast.InputStatement;
import org.metricshub.jpoly.frontend.ast.OutputStatement;
import org.metricshub.jpoly.frontend.ast.Statement;
import org.metricshub.jpoly.frontend.ast.StatementVisitor;

/**
 * Finds assignments whose value is never read.
 * <p>
 * For each assignment to {@code v}, the following statements are scanned
 * until one decides: a read of {@code v} (by {@code OUTPUT v} or by any
 * right-hand side, including the one of a re-assignment of {@code v}) makes
 * it useful; a re-assignment of {@code v} that does not read it, or an
 * {@code INPUT v}, makes it useless. Reaching the end of the script without
 * a decision also makes it useless.
 */
public class UselessAssignmentAnalyzer {

	/** What one later statement says about an earlier assignment. */
	private enum Verdict {
		USED,
		OVERWRITTEN,
		UNDECIDED
	}

	/**
	 * Judges later statements against one assigned variable.
	 */
	private static final class Successor implements StatementVisitor<Verdict> {

		private final String variable;

		private Successor(String variable) {
			this.variable = variable;
		}

		@Override
		public Verdict visitInput(InputStatement statement) {
			return variable.equals(statement.getVariable()) ? Verdict.OVERWRITTEN : Verdict.UNDECIDED;
		}

		@Override
		public Verdict visitOutput(OutputStatement statement) {
			return variable.equals(statement.getVariable()) ? Verdict.USED : Verdict.UNDECIDED;
		}

		@Override
		public Verdict visitAssign(AssignStatement statement) {
			if (VariableReferences.reads(statement.getValue(), variable)) {
				return Verdict.USED;
			}
			return variable.equals(statement.getVariable()) ? Verdict.OVERWRITTEN : Verdict.UNDECIDED;
		}
	}

	/**
	 * @param program a compiled program
	 * @return the line of every useless assignment, sorted ascending
	 */
	public List<Integer> analyze(CompiledProgram program) {
		List<Statement> statements = program.getStatements();
		List<Integer> useless = new ArrayList<Integer>();
		for (int i = 0; i < statements.size(); i++) {
			if (!(statements.get(i) instanceof AssignStatement)) {
				continue;
			}
			Statement assignment = statements.get(i);
			Successor successor = new Successor(assignment.getVariable());
			Verdict verdict = Verdict.UNDECIDED;
			for (int j = i + 1; j < statements.size() && verdict == Verdict.UNDECIDED; j++) {
				verdict = statements.get(j).accept(successor);
			}
			if (verdict != Verdict.USED) {
				useless.add(assignment.getLineNumber());
			}
		}
		Collections.sort(useless);
		return useless;
	}
}
