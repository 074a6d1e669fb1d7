package org.metricshub.jpoly.frontend;

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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.jpoly.frontend.ast.AssignStatement;
import org.metricshub.jpoly.frontend.ast.InputStatement;
import org.metricshub.jpoly.frontend.ast.OutputStatement;
import org.metricshub.jpoly.frontend.ast.PolynomialDeclaration;
import org.metricshub.jpoly.frontend.ast.Statement;
import org.metricshub.jpoly.frontend.ast.StatementVisitor;

/**
 * A parsed, semantically valid polynomial program.
 * <p>
 * The interpreter and the analyses only read it; nothing in it can be modified.
 */
public final class CompiledProgram {

	private final Set<Task> tasks;
	private final List<PolynomialDeclaration> declarations;
	private final Map<String, PolynomialDeclaration> declarationsByName;
	private final List<Statement> statements;
	private final List<Integer> inputs;

	CompiledProgram(
			Set<Task> tasks,
			Collection<PolynomialDeclaration> declarations,
			List<Statement> statements,
			List<Integer> inputs) {
		Set<Task> taskCopy = EnumSet.noneOf(Task.class);
		taskCopy.addAll(tasks);
		this.tasks = Collections.unmodifiableSet(taskCopy);

		List<PolynomialDeclaration> sorted = new ArrayList<PolynomialDeclaration>(declarations);
		sorted
				.sort(
						Comparator
								.comparingInt(PolynomialDeclaration::getLineNumber)
								.thenComparing(PolynomialDeclaration::getName));
		this.declarations = Collections.unmodifiableList(sorted);

		Map<String, PolynomialDeclaration> byName = new HashMap<String, PolynomialDeclaration>();
		for (PolynomialDeclaration declaration : sorted) {
			byName.put(declaration.getName(), declaration);
		}
		this.declarationsByName = Collections.unmodifiableMap(byName);
		this.statements = Collections.unmodifiableList(new ArrayList<Statement>(statements));
		this.inputs = Collections.unmodifiableList(new ArrayList<Integer>(inputs));
	}

	/**
	 * @return the tasks selected by the {@code TASKS} section
	 */
	public Set<Task> getTasks() {
		return tasks;
	}

	public boolean isSelected(Task task) {
		return tasks.contains(task);
	}

	/**
	 * @return the polynomial declarations, ordered by declaration line
	 */
	public List<PolynomialDeclaration> getDeclarations() {
		return declarations;
	}

	/**
	 * @param name a polynomial name
	 * @return its declaration, or {@code null} if no polynomial has this name
	 */
	public PolynomialDeclaration getDeclaration(String name) {
		return declarationsByName.get(name);
	}

	/**
	 * @return the statements of the execution section, in source order
	 */
	public List<Statement> getStatements() {
		return statements;
	}

	/**
	 * @return the values of the {@code INPUTS} section, in source order
	 */
	public List<Integer> getInputs() {
		return inputs;
	}

	/**
	 * Prints a readable form of the syntax trees.
	 *
	 * @param out where to print
	 */
	public void dump(PrintStream out) {
		StringBuilder taskList = new StringBuilder("TASKS");
		for (Task task : tasks) {
			taskList.append(' ').append(task.getNumber());
		}
		out.println(taskList);
		out.println("POLY");
		for (PolynomialDeclaration declaration : declarations) {
			out.println("  " + declaration.getLineNumber() + ": " + declaration);
		}
		out.println("EXECUTE");
		StatementVisitor<String> printer = new StatementVisitor<String>() {
			@Override
			public String visitInput(InputStatement statement) {
				return "INPUT " + statement.getVariable();
			}

			@Override
			public String visitOutput(OutputStatement statement) {
				return "OUTPUT " + statement.getVariable();
			}

			@Override
			public String visitAssign(AssignStatement statement) {
				return statement.getVariable() + " = " + statement.getValue();
			}
		};
		for (Statement statement : statements) {
			out.println("  " + statement.getLineNumber() + ": " + statement.accept(printer));
		}
		StringBuilder inputList = new StringBuilder("INPUTS");
		for (Integer value : inputs) {
			inputList.append(' ').append(value);
		}
		out.println(inputList);
	}
}
