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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.jpoly.frontend.ast.Expr;
import org.metricshub.jpoly.frontend.ast.PolynomialDeclaration;
import org.metricshub.jpoly.frontend.ast.Statement;

/**
 * Everything {@link PolyParser} learns about one program: the selected tasks,
 * the declaration table, the execution script, the input values, and the
 * semantic findings recorded along the way.
 * <p>
 * One context is created per compilation and is only filled by the parser.
 * Once the semantic gate has passed, {@link #toCompiledProgram()} freezes it.
 */
public class CompilationContext {

	private final Set<Task> tasks = EnumSet.noneOf(Task.class);
	private final Map<String, PolynomialDeclaration> declarations = new LinkedHashMap<String, PolynomialDeclaration>();
	private final List<Statement> statements = new ArrayList<Statement>();
	private final List<Integer> inputs = new ArrayList<Integer>();

	private final List<Integer> duplicateDeclarationLines = new ArrayList<Integer>();
	private final List<Integer> invalidMonomialLines = new ArrayList<Integer>();
	private final List<Integer> undeclaredCallLines = new ArrayList<Integer>();
	private final List<Integer> arityMismatchLines = new ArrayList<Integer>();

	/**
	 * Selects the task with the given number. Unknown numbers are ignored,
	 * and selecting a task twice is the same as selecting it once.
	 *
	 * @param number the task number read in the {@code TASKS} section
	 */
	void selectTask(int number) {
		Task task = Task.fromNumber(number);
		if (task != null) {
			tasks.add(task);
		}
	}

	/**
	 * Records a polynomial declaration. The first declaration of a name wins;
	 * a later one only has its line recorded as a duplicate.
	 *
	 * @return {@code true} if this was the first declaration of {@code name}
	 */
	boolean declare(String name, List<String> parameters, int lineNumber, Expr body) {
		if (declarations.containsKey(name)) {
			duplicateDeclarationLines.add(lineNumber);
			return false;
		}
		declarations.put(name, new PolynomialDeclaration(name, parameters, lineNumber, body));
		return true;
	}

	PolynomialDeclaration getDeclaration(String name) {
		return declarations.get(name);
	}

	void addStatement(Statement statement) {
		statements.add(statement);
	}

	void addInput(int value) {
		inputs.add(value);
	}

	void recordInvalidMonomial(int lineNumber) {
		invalidMonomialLines.add(lineNumber);
	}

	void recordUndeclaredCall(int lineNumber) {
		undeclaredCallLines.add(lineNumber);
	}

	void recordArityMismatch(int lineNumber) {
		arityMismatchLines.add(lineNumber);
	}

	public List<Integer> getDuplicateDeclarationLines() {
		return Collections.unmodifiableList(duplicateDeclarationLines);
	}

	public List<Integer> getInvalidMonomialLines() {
		return Collections.unmodifiableList(invalidMonomialLines);
	}

	public List<Integer> getUndeclaredCallLines() {
		return Collections.unmodifiableList(undeclaredCallLines);
	}

	public List<Integer> getArityMismatchLines() {
		return Collections.unmodifiableList(arityMismatchLines);
	}

	/**
	 * Freezes the parsed program. Only meaningful once the semantic gate found nothing.
	 *
	 * @return an immutable view of the program
	 */
	public CompiledProgram toCompiledProgram() {
		return new CompiledProgram(tasks, declarations.values(), statements, inputs);
	}
}
