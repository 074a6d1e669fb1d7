package org.metricshub.jpoly;

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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.metricshub.jpoly.analysis.DegreeCalculator;
import org.metricshub.jpoly.analysis.UninitializedUseAnalyzer;
import org.metricshub.jpoly.analysis.UselessAssignmentAnalyzer;
import org.metricshub.jpoly.analysis.WarningCode;
import org.metricshub.jpoly.backend.PVM;
import org.metricshub.jpoly.backend.PolyInterpreter;
import org.metricshub.jpoly.frontend.CompilationContext;
import org.metricshub.jpoly.frontend.CompiledProgram;
import org.metricshub.jpoly.frontend.PolyParser;
import org.metricshub.jpoly.frontend.Task;
import org.metricshub.jpoly.semantic.SemanticChecker;
import org.metricshub.jpoly.util.JpolySettings;
import org.metricshub.jpoly.util.PolyLogger;
import org.metricshub.jpoly.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point into the parsing, checking, and execution
 * of a polynomial program.
 * This entry point is used both when Jpoly is executed as a library and when
 * invoked from the command line.
 * <p>
 * The overall process is as follows:
 * <ul>
 * <li>Parse the program, producing one syntax tree per polynomial and per
 * statement, and recording semantic findings along the way.
 * <li>Pass the semantic gate: the first class of semantic error found, if any,
 * is thrown as a {@link org.metricshub.jpoly.semantic.SemanticException}.
 * <li>Run the tasks selected by the program, in task number order: execute
 * the script, report uninitialized uses, report useless assignments, print
 * polynomial degrees.
 * </ul>
 * Syntax errors surface as {@link org.metricshub.jpoly.frontend.ast.ParserException}.
 * Printing diagnostics and exiting is left to the caller, see {@link Cli}.
 */
public class Jpoly {

	private static final Logger LOG = PolyLogger.getLogger(Jpoly.class);

	/**
	 * Parses the specified program and passes it through the semantic gate.
	 *
	 * @param source the program text
	 * @return the compiled program, ready to run
	 * @throws IOException upon an IO error
	 * @throws org.metricshub.jpoly.frontend.ast.ParserException upon a syntax error
	 * @throws org.metricshub.jpoly.semantic.SemanticException if the program is
	 *         semantically invalid
	 */
	public CompiledProgram compile(ScriptSource source) throws IOException {
		CompilationContext context = new PolyParser().parse(source);
		SemanticChecker.check(context);
		CompiledProgram program = context.toCompiledProgram();
		LOG
				.debug(
						"Compiled {}: {} polynomials, {} statements, {} inputs, tasks {}",
						source.getDescription(),
						program.getDeclarations().size(),
						program.getStatements().size(),
						program.getInputs().size(),
						program.getTasks());
		return program;
	}

	/**
	 * Compiles and runs the specified program text.
	 *
	 * @param program the program text
	 * @param settings where to print and how to run
	 * @throws IOException upon an IO error
	 */
	public void invoke(String program, JpolySettings settings) throws IOException {
		invoke(new ScriptSource(ScriptSource.DESCRIPTION_STRING_SCRIPT, new StringReader(program)), settings);
	}

	/**
	 * Compiles and runs a single {@link ScriptSource}.
	 *
	 * @param source the program text
	 * @param settings where to print and how to run
	 * @throws IOException upon an IO error
	 */
	public void invoke(ScriptSource source, JpolySettings settings) throws IOException {
		invoke(compile(source), settings);
	}

	/**
	 * Runs the tasks selected by a compiled program.
	 *
	 * @param program the compiled program
	 * @param settings where to print and how to run
	 */
	public void invoke(CompiledProgram program, JpolySettings settings) {
		PrintStream out = settings.getOutputStream();
		// constants are declared in task number order
		for (Task task : Task.values()) {
			if (program.isSelected(task)) {
				Logger taskLog = PolyLogger.getTaskLogger(task);
				taskLog.debug("Running task {}", task.getNumber());
				runTask(task, program, settings, out);
				taskLog.debug("Task {} done", task.getNumber());
			}
		}
		out.flush();
	}

	private static void runTask(Task task, CompiledProgram program, JpolySettings settings, PrintStream out) {
		switch (task) {
		case EXECUTE:
			PolyInterpreter interpreter = new PVM(settings);
			interpreter.interpret(program);
			break;
		case UNINITIALIZED_USE:
			report(out, WarningCode.UNINITIALIZED_USE, new UninitializedUseAnalyzer().analyze(program));
			break;
		case USELESS_ASSIGNMENT:
			report(out, WarningCode.USELESS_ASSIGNMENT, new UselessAssignmentAnalyzer().analyze(program));
			break;
		case DEGREES:
			for (Map.Entry<String, Integer> entry : new DegreeCalculator().degrees(program).entrySet()) {
				out.println(entry.getKey() + ": " + entry.getValue());
			}
			break;
		default:
			throw new IllegalStateException("Unknown task " + task);
		}
	}

	/**
	 * Compiles and runs the specified program text and returns what it printed.
	 *
	 * @param program the program text
	 * @return the output of the program
	 * @throws IOException upon an IO error
	 */
	public String run(String program) throws IOException {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		JpolySettings settings = new JpolySettings();
		settings.setOutputStream(new PrintStream(out, true, StandardCharsets.UTF_8.name()));
		invoke(program, settings);
		return out.toString(StandardCharsets.UTF_8.name());
	}

	private static void report(PrintStream out, WarningCode code, List<Integer> lines) {
		if (!lines.isEmpty()) {
			out.println(code.format(lines));
		}
	}
}
