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

import java.io.PrintStream;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.metricshub.jpoly.frontend.CompiledProgram;
import org.metricshub.jpoly.frontend.ast.AssignStatement;
import org.metricshub.jpoly.frontend.ast.InputStatement;
import org.metricshub.jpoly.frontend.ast.OutputStatement;
import org.metricshub.jpoly.frontend.ast.Statement;
import org.metricshub.jpoly.frontend.ast.StatementVisitor;
import org.metricshub.jpoly.jrt.PolyRuntimeException;
import org.metricshub.jpoly.util.InputExhaustionPolicy;
import org.metricshub.jpoly.util.JpolySettings;
import org.metricshub.jpoly.util.PolyLogger;
import org.slf4j.Logger;

/**
 * The Jpoly virtual machine: runs the execution section of a program,
 * one statement after the other, in a single pass.
 * <p>
 * Every run starts with an empty symbol table, zeroed memory and the input
 * cursor on the first value of the {@code INPUTS} section.
 */
public class PVM implements PolyInterpreter, StatementVisitor<Void> {

	private static final Logger LOG = PolyLogger.getLogger(PVM.class);

	private final PrintStream output;
	private final int memoryCapacity;
	private final InputExhaustionPolicy inputExhaustionPolicy;

	private CompiledProgram program;
	private MemoryStore memory;
	private List<Integer> inputs;
	private int nextInput;

	/**
	 * @param settings where to print and how to size the memory
	 */
	public PVM(JpolySettings settings) {
		this.output = settings.getOutputStream();
		this.memoryCapacity = settings.getMemoryCapacity();
		this.inputExhaustionPolicy = settings.getInputExhaustionPolicy();
	}

	/** {@inheritDoc} */
	@Override
	public void interpret(CompiledProgram compiledProgram) {
		this.program = compiledProgram;
		this.memory = new MemoryStore(memoryCapacity);
		this.inputs = compiledProgram.getInputs();
		this.nextInput = 0;
		for (Statement statement : compiledProgram.getStatements()) {
			statement.accept(this);
		}
		LOG
				.debug(
						"Executed {} statements, {} variables allocated",
						compiledProgram.getStatements().size(),
						memory.getSymbolTable().size());
	}

	@Override
	public Void visitInput(InputStatement statement) {
		int slot = memory.slotOf(statement.getVariable(), statement.getLineNumber());
		memory.set(slot, nextInputValue(statement));
		return null;
	}

	@Override
	public Void visitOutput(OutputStatement statement) {
		int slot = memory.slotOf(statement.getVariable(), statement.getLineNumber());
		output.println(memory.get(slot));
		return null;
	}

	@Override
	public Void visitAssign(AssignStatement statement) {
		int slot = memory.slotOf(statement.getVariable(), statement.getLineNumber());
		int value = new Evaluator(program, memory.snapshot()).evaluate(statement.getValue());
		memory.set(slot, value);
		return null;
	}

	private int nextInputValue(InputStatement statement) {
		if (nextInput < inputs.size()) {
			return inputs.get(nextInput++);
		}
		if (inputExhaustionPolicy == InputExhaustionPolicy.ZERO) {
			LOG.debug("No input left for {} at line {}, storing 0", statement.getVariable(), statement.getLineNumber());
			return 0;
		}
		throw new PolyRuntimeException(
				statement.getLineNumber(),
				"No input value left for INPUT " + statement.getVariable() + " (" + inputs.size() + " values supplied)");
	}

	/**
	 * @return the symbol table of the last run, mapping variables to slots (read-only)
	 */
	public Map<String, Integer> getSymbolTable() {
		if (memory == null) {
			return Collections.emptyMap();
		}
		return memory.getSymbolTable();
	}

	/**
	 * @param name a variable
	 * @return its value at the end of the last run, zero if it was never referenced
	 */
	public int valueOf(String name) {
		Integer slot = getSymbolTable().get(name);
		return slot != null ? memory.get(slot) : 0;
	}
}
