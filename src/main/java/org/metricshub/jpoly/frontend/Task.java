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

/**
 * Behaviors that the {@code TASKS} section of a program can select.
 * Task 1 (parsing and semantic checking) is always performed and therefore
 * has no constant here.
 */
public enum Task {

	/** Task 2: run the execution script. */
	EXECUTE(2),

	/** Task 3: warn about variables read before being initialized. */
	UNINITIALIZED_USE(3),

	/** Task 4: warn about assignments whose value is never used. */
	USELESS_ASSIGNMENT(4),

	/** Task 5: print the degree of every polynomial. */
	DEGREES(5);

	private final int number;

	Task(int number) {
		this.number = number;
	}

	/**
	 * @return the number selecting this task in the {@code TASKS} section
	 */
	public int getNumber() {
		return number;
	}

	/**
	 * @param number a task number read from the program
	 * @return the matching task, or {@code null} if the number selects no behavior
	 */
	public static Task fromNumber(int number) {
		for (Task task : values()) {
			if (task.number == number) {
				return task;
			}
		}
		return null;
	}
}
