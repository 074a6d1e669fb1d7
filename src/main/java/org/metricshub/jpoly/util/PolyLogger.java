package org.metricshub.jpoly.util;

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

import java.util.Locale;
import org.metricshub.jpoly.frontend.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logger factory for Jpoly.
 * <p>
 * Besides the usual per-class loggers, every task has its own logger named
 * {@value #TASK_LOGGER_PREFIX} followed by the lower-case task name, e.g.
 * {@code org.metricshub.jpoly.task.degrees}. Its level can be set
 * independently to trace a single task.
 * <p>
 * SLF4J's own initialization messages are limited to warnings.
 */
public final class PolyLogger {

	/** Prefix of the per-task logger names */
	public static final String TASK_LOGGER_PREFIX = "org.metricshub.jpoly.task.";

	static {
		System.setProperty("slf4j.internal.verbosity", "WARN");
	}

	private PolyLogger() {}

	/**
	 * @param clazz class that logs
	 * @return the logger named after {@code clazz}
	 */
	public static Logger getLogger(Class<?> clazz) {
		return LoggerFactory.getLogger(clazz);
	}

	/**
	 * @param task task being run
	 * @return the logger dedicated to {@code task}
	 */
	public static Logger getTaskLogger(Task task) {
		return LoggerFactory.getLogger(TASK_LOGGER_PREFIX + task.name().toLowerCase(Locale.ROOT));
	}
}
