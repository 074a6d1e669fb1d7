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

/**
 * Carries the exit status of the command-line tool up to
 * {@link Cli#main(String[])}, which is the only place where the
 * JVM is actually terminated.
 */
public class ExitException extends Exception {

	private static final long serialVersionUID = 1L;

	private final int code;

	/**
	 * @param code exit status of the process
	 * @param msg reason for exiting
	 */
	public ExitException(int code, String msg) {
		super(msg);
		this.code = code;
	}

	/**
	 * @return the exit status requested
	 */
	public int getCode() {
		return code;
	}
}
