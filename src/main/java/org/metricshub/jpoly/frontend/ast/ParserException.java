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
 * Exception raised when the token sequence does not follow the grammar
 * of a polynomial program. Parsing stops at the first such error.
 */
public class ParserException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/** Fixed diagnostic printed for every syntax error. */
	public static final String DIAGNOSTIC = "SYNTAX ERROR !!!!!&%!!";

	private final String sourceDescription;
	private final int lineNumber;

	/**
	 * @param msg what the parser expected and what it got
	 * @param sourceDescription name of the program source
	 * @param lineNumber line of the offending token
	 */
	public ParserException(String msg, String sourceDescription, int lineNumber) {
		super(msg + " (" + sourceDescription + ":" + lineNumber + ")");
		this.sourceDescription = sourceDescription;
		this.lineNumber = lineNumber;
	}

	public String getSourceDescription() {
		return sourceDescription;
	}

	public int getLineNumber() {
		return lineNumber;
	}
}
