package org.metricshub.jpoly.semantic;

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

/**
 * Outcome of a semantic gate that found errors: the class of the first
 * non-empty finding list and its source lines, sorted ascending and
 * without repetitions.
 */
public class SemanticException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final SemanticErrorCode errorCode;
	private final List<Integer> lineNumbers;

	/**
	 * @param errorCode the class of error reported
	 * @param lineNumbers the lines to report, already sorted and de-duplicated
	 */
	public SemanticException(SemanticErrorCode errorCode, List<Integer> lineNumbers) {
		super(format(errorCode, lineNumbers));
		this.errorCode = errorCode;
		this.lineNumbers = Collections.unmodifiableList(new ArrayList<Integer>(lineNumbers));
	}

	public SemanticErrorCode getErrorCode() {
		return errorCode;
	}

	public List<Integer> getLineNumbers() {
		return lineNumbers;
	}

	/**
	 * @return the single diagnostic line, e.g. {@code Semantic Error Code 2: 3 5}
	 */
	public String getDiagnostic() {
		return getMessage();
	}

	private static String format(SemanticErrorCode errorCode, List<Integer> lineNumbers) {
		StringBuilder sb = new StringBuilder(errorCode.getLabel());
		for (Integer line : lineNumbers) {
			sb.append(' ').append(line);
		}
		return sb.toString();
	}
}
