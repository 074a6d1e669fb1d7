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
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import org.metricshub.jpoly.frontend.CompilationContext;
import org.metricshub.jpoly.util.PolyLogger;
import org.slf4j.Logger;

/**
 * The semantic gate, run once a program has been parsed completely.
 * <p>
 * Only the first class of error with findings is reported, in this order:
 * duplicate declarations, invalid monomials, calls to undeclared polynomials,
 * calls with a wrong argument count.
 */
public final class SemanticChecker {

	private static final Logger LOG = PolyLogger.getLogger(SemanticChecker.class);

	private SemanticChecker() {}

	/**
	 * Finds the error to report for the specified parse results, if any.
	 *
	 * @param context what the parser recorded
	 * @return the error to report, or {@code null} if the program is semantically valid
	 */
	public static SemanticException firstError(CompilationContext context) {
		if (!context.getDuplicateDeclarationLines().isEmpty()) {
			return error(SemanticErrorCode.DUPLICATE_DECLARATION, context.getDuplicateDeclarationLines());
		}
		if (!context.getInvalidMonomialLines().isEmpty()) {
			return error(SemanticErrorCode.INVALID_MONOMIAL, context.getInvalidMonomialLines());
		}
		if (!context.getUndeclaredCallLines().isEmpty()) {
			return error(SemanticErrorCode.UNDECLARED_POLYNOMIAL, context.getUndeclaredCallLines());
		}
		if (!context.getArityMismatchLines().isEmpty()) {
			return error(SemanticErrorCode.ARITY_MISMATCH, context.getArityMismatchLines());
		}
		return null;
	}

	/**
	 * Throws the error to report for the specified parse results, if any.
	 *
	 * @param context what the parser recorded
	 * @throws SemanticException if the program is not semantically valid
	 */
	public static void check(CompilationContext context) {
		SemanticException error = firstError(context);
		if (error != null) {
			LOG.debug("Semantic gate rejected the program: {}", error.getDiagnostic());
			throw error;
		}
	}

	private static SemanticException error(SemanticErrorCode code, Collection<Integer> lines) {
		List<Integer> sorted = new ArrayList<Integer>(new TreeSet<Integer>(lines));
		return new SemanticException(code, sorted);
	}
}
