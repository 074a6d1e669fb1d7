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

import java.io.IOException;

/**
 * Source of tokens consumed by {@link PolyParser}.
 * Once the end of the input is reached, both methods keep returning
 * an {@link TokenType#END_OF_FILE} token.
 */
public interface TokenStream {

	/**
	 * Consumes and returns the next token.
	 *
	 * @return the next token
	 * @throws IOException if the underlying source cannot be read
	 */
	Token getToken() throws IOException;

	/**
	 * Returns a token ahead of the current position without consuming it.
	 *
	 * @param offset 1 for the token {@link #getToken()} would return next,
	 *        2 for the one after, and so on
	 * @return the token at that offset
	 * @throws IOException if the underlying source cannot be read
	 */
	Token peek(int offset) throws IOException;
}
