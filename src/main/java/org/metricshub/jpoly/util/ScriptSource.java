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

import java.io.IOException;
import java.io.Reader;

/**
 * A polynomial program together with a name for diagnostics.
 * The CLI builds one over standard input, {@link org.metricshub.jpoly.Jpoly}
 * over a string, and {@link ScriptFileSource} covers {@code -f}.
 */
public class ScriptSource {

	/** Name of a program read from standard input */
	public static final String DESCRIPTION_STANDARD_INPUT = "<standard-input>";

	/** Name of a program passed as a string */
	public static final String DESCRIPTION_STRING_SCRIPT = "<string-supplied-program>";

	private final String description;
	private final Reader reader;

	/**
	 * @param description name of the program, such as a file path
	 * @param reader the program text
	 */
	public ScriptSource(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
	}

	/**
	 * @return the name of this program, used in diagnostics
	 */
	public final String getDescription() {
		return description;
	}

	/**
	 * @return the program text
	 * @throws IOException if the text cannot be opened
	 */
	public Reader getReader() throws IOException {
		return reader;
	}

	@Override
	public String toString() {
		return getDescription();
	}
}
