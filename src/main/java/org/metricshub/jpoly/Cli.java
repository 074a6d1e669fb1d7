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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.metricshub.jpoly.frontend.CompiledProgram;
import org.metricshub.jpoly.frontend.ast.ParserException;
import org.metricshub.jpoly.jrt.PolyRuntimeException;
import org.metricshub.jpoly.semantic.SemanticException;
import org.metricshub.jpoly.util.InputExhaustionPolicy;
import org.metricshub.jpoly.util.JpolySettings;
import org.metricshub.jpoly.util.PolyLogger;
import org.metricshub.jpoly.util.ScriptFileSource;
import org.metricshub.jpoly.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Command-line interface for Jpoly.
 * <p>
 * The program is read from standard input unless {@code -f} names a file.
 * A syntax error prints {@value ParserException#DIAGNOSTIC} and exits with
 * status 1; a semantic error prints its single diagnostic line and exits
 * with status 0. Both go to the output stream, like the program output.
 */
public final class Cli {

	private static final Logger LOG = PolyLogger.getLogger(Cli.class);

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "Jpoly.jar";
		}
		JAR_NAME = myName;
	}

	private final JpolySettings settings = new JpolySettings();
	private final InputStream in;
	private final PrintStream out;

	private ScriptSource scriptSource;
	private boolean dumpSyntaxTree;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard input and output streams.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams. The error stream is
	 * currently unused but kept for API symmetry with typical Java main methods.
	 *
	 * @param in stream from which the program is read when no file is given
	 * @param out stream where program output and diagnostics are written
	 * @param err stream where error messages could be written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, @SuppressWarnings("unused") PrintStream err) {
		this.in = in;
		this.out = out;
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link JpolySettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public JpolySettings getSettings() {
		return settings;
	}

	/**
	 * @return the program source given with {@code -f}, or {@code null} for standard input
	 */
	public ScriptSource getScriptSource() {
		return scriptSource;
	}

	public boolean isDumpSyntaxTree() {
		return dumpSyntaxTree;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {
		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.equals("-f")) {
				// -f filename : load program from file
				checkParameterHasArgument(args, argIdx);
				scriptSource = new ScriptFileSource(args[++argIdx]);
			} else if (arg.equals("--memory")) {
				// --memory N : number of variable slots
				checkParameterHasArgument(args, argIdx);
				String value = args[++argIdx];
				try {
					settings.setMemoryCapacity(Integer.parseInt(value));
				} catch (NumberFormatException e) {
					throw new IllegalArgumentException("Invalid memory capacity: " + value, e);
				}
			} else if (arg.equals("--on-input-exhausted")) {
				// --on-input-exhausted fail|zero : behavior of INPUT once INPUTS is used up
				checkParameterHasArgument(args, argIdx);
				settings.setInputExhaustionPolicy(InputExhaustionPolicy.fromString(args[++argIdx]));
			} else if (arg.equals("--dump-syntax")) {
				// --dump-syntax : print the syntax trees instead of running the tasks
				dumpSyntaxTree = true;
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : display usage information and exit
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Compiles the program and runs its tasks, based on the previously parsed
	 * arguments.
	 *
	 * @throws IOException if the program cannot be read
	 * @throws ExitException when the program was rejected, carrying the exit status
	 */
	public void run() throws IOException, ExitException {
		if (printUsage) {
			usage(out);
			return;
		}
		ScriptSource source = scriptSource != null ?
				scriptSource : new ScriptSource(
						ScriptSource.DESCRIPTION_STANDARD_INPUT,
						new InputStreamReader(in, StandardCharsets.UTF_8));

		Jpoly jpoly = new Jpoly();
		CompiledProgram program;
		try {
			program = jpoly.compile(source);
		} catch (ParserException e) {
			LOG.debug("Syntax error", e);
			out.println(ParserException.DIAGNOSTIC);
			out.flush();
			throw new ExitException(1, e.getMessage());
		} catch (SemanticException e) {
			out.println(e.getDiagnostic());
			out.flush();
			throw new ExitException(0, e.getMessage());
		}

		if (dumpSyntaxTree) {
			program.dump(out);
			out.flush();
			return;
		}
		jpoly.invoke(program, settings);
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-f program-filename]" +
								" [--memory slots]" +
								" [--on-input-exhausted fail|zero]" +
								" [--dump-syntax]");
		dest.println();
		dest.println(" -f filename = Read the program from filename instead of standard input.");
		dest
				.println(
						" --memory slots = Number of variables the execution script may use (default "
								+ JpolySettings.DEFAULT_MEMORY_CAPACITY
								+ ").");
		dest.println(" --on-input-exhausted fail|zero = What INPUT does once INPUTS is used up (default fail).");
		dest.println(" --dump-syntax = Print the syntax trees instead of running the tasks.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		try {
			Cli cli = new Cli();
			cli.parse(args);
			cli.run();
		} catch (ExitException e) {
			System.exit(e.getCode());
		} catch (PolyRuntimeException e) {
			System.err.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
			System.exit(1);
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			e.printStackTrace(System.err);
			System.exit(1);
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		}
	}
}
