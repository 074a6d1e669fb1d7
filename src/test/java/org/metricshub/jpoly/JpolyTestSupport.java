package org.metricshub.jpoly;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.metricshub.jpoly.util.InputExhaustionPolicy;
import org.metricshub.jpoly.util.JpolySettings;
import org.metricshub.jpoly.util.ScriptSource;

/**
 * Fluent builders that run a polynomial program through {@link Jpoly}
 * ({@link #jpolyTest(String)}) or through {@link Cli} ({@link #cliTest(String)})
 * and check what it printed, its exit code, or the exception it threw.
 */
public final class JpolyTestSupport {

	private JpolyTestSupport() {}

	public static JpolyTestBuilder jpolyTest(String description) {
		return new JpolyTestBuilder(description);
	}

	/**
	 * The program is given on standard input, so {@code -f} is only needed to
	 * test reading from a file.
	 *
	 * @param description used in assertion messages
	 * @return a new builder
	 */
	public static CliTestBuilder cliTest(String description) {
		return new CliTestBuilder(description);
	}

	/**
	 * Runs the program with {@link Jpoly#invoke(ScriptSource, JpolySettings)}.
	 */
	public static final class JpolyTestBuilder extends BaseTestBuilder<JpolyTestBuilder> {
		private final JpolySettings settings = new JpolySettings();

		private JpolyTestBuilder(String description) {
			super(description);
		}

		public JpolyTestBuilder memoryCapacity(int slots) {
			settings.setMemoryCapacity(slots);
			return this;
		}

		public JpolyTestBuilder onInputExhausted(InputExhaustionPolicy policy) {
			settings.setInputExhaustionPolicy(policy);
			return this;
		}

		@Override
		Execution execute() throws Exception {
			ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
			settings.setOutputStream(new PrintStream(outBytes, true, StandardCharsets.UTF_8.name()));
			new Jpoly().invoke(new ScriptSource("test", new StringReader(script)), settings);
			return new Execution(outBytes.toString(StandardCharsets.UTF_8.name()), 0);
		}
	}

	/**
	 * Runs the program with {@link Cli#parse(String[])} and {@link Cli#run()},
	 * turning an {@link ExitException} into the exit code.
	 */
	public static final class CliTestBuilder extends BaseTestBuilder<CliTestBuilder> {
		private final List<String> arguments = new ArrayList<>();

		private CliTestBuilder(String description) {
			super(description);
		}

		public CliTestBuilder argument(String... args) {
			arguments.addAll(Arrays.asList(args));
			return this;
		}

		@Override
		Execution execute() throws Exception {
			byte[] stdin = script != null ? script.getBytes(StandardCharsets.UTF_8) : new byte[0];
			ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
			PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8.name());
			Cli cli = new Cli(new ByteArrayInputStream(stdin), out, out);
			int exitCode = 0;
			try {
				cli.parse(arguments.toArray(new String[0]));
				cli.run();
			} catch (ExitException ex) {
				exitCode = ex.getCode();
			}
			return new Execution(outBytes.toString(StandardCharsets.UTF_8.name()), exitCode);
		}
	}

	private abstract static class BaseTestBuilder<B extends BaseTestBuilder<B>> {
		final String description;
		String script;
		private String expectedOutput;
		private List<String> expectedLines;
		private int expectedExitCode;
		private Class<? extends Throwable> expectedException;

		BaseTestBuilder(String description) {
			this.description = description;
		}

		@SuppressWarnings("unchecked")
		private B self() {
			return (B) this;
		}

		public B script(String script) {
			this.script = script;
			return self();
		}

		/**
		 * @param expected the exact expected output, line terminators included
		 * @return this builder
		 */
		public B expect(String expected) {
			this.expectedOutput = expected;
			this.expectedLines = null;
			return self();
		}

		public B expectLines(String... lines) {
			this.expectedLines = Arrays.asList(lines);
			this.expectedOutput = null;
			return self();
		}

		public B expectExit(int code) {
			this.expectedExitCode = code;
			return self();
		}

		/**
		 * Expects the run to fail; output and exit code are then not checked.
		 *
		 * @param exceptionClass type of the failure
		 * @return this builder
		 */
		public B expectThrow(Class<? extends Throwable> exceptionClass) {
			this.expectedException = exceptionClass;
			return self();
		}

		/**
		 * Runs the program without checking any expectation.
		 *
		 * @return what the program printed
		 * @throws Exception if the run fails
		 */
		public String output() throws Exception {
			return execute().output;
		}

		public void runAndAssert() throws Exception {
			if (expectedException != null) {
				assertThrows(description, expectedException, this::execute);
				return;
			}
			Execution execution = execute();
			if (expectedLines != null) {
				assertEquals("Unexpected output for " + description, expectedLines, lines(execution.output));
			} else if (expectedOutput != null) {
				assertEquals("Unexpected output for " + description, expectedOutput, execution.output);
			}
			assertEquals("Unexpected exit code for " + description, expectedExitCode, execution.exitCode);
		}

		abstract Execution execute() throws Exception;
	}

	private static final class Execution {
		final String output;
		final int exitCode;

		Execution(String output, int exitCode) {
			this.output = output;
			this.exitCode = exitCode;
		}
	}

	private static List<String> lines(String output) {
		if (output.isEmpty()) {
			return Collections.emptyList();
		}
		String normalized = output.replace("\r\n", "\n");
		if (normalized.endsWith("\n")) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		return Arrays.asList(normalized.split("\n", -1));
	}
}
