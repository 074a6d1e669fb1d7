package org.metricshub.jpoly;

import static org.junit.Assert.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Test;
import org.metricshub.jpoly.frontend.ast.ParserException;
import org.metricshub.jpoly.jrt.PolyRuntimeException;
import org.metricshub.jpoly.util.InputExhaustionPolicy;
import org.metricshub.jpoly.util.JpolySettings;
import org.metricshub.jpoly.util.ScriptFileSource;

public class CliTest {

	private static final String ROUND_TRIP = "TASKS 2 5\n"
			+ "POLY\n"
			+ "f(x) = x + 1;\n"
			+ "EXECUTE\n"
			+ "INPUT a;\n"
			+ "b = f(a);\n"
			+ "OUTPUT b;\n"
			+ "INPUTS 5\n";

	@Test
	public void testProgramFromStandardInput() throws Exception {
		JpolyTestSupport.cliTest("stdin program").script(ROUND_TRIP).expectLines("6", "f: 1").runAndAssert();
	}

	@Test
	public void testProgramFromFile() throws Exception {
		Path file = Files.createTempFile("jpoly", ".poly");
		try {
			Files.write(file, ROUND_TRIP.getBytes(StandardCharsets.UTF_8));
			JpolyTestSupport
					.cliTest("-f program")
					.argument("-f", file.toString())
					.expectLines("6", "f: 1")
					.runAndAssert();
		} finally {
			Files.delete(file);
		}
	}

	@Test
	public void testSyntaxErrorExitsWithOne() throws Exception {
		JpolyTestSupport
				.cliTest("syntax error")
				.script("TASKS 2 POLY f = x; EXECUTE OUTPUT a; INPUTS 1 trailing")
				.expectLines(ParserException.DIAGNOSTIC)
				.expectExit(1)
				.runAndAssert();
	}

	@Test
	public void testUnknownCharacterIsASyntaxError() throws Exception {
		JpolyTestSupport
				.cliTest("no * operator")
				.script("TASKS 2 POLY f = x * x; EXECUTE OUTPUT a; INPUTS 1")
				.expectLines(ParserException.DIAGNOSTIC)
				.expectExit(1)
				.runAndAssert();
	}

	@Test
	public void testSemanticErrorExitsWithZero() throws Exception {
		JpolyTestSupport
				.cliTest("duplicate declaration")
				.script("TASKS 2\nPOLY\nf = x;\nf = x;\nEXECUTE\nOUTPUT a;\nINPUTS 1\n")
				.expectLines("Semantic Error Code 1: 4")
				.expectExit(0)
				.runAndAssert();
	}

	@Test
	public void testDumpSyntax() throws Exception {
		JpolyTestSupport
				.cliTest("--dump-syntax")
				.script(ROUND_TRIP)
				.argument("--dump-syntax")
				.expectLines("TASKS 2 5", "POLY", "  3: f(x) = (x + 1)", "EXECUTE", "  5: INPUT a", "  6: b = f(a)", "  7: OUTPUT b", "INPUTS 5")
				.runAndAssert();
	}

	@Test
	public void testInputExhaustionOption() throws Exception {
		String script = "TASKS 2 POLY f = x; EXECUTE INPUT a; INPUT b; OUTPUT b; INPUTS 1";
		JpolyTestSupport
				.cliTest("--on-input-exhausted zero")
				.script(script)
				.argument("--on-input-exhausted", "zero")
				.expectLines("0")
				.runAndAssert();
		JpolyTestSupport
				.cliTest("--on-input-exhausted fail")
				.script(script)
				.argument("--on-input-exhausted", "FAIL")
				.expectThrow(PolyRuntimeException.class)
				.runAndAssert();
	}

	@Test
	public void testMemoryOption() throws Exception {
		JpolyTestSupport
				.cliTest("--memory 1")
				.script("TASKS 2 POLY f = x; EXECUTE INPUT a; b = a; OUTPUT b; INPUTS 1")
				.argument("--memory", "1")
				.expectThrow(PolyRuntimeException.class)
				.runAndAssert();
	}

	@Test
	public void testParseSettings() {
		Cli cli = new Cli();
		cli.parse(new String[] { "--memory", "12", "--on-input-exhausted", "zero", "--dump-syntax", "-f", "prog.poly" });
		JpolySettings settings = cli.getSettings();
		assertEquals(12, settings.getMemoryCapacity());
		assertEquals(InputExhaustionPolicy.ZERO, settings.getInputExhaustionPolicy());
		assertTrue(cli.isDumpSyntaxTree());
		assertTrue(cli.getScriptSource() instanceof ScriptFileSource);
		assertEquals("prog.poly", cli.getScriptSource().getDescription());
	}

	@Test
	public void testDefaults() {
		Cli cli = Cli.parseCommandLineArguments(new String[0]);
		assertEquals(JpolySettings.DEFAULT_MEMORY_CAPACITY, cli.getSettings().getMemoryCapacity());
		assertEquals(InputExhaustionPolicy.FAIL, cli.getSettings().getInputExhaustionPolicy());
		assertFalse(cli.isDumpSyntaxTree());
		assertNull(cli.getScriptSource());
	}

	@Test
	public void testInvalidArguments() {
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "--memory" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "--memory", "lots" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "--memory", "0" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "--on-input-exhausted", "retry" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "--bogus" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "-h", "-f", "x" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "" }));
	}

	@Test
	public void testUsage() throws Exception {
		String output = JpolyTestSupport.cliTest("-h").argument("-h").output();
		assertTrue(output.startsWith("Usage:"));
		assertTrue(output.contains("--on-input-exhausted"));
		assertTrue(output.contains("-f filename"));
	}
}
