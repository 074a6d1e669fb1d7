package org.metricshub.jpoly.backend;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;
import org.junit.Test;
import org.metricshub.jpoly.frontend.CompiledProgram;
import org.metricshub.jpoly.frontend.PolyParser;
import org.metricshub.jpoly.jrt.PolyRuntimeException;
import org.metricshub.jpoly.util.InputExhaustionPolicy;
import org.metricshub.jpoly.util.JpolySettings;
import org.metricshub.jpoly.util.ScriptSource;

public class PVMTest {

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();

	private JpolySettings settings() throws Exception {
		JpolySettings settings = new JpolySettings();
		settings.setOutputStream(new PrintStream(out, true, StandardCharsets.UTF_8.name()));
		return settings;
	}

	private static CompiledProgram program(String script, String inputs) throws Exception {
		String text = "TASKS 2 POLY f = x + 1; EXECUTE " + script + " INPUTS " + inputs;
		return new PolyParser().parse(new ScriptSource("test", new StringReader(text))).toCompiledProgram();
	}

	@Test
	public void testSlotsFollowFirstRuntimeReference() throws Exception {
		PVM pvm = new PVM(settings());
		assertTrue(pvm.getSymbolTable().isEmpty());
		pvm.interpret(program("c = a + b; INPUT b; OUTPUT d; a = f(b);", "4"));
		Map<String, Integer> symbols = pvm.getSymbolTable();
		assertEquals(Arrays.asList("c", "b", "d", "a"), new ArrayList<String>(symbols.keySet()));
		assertEquals(Integer.valueOf(0), symbols.get("c"));
		assertEquals(Integer.valueOf(1), symbols.get("b"));
		assertEquals(Integer.valueOf(2), symbols.get("d"));
		assertEquals(Integer.valueOf(3), symbols.get("a"));
		assertEquals(0, pvm.valueOf("c"));
		assertEquals(4, pvm.valueOf("b"));
		assertEquals(5, pvm.valueOf("a"));
		assertEquals(0, pvm.valueOf("never"));
		assertEquals("0\n", out.toString(StandardCharsets.UTF_8.name()).replace("\r\n", "\n"));
	}

	@Test
	public void testAssignmentSeesCurrentValues() throws Exception {
		PVM pvm = new PVM(settings());
		pvm.interpret(program("INPUT a; a = a + a; a = a f(a); OUTPUT a;", "3"));
		assertEquals("42\n", out.toString(StandardCharsets.UTF_8.name()).replace("\r\n", "\n"));
	}

	@Test
	public void testEveryRunStartsFresh() throws Exception {
		PVM pvm = new PVM(settings());
		CompiledProgram program = program("INPUT a; b = b + a; OUTPUT b;", "5");
		pvm.interpret(program);
		pvm.interpret(program);
		assertEquals("5\n5\n", out.toString(StandardCharsets.UTF_8.name()).replace("\r\n", "\n"));
	}

	@Test
	public void testInputExhaustion() throws Exception {
		CompiledProgram program = program("INPUT a; INPUT b; OUTPUT b;", "1");
		PolyRuntimeException e = assertThrows(PolyRuntimeException.class, () -> new PVM(settings()).interpret(program));
		assertEquals(1, e.getLineNumber());

		JpolySettings zero = settings();
		zero.setInputExhaustionPolicy(InputExhaustionPolicy.ZERO);
		new PVM(zero).interpret(program);
		assertEquals("0\n", out.toString(StandardCharsets.UTF_8.name()).replace("\r\n", "\n"));
	}

	@Test
	public void testMemoryExhaustion() throws Exception {
		JpolySettings settings = settings();
		settings.setMemoryCapacity(2);
		CompiledProgram program = program("a = 1; b = 2; OUTPUT b; c = 3;", "1");
		PolyRuntimeException e = assertThrows(PolyRuntimeException.class, () -> new PVM(settings).interpret(program));
		assertTrue(e.getMessage().contains("c"));
		assertEquals("2\n", out.toString(StandardCharsets.UTF_8.name()).replace("\r\n", "\n"));
	}
}
