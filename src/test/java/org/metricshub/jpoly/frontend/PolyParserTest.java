package org.metricshub.jpoly.frontend;

import static org.junit.Assert.*;

import java.io.StringReader;
import java.util.Arrays;
import org.junit.Test;
import org.metricshub.jpoly.frontend.ast.AssignStatement;
import org.metricshub.jpoly.frontend.ast.CallExpr;
import org.metricshub.jpoly.frontend.ast.InputStatement;
import org.metricshub.jpoly.frontend.ast.MulExpr;
import org.metricshub.jpoly.frontend.ast.OutputStatement;
import org.metricshub.jpoly.frontend.ast.ParserException;
import org.metricshub.jpoly.frontend.ast.PolynomialDeclaration;
import org.metricshub.jpoly.frontend.ast.PowExpr;
import org.metricshub.jpoly.util.ScriptSource;

public class PolyParserTest {

	private static CompilationContext parse(String text) throws Exception {
		return new PolyParser().parse(new ScriptSource("test", new StringReader(text)));
	}

	/** Parses a program made of the given polynomial section and a trivial script. */
	private static CompilationContext parsePoly(String declarations) throws Exception {
		return parse("TASKS 5 POLY " + declarations + " EXECUTE OUTPUT a; INPUTS 1");
	}

	/** Parses a program made of the given script and a single polynomial {@code f}. */
	private static CompilationContext parseScript(String statements) throws Exception {
		return parse("TASKS 2 POLY f = x; EXECUTE " + statements + " INPUTS 1");
	}

	private static String body(CompilationContext context, String name) {
		return context.getDeclaration(name).getBody().toString();
	}

	private static void assertSyntaxError(String text) {
		assertThrows(text, ParserException.class, () -> parse(text));
	}

	@Test
	public void testSections() throws Exception {
		CompiledProgram program = parse(
				"TASKS 2 4\nPOLY\ng(a, b) = a + b;\nEXECUTE\nINPUT u;\nv = g(u, 2);\nOUTPUT v;\nINPUTS 3 1\n")
				.toCompiledProgram();
		assertTrue(program.isSelected(Task.EXECUTE));
		assertTrue(program.isSelected(Task.USELESS_ASSIGNMENT));
		assertFalse(program.isSelected(Task.DEGREES));

		PolynomialDeclaration g = program.getDeclaration("g");
		assertEquals(Arrays.asList("a", "b"), g.getParameters());
		assertEquals(3, g.getLineNumber());

		assertEquals(3, program.getStatements().size());
		assertTrue(program.getStatements().get(0) instanceof InputStatement);
		assertTrue(program.getStatements().get(1) instanceof AssignStatement);
		assertTrue(program.getStatements().get(2) instanceof OutputStatement);
		assertEquals("v", program.getStatements().get(1).getVariable());
		assertEquals(6, program.getStatements().get(1).getLineNumber());
		assertEquals(Arrays.asList(3, 1), program.getInputs());
	}

	@Test
	public void testDefaultParameter() throws Exception {
		CompilationContext context = parsePoly("f = 3x^2 + 1;");
		assertEquals(Arrays.asList("x"), context.getDeclaration("f").getParameters());
		assertTrue(context.getInvalidMonomialLines().isEmpty());
	}

	@Test
	public void testPolynomialBodyShapes() throws Exception {
		CompilationContext context = parsePoly(
				"a = x + 1 + x; b = x - 1 - x; c = 2 x x; d = (x + 1)^2 x; e = x^2 - x + 1; f = x(x - 1);");
		assertEquals("((x + 1) + x)", body(context, "a"));
		assertEquals("(x - (1 - x))", body(context, "b"));
		assertEquals("((2 * x) * x)", body(context, "c"));
		assertEquals("((x + 1)^2 * x)", body(context, "d"));
		assertEquals("(x^2 - (x + 1))", body(context, "e"));
		assertEquals("(x * (x - 1))", body(context, "f"));
		assertTrue(context.getDeclaration("d").getBody() instanceof MulExpr);
	}

	@Test
	public void testExponentIsALiteral() throws Exception {
		CompilationContext context = parsePoly("f = x^0;");
		PowExpr pow = (PowExpr) context.getDeclaration("f").getBody();
		assertEquals(0, pow.getExponent());
		assertSyntaxError("TASKS 5 POLY f = x^x; EXECUTE OUTPUT a; INPUTS 1");
		assertSyntaxError("TASKS 5 POLY f = x^(2); EXECUTE OUTPUT a; INPUTS 1");
		assertSyntaxError("TASKS 5 POLY f = x^2147483648; EXECUTE OUTPUT a; INPUTS 1");
	}

	@Test
	public void testParenthesizedFactorFollowedByNumeral() throws Exception {
		assertSyntaxError("TASKS 5 POLY f = (x + 1) 2; EXECUTE OUTPUT a; INPUTS 1");
		// in the execution script the numeral ends the expression, leaving the statement unterminated
		assertSyntaxError("TASKS 2 POLY f = x; EXECUTE a = (1 + 1) 2; INPUTS 1");
		assertEquals("(2 * (x + 1))", body(parsePoly("f = 2(x + 1);"), "f"));
	}

	@Test
	public void testInvalidMonomialsAreRecordedPerOccurrence() throws Exception {
		CompilationContext context = parse("TASKS 5 POLY\nf(y) = x + y\n + x x;\nEXECUTE OUTPUT a; INPUTS 1");
		assertEquals(Arrays.asList(2, 3, 3), context.getInvalidMonomialLines());
	}

	@Test
	public void testDuplicateDeclarationKeepsTheFirstBody() throws Exception {
		CompilationContext context = parse("TASKS 5 POLY\nf = x;\nf(y) = y + 1;\nEXECUTE OUTPUT a; INPUTS 1");
		assertEquals(Arrays.asList(3), context.getDuplicateDeclarationLines());
		assertEquals("x", body(context, "f"));
		assertEquals(2, context.getDeclaration("f").getLineNumber());
	}

	@Test
	public void testCalls() throws Exception {
		CompilationContext context = parse("TASKS 2 POLY f = x; g(x, y) = x y; EXECUTE\nb = g(f(a), a + 1);\nINPUTS 1");
		AssignStatement assign = (AssignStatement) context.toCompiledProgram().getStatements().get(0);
		CallExpr call = (CallExpr) assign.getValue();
		assertEquals("g", call.getPolynomialName());
		assertEquals(2, call.getLineNumber());
		assertEquals(2, call.getArguments().size());
		assertTrue(call.getArguments().get(0) instanceof CallExpr);
		assertEquals("g(f(a), (a + 1))", call.toString());
		assertTrue(context.getUndeclaredCallLines().isEmpty());
		assertTrue(context.getArityMismatchLines().isEmpty());
	}

	@Test
	public void testCallFindings() throws Exception {
		CompilationContext context = parseScript("\nb = h(1);\nc = f(1, 2) + f(f(1, 2));\nd = h(f(1));");
		assertEquals(Arrays.asList(2, 4), context.getUndeclaredCallLines());
		assertEquals(Arrays.asList(3, 3), context.getArityMismatchLines());
	}

	@Test
	public void testCallIsNotContinuedByImplicitMultiplication() throws Exception {
		assertSyntaxError("TASKS 2 POLY f = x; EXECUTE b = f(1) a; INPUTS 1");
		AssignStatement assign = (AssignStatement) parseScript("b = f(1) + 2 a;").toCompiledProgram().getStatements().get(0);
		assertEquals("(f(1) + (2 * a))", assign.getValue().toString());
	}

	@Test
	public void testSyntaxErrors() {
		assertSyntaxError("");
		assertSyntaxError("TASKS POLY f = x; EXECUTE OUTPUT a; INPUTS 1");
		assertSyntaxError("TASKS 2 POLY EXECUTE OUTPUT a; INPUTS 1");
		assertSyntaxError("TASKS 2 POLY f = ; EXECUTE OUTPUT a; INPUTS 1");
		assertSyntaxError("TASKS 2 POLY f() = 1; EXECUTE OUTPUT a; INPUTS 1");
		assertSyntaxError("TASKS 2 POLY f(x,) = x; EXECUTE OUTPUT a; INPUTS 1");
		assertSyntaxError("TASKS 2 POLY f = x; EXECUTE INPUTS 1");
		assertSyntaxError("TASKS 2 POLY f = x; EXECUTE OUTPUT 1; INPUTS 1");
		assertSyntaxError("TASKS 2 POLY f = x; EXECUTE a = ; INPUTS 1");
		assertSyntaxError("TASKS 2 POLY f = x; EXECUTE a = f(); INPUTS 1");
		assertSyntaxError("TASKS 2 POLY f = x; EXECUTE OUTPUT a; INPUTS");
		assertSyntaxError("TASKS 2 POLY f = x; EXECUTE OUTPUT a; INPUTS 1 x");
		assertSyntaxError("TASKS 2 POLY f = x; EXECUTE OUTPUT a; INPUTS 1 -1");
		assertSyntaxError("TASKS 2 POLY f = x; EXECUTE OUTPUT a;");
	}

	@Test
	public void testSyntaxErrorReportsLine() {
		ParserException e = assertThrows(
				ParserException.class,
				() -> parse("TASKS 2\nPOLY\nf = x;\nEXECUTE\nOUTPUT a\nINPUTS 1\n"));
		assertEquals(6, e.getLineNumber());
		assertEquals("test", e.getSourceDescription());
	}
}
