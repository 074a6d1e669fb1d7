package org.metricshub.jpoly.analysis;

import static org.junit.Assert.*;

import java.io.StringReader;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import org.junit.Test;
import org.metricshub.jpoly.frontend.CompiledProgram;
import org.metricshub.jpoly.frontend.PolyParser;
import org.metricshub.jpoly.frontend.ast.AddExpr;
import org.metricshub.jpoly.frontend.ast.CallExpr;
import org.metricshub.jpoly.frontend.ast.ConstExpr;
import org.metricshub.jpoly.frontend.ast.Expr;
import org.metricshub.jpoly.frontend.ast.MulExpr;
import org.metricshub.jpoly.frontend.ast.PowExpr;
import org.metricshub.jpoly.frontend.ast.SubExpr;
import org.metricshub.jpoly.frontend.ast.VarExpr;
import org.metricshub.jpoly.util.ScriptSource;

public class DegreeCalculatorTest {

	private static final DegreeCalculator DEGREE = new DegreeCalculator();

	private static Expr x() {
		return new VarExpr("x", 1);
	}

	@Test
	public void testRules() {
		assertEquals(0, DEGREE.degree(new ConstExpr(2)));
		assertEquals(1, DEGREE.degree(x()));
		assertEquals(3, DEGREE.degree(new PowExpr(x(), 3)));
		assertEquals(0, DEGREE.degree(new PowExpr(x(), 0)));
		Expr xPlusOne = new AddExpr(x(), new ConstExpr(1));
		Expr xMinusOne = new SubExpr(x(), new ConstExpr(1));
		assertEquals(2, DEGREE.degree(new MulExpr(xPlusOne, xMinusOne)));
		assertEquals(4, DEGREE.degree(new PowExpr(new MulExpr(x(), x()), 2)));
		assertEquals(2, DEGREE.degree(new SubExpr(new ConstExpr(1), new PowExpr(x(), 2))));
		assertEquals(0, DEGREE.degree(new CallExpr("f", 1, Collections.<Expr>singletonList(new PowExpr(x(), 9)))));
	}

	@Test
	public void testDegreeWrapsAround() {
		// 65536 * 65536 is 2^32
		assertEquals(0, DEGREE.degree(new PowExpr(new PowExpr(x(), 65536), 65536)));
		assertEquals(Integer.MIN_VALUE, DEGREE.degree(new PowExpr(new PowExpr(x(), 65536), 32768)));
	}

	@Test
	public void testDegreesOfProgram() throws Exception {
		String text = "TASKS 5 POLY\ng(x, y) = x y^2 + 7;\nf = (x + 1)(x - 1);\nh = 3; a = x;\nEXECUTE OUTPUT a; INPUTS 1";
		CompiledProgram program = new PolyParser().parse(new ScriptSource("test", new StringReader(text))).toCompiledProgram();
		Map<String, Integer> degrees = DEGREE.degrees(program);
		assertEquals(Arrays.asList("g", "f", "a", "h"), Arrays.asList(degrees.keySet().toArray(new String[0])));
		assertEquals(Integer.valueOf(3), degrees.get("g"));
		assertEquals(Integer.valueOf(2), degrees.get("f"));
		assertEquals(Integer.valueOf(1), degrees.get("a"));
		assertEquals(Integer.valueOf(0), degrees.get("h"));
	}
}
