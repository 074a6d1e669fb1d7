package org.metricshub.jpoly.analysis;

import static org.junit.Assert.*;

import java.io.StringReader;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.jpoly.frontend.PolyParser;
import org.metricshub.jpoly.util.ScriptSource;

public class UselessAssignmentAnalyzerTest {

	private static List<Integer> analyze(String... statements) throws Exception {
		String text = "TASKS 4\nPOLY\nf = x;\nEXECUTE\n" + String.join("\n", statements) + "\nINPUTS 1";
		return new UselessAssignmentAnalyzer()
				.analyze(new PolyParser().parse(new ScriptSource("test", new StringReader(text))).toCompiledProgram());
	}

	@Test
	public void testOverwrittenBeforeUse() throws Exception {
		// statements start on line 5
		assertEquals(Arrays.asList(5), analyze("a = 1;", "a = 2;", "OUTPUT a;"));
	}

	@Test
	public void testSelfReferenceCountsAsUse() throws Exception {
		assertEquals(Collections.emptyList(), analyze("a = 1;", "a = a + 1;", "OUTPUT a;"));
	}

	@Test
	public void testInputOverwrites() throws Exception {
		assertEquals(Arrays.asList(5), analyze("a = 1;", "INPUT a;", "OUTPUT a;"));
	}

	@Test
	public void testReadByAnotherAssignment() throws Exception {
		assertEquals(Collections.emptyList(), analyze("a = 1;", "b = f(a);", "a = 3;", "OUTPUT a;", "OUTPUT b;"));
	}

	@Test
	public void testNeverReadIsUseless() throws Exception {
		assertEquals(Arrays.asList(5, 7), analyze("a = 1;", "OUTPUT b;", "c = 2;", "INPUT a;", "OUTPUT a;"));
	}

	@Test
	public void testUnrelatedStatementsDoNotDecide() throws Exception {
		assertEquals(Arrays.asList(6), analyze("a = 1;", "b = 2;", "INPUT c;", "c = c + 1;", "OUTPUT c;", "OUTPUT a;"));
	}
}
