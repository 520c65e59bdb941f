package org.metricshub.formatgen.typing;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Test;
import org.metricshub.formatgen.FormatGen;
import org.metricshub.formatgen.frontend.ast.BinaryOperation;
import org.metricshub.formatgen.frontend.ast.Format;
import org.metricshub.formatgen.frontend.ast.Item;
import org.metricshub.formatgen.frontend.ast.Loop;
import org.metricshub.formatgen.frontend.ast.NumberLiteral;

public class MatcherTest {

	private static final String GRID = "H W\nA_{0,0} ... A_{0,W-1}\n\\vdots\nA_{H-1,0} ... A_{H-1,W-1}";

	private static Format format(String text) {
		return new FormatGen().normalize(text);
	}

	@Test
	public void testScalarAndSequence() {
		MatchEnvironment environment = new Matcher().match(format("N\nA_1 A_2 ... A_N"), "3\n10 20 30\n");
		assertEquals("3", environment.getScalar("N"));
		assertFalse(environment.isArray("N"));
		assertTrue(environment.isArray("A"));
		assertEquals("20", environment.getElement("A", Arrays.asList(2L)));
		assertEquals(Arrays.asList("N", "A"), Arrays.asList(environment.getNames().toArray()));
		assertEquals(4, environment.getConsumedTokens());
	}

	@Test
	public void testGrid() {
		MatchEnvironment environment = new Matcher().match(format(GRID), "2 3\n1 2 3\n4 5 6");
		Map<String, String> expected = new LinkedHashMap<String, String>();
		expected.put("0,0", "1");
		expected.put("0,1", "2");
		expected.put("0,2", "3");
		expected.put("1,0", "4");
		expected.put("1,1", "5");
		expected.put("1,2", "6");
		assertEquals(expected, environment.getArray("A"));
		assertEquals("{H=2, W=3, A={0,0=1, 0,1=2, 0,2=3, 1,0=4, 1,1=5, 1,2=6}}", environment.toString());
	}

	@Test
	public void testEmptyRange() {
		MatchEnvironment environment = new Matcher().match(format("N\nA_1 A_2 ... A_N"), "0");
		assertNull(environment.getArray("A"));
		assertEquals(1, environment.getConsumedTokens());
	}

	@Test
	public void testTrailingTokensAreLeft() {
		MatchEnvironment environment = new Matcher().match(format("N M"), "1 2 3 4");
		assertEquals(2, environment.getConsumedTokens());
	}

	@Test
	public void testEndOfInput() {
		MatchException e = assertThrows(
				MatchException.class,
				() -> new Matcher().match(format("N\nA_1 A_2 ... A_N"), "3 10 20"));
		assertEquals(3, e.getTokenPosition());
		assertTrue(e.getMessage(), e.getMessage().contains("Unexpected end of input"));
	}

	@Test
	public void testNonIntegerBound() {
		MatchException e = assertThrows(
				MatchException.class,
				() -> new Matcher().match(format("N\nA_1 A_2 ... A_N"), "abc 1 2"));
		assertTrue(e.getMessage(), e.getMessage().contains("not an integer"));
	}

	@Test
	public void testFloorDivision() {
		Map<String, Long> bindings = new HashMap<String, Long>();
		bindings.put("x", Long.valueOf(-7));
		Evaluator evaluator = new Evaluator(new MatchEnvironment(), bindings);
		assertEquals(-4L, evaluator.evaluate(new BinaryOperation('/', new Item("x"), new NumberLiteral(2))));
		assertEquals(3L, evaluator.evaluate(new BinaryOperation('/', new NumberLiteral(7), new NumberLiteral(2))));
	}

	@Test
	public void testDivisionByZero() {
		Evaluator evaluator = new Evaluator(new MatchEnvironment(), new HashMap<String, Long>());
		assertThrows(
				MatchException.class,
				() -> evaluator.evaluate(new BinaryOperation('/', new NumberLiteral(1), new NumberLiteral(0))));
	}

	@Test
	public void testArrayWithoutIndices() {
		MatchEnvironment environment = new Matcher().match(format("N\nA_1 A_2 ... A_N"), "1 5");
		Evaluator evaluator = new Evaluator(environment, new HashMap<String, Long>());
		MatchException e = assertThrows(MatchException.class, () -> evaluator.evaluate(new Item("A")));
		assertTrue(e.getMessage(), e.getMessage().contains("array"));
		assertEquals(5L, evaluator.evaluate(new Item("A", Arrays.asList(new NumberLiteral(1)))));
	}

	@Test
	public void testLoopBindingsShadowVariables() {
		MatchEnvironment environment = new Matcher().match(format("i"), "4");
		Map<String, Long> bindings = new HashMap<String, Long>();
		bindings.put("i", Long.valueOf(9));
		assertEquals(9L, new Evaluator(environment, bindings).evaluate(new Item("i")));
		assertEquals(4L, new Evaluator(environment, new HashMap<String, Long>()).evaluate(new Item("i")));
	}

	@Test(timeout = 5000)
	public void testEmptyRowsAreNotRepeated() {
		String grid = "N M\nA_{1,1} \\ldots A_{1,M}\n\\vdots\nA_{N,1} \\ldots A_{N,M}";
		MatchEnvironment environment = new Matcher().match(format(grid), "1000000000000 0");
		assertEquals(2, environment.getConsumedTokens());
		assertFalse(environment.getNames().contains("A"));
	}

	@Test
	public void testRowsDependingOnTheOuterLoop() {
		// N, then for i in 1..N: A_{i,2} ... A_{i,i}; the first row is empty
		Loop row = new Loop("j", new NumberLiteral(2), new Item("i"),
				Arrays.asList(new Item("A", Arrays.asList(new Item("i"), new Item("j")))));
		Format triangle = new Format(Arrays.asList(
				new Item("N"),
				new Loop("i", new NumberLiteral(1), new Item("N"), Arrays.asList(row))));
		MatchEnvironment environment = new Matcher().match(triangle, "3 7 8 9");
		assertEquals(4, environment.getConsumedTokens());
		assertEquals("7", environment.getElement("A", Arrays.asList(2L, 2L)));
		assertEquals("9", environment.getElement("A", Arrays.asList(3L, 3L)));
	}
}
