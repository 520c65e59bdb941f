package org.metricshub.formatgen.typing;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import org.junit.Test;
import org.metricshub.formatgen.FormatGen;
import org.metricshub.formatgen.frontend.ast.Format;
import org.metricshub.formatgen.frontend.ast.Item;
import org.metricshub.formatgen.frontend.ast.Loop;

public class TypeInferencerTest {

	private static Format format(String text) {
		return new FormatGen().normalize(text);
	}

	@Test
	public void testTypesAcrossSamples() {
		TypingResult result = new TypeInferencer().infer(
				format("N X\nA_1 A_2 ... A_N"),
				Arrays.asList("2 5 1 2", "3 2.5 7 8 9"));
		assertEquals(VarType.INDEX_INT, result.getType("N"));
		assertEquals(VarType.FLOAT, result.getType("X"));
		assertEquals(VarType.INT, result.getType("A"));
		assertFalse(result.isCollapsed());
	}

	@Test
	public void testTreeItemsAreTyped() {
		TypingResult result = new TypeInferencer().infer(format("N\nA_1 A_2 ... A_N"), Arrays.asList("2 a bc"));
		assertEquals(VarType.STRING, result.getType("A"));
		Loop loop = (Loop) result.getTree().getChildren().get(1);
		assertEquals(VarType.STRING, ((Item) loop.getBody().get(0)).getType());
		assertEquals(VarType.INDEX_INT, ((Item) result.getTree().getChildren().get(0)).getType());
	}

	@Test
	public void testIndexVariablesArePromoted() {
		TypingResult result = new TypeInferencer().infer(format("K N\nA_K"), Arrays.asList("1 2 3"));
		assertEquals(VarType.INDEX_INT, result.getType("K"));
		assertEquals(VarType.INT, result.getType("N"));
	}

	@Test
	public void testStringRowsAreCollapsed() {
		TypingResult result = new TypeInferencer().infer(
				format("H W\nS_{1,1} ... S_{1,W}\n\\vdots\nS_{H,1} ... S_{H,W}"),
				Arrays.asList("2 3\n#.#\n..#"));
		assertTrue(result.isCollapsed());
		assertEquals(Collections.singleton("S"), result.getCollapsedNames());
		assertEquals(VarType.STRING, result.getType("S"));
		assertEquals("H W for j in 1..H { S_{j} }", result.getTree().toString());
	}

	@Test
	public void testSingleStringIsCollapsed() {
		TypingResult result = new TypeInferencer().infer(format("N\nc_1 c_2 ... c_N"), Arrays.asList("5\nhello"));
		assertEquals("N c", result.getTree().toString());
		assertEquals(VarType.STRING, result.getType("c"));
	}

	@Test
	public void testCollapseOnlyWhenSingleItem() {
		Set<String> names = new LinkedHashSet<String>();
		Format tree = format("N\nA_1 B_1\n\\vdots\nA_N B_N");
		assertEquals(tree, new LoopCollapser().collapse(tree, names));
		assertTrue(names.isEmpty());
	}

	@Test
	public void testMismatchIsReported() {
		MatchException e = assertThrows(
				MatchException.class,
				() -> new TypeInferencer().infer(format("N M\nA_1 B_1\n\\vdots\nA_N B_N"), Arrays.asList("3 1 1")));
		assertTrue(e.getMessage(), e.getMessage().contains("Unexpected end of input"));
	}

	@Test
	public void testLenientInference() {
		TypingResult result = new TypeInferencer(false).infer(
				format("N M\nA_1 B_1\n\\vdots\nA_N B_N"),
				Arrays.asList("3 1 1"));
		assertTrue(result.getTypes().isEmpty());
	}

	@Test
	public void testNoSamples() {
		Format tree = format("N");
		TypingResult result = new TypeInferencer().infer(tree, Collections.<String>emptyList());
		assertTrue(result.getTypes().isEmpty());
		assertEquals(tree, result.getTree());
	}
}
