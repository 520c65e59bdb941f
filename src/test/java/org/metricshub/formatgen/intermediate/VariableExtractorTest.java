package org.metricshub.formatgen.intermediate;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.formatgen.FormatGen;
import org.metricshub.formatgen.frontend.ast.Expression;
import org.metricshub.formatgen.frontend.ast.Format;
import org.metricshub.formatgen.frontend.ast.Item;
import org.metricshub.formatgen.frontend.ast.Loop;
import org.metricshub.formatgen.frontend.ast.NumberLiteral;
import org.metricshub.formatgen.typing.TypeInferencer;
import org.metricshub.formatgen.typing.TypingResult;
import org.metricshub.formatgen.typing.VarType;

public class VariableExtractorTest {

	private static List<VariableDescriptor> extract(String text, String... samples) {
		Format format = new FormatGen().normalize(text);
		TypingResult typing = new TypeInferencer().infer(format, Arrays.asList(samples));
		return new VariableExtractor().extract(format, typing);
	}

	@Test
	public void testSequence() {
		List<VariableDescriptor> variables = extract("N\nA_1 A_2 ... A_N", "3\n1 2 3");
		assertEquals("[{N,index_int,0,[]}, {A,int,1,[N]}]", variables.toString());
		VariableDescriptor a = variables.get(1);
		assertEquals(new NumberLiteral(1), a.getStart(0));
		assertEquals(new Item("N"), a.getLength(0));
		assertEquals(1, a.getLoopDepth());
	}

	@Test
	public void testZeroBasedGrid() {
		List<VariableDescriptor> variables = extract(
				"H W\nA_{0,0} ... A_{0,W-1}\n\\vdots\nA_{H-1,0} ... A_{H-1,W-1}",
				"2 2\n1.5 2\n3 4");
		VariableDescriptor a = variables.get(2);
		assertEquals("A", a.getName());
		assertEquals(VarType.FLOAT, a.getType());
		assertEquals(2, a.getDimensions());
		assertEquals(new Item("H"), a.getLength(0));
		assertEquals(new Item("W"), a.getLength(1));
		assertEquals(2, a.getLoopDepth());
	}

	@Test
	public void testStringRowKeepsItsLoopIndex() {
		List<VariableDescriptor> variables = extract("N\nS_{1,1} S_{1,2} \\ldots S_{1,N}", "3\nab cd ef");
		VariableDescriptor s = variables.get(1);
		assertEquals("{S,string,1,[N]}", s.toString());
		assertEquals(1, s.getIndexPosition(0));
		assertEquals(new NumberLiteral(1), s.getStart(0));
	}

	@Test
	public void testCollapsedRowsLoseTheirLastDimension() {
		List<VariableDescriptor> variables = extract(
				"H W\nS_{1,1} ... S_{1,W}\n\\vdots\nS_{H,1} ... S_{H,W}",
				"2 3\n#.#\n..#");
		assertEquals("{S,string,1,[H]}", variables.get(2).toString());
	}

	@Test
	public void testCollapsedString() {
		List<VariableDescriptor> variables = extract("N\nc_1 c_2 ... c_N", "5\nhello");
		assertEquals("{c,string,0,[]}", variables.get(1).toString());
	}

	@Test
	public void testStringIndexedPastItsLoops() {
		List<VariableDescriptor> variables = extract("N\nS_{1,1} S_{2,1} ... S_{N,1}", "2\nab cd");
		VariableDescriptor s = variables.get(1);
		assertEquals(VarType.STRING, s.getType());
		assertEquals(Collections.<Expression>singletonList(new Item("N")), s.getSizes());
	}

	@Test
	public void testMostIndexedReadWins() {
		Item n = new Item("N");
		Format format = new Format(Arrays.asList(
				n,
				new Item("X"),
				new Loop("i", new NumberLiteral(1), n, Arrays.asList(new Item("X", Arrays.asList(new Item("i")))))));
		TypingResult typing = new TypingResult(
				Collections.<String, VarType>emptyMap(),
				Collections.<String>emptySet(),
				format);
		List<VariableDescriptor> variables = new VariableExtractor().extract(format, typing);
		assertEquals("[{N,int,0,[]}, {X,int,1,[N]}]", variables.toString());
	}

	@Test
	public void testIndexOutsideLoopsIsKept() {
		List<VariableDescriptor> variables = extract("K\nA_K", "2 7");
		VariableDescriptor a = variables.get(1);
		assertEquals(Collections.<Expression>singletonList(new Item("K")), a.getSizes());
		assertNull(a.getStart(0));
		assertEquals(new Item("K"), a.getLength(0));
	}

	@Test
	public void testDescriptorEqualityIgnoresStarts() {
		VariableDescriptor counted = new VariableDescriptor("A", VarType.INT, Arrays.asList(new Item("N")));
		VariableDescriptor ranged = new VariableDescriptor(
				"A",
				VarType.INT,
				Arrays.asList(new Item("N")),
				Arrays.asList(new NumberLiteral(1)),
				1);
		assertEquals(counted, ranged);
		assertEquals("B", counted.withName("B").getName());
		assertEquals(0, counted.withName("B").getIndexPosition(0));
	}
}
