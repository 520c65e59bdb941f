package org.metricshub.formatgen.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.formatgen.frontend.ast.Format;
import org.metricshub.formatgen.frontend.ast.Item;
import org.metricshub.formatgen.frontend.ast.Loop;
import org.metricshub.formatgen.frontend.ast.Marker;
import org.metricshub.formatgen.frontend.ast.NumberLiteral;
import org.metricshub.formatgen.frontend.ast.RawStatement;

public class AnalyzerTest {

	private static Format analyze(String text) {
		return new Analyzer().analyze(new Parser(new Lexer(text).tokenize()).parse().getRoot());
	}

	@Test
	public void testSimpleSequence() {
		Format format = analyze("N\nA_1 A_2 ... A_N");
		assertEquals("N for i in 1..N { A_{i} }", format.toString());
		Loop loop = (Loop) format.getChildren().get(1);
		assertEquals(new NumberLiteral(1), loop.getStart());
		assertEquals(new Item("N"), loop.getEnd());
	}

	@Test
	public void testExplicitTermsAreAbsorbed() {
		assertEquals("n for i in 1..n { a_{i} }", analyze("n\na_1 a_2 a_3 \\ldots a_n").toString());
	}

	@Test
	public void testZeroBasedSequence() {
		assertEquals("N for i in 0..N - 1 { A_{i} }", analyze("N\nA_0 A_1 \\cdots A_{N-1}").toString());
	}

	@Test
	public void testSeveralVariablesPerIteration() {
		Format format = analyze("N\nA_1 B_1\nA_2 B_2\n\\vdots\nA_N B_N");
		assertEquals("N for i in 1..N { A_{i} B_{i} }", format.toString());
	}

	@Test
	public void testLoopVariableAvoidsUsedNames() {
		Format format = analyze("i N\nA_i ... A_N");
		assertEquals("i N for j in i..N { A_{j} }", format.toString());
	}

	@Test
	public void testGrid() {
		Format format = analyze("H W\nc_{1,1} ... c_{1,W}\n\\vdots\nc_{H,1} ... c_{H,W}");
		assertEquals("H W for j in 1..H { for i in 1..W { c_{j,i} } }", format.toString());
	}

	@Test
	public void testSubscriptedConstantsAreFlattened() {
		assertEquals("T1 T2 N", analyze("T_1 T_2\nN").toString());
		assertEquals("N A1 A2 A3", analyze("N\nA_1 A_2 A_3").toString());
	}

	@Test
	public void testFlatteningSkipsNamesNextToEllipsis() {
		Analyzer analyzer = new Analyzer();
		List<RawStatement> statements = Arrays.<RawStatement>asList(
				new Item("K", Arrays.asList(new NumberLiteral(1))),
				Marker.BREAK,
				Marker.DOTS);
		List<RawStatement> result = analyzer.flattenScalars(statements);
		assertEquals(statements, result);
	}

	@Test
	public void testUnmatchedEllipsisIsDropped() {
		assertEquals("N", analyze("N ...").toString());
		assertEquals("A_{1} B_{N}", analyze("A_1 ... B_N").toString());
	}

	@Test
	public void testAnalysisIsIdempotent() {
		Analyzer analyzer = new Analyzer();
		for (String text : new String[] {
				"N\nA_1 A_2 ... A_N",
				"H W\nc_{1,1} ... c_{1,W}\n\\vdots\nc_{H,1} ... c_{H,W}",
				"T_1 T_2\nN",
				"N M\nA_1 B_1\n\\vdots\nA_M B_M" }) {
			Format once = analyze(text);
			assertEquals(text, once, analyzer.analyze(once));
		}
	}

	@Test
	public void testNoMarkersRemain() {
		Format format = analyze("N\nA_1 ... A_N\n\nQ\nx_1 y_1\n\\vdots\nx_Q y_Q");
		assertEquals(4, format.getChildren().size());
		assertTrue(format.getChildren().get(1) instanceof Loop);
		assertTrue(format.getChildren().get(3) instanceof Loop);
	}
}
