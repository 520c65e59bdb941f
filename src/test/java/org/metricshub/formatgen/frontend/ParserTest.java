package org.metricshub.formatgen.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.formatgen.frontend.ast.BinaryOperation;
import org.metricshub.formatgen.frontend.ast.Item;
import org.metricshub.formatgen.frontend.ast.Marker;
import org.metricshub.formatgen.frontend.ast.NumberLiteral;
import org.metricshub.formatgen.frontend.ast.RawStatement;

public class ParserTest {

	private static ParseResult parse(String text) {
		return new Parser(new Lexer(text).tokenize()).parse();
	}

	@Test
	public void testStatementsAndMarkers() {
		ParseResult result = parse("N\nA_1 A_2 ... A_N");
		assertFalse(result.hasDiagnostics());
		assertEquals("N BREAK A_{1} A_{2} DOTS A_{N}", result.getRoot().toString());
		List<RawStatement> children = result.getRoot().getChildren();
		assertEquals(Marker.BREAK, children.get(1));
		assertEquals(Marker.DOTS, children.get(4));
	}

	@Test
	public void testBracketedIndexList() {
		ParseResult result = parse("A_{i,j}");
		Item item = (Item) result.getRoot().getChildren().get(0);
		assertEquals("A", item.getName());
		assertEquals(Arrays.asList(new Item("i"), new Item("j")), item.getIndices());
	}

	@Test
	public void testChainedSubscripts() {
		Item item = (Item) parse("A_i_j").getRoot().getChildren().get(0);
		assertEquals(Arrays.asList(new Item("i"), new Item("j")), item.getIndices());
	}

	@Test
	public void testIndexArithmetic() {
		Item item = (Item) parse("A_{N-1}").getRoot().getChildren().get(0);
		assertEquals(
				Collections.singletonList(new BinaryOperation('-', new Item("N"), new NumberLiteral(1))),
				item.getIndices());

		item = (Item) parse("B_{2*i+1}").getRoot().getChildren().get(0);
		assertEquals("B_{2 * i + 1}", item.toString());
	}

	@Test
	public void testUnbracketedArithmeticIndex() {
		Item item = (Item) parse("a_n-1").getRoot().getChildren().get(0);
		assertEquals(
				Collections.singletonList(new BinaryOperation('-', new Item("n"), new NumberLiteral(1))),
				item.getIndices());
	}

	@Test
	public void testParenthesesKeepPrecedence() {
		Item item = (Item) parse("A_{(N-1)/2}").getRoot().getChildren().get(0);
		assertEquals("A_{(N - 1) / 2}", item.toString());
	}

	@Test
	public void testMixedBrackets() {
		ParseResult result = parse("A_[i, j)");
		assertFalse(result.hasDiagnostics());
		assertEquals(2, ((Item) result.getRoot().getChildren().get(0)).getIndices().size());
	}

	@Test
	public void testEmptyIndexList() {
		Item item = (Item) parse("S_{}").getRoot().getChildren().get(0);
		assertEquals("S", item.getName());
		assertTrue(item.getIndices().isEmpty());
	}

	@Test
	public void testCommasAreSeparators() {
		assertEquals("N M", parse("N, M").getRoot().toString());
	}

	@Test
	public void testStatementLiteralsAreRecorded() {
		ParseResult result = parse("2 x y");
		assertFalse(result.hasDiagnostics());
		assertEquals(Collections.singletonList(2L), result.getStatementLiterals());
		assertEquals("x y", result.getRoot().toString());
	}

	@Test
	public void testMissingClosingBracket() {
		ParseResult result = parse("A_{i");
		assertEquals(1, result.getDiagnostics().size());
		assertTrue(result.getDiagnostics().get(0).getMessage().contains("closing bracket"));
		assertEquals("A_{i}", result.getRoot().toString());
	}

	@Test
	public void testMissingOperand() {
		ParseResult result = parse("A_{N-}");
		assertTrue(result.hasDiagnostics());
		Item item = (Item) result.getRoot().getChildren().get(0);
		assertEquals("A_{N - " + Parser.ERROR_NAME + "}", item.toString());
	}

	@Test
	public void testUnexpectedTokenIsSkipped() {
		ParseResult result = parse("N ) M");
		assertEquals(1, result.getDiagnostics().size());
		Diagnostic diagnostic = result.getDiagnostics().get(0);
		assertEquals(1, diagnostic.getLine());
		assertEquals(3, diagnostic.getColumn());
		assertEquals("N M", result.getRoot().toString());
	}
}
