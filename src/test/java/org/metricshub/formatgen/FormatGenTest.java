package org.metricshub.formatgen;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.formatgen.backend.ContextBundle;
import org.metricshub.formatgen.backend.QueryCase;
import org.metricshub.formatgen.backend.TemplateConfigException;
import org.metricshub.formatgen.frontend.ast.Item;
import org.metricshub.formatgen.intermediate.InputPart;
import org.metricshub.formatgen.intermediate.VariableDescriptor;
import org.metricshub.formatgen.typing.MatchException;
import org.metricshub.formatgen.typing.VarType;
import org.metricshub.formatgen.util.GeneratorSettings;

public class FormatGenTest {

	private static final String QUERY_SAMPLE = "3 3\n5 6 7\n1 2 10\n2 1\n1 3 4\n";

	@Test
	public void testScalars() {
		InputPart part = new FormatGen().process("N M", "3 4");
		assertEquals("[{N,int,0,[]}, {M,int,0,[]}]", part.getVariables().toString());
	}

	@Test
	public void testSequenceWithExplicitTerms() {
		InputPart part = new FormatGen().process("N\na_1 a_2 a_3 … a_N", "4\n1 2 3 4");
		assertEquals("N for i in 1..N { a_{i} }", part.getTree().toString());
		VariableDescriptor a = part.getVariable("a");
		assertEquals(VarType.INT, a.getType());
		assertEquals(1, a.getDimensions());
		assertEquals(new Item("N"), a.getLength(0));
	}

	@Test
	public void testLoopVariableCollision() {
		assertEquals("for j in i..N { A_{j} }", new FormatGen().normalize("A_i … A_N").toString());
	}

	@Test
	public void testDiagnosticsAndDiscriminator() {
		InputPart part = new FormatGen().process("3 x_{1", "7");
		assertEquals(Long.valueOf(3), part.getDiscriminator());
		assertEquals(1, part.getDiagnostics().size());
		assertEquals("x1", part.getVariables().get(0).getName());
	}

	@Test
	public void testFormatsFollowingEachOther() {
		ProblemInput problem = new ProblemInput(
				Arrays.asList("N\nA_1 ... A_N", "M\nB_1 ... B_M"),
				Collections.singletonList(new Sample("2\n1 2\n3\n1.5 2 3\n")),
				false);
		List<InputPart> parts = new FormatGen().process(problem);
		assertEquals(2, parts.size());
		assertEquals(VarType.INT, parts.get(0).getVariable("A").getType());
		assertEquals(VarType.INDEX_INT, parts.get(1).getVariable("M").getType());
		assertEquals(VarType.FLOAT, parts.get(1).getVariable("B").getType());
	}

	@Test
	public void testQueries() {
		GeneratorSettings settings = new GeneratorSettings();
		settings.setQueryMode(true);
		ProblemInput problem = new ProblemInput(
				Arrays.asList("N Q\nA_1 A_2 ... A_N", "1 x y", "2 k"),
				Collections.singletonList(new Sample(QUERY_SAMPLE)),
				false);
		FormatGen formatGen = new FormatGen(settings);

		List<InputPart> parts = formatGen.process(problem);
		assertEquals(Long.valueOf(1), parts.get(1).getDiscriminator());
		assertEquals("[{x,int,0,[]}, {y,int,0,[]}]", parts.get(1).getVariables().toString());
		assertEquals("[{k,int,0,[]}]", parts.get(2).getVariables().toString());

		ContextBundle bundle = formatGen.generate(problem);
		assertTrue(bundle.isQueryMode());
		assertEquals("Q", bundle.getQueryCountVariable());
		assertEquals("long long N, long long Q, std::vector<long long> A", bundle.getFormalArguments());
		List<QueryCase> cases = bundle.getQueryCases();
		assertEquals(2, cases.size());
		assertEquals(1L, cases.get(0).getDiscriminator());
		assertEquals("long long x, long long y", cases.get(0).getFormalArguments());
		assertTrue(bundle.getInputPart(), bundle.getInputPart().contains("for(int j = 0 ; j < Q ; j++){"));
		assertTrue(bundle.getInputPart(), bundle.getInputPart().contains("if(type == 2){"));
	}

	@Test
	public void testMultipleCases() {
		ProblemInput problem = new ProblemInput(
				Collections.singletonList("N\nA_1 A_2 ... A_N"),
				Collections.singletonList(new Sample("2\n3\n1 2 3\n1\n5\n")),
				true);
		FormatGen formatGen = new FormatGen();
		assertEquals(VarType.INDEX_INT, formatGen.process(problem).get(0).getVariable("N").getType());

		ContextBundle bundle = formatGen.generate(problem);
		assertTrue(bundle.isMultipleCases());
		assertEquals("T", bundle.getCaseCountVariable());
	}

	@Test
	public void testStrictTyping() {
		assertThrows(
				MatchException.class,
				() -> new FormatGen().process("N\nA_1 B_1\n\\vdots\nA_N B_N", "3 1 1"));
	}

	@Test
	public void testLenientTyping() {
		GeneratorSettings settings = new GeneratorSettings();
		settings.setStrictTyping(false);
		InputPart part = new FormatGen(settings).process("N\nA_1 B_1\n\\vdots\nA_N B_N", "3 1 1");
		assertEquals("[{N,int,0,[]}, {A,int,1,[N]}, {B,int,1,[N]}]", part.getVariables().toString());
	}

	@Test
	public void testGenerateWithJavaTemplates() {
		GeneratorSettings settings = new GeneratorSettings();
		settings.setTemplateName("java");
		ContextBundle bundle = new FormatGen(settings).generate(ProblemInput.of("N S", "3 abc"));
		assertEquals("long N, String S", bundle.getFormalArguments());
	}

	@Test
	public void testMissingTemplateFile() {
		GeneratorSettings settings = new GeneratorSettings();
		settings.setTemplatePath("does/not/exist.properties");
		assertThrows(TemplateConfigException.class, () -> new FormatGen(settings).getTemplateConfig());
	}

	@Test
	public void testProblemNeedsAFormat() {
		assertThrows(
				IllegalArgumentException.class,
				() -> new ProblemInput(Collections.<String>emptyList(), Collections.<Sample>emptyList(), false));
	}
}
