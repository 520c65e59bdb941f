package org.metricshub.formatgen.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.formatgen.FormatGen;
import org.metricshub.formatgen.frontend.ast.BinaryOperation;
import org.metricshub.formatgen.frontend.ast.Expression;
import org.metricshub.formatgen.frontend.ast.Format;
import org.metricshub.formatgen.frontend.ast.Item;
import org.metricshub.formatgen.frontend.ast.Loop;
import org.metricshub.formatgen.frontend.ast.NumberLiteral;
import org.metricshub.formatgen.intermediate.InputPart;
import org.metricshub.formatgen.intermediate.VariableDescriptor;
import org.metricshub.formatgen.typing.VarType;
import org.metricshub.formatgen.util.GeneratorSettings;

public class UniversalGeneratorTest {

	private static final String SEQUENCE = "N\nA_1 A_2 ... A_N";

	private static String lines(String... lines) {
		return String.join("\n", lines);
	}

	private static UniversalGenerator cpp() {
		return new UniversalGenerator(TemplateRegistry.resolve("cpp"));
	}

	private static VariableDescriptor scalar(String name, VarType type) {
		return new VariableDescriptor(name, type, Collections.<Expression>emptyList());
	}

	@Test
	public void testSequence() {
		ContextBundle bundle = cpp().generate(new FormatGen().process(SEQUENCE, "3\n1 2 3"));
		assertEquals(lines("    long long N;", "    std::vector<long long> A(N);"), bundle.getDeclarations());
		assertEquals(
				lines(
						"    long long N;",
						"    std::cin >> N;",
						"    std::vector<long long> A(N);",
						"    for(int i = 0 ; i < N ; i++){",
						"        std::cin >> A[i];",
						"    }"),
				bundle.getInputPart());
		assertEquals("long long N, std::vector<long long> A", bundle.getFormalArguments());
		assertEquals("N, std::move(A)", bundle.getActualArguments());
		assertFalse(bundle.isMultipleCases());
		assertFalse(bundle.isQueryMode());
	}

	@Test
	public void testJavaTemplates() {
		ContextBundle bundle = new UniversalGenerator(TemplateRegistry.resolve("java"))
				.generate(new FormatGen().process(SEQUENCE, "2\n1.5 2"));
		assertEquals(
				lines(
						"    long N;",
						"    N = sc.nextLong();",
						"    double[] A = new double[(int) (N)];",
						"    for (int i = 0; i < N; i++) {",
						"        A[(int) (i)] = sc.nextDouble();",
						"    }"),
				bundle.getInputPart());
		assertEquals("long N, double[] A", bundle.getFormalArguments());
		assertEquals("N, A", bundle.getActualArguments());
	}

	@Test
	public void testZeroBasedGrid() {
		InputPart part = new FormatGen().process(
				"H W\nA_{0,0} ... A_{0,W-1}\n\\vdots\nA_{H-1,0} ... A_{H-1,W-1}",
				"2 2\n1 2\n3 4");
		ContextBundle bundle = cpp().generate(part);
		assertEquals(
				lines(
						"    long long H;",
						"    std::cin >> H;",
						"    long long W;",
						"    std::cin >> W;",
						"    std::vector<std::vector<long long>> A(H, std::vector<long long>(W));",
						"    for(int j = 0 ; j < H ; j++){",
						"        for(int i = 0 ; i < W ; i++){",
						"            std::cin >> A[j][i];",
						"        }",
						"    }"),
				bundle.getInputPart());
		assertEquals("long long H, long long W, std::vector<std::vector<long long>> A", bundle.getFormalArguments());
	}

	@Test
	public void testIndicesAreShifted() {
		Item n = new Item("N");
		Format tree = new Format(Arrays.asList(
				n,
				new Loop(
						"i",
						new NumberLiteral(0),
						new BinaryOperation('-', n, new NumberLiteral(1)),
						Arrays.asList(new Item("A", Arrays.asList(new BinaryOperation('+', new Item("i"), new NumberLiteral(1))))))));
		List<VariableDescriptor> variables = Arrays.asList(
				scalar("N", VarType.INDEX_INT),
				new VariableDescriptor("A", VarType.INT, Arrays.asList(n), Arrays.asList(new NumberLiteral(1)), 1));
		ContextBundle bundle = cpp().generate(new InputPart(variables, tree));
		assertTrue(bundle.getInputPart(), bundle.getInputPart().contains("for(int i = 0 ; i < N ; i++){"));
		assertTrue(bundle.getInputPart(), bundle.getInputPart().contains("std::cin >> A[i];"));
	}

	@Test
	public void testStringRowReadByItsLoopIndex() {
		ContextBundle bundle = cpp().generate(new FormatGen().process("N\nS_{1,1} S_{1,2} \\ldots S_{1,N}", "3\nab cd ef"));
		assertEquals(lines("    long long N;", "    std::vector<std::string> S(N);"), bundle.getDeclarations());
		assertTrue(bundle.getInputPart(), bundle.getInputPart().contains("std::cin >> S[i];"));
		assertFalse(bundle.getInputPart(), bundle.getInputPart().contains("S[0]"));
	}

	@Test
	public void testElementInBoundIsShifted() {
		ContextBundle bundle = cpp().generate(new FormatGen().process("N\nA_{1} \\ldots A_{N}\nB_1 \\ldots B_{A_1}", "2\n3 5\n7 8 9"));
		assertTrue(bundle.getDeclarations(), bundle.getDeclarations().contains("std::vector<long long> B(A[0]);"));
		assertTrue(bundle.getInputPart(), bundle.getInputPart().contains("std::vector<long long> B(A[0]);"));
		assertTrue(bundle.getInputPart(), bundle.getInputPart().contains("for(int i = 0 ; i < A[0] ; i++){"));
		assertFalse(bundle.getInputPart(), bundle.getInputPart().contains("A[1]"));
	}

	@Test
	public void testMultipleCases() {
		ContextBundle bundle = cpp().generate(Collections.singletonList(new FormatGen().process("N", "3")), true);
		assertTrue(bundle.isMultipleCases());
		assertEquals("T", bundle.getCaseCountVariable());
		assertEquals(lines("    long long T;", "    std::cin >> T;"), bundle.getCaseCountPart());
	}

	@Test
	public void testCaseCountAvoidsFormatNames() {
		ContextBundle bundle = cpp().generate(Collections.singletonList(new FormatGen().process("T", "3")), true);
		assertEquals("T_", bundle.getCaseCountVariable());
	}

	@Test
	public void testConflictingPartsAreRenamed() {
		InputPart first = new InputPart(Arrays.asList(scalar("X", VarType.INT)), new Format(Arrays.asList(new Item("X"))));
		InputPart second = new InputPart(Arrays.asList(scalar("X", VarType.FLOAT)), new Format(Arrays.asList(new Item("X"))));
		ContextBundle bundle = cpp().generate(Arrays.asList(first, second));
		assertEquals(lines("    long long X;", "    long double X_1;"), bundle.getDeclarations());
		assertEquals(
				lines(
						"    long long X;",
						"    std::cin >> X;",
						"",
						"    // Additional input format 1",
						"    long double X_1;",
						"    std::cin >> X_1;"),
				bundle.getInputPart());
		assertEquals("long long X, long double X_1", bundle.getFormalArguments());
	}

	@Test
	public void testCompatiblePartsShareVariables() {
		InputPart first = new InputPart(Arrays.asList(scalar("X", VarType.INT)), new Format(Arrays.asList(new Item("X"))));
		InputPart second = new InputPart(Arrays.asList(scalar("X", VarType.INDEX_INT)), new Format(Arrays.asList(new Item("X"))));
		ContextBundle bundle = cpp().generate(Arrays.asList(first, second));
		assertEquals("    long long X;", bundle.getDeclarations());
		assertEquals("long long X", bundle.getFormalArguments());
	}

	@Test
	public void testQueries() {
		GeneratorSettings settings = new GeneratorSettings();
		settings.setQueryMode(true);
		InputPart setup = new InputPart(Arrays.asList(scalar("Q", VarType.INDEX_INT)), new Format(Arrays.asList(new Item("Q"))));
		InputPart first = new InputPart(
				Arrays.asList(scalar("x", VarType.INT)),
				new Format(Arrays.asList(new Item("x"))),
				Collections.emptyList(),
				Long.valueOf(1));
		InputPart second = new InputPart(
				Arrays.asList(scalar("x", VarType.INT), scalar("y", VarType.INT)),
				new Format(Arrays.asList(new Item("x"), new Item("y"))),
				Collections.emptyList(),
				Long.valueOf(2));

		ContextBundle bundle = new UniversalGenerator(TemplateRegistry.resolve("cpp"), settings)
				.generate(Arrays.asList(setup, first, second));

		assertTrue(bundle.isQueryMode());
		assertEquals("Q", bundle.getQueryCountVariable());
		assertEquals("type", bundle.getQueryTypeVariable());
		assertEquals(lines("    long long Q;", "    std::cin >> Q;"), bundle.getSetupPart());
		assertEquals(
				lines(
						"    long long Q;",
						"    std::cin >> Q;",
						"    for(int i = 0 ; i < Q ; i++){",
						"        long long type;",
						"        std::cin >> type;",
						"        long long x;",
						"        if(type == 1){",
						"            std::cin >> x;",
						"        }",
						"        if(type == 2){",
						"            std::cin >> x;",
						"            long long y;",
						"            std::cin >> y;",
						"        }",
						"    }"),
				bundle.getInputPart());
		assertEquals("long long Q", bundle.getFormalArguments());

		List<QueryCase> cases = bundle.getQueryCases();
		assertEquals(2, cases.size());
		assertEquals(2L, cases.get(1).getDiscriminator());
		assertEquals(lines("    std::cin >> x;", "    long long y;", "    std::cin >> y;"), cases.get(1).getInputPart());
		assertEquals("long long x, long long y", cases.get(1).getFormalArguments());
		assertEquals("x, y", cases.get(1).getActualArguments());
	}

	@Test
	public void testQueryModeNeedsSeveralParts() {
		GeneratorSettings settings = new GeneratorSettings();
		settings.setQueryMode(true);
		ContextBundle bundle = new UniversalGenerator(TemplateRegistry.resolve("cpp"), settings)
				.generate(new FormatGen().process("N", "1"));
		assertFalse(bundle.isQueryMode());
		assertNull(bundle.getSetupPart());
		assertEquals(lines("    long long N;", "    std::cin >> N;"), bundle.getInputPart());
	}

	@Test
	public void testUnsupportedDimensions() {
		Item n = new Item("N");
		VariableDescriptor cube = new VariableDescriptor("B", VarType.INT, Arrays.asList(n, n, n));
		ContextBundle bundle = cpp().generate(new InputPart(Arrays.asList(cube), new Format(Collections.<Item>emptyList())));
		assertEquals("    /* unresolved: B */", bundle.getDeclarations());
	}

	@Test
	public void testNothingToGenerate() {
		assertThrows(IllegalArgumentException.class, () -> cpp().generate(Collections.<InputPart>emptyList()));
	}

	@Test
	public void testTypeKeys() {
		assertEquals("int", UniversalGenerator.typeKey(VarType.INDEX_INT));
		assertEquals("int", UniversalGenerator.typeKey(VarType.QUERY));
		assertEquals("str", UniversalGenerator.typeKey(VarType.CHAR));
		assertEquals("float", UniversalGenerator.typeKey(VarType.FLOAT));
	}
}
