package org.metricshub.formatgen.backend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * FormatGen
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.formatgen.frontend.LoopVariables;
import org.metricshub.formatgen.frontend.ast.BinaryOperation;
import org.metricshub.formatgen.frontend.ast.Expression;
import org.metricshub.formatgen.frontend.ast.Expressions;
import org.metricshub.formatgen.frontend.ast.Format;
import org.metricshub.formatgen.frontend.ast.Item;
import org.metricshub.formatgen.frontend.ast.Loop;
import org.metricshub.formatgen.frontend.ast.NodeVisitor;
import org.metricshub.formatgen.frontend.ast.NumberLiteral;
import org.metricshub.formatgen.frontend.ast.Statement;
import org.metricshub.formatgen.intermediate.InputPart;
import org.metricshub.formatgen.intermediate.VariableDescriptor;
import org.metricshub.formatgen.typing.VarType;
import org.metricshub.formatgen.util.FormatGenLogger;
import org.metricshub.formatgen.util.GeneratorSettings;
import org.slf4j.Logger;

/**
 * Generates the code reading an input, for any target language described by
 * a {@link TemplateConfig}.
 * <p>
 * The reading code follows the format tree: a loop of the tree becomes a loop
 * of the target language running from 0 to its number of iterations, and an
 * item becomes the read of a scalar or of an array element. Indices are
 * shifted so that arrays start at 0.
 * <p>
 * When several parts are generated, a variable read by two parts with
 * different types or dimensions is renamed with the number of the part
 * ({@code x_2}); otherwise both parts share it. In query mode, the first part
 * is read once and the other parts are cases of a loop over the queries,
 * selected by the kind of the query.
 */
public class UniversalGenerator {

	private static final Logger LOG = FormatGenLogger.getLogger(UniversalGenerator.class);

	private static final String DEFAULT_COMMENT = "// {text}";

	private final TemplateConfig config;
	private final GeneratorSettings settings;
	private final String indent;

	/**
	 * Creates a generator with default settings.
	 *
	 * @param config the templates of the target language
	 */
	public UniversalGenerator(TemplateConfig config) {
		this(config, new GeneratorSettings());
	}

	/**
	 * @param config the templates of the target language
	 * @param settings multiple cases and query options
	 */
	public UniversalGenerator(TemplateConfig config, GeneratorSettings settings) {
		this.config = config;
		this.settings = settings;
		this.indent = config.getIndent();
	}

	/**
	 * One line of generated code and its nesting level.
	 */
	private static final class Line {
		private final int depth;
		private final String text;

		private Line(int depth, String text) {
			this.depth = depth;
			this.text = text;
		}
	}

	/**
	 * The variables of all the parts, once name conflicts are resolved.
	 */
	private static final class Resolution {
		private final List<VariableDescriptor> all = new ArrayList<VariableDescriptor>();
		private final Map<String, VariableDescriptor> byName = new HashMap<String, VariableDescriptor>();
		private final List<Map<String, VariableDescriptor>> scopes = new ArrayList<Map<String, VariableDescriptor>>();
	}

	/**
	 * What a sequence of reads knows while it is generated.
	 */
	private static final class Block {
		private final Map<String, VariableDescriptor> scope;
		private final Set<String> declared;
		private final Set<String> hoisted;
		private final Set<String> allocated = new HashSet<String>();
		private final List<Line> lines = new ArrayList<Line>();

		private Block(Map<String, VariableDescriptor> scope, Set<String> declared, Set<String> hoisted) {
			this.scope = scope;
			this.declared = declared;
			this.hoisted = hoisted;
		}

		private void add(int depth, String text) {
			lines.add(new Line(depth, text));
		}
	}

	/**
	 * Generates the code of a single format.
	 *
	 * @param part the processed format
	 * @return the generated pieces of code
	 */
	public ContextBundle generate(InputPart part) {
		return generate(Collections.singletonList(part));
	}

	/**
	 * Generates the code of one or more formats.
	 *
	 * @param parts the processed formats; in query mode the setup part first
	 * @return the generated pieces of code
	 */
	public ContextBundle generate(List<InputPart> parts) {
		return generate(parts, settings.isMultipleCases());
	}

	/**
	 * Generates the code of one or more formats.
	 *
	 * @param parts the processed formats; in query mode the setup part first
	 * @param multipleCases whether the input starts with a number of test cases
	 * @return the generated pieces of code
	 */
	public ContextBundle generate(List<InputPart> parts, boolean multipleCases) {
		if (parts.isEmpty()) {
			throw new IllegalArgumentException("Nothing to generate: no input part");
		}
		Resolution resolution = resolve(parts);

		ContextBundle bundle = new ContextBundle();
		bundle.setDeclarations(renderDeclarations(resolution.all, resolution.byName));

		if (multipleCases) {
			String name = freeName(settings.getTestCaseVariable(), resolution, parts);
			List<Line> lines = new ArrayList<Line>();
			lines.add(new Line(0, declare(new VariableDescriptor(name, VarType.INT, Collections.<Expression>emptyList()), Collections.<String, VariableDescriptor>emptyMap())));
			lines.add(new Line(0, config.format("input.int", parameters("name", name))));
			bundle.setMultipleCases(true);
			bundle.setCaseCountVariable(name);
			bundle.setCaseCountPart(render(lines, 1));
		}

		boolean queryMode = settings.isQueryMode() && parts.size() > 1;
		if (settings.isQueryMode() && !queryMode) {
			LOG.warn("Query mode needs a setup format and at least one query format, generating a plain format instead");
		}
		if (queryMode) {
			generateQueries(parts, resolution, bundle);
		} else {
			generateSequence(parts, resolution, bundle);
		}
		return bundle;
	}

	// ---------------------------------------------------------------------
	// Name resolution
	// ---------------------------------------------------------------------

	private Resolution resolve(List<InputPart> parts) {
		Resolution resolution = new Resolution();
		for (int p = 0; p < parts.size(); p++) {
			Map<String, VariableDescriptor> scope = new LinkedHashMap<String, VariableDescriptor>();
			for (VariableDescriptor variable : parts.get(p).getVariables()) {
				VariableDescriptor resolved = variable;
				VariableDescriptor existing = resolution.byName.get(variable.getName());
				if (existing != null && isCompatible(existing, variable)) {
					resolved = existing;
				} else if (existing != null) {
					String renamed = variable.getName() + "_" + p;
					LOG.debug("{} has another type or shape in part {}, renamed {}", variable.getName(), p, renamed);
					VariableDescriptor previous = resolution.byName.get(renamed);
					resolved = previous != null && isCompatible(previous, variable) ? previous : variable.withName(renamed);
				}
				if (!resolution.byName.containsKey(resolved.getName())) {
					resolution.byName.put(resolved.getName(), resolved);
					resolution.all.add(resolved);
				}
				scope.put(variable.getName(), resolved);
			}
			resolution.scopes.add(scope);
		}
		return resolution;
	}

	private static boolean isCompatible(VariableDescriptor a, VariableDescriptor b) {
		return typeKey(a.getType()).equals(typeKey(b.getType())) && a.getDimensions() == b.getDimensions();
	}

	/**
	 * @return {@code base}, followed by underscores until it names no variable
	 */
	private static String freeName(String base, Resolution resolution, List<InputPart> parts) {
		Set<String> used = new HashSet<String>(resolution.byName.keySet());
		for (InputPart part : parts) {
			for (Statement statement : part.getTree().getChildren()) {
				Expressions.collectStatementNames(statement, used);
			}
		}
		String name = base;
		while (used.contains(name)) {
			name = name + "_";
		}
		return name;
	}

	// ---------------------------------------------------------------------
	// Plain formats
	// ---------------------------------------------------------------------

	private void generateSequence(List<InputPart> parts, Resolution resolution, ContextBundle bundle) {
		Set<String> declared = new HashSet<String>();
		List<Line> lines = new ArrayList<Line>();
		for (int p = 0; p < parts.size(); p++) {
			if (p > 0) {
				lines.add(new Line(0, ""));
				lines.add(new Line(0, comment("Additional input format " + p)));
			}
			Block block = new Block(resolution.scopes.get(p), declared, Collections.<String>emptySet());
			emit(parts.get(p).getTree().getChildren(), 0, new ArrayDeque<Loop>(), block);
			lines.addAll(block.lines);
		}
		bundle.setInputPart(render(lines, 1));
		bundle.setFormalArguments(formalArguments(resolution.all));
		bundle.setActualArguments(actualArguments(resolution.all));
	}

	// ---------------------------------------------------------------------
	// Query formats
	// ---------------------------------------------------------------------

	private void generateQueries(List<InputPart> parts, Resolution resolution, ContextBundle bundle) {
		Map<String, VariableDescriptor> setupScope = resolution.scopes.get(0);
		Set<String> declared = new HashSet<String>();

		Block setup = new Block(setupScope, declared, Collections.<String>emptySet());
		emit(parts.get(0).getTree().getChildren(), 0, new ArrayDeque<Loop>(), setup);

		String countVariable = findQueryCount(parts.get(0), setupScope);
		String typeVariable = freeName(settings.getQueryTypeVariable(), resolution, parts);
		Set<String> used = new HashSet<String>(resolution.byName.keySet());
		for (InputPart part : parts) {
			for (Statement statement : part.getTree().getChildren()) {
				Expressions.collectStatementNames(statement, used);
			}
		}
		used.add(typeVariable);
		String queryLoopVariable = LoopVariables.choose(used);

		List<Line> lines = new ArrayList<Line>(setup.lines);
		lines.add(new Line(0, config.format("query.loop_header", parameters(
				"loop_var", queryLoopVariable,
				"length", countVariable == null ? unresolved("query count") : countVariable))));
		lines.add(new Line(1, declare(new VariableDescriptor(typeVariable, VarType.QUERY, Collections.<Expression>emptyList()), setupScope)));
		lines.add(new Line(1, config.format("input.int", parameters("name", typeVariable))));
		declared.add(typeVariable);

		// variables read by several kinds of queries are declared once, before the cases
		Set<String> hoisted = sharedQueryVariables(resolution, declared);
		for (String name : hoisted) {
			lines.add(new Line(1, declareOnly(resolution.byName.get(name))));
		}
		declared.addAll(hoisted);

		List<QueryCase> cases = new ArrayList<QueryCase>();
		for (int p = 1; p < parts.size(); p++) {
			InputPart part = parts.get(p);
			long discriminator = part.getDiscriminator() != null ? part.getDiscriminator().longValue() : p;
			Block block = new Block(resolution.scopes.get(p), new HashSet<String>(declared), hoisted);
			emit(part.getTree().getChildren(), 0, new ArrayDeque<Loop>(), block);

			lines.add(new Line(1, config.format("query.case_header", parameters("name", typeVariable, "value", String.valueOf(discriminator)))));
			for (Line line : block.lines) {
				lines.add(new Line(line.depth + 2, line.text));
			}
			lines.add(new Line(1, config.format("query.case_footer", parameters("name", typeVariable, "value", String.valueOf(discriminator)))));

			Collection<VariableDescriptor> caseVariables = new LinkedHashSet<VariableDescriptor>(resolution.scopes.get(p).values());
			cases.add(new QueryCase(discriminator, render(block.lines, 1), formalArguments(caseVariables), actualArguments(caseVariables)));
		}
		lines.add(new Line(0, config.format("query.loop_footer", parameters("loop_var", queryLoopVariable))));

		Collection<VariableDescriptor> setupVariables = new LinkedHashSet<VariableDescriptor>(setupScope.values());
		bundle.setQueryMode(true);
		bundle.setSetupPart(render(setup.lines, 1));
		bundle.setQueryCountVariable(countVariable);
		bundle.setQueryTypeVariable(typeVariable);
		bundle.setQueryCases(cases);
		bundle.setInputPart(render(lines, 1));
		bundle.setFormalArguments(formalArguments(setupVariables));
		bundle.setActualArguments(actualArguments(setupVariables));
	}

	/**
	 * Finds the number of queries among the setup variables: {@code Q} or
	 * {@code q}, otherwise the last integer scalar that is not the size of
	 * something read by the setup.
	 *
	 * @return the resolved name of the count, or {@code null}
	 */
	private String findQueryCount(InputPart setup, Map<String, VariableDescriptor> scope) {
		for (VariableDescriptor variable : setup.getVariables()) {
			if (variable.getDimensions() == 0 && ("Q".equals(variable.getName()) || "q".equals(variable.getName()))) {
				return scope.get(variable.getName()).getName();
			}
		}
		Set<String> sizeNames = new HashSet<String>();
		collectBoundNames(setup.getTree().getChildren(), sizeNames);
		for (VariableDescriptor variable : setup.getVariables()) {
			for (Expression size : variable.getSizes()) {
				Expressions.collectNames(size, sizeNames);
			}
		}
		String candidate = null;
		for (VariableDescriptor variable : setup.getVariables()) {
			if (variable.getDimensions() == 0
					&& "int".equals(typeKey(variable.getType()))
					&& variable.getType() != VarType.QUERY
					&& !sizeNames.contains(variable.getName())) {
				candidate = scope.get(variable.getName()).getName();
			}
		}
		if (candidate == null) {
			LOG.warn("Cannot find the number of queries among {}", setup.getVariables());
		}
		return candidate;
	}

	private static void collectBoundNames(List<Statement> statements, Set<String> names) {
		for (Statement statement : statements) {
			if (statement instanceof Loop) {
				Loop loop = (Loop) statement;
				Expressions.collectNames(loop.getStart(), names);
				Expressions.collectNames(loop.getEnd(), names);
				collectBoundNames(loop.getBody(), names);
			}
		}
	}

	private static Set<String> sharedQueryVariables(Resolution resolution, Set<String> declared) {
		Map<String, Integer> counts = new LinkedHashMap<String, Integer>();
		for (int p = 1; p < resolution.scopes.size(); p++) {
			for (VariableDescriptor variable : new LinkedHashSet<VariableDescriptor>(resolution.scopes.get(p).values())) {
				Integer count = counts.get(variable.getName());
				counts.put(variable.getName(), count == null ? 1 : count + 1);
			}
		}
		Set<String> shared = new LinkedHashSet<String>();
		for (Map.Entry<String, Integer> entry : counts.entrySet()) {
			if (entry.getValue() > 1 && !declared.contains(entry.getKey())) {
				shared.add(entry.getKey());
			}
		}
		return shared;
	}

	// ---------------------------------------------------------------------
	// Reads
	// ---------------------------------------------------------------------

	private void emit(List<Statement> statements, int depth, Deque<Loop> loops, Block block) {
		for (Statement statement : statements) {
			prepare(statement, depth, block);
			if (statement instanceof Loop) {
				Loop loop = (Loop) statement;
				Expression length = toCode(Expressions.count(loop.getStart(), loop.getEnd()), loops);
				block.add(depth, config.format("loop.header", parameters(
						"loop_var", loop.getVariable(),
						"length", expression(length, block.scope))));
				loops.push(loop);
				emit(loop.getBody(), depth + 1, loops, block);
				loops.pop();
				block.add(depth, config.format("loop.footer", parameters("loop_var", loop.getVariable())));
			} else {
				block.add(depth, read((Item) statement, loops, block.scope));
			}
		}
	}

	/**
	 * Declares, or allocates, the variables read by a statement that are not
	 * declared yet.
	 */
	private void prepare(Statement statement, int depth, Block block) {
		Set<String> names = new LinkedHashSet<String>();
		collectReadNames(statement, names);
		for (String name : names) {
			VariableDescriptor variable = block.scope.get(name);
			if (variable == null) {
				continue;
			}
			if (block.hoisted.contains(variable.getName())) {
				if (variable.getDimensions() > 0 && block.allocated.add(variable.getName())) {
					block.add(depth, allocate(variable, block.scope));
				}
			} else if (block.declared.add(variable.getName())) {
				block.add(depth, declare(variable, block.scope));
			}
		}
	}

	private static void collectReadNames(Statement statement, Set<String> names) {
		if (statement instanceof Loop) {
			for (Statement child : ((Loop) statement).getBody()) {
				collectReadNames(child, names);
			}
		} else {
			names.add(((Item) statement).getName());
		}
	}

	private String read(Item item, Deque<Loop> loops, Map<String, VariableDescriptor> scope) {
		VariableDescriptor variable = scope.get(item.getName());
		if (variable == null) {
			return unresolved(item.getName());
		}
		String key = "input." + typeKey(variable.getType());
		int dimensions = variable.getDimensions();
		if (dimensions == 0) {
			return config.format(key, parameters("name", variable.getName()));
		}
		if (dimensions > 2 || !addresses(item, variable)) {
			return unresolved(variable.getName());
		}
		String access;
		if (dimensions == 1) {
			access = config.format("access.seq", parameters(
					"name", variable.getName(),
					"index", index(item, variable, 0, loops, scope)));
		} else {
			access = config.format("access.2d_seq", parameters(
					"name", variable.getName(),
					"index_i", index(item, variable, 0, loops, scope),
					"index_j", index(item, variable, 1, loops, scope)));
		}
		return config.format(key, parameters("name", access));
	}

	/**
	 * @return whether the read has an index for every dimension of the variable
	 */
	private static boolean addresses(Item item, VariableDescriptor variable) {
		for (int d = 0; d < variable.getDimensions(); d++) {
			if (variable.getIndexPosition(d) >= item.getIndices().size()) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Renders the index of one dimension of a read, relative to the first
	 * index of this dimension.
	 */
	private String index(Item item, VariableDescriptor variable, int dimension, Deque<Loop> loops, Map<String, VariableDescriptor> scope) {
		Expression index = item.getIndices().get(variable.getIndexPosition(dimension));
		Expression start = variable.getStart(dimension);
		for (Loop loop : loops) {
			if (Expressions.isReferenceTo(index, loop.getVariable()) && loop.getStart().equals(start)) {
				return loop.getVariable();
			}
		}
		return expression(relative(toCode(index, loops), start == null ? null : toCode(start, loops)), scope);
	}

	/**
	 * @return {@code index} minus {@code start}, or {@code index} when the start is unknown
	 */
	private static Expression relative(Expression index, Expression start) {
		if (start instanceof NumberLiteral) {
			return Expressions.shift(index, -((NumberLiteral) start).getValue());
		}
		return start == null ? index : new BinaryOperation('-', index, start);
	}

	/**
	 * Rewrites an expression over the loop variables of the format into the
	 * same expression over the loop variables of the generated code, which
	 * start at 0.
	 */
	private static Expression toCode(Expression expression, Deque<Loop> loops) {
		Expression result = expression;
		// innermost first, as the start of a loop may use outer loop variables
		for (Loop loop : loops) {
			Expression variable = new Item(loop.getVariable());
			Expression value = loop.getStart() instanceof NumberLiteral
					? Expressions.shift(variable, ((NumberLiteral) loop.getStart()).getValue())
					: new BinaryOperation('+', variable, loop.getStart());
			result = Expressions.substitute(result, loop.getVariable(), value);
		}
		return result;
	}

	// ---------------------------------------------------------------------
	// Declarations and arguments
	// ---------------------------------------------------------------------

	private String renderDeclarations(List<VariableDescriptor> variables, Map<String, VariableDescriptor> scope) {
		List<Line> lines = new ArrayList<Line>();
		for (VariableDescriptor variable : variables) {
			lines.add(new Line(0, declare(variable, scope)));
		}
		return render(lines, 1);
	}

	/**
	 * Declares a variable, allocating arrays.
	 */
	private String declare(VariableDescriptor variable, Map<String, VariableDescriptor> scope) {
		String key = typeKey(variable.getType());
		switch (variable.getDimensions()) {
		case 0:
			return config.format("declare." + key, parameters("name", variable.getName()));
		case 1:
			return config.format("declare_and_allocate.seq", parameters(
					"name", variable.getName(),
					"type", config.get("type." + key),
					"default", config.get("default." + key),
					"length", expression(variable.getLength(0), scope)));
		case 2:
			return config.format("declare_and_allocate.2d_seq", parameters(
					"name", variable.getName(),
					"type", config.get("type." + key),
					"default", config.get("default." + key),
					"length_i", expression(variable.getLength(0), scope),
					"length_j", expression(variable.getLength(1), scope)));
		default:
			return unresolved(variable.getName());
		}
	}

	/**
	 * Declares a variable without allocating it.
	 */
	private String declareOnly(VariableDescriptor variable) {
		String key = typeKey(variable.getType());
		if (variable.getDimensions() == 0) {
			return config.format("declare." + key, parameters("name", variable.getName()));
		}
		String template = variable.getDimensions() == 1 ? "declare.seq" : "declare.2d_seq";
		if (variable.getDimensions() > 2 || !config.has(template)) {
			return unresolved(variable.getName());
		}
		return config.format(template, parameters("name", variable.getName(), "type", config.get("type." + key)));
	}

	private String allocate(VariableDescriptor variable, Map<String, VariableDescriptor> scope) {
		String key = typeKey(variable.getType());
		String template = variable.getDimensions() == 1 ? "allocate.seq" : "allocate.2d_seq";
		if (variable.getDimensions() > 2 || !config.has(template)) {
			return unresolved(variable.getName());
		}
		Map<String, String> parameters = parameters(
				"name", variable.getName(),
				"type", config.get("type." + key),
				"default", config.get("default." + key));
		if (variable.getDimensions() == 1) {
			parameters.put("length", expression(variable.getLength(0), scope));
		} else {
			parameters.put("length_i", expression(variable.getLength(0), scope));
			parameters.put("length_j", expression(variable.getLength(1), scope));
		}
		return config.format(template, parameters);
	}

	private String formalArguments(Collection<VariableDescriptor> variables) {
		StringBuilder sb = new StringBuilder();
		for (VariableDescriptor variable : variables) {
			if (sb.length() > 0) {
				sb.append(", ");
			}
			String key = typeKey(variable.getType());
			Map<String, String> parameters = parameters("name", variable.getName(), "type", config.get("type." + key));
			switch (variable.getDimensions()) {
			case 0:
				sb.append(config.format("arg." + key, parameters));
				break;
			case 1:
				sb.append(config.format("arg.seq", parameters));
				break;
			case 2:
				sb.append(config.format("arg.2d_seq", parameters));
				break;
			default:
				sb.append(unresolved(variable.getName()));
			}
		}
		return sb.toString();
	}

	private String actualArguments(Collection<VariableDescriptor> variables) {
		StringBuilder sb = new StringBuilder();
		for (VariableDescriptor variable : variables) {
			if (sb.length() > 0) {
				sb.append(", ");
			}
			String template = variable.getDimensions() == 1 ? "actual_arg.seq" : "actual_arg.2d_seq";
			if (variable.getDimensions() > 0 && config.has(template)) {
				sb.append(config.format(template, parameters("name", variable.getName())));
			} else {
				sb.append(variable.getName());
			}
		}
		return sb.toString();
	}

	// ---------------------------------------------------------------------
	// Text
	// ---------------------------------------------------------------------

	/**
	 * @return the template key of a type: {@code int}, {@code float} or {@code str}
	 */
	static String typeKey(VarType type) {
		switch (type) {
		case FLOAT:
			return "float";
		case CHAR:
		case STRING:
			return "str";
		default:
			return "int";
		}
	}

	private String unresolved(String name) {
		LOG.warn("Cannot generate the code for {}", name);
		return TemplateConfig.substitute(config.get("unresolved", TemplateConfig.DEFAULT_UNRESOLVED), parameters("name", name));
	}

	private String comment(String text) {
		return TemplateConfig.substitute(config.get("comment", DEFAULT_COMMENT), parameters("text", text));
	}

	private String render(List<Line> lines, int baseDepth) {
		StringBuilder sb = new StringBuilder();
		for (Line line : lines) {
			if (sb.length() > 0) {
				sb.append('\n');
			}
			if (!line.text.isEmpty()) {
				for (int i = 0; i < line.depth + baseDepth; i++) {
					sb.append(indent);
				}
				sb.append(line.text);
			}
		}
		return sb.toString();
	}

	private static Map<String, String> parameters(String... keysAndValues) {
		Map<String, String> parameters = new HashMap<String, String>();
		for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
			parameters.put(keysAndValues[i], keysAndValues[i + 1]);
		}
		return parameters;
	}

	/**
	 * Renders an expression in the target language, with renamed variables
	 * and array accesses.
	 */
	private String expression(Expression expression, Map<String, VariableDescriptor> scope) {
		return expression.accept(new ExpressionRenderer(scope));
	}

	private final class ExpressionRenderer implements NodeVisitor<String> {

		private final Map<String, VariableDescriptor> scope;

		private ExpressionRenderer(Map<String, VariableDescriptor> scope) {
			this.scope = scope;
		}

		@Override
		public String visitNumber(NumberLiteral number) {
			return String.valueOf(number.getValue());
		}

		@Override
		public String visitItem(Item item) {
			VariableDescriptor variable = scope.get(item.getName());
			String name = variable == null ? item.getName() : variable.getName();
			if (item.getIndices().isEmpty()) {
				return name;
			}
			List<Expression> indices = new ArrayList<Expression>(item.getIndices());
			if (variable != null && variable.getDimensions() > 0 && addresses(item, variable)) {
				// array elements are stored from 0
				indices.clear();
				for (int d = 0; d < variable.getDimensions(); d++) {
					indices.add(relative(item.getIndices().get(variable.getIndexPosition(d)), variable.getStart(d)));
				}
			}
			if (indices.size() == 1) {
				return config.format("access.seq", parameters("name", name, "index", indices.get(0).accept(this)));
			}
			if (indices.size() == 2) {
				return config.format("access.2d_seq", parameters(
						"name", name,
						"index_i", indices.get(0).accept(this),
						"index_j", indices.get(1).accept(this)));
			}
			return unresolved(name);
		}

		@Override
		public String visitBinaryOperation(BinaryOperation operation) {
			return operand(operation, operation.getLeft(), false)
					+ " " + operation.getOperator() + " "
					+ operand(operation, operation.getRight(), true);
		}

		private String operand(BinaryOperation parent, Expression operand, boolean rightSide) {
			String text = operand.accept(this);
			if (!(operand instanceof BinaryOperation)) {
				return text;
			}
			int parentPrecedence = precedence(parent.getOperator());
			int operandPrecedence = precedence(((BinaryOperation) operand).getOperator());
			boolean parenthesize = operandPrecedence < parentPrecedence
					|| (rightSide && operandPrecedence == parentPrecedence && (parent.getOperator() == '-' || parent.getOperator() == '/'));
			return parenthesize ? "(" + text + ")" : text;
		}

		private int precedence(char operator) {
			return operator == '+' || operator == '-' ? 1 : 2;
		}

		@Override
		public String visitFormat(Format format) {
			throw new IllegalArgumentException("A format is not an expression");
		}

		@Override
		public String visitLoop(Loop loop) {
			throw new IllegalArgumentException("A loop is not an expression");
		}
	}
}
