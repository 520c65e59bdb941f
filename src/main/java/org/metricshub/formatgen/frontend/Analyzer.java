package org.metricshub.formatgen.frontend;

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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.formatgen.frontend.ast.BinaryOperation;
import org.metricshub.formatgen.frontend.ast.Expression;
import org.metricshub.formatgen.frontend.ast.Expressions;
import org.metricshub.formatgen.frontend.ast.Format;
import org.metricshub.formatgen.frontend.ast.Item;
import org.metricshub.formatgen.frontend.ast.Loop;
import org.metricshub.formatgen.frontend.ast.Marker;
import org.metricshub.formatgen.frontend.ast.NumberLiteral;
import org.metricshub.formatgen.frontend.ast.RawFormat;
import org.metricshub.formatgen.frontend.ast.RawStatement;
import org.metricshub.formatgen.frontend.ast.Statement;
import org.metricshub.formatgen.util.FormatGenLogger;
import org.slf4j.Logger;

/**
 * Normalizes a raw format tree.
 * <p>
 * The analysis is made of the following passes:
 * <ol>
 * <li>Scalar flattening: an identifier always written with a single literal
 * index, never next to an ellipsis, is a plain scalar ({@code T_1} becomes
 * {@code T1}).
 * <li>Line breaks are dropped.
 * <li>Loop detection around horizontal ellipses, then around vertical
 * ellipses, so that the rows of a grid are loops before the rows themselves
 * are folded.
 * <li>Ellipses that could not be turned into loops are dropped.
 * </ol>
 * A detected loop that starts at a literal is extended backwards over the
 * statements written explicitly before the ellipsis: {@code a_1 a_2 a_3 … a_n}
 * becomes a single loop from 1 to {@code n}.
 */
public class Analyzer {

	private static final Logger LOG = FormatGenLogger.getLogger(Analyzer.class);

	/**
	 * A position where the indices of two otherwise identical statements differ.
	 */
	private static final class IndexDifference {
		private final int position;
		private final Expression from;
		private final Expression to;

		private IndexDifference(int position, Expression from, Expression to) {
			this.position = position;
			this.from = from;
			this.to = to;
		}
	}

	/**
	 * Normalizes a raw tree.
	 *
	 * @param root the raw tree
	 * @return the normalized tree, free of ellipses and line breaks
	 */
	public Format analyze(RawFormat root) {
		List<RawStatement> statements = flattenScalars(root.getChildren());

		List<RawStatement> withoutBreaks = new ArrayList<RawStatement>(statements.size());
		for (RawStatement statement : statements) {
			if (statement != Marker.BREAK) {
				withoutBreaks.add(statement);
			}
		}

		List<RawStatement> folded = detectLoops(detectLoops(withoutBreaks, Marker.DOTS), Marker.VDOTS);

		List<Statement> children = new ArrayList<Statement>(folded.size());
		for (RawStatement statement : folded) {
			if (statement instanceof Marker) {
				LOG.warn("Dropping {} that does not delimit a repeated sequence", statement);
			} else {
				children.add((Statement) statement);
			}
		}
		Format format = new Format(children);
		LOG.debug("Normalized format: {}", format);
		return format;
	}

	/**
	 * Normalizes an already normalized tree again. The result equals the input.
	 *
	 * @param format a normalized tree
	 * @return the normalized tree
	 */
	public Format analyze(Format format) {
		return analyze(format.toRaw());
	}

	// ---------------------------------------------------------------------
	// Scalar flattening
	// ---------------------------------------------------------------------

	List<RawStatement> flattenScalars(List<RawStatement> statements) {
		Map<String, Boolean> eligible = new LinkedHashMap<String, Boolean>();
		for (int i = 0; i < statements.size(); i++) {
			RawStatement statement = statements.get(i);
			if (statement instanceof Item && isNextToEllipsis(statements, i)) {
				eligible.put(((Item) statement).getName(), Boolean.FALSE);
			}
			recordReferences(statement, eligible);
		}

		final Set<String> names = new HashSet<String>();
		for (Map.Entry<String, Boolean> entry : eligible.entrySet()) {
			if (entry.getValue().booleanValue()) {
				names.add(entry.getKey());
			}
		}
		if (names.isEmpty()) {
			return statements;
		}
		LOG.debug("Flattening subscripted constants {}", names);

		List<RawStatement> result = new ArrayList<RawStatement>(statements.size());
		for (RawStatement statement : statements) {
			result.add(statement instanceof Marker ? statement : flatten((Statement) statement, names));
		}
		return result;
	}

	private static boolean isNextToEllipsis(List<RawStatement> statements, int position) {
		for (int step = -1; step <= 1; step += 2) {
			int i = position + step;
			while (i >= 0 && i < statements.size() && statements.get(i) == Marker.BREAK) {
				i += step;
			}
			if (i >= 0 && i < statements.size()) {
				RawStatement neighbour = statements.get(i);
				if (neighbour == Marker.DOTS || neighbour == Marker.VDOTS) {
					return true;
				}
			}
		}
		return false;
	}

	private static void recordReferences(RawStatement statement, Map<String, Boolean> eligible) {
		if (statement instanceof Loop) {
			Loop loop = (Loop) statement;
			recordReferences(loop.getStart(), eligible);
			recordReferences(loop.getEnd(), eligible);
			for (Statement child : loop.getBody()) {
				recordReferences(child, eligible);
			}
		} else if (statement instanceof Item) {
			recordReferences((Expression) statement, eligible);
		}
	}

	private static void recordReferences(Expression expression, Map<String, Boolean> eligible) {
		if (expression instanceof Item) {
			Item item = (Item) expression;
			boolean constantIndex = item.getIndices().size() == 1 && item.getIndices().get(0) instanceof NumberLiteral;
			Boolean previous = eligible.get(item.getName());
			eligible.put(item.getName(), constantIndex && (previous == null || previous.booleanValue()));
			for (Expression index : item.getIndices()) {
				recordReferences(index, eligible);
			}
		} else if (expression instanceof BinaryOperation) {
			BinaryOperation operation = (BinaryOperation) expression;
			recordReferences(operation.getLeft(), eligible);
			recordReferences(operation.getRight(), eligible);
		}
	}

	private static Statement flatten(Statement statement, Set<String> names) {
		if (statement instanceof Loop) {
			Loop loop = (Loop) statement;
			List<Statement> body = new ArrayList<Statement>(loop.getBody().size());
			for (Statement child : loop.getBody()) {
				body.add(flatten(child, names));
			}
			return new Loop(loop.getVariable(), flatten(loop.getStart(), names), flatten(loop.getEnd(), names), body);
		}
		return (Item) flatten((Expression) statement, names);
	}

	private static Expression flatten(Expression expression, Set<String> names) {
		if (expression instanceof Item) {
			Item item = (Item) expression;
			if (names.contains(item.getName())) {
				return new Item(item.getName() + ((NumberLiteral) item.getIndices().get(0)).getValue());
			}
			List<Expression> indices = new ArrayList<Expression>(item.getIndices().size());
			for (Expression index : item.getIndices()) {
				indices.add(flatten(index, names));
			}
			return item.withIndices(indices);
		}
		if (expression instanceof BinaryOperation) {
			BinaryOperation operation = (BinaryOperation) expression;
			return new BinaryOperation(
					operation.getOperator(),
					flatten(operation.getLeft(), names),
					flatten(operation.getRight(), names));
		}
		return expression;
	}

	// ---------------------------------------------------------------------
	// Loop detection
	// ---------------------------------------------------------------------

	private List<RawStatement> detectLoops(List<RawStatement> input, Marker ellipsis) {
		List<RawStatement> output = new ArrayList<RawStatement>(input.size());
		int i = 0;
		while (i < input.size()) {
			RawStatement statement = input.get(i);
			if (statement == ellipsis) {
				Loop loop = null;
				int window = 0;
				for (int k = 1; k <= output.size() && i + k < input.size(); k++) {
					List<RawStatement> left = new ArrayList<RawStatement>(output.subList(output.size() - k, output.size()));
					List<RawStatement> right = new ArrayList<RawStatement>(input.subList(i + 1, i + 1 + k));
					loop = buildLoop(left, right);
					if (loop != null) {
						window = k;
						break;
					}
				}
				if (loop != null) {
					truncate(output, output.size() - window);
					output.add(extendBackwards(loop, output));
					i += window + 1;
					continue;
				}
			}
			output.add(statement);
			i++;
		}
		return output;
	}

	/**
	 * Builds the loop that replaces {@code left … right}, where both sides have
	 * the same size.
	 *
	 * @return the loop, or {@code null} if the two sides do not describe a repeated sequence
	 */
	private Loop buildLoop(List<RawStatement> left, List<RawStatement> right) {
		List<IndexDifference> first = new ArrayList<IndexDifference>();
		if (!compare(left.get(0), right.get(0), first) || first.isEmpty()) {
			return null;
		}
		IndexDifference varying = first.get(0);
		for (IndexDifference difference : first) {
			if (difference.position != varying.position
					|| !difference.from.equals(varying.from)
					|| !difference.to.equals(varying.to)) {
				return null;
			}
		}
		int position = varying.position;

		for (int k = 1; k < left.size(); k++) {
			List<IndexDifference> others = new ArrayList<IndexDifference>();
			if (!compare(left.get(k), right.get(k), others)) {
				return null;
			}
			for (IndexDifference difference : others) {
				if (difference.position != position) {
					return null;
				}
			}
		}
		for (RawStatement statement : left) {
			if (!hasIndexAt((Statement) statement, position)) {
				return null;
			}
		}

		Set<String> used = new HashSet<String>();
		Expressions.collectNames(varying.from, used);
		Expressions.collectNames(varying.to, used);
		for (RawStatement statement : left) {
			Expressions.collectStatementNames(statement, used);
		}
		for (RawStatement statement : right) {
			Expressions.collectStatementNames(statement, used);
		}
		String variable = LoopVariables.choose(used);

		List<Statement> body = new ArrayList<Statement>(left.size());
		for (RawStatement statement : left) {
			body.add(replaceIndex((Statement) statement, position, new Item(variable)));
		}
		return new Loop(variable, varying.from, varying.to, body);
	}

	/**
	 * Compares two statements that must have the same shape, recording where
	 * their indices differ.
	 *
	 * @return {@code false} when the statements do not have the same shape
	 */
	private static boolean compare(RawStatement a, RawStatement b, List<IndexDifference> differences) {
		if (a instanceof Item && b instanceof Item) {
			Item left = (Item) a;
			Item right = (Item) b;
			if (!left.getName().equals(right.getName()) || left.getIndices().size() != right.getIndices().size()) {
				return false;
			}
			for (int j = 0; j < left.getIndices().size(); j++) {
				Expression from = left.getIndices().get(j);
				Expression to = right.getIndices().get(j);
				if (!from.equals(to)) {
					differences.add(new IndexDifference(j, from, to));
				}
			}
			return true;
		}
		if (a instanceof Loop && b instanceof Loop) {
			Loop left = (Loop) a;
			Loop right = (Loop) b;
			if (!left.getVariable().equals(right.getVariable())
					|| !left.getStart().equals(right.getStart())
					|| !left.getEnd().equals(right.getEnd())
					|| left.getBody().size() != right.getBody().size()) {
				return false;
			}
			for (int j = 0; j < left.getBody().size(); j++) {
				if (!compare(left.getBody().get(j), right.getBody().get(j), differences)) {
					return false;
				}
			}
			return true;
		}
		return false;
	}

	private static boolean hasIndexAt(Statement statement, int position) {
		if (statement instanceof Item) {
			return ((Item) statement).getIndices().size() > position;
		}
		for (Statement child : ((Loop) statement).getBody()) {
			if (!hasIndexAt(child, position)) {
				return false;
			}
		}
		return true;
	}

	private static Statement replaceIndex(Statement statement, int position, Expression replacement) {
		if (statement instanceof Item) {
			Item item = (Item) statement;
			List<Expression> indices = new ArrayList<Expression>(item.getIndices());
			indices.set(position, replacement);
			return item.withIndices(indices);
		}
		Loop loop = (Loop) statement;
		List<Statement> body = new ArrayList<Statement>(loop.getBody().size());
		for (Statement child : loop.getBody()) {
			body.add(replaceIndex(child, position, replacement));
		}
		return loop.withBody(body);
	}

	/**
	 * Absorbs into the loop the statements at the end of {@code output} that
	 * are the loop body instantiated for {@code start - 1}, as long as there
	 * are some. Absorbed statements are removed from {@code output}.
	 */
	private static Loop extendBackwards(Loop loop, List<RawStatement> output) {
		Loop current = loop;
		int size = current.getBody().size();
		while (current.getStart() instanceof NumberLiteral && output.size() >= size) {
			long previous = ((NumberLiteral) current.getStart()).getValue() - 1;
			NumberLiteral value = new NumberLiteral(previous);
			int offset = output.size() - size;
			boolean matches = true;
			for (int k = 0; k < size && matches; k++) {
				Statement expected = Expressions.substituteStatement(current.getBody().get(k), current.getVariable(), value);
				matches = expected.equals(output.get(offset + k));
			}
			if (!matches) {
				break;
			}
			truncate(output, offset);
			current = current.withStart(value);
		}
		return current;
	}

	private static void truncate(List<RawStatement> list, int size) {
		list.subList(size, list.size()).clear();
	}
}
