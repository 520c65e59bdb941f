package org.metricshub.formatgen.intermediate;

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
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.formatgen.frontend.ast.Expression;
import org.metricshub.formatgen.frontend.ast.Expressions;
import org.metricshub.formatgen.frontend.ast.Format;
import org.metricshub.formatgen.frontend.ast.Item;
import org.metricshub.formatgen.frontend.ast.Loop;
import org.metricshub.formatgen.frontend.ast.Statement;
import org.metricshub.formatgen.typing.TypingResult;
import org.metricshub.formatgen.typing.VarType;
import org.metricshub.formatgen.util.FormatGenLogger;
import org.slf4j.Logger;

/**
 * Derives the variable descriptors of a normalized format.
 * <p>
 * Every item read by the format declares a variable, in reading order. The
 * read with the most indices defines the dimensions. An index that is the
 * variable of an enclosing loop gets the bounds of that loop as size;
 * any other index is kept as is.
 * <p>
 * Two corrections follow. A variable whose loop was collapsed during type
 * inference loses its last dimension. A string variable with more indices
 * than enclosing loops is a sequence of strings indexed by its characters:
 * it keeps one dimension per loop.
 */
public class VariableExtractor {

	private static final Logger LOG = FormatGenLogger.getLogger(VariableExtractor.class);

	/**
	 * One read of a variable.
	 */
	private static final class Usage {
		private final List<Expression> sizes = new ArrayList<Expression>();
		private final List<Expression> starts = new ArrayList<Expression>();
		private final int depth;

		private Usage(int depth) {
			this.depth = depth;
		}
	}

	/**
	 * @param format the normalized tree, before any collapse
	 * @param typing the result of type inference on this tree
	 * @return the descriptors, in the order the variables are first read
	 */
	public List<VariableDescriptor> extract(Format format, TypingResult typing) {
		Map<String, Usage> usages = new LinkedHashMap<String, Usage>();
		visit(format.getChildren(), new ArrayDeque<Loop>(), usages);

		List<VariableDescriptor> result = new ArrayList<VariableDescriptor>(usages.size());
		for (Map.Entry<String, Usage> entry : usages.entrySet()) {
			String name = entry.getKey();
			Usage usage = entry.getValue();
			VarType type = typing.getType(name);
			if (type == null) {
				LOG.debug("No sample value for {}, assuming {}", name, VarType.INT);
				type = VarType.INT;
			}
			List<Expression> sizes = new ArrayList<Expression>(usage.sizes);
			List<Expression> starts = new ArrayList<Expression>(usage.starts);
			List<Integer> positions = new ArrayList<Integer>();
			for (int i = 0; i < sizes.size(); i++) {
				positions.add(Integer.valueOf(i));
			}

			if (typing.getCollapsedNames().contains(name) && !sizes.isEmpty()) {
				sizes.remove(sizes.size() - 1);
				starts.remove(starts.size() - 1);
				positions.remove(positions.size() - 1);
			}
			if (type == VarType.STRING && sizes.size() > usage.depth) {
				trimToLoops(sizes, starts, positions, usage.depth);
			}
			result.add(new VariableDescriptor(name, type, sizes, starts, positions, usage.depth));
		}
		LOG.debug("Variables: {}", result);
		return result;
	}

	private static void visit(List<Statement> statements, Deque<Loop> loops, Map<String, Usage> usages) {
		for (Statement statement : statements) {
			if (statement instanceof Loop) {
				Loop loop = (Loop) statement;
				loops.push(loop);
				visit(loop.getBody(), loops, usages);
				loops.pop();
			} else {
				Item item = (Item) statement;
				Usage existing = usages.get(item.getName());
				if (existing == null || item.getIndices().size() > existing.sizes.size()) {
					usages.put(item.getName(), usageOf(item, loops));
				}
			}
		}
	}

	private static Usage usageOf(Item item, Deque<Loop> loops) {
		Usage usage = new Usage(loops.size());
		for (Expression index : item.getIndices()) {
			Loop bound = null;
			// innermost loop first
			for (Loop loop : loops) {
				if (Expressions.isReferenceTo(index, loop.getVariable())) {
					bound = loop;
					break;
				}
			}
			if (bound != null) {
				usage.sizes.add(bound.getEnd());
				usage.starts.add(bound.getStart());
			} else {
				usage.sizes.add(index);
				usage.starts.add(null);
			}
		}
		return usage;
	}

	/**
	 * Keeps {@code depth} dimensions, preferring those read by a loop.
	 */
	private static void trimToLoops(List<Expression> sizes, List<Expression> starts, List<Integer> positions, int depth) {
		List<Integer> kept = new ArrayList<Integer>();
		for (int i = 0; i < sizes.size() && kept.size() < depth; i++) {
			if (starts.get(i) != null) {
				kept.add(i);
			}
		}
		for (int i = 0; i < sizes.size() && kept.size() < depth; i++) {
			if (!kept.contains(i)) {
				kept.add(i);
			}
		}
		Collections.sort(kept);
		List<Expression> keptSizes = new ArrayList<Expression>(kept.size());
		List<Expression> keptStarts = new ArrayList<Expression>(kept.size());
		List<Integer> keptPositions = new ArrayList<Integer>(kept.size());
		for (Integer i : kept) {
			keptSizes.add(sizes.get(i));
			keptStarts.add(starts.get(i));
			keptPositions.add(positions.get(i));
		}
		sizes.clear();
		sizes.addAll(keptSizes);
		starts.clear();
		starts.addAll(keptStarts);
		positions.clear();
		positions.addAll(keptPositions);
	}
}
