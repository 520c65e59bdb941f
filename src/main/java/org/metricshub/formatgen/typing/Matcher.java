package org.metricshub.formatgen.typing;

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

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.formatgen.frontend.ast.BinaryOperation;
import org.metricshub.formatgen.frontend.ast.Expressions;
import org.metricshub.formatgen.frontend.ast.Format;
import org.metricshub.formatgen.frontend.ast.Item;
import org.metricshub.formatgen.frontend.ast.Loop;
import org.metricshub.formatgen.frontend.ast.NodeVisitor;
import org.metricshub.formatgen.frontend.ast.NumberLiteral;
import org.metricshub.formatgen.frontend.ast.Statement;
import org.metricshub.formatgen.util.FormatGenLogger;
import org.slf4j.Logger;

/**
 * Reads a sample along a normalized format tree.
 * <p>
 * The sample is split on white space and every item of the tree consumes
 * exactly one token, in the order the tree is walked. Loops run over the
 * inclusive range {@code [start, end]} with a unit step; an empty or
 * reversed range runs zero times.
 */
public class Matcher {

	private static final Logger LOG = FormatGenLogger.getLogger(Matcher.class);

	/**
	 * Matches a sample against a tree.
	 *
	 * @param format the normalized tree
	 * @param input the sample text
	 * @return the values read
	 * @throws MatchException when the sample does not fit the tree
	 */
	public MatchEnvironment match(Format format, String input) {
		String trimmed = input.trim();
		String[] tokens = trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
		Walker walker = new Walker(tokens);
		format.accept(walker);
		walker.environment.setConsumedTokens(walker.position);
		if (walker.position < tokens.length) {
			LOG.debug("{} trailing tokens left after matching {}", tokens.length - walker.position, format);
		}
		return walker.environment;
	}

	/**
	 * Walks the tree, consuming tokens.
	 */
	private static final class Walker implements NodeVisitor<Void> {

		private final String[] tokens;
		private final MatchEnvironment environment = new MatchEnvironment();
		private Map<String, Long> loopBindings = new HashMap<String, Long>();
		private int position;

		private Walker(String[] tokens) {
			this.tokens = tokens;
		}

		private String consume(Item item) {
			if (position >= tokens.length) {
				throw new MatchException(position, "Unexpected end of input while reading " + item);
			}
			return tokens[position++];
		}

		private Evaluator evaluator() {
			return new Evaluator(environment, loopBindings);
		}

		private void visitAll(List<Statement> statements) {
			for (Statement statement : statements) {
				statement.accept(this);
			}
		}

		@Override
		public Void visitFormat(Format format) {
			visitAll(format.getChildren());
			return null;
		}

		@Override
		public Void visitItem(Item item) {
			String value = consume(item);
			if (item.getIndices().isEmpty()) {
				environment.bindScalar(item.getName(), value);
			} else {
				List<Long> indices = evaluator().evaluateAll(item.getIndices());
				environment.bindElement(item.getName(), indices, value);
			}
			return null;
		}

		@Override
		public Void visitLoop(Loop loop) {
			Evaluator evaluator = evaluator();
			long start = evaluator.evaluate(loop.getStart());
			long end = evaluator.evaluate(loop.getEnd());
			long count = Math.max(0, end - start + 1);

			Map<String, Long> outer = loopBindings;
			loopBindings = new HashMap<String, Long>(outer);
			try {
				boolean boundsVary = boundsUse(loop.getBody(), loop.getVariable());
				for (long i = 0; i < count; i++) {
					loopBindings.put(loop.getVariable(), Long.valueOf(start + i));
					int before = position;
					visitAll(loop.getBody());
					if (position == before && !boundsVary) {
						// every other iteration would read nothing as well
						LOG.debug("Iteration {} of {} read no token, skipping the {} others", i, loop, count - i - 1);
						break;
					}
				}
			} finally {
				loopBindings = outer;
			}
			return null;
		}

		/**
		 * @return whether the bounds of a loop nested in {@code body} refer to {@code variable}
		 */
		private static boolean boundsUse(List<Statement> body, String variable) {
			for (Statement statement : body) {
				if (statement instanceof Loop) {
					Loop inner = (Loop) statement;
					if (Expressions.namesOf(inner.getStart()).contains(variable)
							|| Expressions.namesOf(inner.getEnd()).contains(variable)
							|| boundsUse(inner.getBody(), variable)) {
						return true;
					}
				}
			}
			return false;
		}

		@Override
		public Void visitNumber(NumberLiteral number) {
			throw new IllegalArgumentException("A number is not a statement");
		}

		@Override
		public Void visitBinaryOperation(BinaryOperation operation) {
			throw new IllegalArgumentException("An operation is not a statement");
		}
	}
}
