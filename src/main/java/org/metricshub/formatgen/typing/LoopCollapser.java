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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.metricshub.formatgen.frontend.ast.Expression;
import org.metricshub.formatgen.frontend.ast.Expressions;
import org.metricshub.formatgen.frontend.ast.Format;
import org.metricshub.formatgen.frontend.ast.Item;
import org.metricshub.formatgen.frontend.ast.Loop;
import org.metricshub.formatgen.frontend.ast.Statement;

/**
 * Rewrites loops that read one element per iteration into a single read.
 * <p>
 * {@code for i in 1..N { S_i }} becomes {@code S}: the sequence was really a
 * single token, like a string of {@code N} characters. A loop qualifies when
 * its body is one item whose indices mention the loop variable at exactly one
 * position. Loops are examined from the outside in; a collapsed loop is not
 * examined again.
 */
final class LoopCollapser {

	/**
	 * @param format the tree to rewrite
	 * @param collapsedNames where the names of the rewritten items are added
	 * @return the rewritten tree, equal to {@code format} when nothing qualifies
	 */
	Format collapse(Format format, Set<String> collapsedNames) {
		return new Format(collapse(format.getChildren(), collapsedNames));
	}

	private List<Statement> collapse(List<Statement> statements, Set<String> collapsedNames) {
		List<Statement> result = new ArrayList<Statement>(statements.size());
		for (Statement statement : statements) {
			if (statement instanceof Loop) {
				Loop loop = (Loop) statement;
				Item collapsed = collapse(loop);
				if (collapsed != null) {
					collapsedNames.add(collapsed.getName());
					result.add(collapsed);
				} else {
					result.add(loop.withBody(collapse(loop.getBody(), collapsedNames)));
				}
			} else {
				result.add(statement);
			}
		}
		return result;
	}

	private static Item collapse(Loop loop) {
		if (loop.getBody().size() != 1 || !(loop.getBody().get(0) instanceof Item)) {
			return null;
		}
		Item item = (Item) loop.getBody().get(0);
		int position = -1;
		for (int i = 0; i < item.getIndices().size(); i++) {
			if (Expressions.namesOf(item.getIndices().get(i)).contains(loop.getVariable())) {
				if (position >= 0) {
					return null;
				}
				position = i;
			}
		}
		if (position < 0) {
			return null;
		}
		List<Expression> indices = new ArrayList<Expression>(item.getIndices());
		indices.remove(position);
		return item.withIndices(indices);
	}
}
