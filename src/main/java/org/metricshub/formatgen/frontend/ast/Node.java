package org.metricshub.formatgen.frontend.ast;

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

/**
 * Base class of every node of a format tree.
 * <p>
 * The same node classes are shared by the raw tree produced by the
 * {@link org.metricshub.formatgen.frontend.Parser} and the normalized tree
 * produced by the {@link org.metricshub.formatgen.frontend.Analyzer}. The
 * ellipsis and line break markers only exist in the raw tree and are not
 * nodes: see {@link Marker}.
 * <p>
 * Nodes are immutable and compare structurally.
 */
public abstract class Node {

	Node() {}

	/**
	 * Dispatches to the method of the visitor matching the concrete node type.
	 *
	 * @param visitor the visitor
	 * @param <R> result type of the visitor
	 * @return what the visitor returned
	 */
	public abstract <R> R accept(NodeVisitor<R> visitor);
}
