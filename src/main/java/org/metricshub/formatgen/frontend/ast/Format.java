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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root of a normalized format tree: the ordered statements to read.
 */
public final class Format extends Node {

	private final List<Statement> children;

	public Format(List<? extends Statement> children) {
		this.children = Collections.unmodifiableList(new ArrayList<Statement>(children));
	}

	public List<Statement> getChildren() {
		return children;
	}

	/**
	 * @return this tree seen as a raw tree, so that it can be analyzed again
	 */
	public RawFormat toRaw() {
		return new RawFormat(children);
	}

	/**
	 * Prints the tree, one statement per line, loop bodies indented.
	 *
	 * @param out where to print
	 */
	public void dump(PrintStream out) {
		dump(out, children, "");
	}

	private static void dump(PrintStream out, List<Statement> statements, String indent) {
		for (Statement statement : statements) {
			if (statement instanceof Loop) {
				Loop loop = (Loop) statement;
				out.println(indent + "for " + loop.getVariable() + " in " + loop.getStart() + ".." + loop.getEnd());
				dump(out, loop.getBody(), indent + "  ");
			} else {
				Item item = (Item) statement;
				out.println(indent + item + (item.getType() == null ? "" : " : " + item.getType()));
			}
		}
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitFormat(this);
	}

	@Override
	public boolean equals(Object other) {
		return other instanceof Format && ((Format) other).children.equals(children);
	}

	@Override
	public int hashCode() {
		return children.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (Statement child : children) {
			if (sb.length() > 0) {
				sb.append(' ');
			}
			sb.append(child);
		}
		return sb.toString();
	}
}
