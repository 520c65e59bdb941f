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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.metricshub.formatgen.frontend.ast.Format;

/**
 * What type inference learned about a format.
 */
public final class TypingResult {

	private final Map<String, VarType> types;
	private final Set<String> collapsedNames;
	private final Format tree;

	/**
	 * @param types inferred type of every variable read by the samples
	 * @param collapsedNames variables whose loop was collapsed to match the samples
	 * @param tree the tree that matched the samples, with its items typed
	 */
	public TypingResult(Map<String, VarType> types, Set<String> collapsedNames, Format tree) {
		this.types = Collections.unmodifiableMap(new LinkedHashMap<String, VarType>(types));
		this.collapsedNames = Collections.unmodifiableSet(new LinkedHashSet<String>(collapsedNames));
		this.tree = tree;
	}

	public Map<String, VarType> getTypes() {
		return types;
	}

	/**
	 * @param name a variable name
	 * @return its type, or {@code null} if no sample bound it
	 */
	public VarType getType(String name) {
		return types.get(name);
	}

	public Set<String> getCollapsedNames() {
		return collapsedNames;
	}

	/**
	 * @return whether the tree had to be collapsed to match the samples
	 */
	public boolean isCollapsed() {
		return !collapsedNames.isEmpty();
	}

	/**
	 * @return the tree that matched the samples; the collapsed tree when {@link #isCollapsed()}
	 */
	public Format getTree() {
		return tree;
	}

	@Override
	public String toString() {
		return "TypingResult" + types + (collapsedNames.isEmpty() ? "" : " collapsed " + collapsedNames);
	}
}
