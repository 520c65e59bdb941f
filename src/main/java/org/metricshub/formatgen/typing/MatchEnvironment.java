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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The values bound by matching a format tree against one sample.
 * <p>
 * A scalar variable is bound to a single token. An indexed variable is bound
 * to a map from its evaluated indices, joined with commas ({@code "0,2"}), to
 * a token.
 */
public final class MatchEnvironment {

	private final Map<String, String> scalars = new LinkedHashMap<String, String>();
	private final Map<String, Map<String, String>> arrays = new LinkedHashMap<String, Map<String, String>>();
	private final Set<String> names = new LinkedHashSet<String>();
	private int consumedTokens;

	/**
	 * Joins evaluated indices the way array elements are keyed.
	 *
	 * @param indices evaluated indices
	 * @return the key, e.g. {@code "1,2"}
	 */
	public static String key(List<Long> indices) {
		StringBuilder sb = new StringBuilder();
		for (Long index : indices) {
			if (sb.length() > 0) {
				sb.append(',');
			}
			sb.append(index);
		}
		return sb.toString();
	}

	void bindScalar(String name, String value) {
		names.add(name);
		scalars.put(name, value);
	}

	void bindElement(String name, List<Long> indices, String value) {
		names.add(name);
		Map<String, String> elements = arrays.get(name);
		if (elements == null) {
			elements = new LinkedHashMap<String, String>();
			arrays.put(name, elements);
		}
		elements.put(key(indices), value);
	}

	void setConsumedTokens(int consumedTokens) {
		this.consumedTokens = consumedTokens;
	}

	/**
	 * @return the bound variable names, in the order they were first read
	 */
	public Set<String> getNames() {
		return Collections.unmodifiableSet(names);
	}

	/**
	 * @param name a variable name
	 * @return the token bound to the scalar, or {@code null}
	 */
	public String getScalar(String name) {
		return scalars.get(name);
	}

	/**
	 * @param name a variable name
	 * @return whether the variable was read with indices
	 */
	public boolean isArray(String name) {
		return arrays.containsKey(name);
	}

	/**
	 * @param name a variable name
	 * @return the elements of the array keyed by joined indices, or {@code null}
	 */
	public Map<String, String> getArray(String name) {
		Map<String, String> elements = arrays.get(name);
		return elements == null ? null : Collections.unmodifiableMap(elements);
	}

	/**
	 * @param name a variable name
	 * @param indices evaluated indices
	 * @return the token bound to this element, or {@code null}
	 */
	public String getElement(String name, List<Long> indices) {
		Map<String, String> elements = arrays.get(name);
		return elements == null ? null : elements.get(key(indices));
	}

	/**
	 * @param name a variable name
	 * @return every token read for the variable
	 */
	public Collection<String> getValues(String name) {
		List<String> values = new ArrayList<String>();
		if (scalars.containsKey(name)) {
			values.add(scalars.get(name));
		}
		Map<String, String> elements = arrays.get(name);
		if (elements != null) {
			values.addAll(elements.values());
		}
		return values;
	}

	/**
	 * @return the number of sample tokens read by the match
	 */
	public int getConsumedTokens() {
		return consumedTokens;
	}

	@Override
	public String toString() {
		Map<String, Object> all = new LinkedHashMap<String, Object>();
		for (String name : names) {
			all.put(name, arrays.containsKey(name) ? arrays.get(name) : scalars.get(name));
		}
		return all.toString();
	}
}
