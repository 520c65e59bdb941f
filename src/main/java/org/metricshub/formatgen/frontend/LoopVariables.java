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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * The names that may be given to the induction variable of a detected loop,
 * in order of preference.
 */
public final class LoopVariables {

	/** Candidate names, tried in this order. */
	public static final List<String> CANDIDATES = Collections.unmodifiableList(Arrays.asList("i", "j", "k", "l", "m"));

	/** Name used when every candidate is taken. */
	public static final String FALLBACK = "i";

	private LoopVariables() {}

	/**
	 * @param used identifiers already in scope
	 * @return the first candidate that is not used, or {@link #FALLBACK}
	 */
	public static String choose(Set<String> used) {
		for (String candidate : CANDIDATES) {
			if (!used.contains(candidate)) {
				return candidate;
			}
		}
		return FALLBACK;
	}
}
