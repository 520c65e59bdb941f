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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root of a raw format tree, as produced by the parser.
 */
public final class RawFormat {

	private final List<RawStatement> children;

	public RawFormat(List<? extends RawStatement> children) {
		this.children = Collections.unmodifiableList(new ArrayList<RawStatement>(children));
	}

	public List<RawStatement> getChildren() {
		return children;
	}

	@Override
	public boolean equals(Object other) {
		return other instanceof RawFormat && ((RawFormat) other).children.equals(children);
	}

	@Override
	public int hashCode() {
		return children.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (RawStatement child : children) {
			if (sb.length() > 0) {
				sb.append(' ');
			}
			sb.append(child);
		}
		return sb.toString();
	}
}
