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
 * Ellipsis and line break markers of a raw format tree. The
 * {@link org.metricshub.formatgen.frontend.Analyzer} turns ellipses into
 * {@link Loop}s or drops them, and drops line breaks: markers never appear in
 * a normalized {@link Format}.
 */
public enum Marker implements RawStatement {
	/** Horizontal ellipsis: {@code ...}, {@code …}, {@code \ldots}, {@code \cdots}, {@code \dots}. */
	DOTS,
	/** Vertical ellipsis: {@code ⋮}, {@code \vdots}. */
	VDOTS,
	/** End of a line of the format. */
	BREAK
}
