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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.formatgen.frontend.ast.RawFormat;

/**
 * What the parser produced: the raw tree, the diagnostics of everything it
 * had to skip or patch, and the integer literals found at statement level
 * (like the {@code 1} of a query record described as {@code 1 x y}).
 */
public final class ParseResult {

	private final RawFormat root;
	private final List<Diagnostic> diagnostics;
	private final List<Long> statementLiterals;

	public ParseResult(RawFormat root, List<Diagnostic> diagnostics, List<Long> statementLiterals) {
		this.root = root;
		this.diagnostics = Collections.unmodifiableList(new ArrayList<Diagnostic>(diagnostics));
		this.statementLiterals = Collections.unmodifiableList(new ArrayList<Long>(statementLiterals));
	}

	public RawFormat getRoot() {
		return root;
	}

	public List<Diagnostic> getDiagnostics() {
		return diagnostics;
	}

	public boolean hasDiagnostics() {
		return !diagnostics.isEmpty();
	}

	public List<Long> getStatementLiterals() {
		return statementLiterals;
	}
}
