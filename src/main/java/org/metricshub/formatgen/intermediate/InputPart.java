package org.metricshub.formatgen.intermediate;

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
import org.metricshub.formatgen.frontend.Diagnostic;
import org.metricshub.formatgen.frontend.ast.Format;

/**
 * One processed format: its variables and the tree that reads them.
 * <p>
 * Query problems have several parts: the setup part, then one part per kind
 * of query record. The discriminator of a query part is the literal that
 * starts its format ({@code 1 x} gives 1), if any.
 */
public final class InputPart {

	private final List<VariableDescriptor> variables;
	private final Format tree;
	private final List<Diagnostic> diagnostics;
	private final Long discriminator;

	/**
	 * Creates a part with no diagnostic and no discriminator.
	 *
	 * @param variables variable descriptors, in reading order
	 * @param tree the normalized tree, as matched by the samples
	 */
	public InputPart(List<VariableDescriptor> variables, Format tree) {
		this(variables, tree, Collections.<Diagnostic>emptyList(), null);
	}

	/**
	 * @param variables variable descriptors, in reading order
	 * @param tree the normalized tree, as matched by the samples
	 * @param diagnostics what the parser recovered from
	 * @param discriminator leading literal of the format, or {@code null}
	 */
	public InputPart(List<VariableDescriptor> variables, Format tree, List<Diagnostic> diagnostics, Long discriminator) {
		this.variables = Collections.unmodifiableList(new ArrayList<VariableDescriptor>(variables));
		this.tree = tree;
		this.diagnostics = Collections.unmodifiableList(new ArrayList<Diagnostic>(diagnostics));
		this.discriminator = discriminator;
	}

	public List<VariableDescriptor> getVariables() {
		return variables;
	}

	/**
	 * @param name a variable name
	 * @return the descriptor of this variable, or {@code null}
	 */
	public VariableDescriptor getVariable(String name) {
		for (VariableDescriptor variable : variables) {
			if (variable.getName().equals(name)) {
				return variable;
			}
		}
		return null;
	}

	public Format getTree() {
		return tree;
	}

	public List<Diagnostic> getDiagnostics() {
		return diagnostics;
	}

	/**
	 * @return the leading literal of the format, or {@code null}
	 */
	public Long getDiscriminator() {
		return discriminator;
	}

	@Override
	public String toString() {
		return "InputPart{" + tree + " -> " + variables + "}";
	}
}
