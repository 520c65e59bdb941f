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
import java.util.Objects;

/**
 * A repeated sequence of statements. The induction variable runs over the
 * inclusive range {@code [start, end]} with a unit step.
 */
public final class Loop extends Node implements Statement {

	private final String variable;
	private final Expression start;
	private final Expression end;
	private final List<Statement> body;

	/**
	 * @param variable name of the induction variable
	 * @param start first value of the induction variable
	 * @param end last value of the induction variable
	 * @param body repeated statements
	 */
	public Loop(String variable, Expression start, Expression end, List<? extends Statement> body) {
		this.variable = Objects.requireNonNull(variable, "variable");
		this.start = Objects.requireNonNull(start, "start");
		this.end = Objects.requireNonNull(end, "end");
		this.body = Collections.unmodifiableList(new ArrayList<Statement>(body));
	}

	public String getVariable() {
		return variable;
	}

	public Expression getStart() {
		return start;
	}

	public Expression getEnd() {
		return end;
	}

	public List<Statement> getBody() {
		return body;
	}

	/**
	 * @param newStart the new first value
	 * @return a copy of this loop starting at another value
	 */
	public Loop withStart(Expression newStart) {
		return new Loop(variable, newStart, end, body);
	}

	/**
	 * @param newBody the new repeated statements
	 * @return a copy of this loop with another body
	 */
	public Loop withBody(List<? extends Statement> newBody) {
		return new Loop(variable, start, end, newBody);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitLoop(this);
	}

	@Override
	public boolean equals(Object other) {
		if (!(other instanceof Loop)) {
			return false;
		}
		Loop that = (Loop) other;
		return variable.equals(that.variable)
				&& start.equals(that.start)
				&& end.equals(that.end)
				&& body.equals(that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(variable, start, end, body);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("for ")
				.append(variable)
				.append(" in ")
				.append(start)
				.append("..")
				.append(end)
				.append(" {");
		for (Statement statement : body) {
			sb.append(' ').append(statement);
		}
		return sb.append(" }").toString();
	}
}
