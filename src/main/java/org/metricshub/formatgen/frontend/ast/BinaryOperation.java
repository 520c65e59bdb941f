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

import java.util.Objects;

/**
 * One of the four integer arithmetic operations, applied to two expressions.
 */
public final class BinaryOperation extends Expression {

	private final char operator;
	private final Expression left;
	private final Expression right;

	/**
	 * @param operator one of {@code + - * /}
	 * @param left left operand
	 * @param right right operand
	 */
	public BinaryOperation(char operator, Expression left, Expression right) {
		if ("+-*/".indexOf(operator) < 0) {
			throw new IllegalArgumentException("Unknown operator " + operator);
		}
		this.operator = operator;
		this.left = Objects.requireNonNull(left, "left");
		this.right = Objects.requireNonNull(right, "right");
	}

	public char getOperator() {
		return operator;
	}

	public Expression getLeft() {
		return left;
	}

	public Expression getRight() {
		return right;
	}

	@Override
	int precedence() {
		return operator == '+' || operator == '-' ? 1 : 2;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitBinaryOperation(this);
	}

	@Override
	public boolean equals(Object other) {
		if (!(other instanceof BinaryOperation)) {
			return false;
		}
		BinaryOperation that = (BinaryOperation) other;
		return operator == that.operator && left.equals(that.left) && right.equals(that.right);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, left, right);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		appendOperand(sb, left, false);
		sb.append(' ').append(operator).append(' ');
		appendOperand(sb, right, true);
		return sb.toString();
	}

	private void appendOperand(StringBuilder sb, Expression operand, boolean rightSide) {
		// a - (b - c) and a / (b * c) keep their parentheses
		boolean parenthesize = operand.precedence() < precedence()
				|| (rightSide && operand.precedence() == precedence() && (operator == '-' || operator == '/'));
		if (parenthesize) {
			sb.append('(').append(operand).append(')');
		} else {
			sb.append(operand);
		}
	}
}
