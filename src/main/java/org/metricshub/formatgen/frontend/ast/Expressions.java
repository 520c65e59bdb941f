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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Static helpers over expressions and statements.
 */
public final class Expressions {

	private Expressions() {}

	/**
	 * Collects every identifier referenced by a statement: item names, names
	 * inside index expressions, loop variables and names inside loop bounds.
	 *
	 * @param statement the statement to scan
	 * @param names where names are added
	 */
	public static void collectStatementNames(RawStatement statement, Set<String> names) {
		if (statement instanceof Loop) {
			Loop loop = (Loop) statement;
			names.add(loop.getVariable());
			collectNames(loop.getStart(), names);
			collectNames(loop.getEnd(), names);
			for (Statement child : loop.getBody()) {
				collectStatementNames(child, names);
			}
		} else if (statement instanceof Item) {
			collectNames((Expression) statement, names);
		}
	}

	/**
	 * Collects every identifier referenced by an expression.
	 *
	 * @param expression the expression to scan
	 * @param names where names are added
	 */
	public static void collectNames(Expression expression, Set<String> names) {
		if (expression instanceof Item) {
			Item item = (Item) expression;
			names.add(item.getName());
			for (Expression index : item.getIndices()) {
				collectNames(index, names);
			}
		} else if (expression instanceof BinaryOperation) {
			BinaryOperation operation = (BinaryOperation) expression;
			collectNames(operation.getLeft(), names);
			collectNames(operation.getRight(), names);
		}
	}

	/**
	 * @param expression the expression to scan
	 * @return the identifiers referenced by the expression, in order of appearance
	 */
	public static Set<String> namesOf(Expression expression) {
		Set<String> names = new LinkedHashSet<String>();
		collectNames(expression, names);
		return names;
	}

	/**
	 * @param expression the expression to test
	 * @param name an identifier
	 * @return whether the expression is a bare, unindexed reference to {@code name}
	 */
	public static boolean isReferenceTo(Expression expression, String name) {
		return expression instanceof Item
				&& ((Item) expression).getName().equals(name)
				&& ((Item) expression).getIndices().isEmpty();
	}

	/**
	 * Replaces every bare reference to a variable by another expression.
	 *
	 * @param expression where to substitute
	 * @param name the variable to replace
	 * @param replacement the replacing expression
	 * @return the rewritten expression
	 */
	public static Expression substitute(Expression expression, String name, Expression replacement) {
		if (isReferenceTo(expression, name)) {
			return replacement;
		}
		if (expression instanceof Item) {
			Item item = (Item) expression;
			return item.withIndices(substituteAll(item.getIndices(), name, replacement));
		}
		if (expression instanceof BinaryOperation) {
			BinaryOperation operation = (BinaryOperation) expression;
			return new BinaryOperation(
					operation.getOperator(),
					substitute(operation.getLeft(), name, replacement),
					substitute(operation.getRight(), name, replacement));
		}
		return expression;
	}

	/**
	 * Replaces every bare reference to a variable inside a statement: item
	 * indices, loop bounds and loop bodies. A nested loop that rebinds the same
	 * name shadows it.
	 *
	 * @param statement where to substitute
	 * @param name the variable to replace
	 * @param replacement the replacing expression
	 * @return the rewritten statement
	 */
	public static Statement substituteStatement(Statement statement, String name, Expression replacement) {
		if (statement instanceof Item) {
			Item item = (Item) statement;
			return item.withIndices(substituteAll(item.getIndices(), name, replacement));
		}
		Loop loop = (Loop) statement;
		Expression start = substitute(loop.getStart(), name, replacement);
		Expression end = substitute(loop.getEnd(), name, replacement);
		List<Statement> body = loop.getBody();
		if (!loop.getVariable().equals(name)) {
			List<Statement> newBody = new ArrayList<Statement>(body.size());
			for (Statement child : body) {
				newBody.add(substituteStatement(child, name, replacement));
			}
			body = newBody;
		}
		return new Loop(loop.getVariable(), start, end, body);
	}

	private static List<Expression> substituteAll(List<Expression> expressions, String name, Expression replacement) {
		List<Expression> result = new ArrayList<Expression>(expressions.size());
		for (Expression expression : expressions) {
			result.add(substitute(expression, name, replacement));
		}
		return result;
	}

	/**
	 * Builds the number of values of the inclusive range {@code [start, end]},
	 * that is {@code end - start + 1}, folding the constants when {@code start}
	 * is a literal: {@code [1, N]} gives {@code N}, {@code [0, N - 1]} gives
	 * {@code N}.
	 *
	 * @param start first value, or {@code null} when {@code end} already is a count
	 * @param end last value
	 * @return the count expression
	 */
	public static Expression count(Expression start, Expression end) {
		if (start == null) {
			return end;
		}
		if (!(start instanceof NumberLiteral)) {
			return new BinaryOperation(
					'+',
					new BinaryOperation('-', end, start),
					new NumberLiteral(1));
		}
		return shift(end, 1 - ((NumberLiteral) start).getValue());
	}

	/**
	 * Adds a constant to an expression, folding it into a trailing constant
	 * term: {@code shift(N - 1, 1)} gives {@code N}.
	 *
	 * @param expression the expression to shift
	 * @param delta the constant to add
	 * @return the shifted expression
	 */
	public static Expression shift(Expression expression, long delta) {
		if (expression instanceof NumberLiteral) {
			return new NumberLiteral(((NumberLiteral) expression).getValue() + delta);
		}
		long offset = delta;
		Expression base = expression;
		if (expression instanceof BinaryOperation) {
			BinaryOperation operation = (BinaryOperation) expression;
			if (operation.getRight() instanceof NumberLiteral
					&& (operation.getOperator() == '+' || operation.getOperator() == '-')) {
				long constant = ((NumberLiteral) operation.getRight()).getValue();
				offset += operation.getOperator() == '+' ? constant : -constant;
				base = operation.getLeft();
			}
		}
		if (offset == 0) {
			return base;
		}
		if (offset > 0) {
			return new BinaryOperation('+', base, new NumberLiteral(offset));
		}
		return new BinaryOperation('-', base, new NumberLiteral(-offset));
	}
}
