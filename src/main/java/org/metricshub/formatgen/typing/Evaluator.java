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
import java.util.List;
import java.util.Map;
import org.metricshub.formatgen.frontend.ast.BinaryOperation;
import org.metricshub.formatgen.frontend.ast.Expression;
import org.metricshub.formatgen.frontend.ast.Format;
import org.metricshub.formatgen.frontend.ast.Item;
import org.metricshub.formatgen.frontend.ast.Loop;
import org.metricshub.formatgen.frontend.ast.NodeVisitor;
import org.metricshub.formatgen.frontend.ast.NumberLiteral;

/**
 * Evaluates index and loop bound expressions with integer arithmetic.
 * <p>
 * Names resolve first to the active loop variables, then to the scalars
 * already read. Division rounds toward negative infinity.
 */
public final class Evaluator implements NodeVisitor<Long> {

	private final MatchEnvironment environment;
	private final Map<String, Long> loopBindings;

	/**
	 * @param environment values read so far
	 * @param loopBindings current values of the enclosing loop variables
	 */
	public Evaluator(MatchEnvironment environment, Map<String, Long> loopBindings) {
		this.environment = environment;
		this.loopBindings = loopBindings;
	}

	/**
	 * @param expression the expression to evaluate
	 * @return its value
	 * @throws MatchException when a name is unknown, not an integer, or when dividing by zero
	 */
	public long evaluate(Expression expression) {
		return expression.accept(this).longValue();
	}

	/**
	 * @param expressions index expressions
	 * @return their values
	 */
	public List<Long> evaluateAll(List<Expression> expressions) {
		List<Long> values = new ArrayList<Long>(expressions.size());
		for (Expression expression : expressions) {
			values.add(Long.valueOf(evaluate(expression)));
		}
		return values;
	}

	@Override
	public Long visitNumber(NumberLiteral number) {
		return Long.valueOf(number.getValue());
	}

	@Override
	public Long visitItem(Item item) {
		String name = item.getName();
		String value;
		if (item.getIndices().isEmpty()) {
			Long bound = loopBindings.get(name);
			if (bound != null) {
				return bound;
			}
			value = environment.getScalar(name);
			if (value == null) {
				if (environment.isArray(name)) {
					throw new MatchException("Variable " + name + " is an array and cannot be used without indices");
				}
				throw new MatchException("Variable " + name + " not found in environment during evaluation");
			}
		} else {
			List<Long> indices = evaluateAll(item.getIndices());
			value = environment.getElement(name, indices);
			if (value == null) {
				throw new MatchException("Element " + name + "[" + MatchEnvironment.key(indices) + "] not found in environment during evaluation");
			}
		}
		try {
			return Long.valueOf(value.trim());
		} catch (NumberFormatException e) {
			throw new MatchException("Variable " + name + " is not an integer: " + value);
		}
	}

	@Override
	public Long visitBinaryOperation(BinaryOperation operation) {
		long left = evaluate(operation.getLeft());
		long right = evaluate(operation.getRight());
		switch (operation.getOperator()) {
		case '+':
			return Long.valueOf(left + right);
		case '-':
			return Long.valueOf(left - right);
		case '*':
			return Long.valueOf(left * right);
		case '/':
			if (right == 0) {
				throw new MatchException("Division by zero in " + operation);
			}
			return Long.valueOf(Math.floorDiv(left, right));
		default:
			throw new MatchException("Unknown operator " + operation.getOperator());
		}
	}

	@Override
	public Long visitFormat(Format format) {
		throw new IllegalArgumentException("A format is not an expression");
	}

	@Override
	public Long visitLoop(Loop loop) {
		throw new IllegalArgumentException("A loop is not an expression");
	}
}
