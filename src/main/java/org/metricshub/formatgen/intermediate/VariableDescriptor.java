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
import java.util.Objects;
import org.metricshub.formatgen.frontend.ast.Expression;
import org.metricshub.formatgen.frontend.ast.Expressions;
import org.metricshub.formatgen.typing.VarType;

/**
 * Everything the generator needs to know about one variable: its name, its
 * type, and for every dimension the expression of its size.
 * <p>
 * The size of a dimension read by a loop is the loop end; the loop start is
 * kept aside so that the number of elements can be computed. When a read has
 * more indices than the variable has dimensions, the index positions tell
 * which indices of the read address the variable. Two descriptors are equal
 * when their name, type and sizes are.
 */
public final class VariableDescriptor {

	private final String name;
	private final VarType type;
	private final List<Expression> sizes;
	private final List<Expression> starts;
	private final List<Integer> indexPositions;
	private final int loopDepth;

	/**
	 * Creates a descriptor whose sizes are element counts.
	 *
	 * @param name variable name
	 * @param type value type
	 * @param sizes size of every dimension, outermost first
	 */
	public VariableDescriptor(String name, VarType type, List<? extends Expression> sizes) {
		this(name, type, sizes, Collections.<Expression>nCopies(sizes.size(), null), 0);
	}

	/**
	 * @param name variable name
	 * @param type value type
	 * @param sizes last index of every dimension, outermost first
	 * @param starts first index of every dimension; a {@code null} entry means
	 *        the size already is an element count
	 * @param loopDepth number of loops around the read of the variable
	 */
	public VariableDescriptor(String name, VarType type, List<? extends Expression> sizes, List<? extends Expression> starts, int loopDepth) {
		this(name, type, sizes, starts, firstPositions(sizes.size()), loopDepth);
	}

	/**
	 * @param name variable name
	 * @param type value type
	 * @param sizes last index of every dimension, outermost first
	 * @param starts first index of every dimension; a {@code null} entry means
	 *        the size already is an element count
	 * @param indexPositions for every dimension, the position of its index in a read
	 * @param loopDepth number of loops around the read of the variable
	 */
	public VariableDescriptor(
			String name,
			VarType type,
			List<? extends Expression> sizes,
			List<? extends Expression> starts,
			List<Integer> indexPositions,
			int loopDepth) {
		if (sizes.size() != starts.size() || sizes.size() != indexPositions.size()) {
			throw new IllegalArgumentException("Expected " + sizes.size() + " starts and index positions for " + name
					+ ", got " + starts.size() + " and " + indexPositions.size());
		}
		this.name = Objects.requireNonNull(name, "name");
		this.type = Objects.requireNonNull(type, "type");
		this.sizes = Collections.unmodifiableList(new ArrayList<Expression>(sizes));
		this.starts = Collections.unmodifiableList(new ArrayList<Expression>(starts));
		this.indexPositions = Collections.unmodifiableList(new ArrayList<Integer>(indexPositions));
		this.loopDepth = loopDepth;
	}

	public String getName() {
		return name;
	}

	public VarType getType() {
		return type;
	}

	/**
	 * @return 0 for a scalar, 1 for a sequence, 2 for a grid
	 */
	public int getDimensions() {
		return sizes.size();
	}

	public List<Expression> getSizes() {
		return sizes;
	}

	public List<Expression> getStarts() {
		return starts;
	}

	/**
	 * @param dimension a dimension, 0 being the outermost
	 * @return the position, among the indices of a read, of the index of this dimension
	 */
	public int getIndexPosition(int dimension) {
		return indexPositions.get(dimension).intValue();
	}

	public int getLoopDepth() {
		return loopDepth;
	}

	/**
	 * @param dimension a dimension, 0 being the outermost
	 * @return the number of elements along this dimension
	 */
	public Expression getLength(int dimension) {
		return Expressions.count(starts.get(dimension), sizes.get(dimension));
	}

	/**
	 * @param dimension a dimension, 0 being the outermost
	 * @return the first index along this dimension, or {@code null} when unknown
	 */
	public Expression getStart(int dimension) {
		return starts.get(dimension);
	}

	/**
	 * @param newName another name
	 * @return a copy of this descriptor with another name
	 */
	public VariableDescriptor withName(String newName) {
		return new VariableDescriptor(newName, type, sizes, starts, indexPositions, loopDepth);
	}

	private static List<Integer> firstPositions(int count) {
		List<Integer> positions = new ArrayList<Integer>(count);
		for (int i = 0; i < count; i++) {
			positions.add(Integer.valueOf(i));
		}
		return positions;
	}

	@Override
	public boolean equals(Object other) {
		if (!(other instanceof VariableDescriptor)) {
			return false;
		}
		VariableDescriptor that = (VariableDescriptor) other;
		return name.equals(that.name) && type == that.type && sizes.equals(that.sizes);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type, sizes);
	}

	@Override
	public String toString() {
		return "{" + name + "," + type + "," + sizes.size() + "," + sizes + "}";
	}
}
