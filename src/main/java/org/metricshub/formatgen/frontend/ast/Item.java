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
import org.metricshub.formatgen.typing.VarType;

/**
 * A named variable reference, with zero (scalar) or more index expressions.
 * <p>
 * An item is both a statement (a value to read) and an expression (a
 * reference used in an index or a loop bound). Once the types are inferred,
 * it may carry the {@link VarType} of its variable; the type tag does not take
 * part in structural equality.
 */
public final class Item extends Expression implements Statement {

	private final String name;
	private final List<Expression> indices;
	private final VarType type;

	/**
	 * Creates a scalar reference.
	 *
	 * @param name variable name
	 */
	public Item(String name) {
		this(name, Collections.<Expression>emptyList(), null);
	}

	/**
	 * @param name variable name
	 * @param indices index expressions, outermost first
	 */
	public Item(String name, List<? extends Expression> indices) {
		this(name, indices, null);
	}

	private Item(String name, List<? extends Expression> indices, VarType type) {
		this.name = Objects.requireNonNull(name, "name");
		this.indices = Collections.unmodifiableList(new ArrayList<Expression>(indices));
		this.type = type;
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the index expressions; the size of this list is the dimensionality of the reference
	 */
	public List<Expression> getIndices() {
		return indices;
	}

	/**
	 * @return the inferred type, or {@code null} when the tree is not typed yet
	 */
	public VarType getType() {
		return type;
	}

	/**
	 * @param newType the inferred type
	 * @return a copy of this item carrying the specified type
	 */
	public Item withType(VarType newType) {
		return new Item(name, indices, newType);
	}

	/**
	 * @param newIndices replacement index expressions
	 * @return a copy of this item with other indices
	 */
	public Item withIndices(List<? extends Expression> newIndices) {
		return new Item(name, newIndices, type);
	}

	@Override
	int precedence() {
		return 3;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitItem(this);
	}

	@Override
	public boolean equals(Object other) {
		if (!(other instanceof Item)) {
			return false;
		}
		Item that = (Item) other;
		return name.equals(that.name) && indices.equals(that.indices);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, indices);
	}

	@Override
	public String toString() {
		if (indices.isEmpty()) {
			return name;
		}
		StringBuilder sb = new StringBuilder(name).append("_{");
		for (int i = 0; i < indices.size(); i++) {
			if (i > 0) {
				sb.append(',');
			}
			sb.append(indices.get(i));
		}
		return sb.append('}').toString();
	}
}
