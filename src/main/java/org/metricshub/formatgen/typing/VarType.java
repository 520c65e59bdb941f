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

import java.util.regex.Pattern;

/**
 * The type of the values read for a variable.
 * <p>
 * Types form a small lattice: integers used as indices widen to integers,
 * integers widen to floats, and any other mix gives a string.
 */
public enum VarType {
	/** Integer value. */
	INT("int"),
	/** Integer used as a loop bound or as an index. */
	INDEX_INT("index_int"),
	/** Decimal value. */
	FLOAT("float"),
	/** Single character. */
	CHAR("char"),
	/** Anything else. */
	STRING("string"),
	/** Discriminator of a query record. */
	QUERY("query");

	private static final Pattern INTEGER = Pattern.compile("^-?\\d+$");
	private static final Pattern DECIMAL = Pattern.compile("^-?\\d+(\\.\\d+)?$");

	private final String label;

	VarType(String label) {
		this.label = label;
	}

	/**
	 * @return the lower-case name of this type, as shown to users
	 */
	public String getLabel() {
		return label;
	}

	/**
	 * Classifies one value read from a sample.
	 *
	 * @param value the sample token
	 * @return {@link #INT}, {@link #FLOAT}, {@link #CHAR} or {@link #STRING}
	 * @throws TypingException when there is no value to classify
	 */
	public static VarType classify(String value) {
		if (value == null || value.isEmpty()) {
			throw new TypingException("Unknown value type: " + (value == null ? "null" : "empty value"));
		}
		if (INTEGER.matcher(value).matches()) {
			return INT;
		}
		if (DECIMAL.matcher(value).matches()) {
			return FLOAT;
		}
		if (value.length() == 1) {
			return CHAR;
		}
		return STRING;
	}

	/**
	 * Computes the narrowest type that accepts the values of both types.
	 *
	 * @param other the other type
	 * @return the unified type
	 */
	public VarType unify(VarType other) {
		if (this == other) {
			return this;
		}
		if (this == STRING || other == STRING || this == CHAR || other == CHAR) {
			return STRING;
		}
		if (isNumeric() && other.isNumeric()) {
			if (this == FLOAT || other == FLOAT) {
				return FLOAT;
			}
			return INT;
		}
		return STRING;
	}

	private boolean isNumeric() {
		return this == INT || this == INDEX_INT || this == FLOAT;
	}

	@Override
	public String toString() {
		return label;
	}
}
