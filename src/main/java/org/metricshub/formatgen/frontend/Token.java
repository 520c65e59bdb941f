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

/**
 * A token of a format string, with the position where it starts.
 * <p>
 * The value is a {@link Long} for {@link TokenType#NUMBER} tokens, the
 * matched text for the other kinds, and {@code null} for
 * {@link TokenType#EOF}.
 */
public final class Token {

	private final TokenType type;
	private final Object value;
	private final int line;
	private final int column;

	public Token(TokenType type, Object value, int line, int column) {
		this.type = type;
		this.value = value;
		this.line = line;
		this.column = column;
	}

	public TokenType getType() {
		return type;
	}

	public Object getValue() {
		return value;
	}

	/**
	 * @return the value of a {@link TokenType#NUMBER} token
	 */
	public long getNumber() {
		return ((Long) value).longValue();
	}

	/**
	 * @return the value as text
	 */
	public String getText() {
		return value == null ? "" : value.toString();
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	@Override
	public String toString() {
		return value == null ? type.name() : type + "(" + value + ")";
	}
}
