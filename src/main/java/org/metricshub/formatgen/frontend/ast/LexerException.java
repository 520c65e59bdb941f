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

/**
 * Thrown when a format string contains a character that no token rule
 * recognizes. The whole format is rejected.
 */
public class LexerException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int line;
	private final int column;
	private final char offendingCharacter;

	/**
	 * @param line 1-based line of the offending character
	 * @param column 1-based column of the offending character
	 * @param offendingCharacter the character that could not be tokenized
	 */
	public LexerException(int line, int column, char offendingCharacter) {
		this("Unexpected character", line, column, offendingCharacter);
	}

	/**
	 * @param reason what is wrong with the text at this position
	 * @param line 1-based line of the offending text
	 * @param column 1-based column of the offending text
	 * @param offendingCharacter the first character of the offending text
	 */
	public LexerException(String reason, int line, int column, char offendingCharacter) {
		super(reason + " at line " + line + ", column " + column + ": " + offendingCharacter);
		this.line = line;
		this.column = column;
		this.offendingCharacter = offendingCharacter;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	public char getOffendingCharacter() {
		return offendingCharacter;
	}
}
