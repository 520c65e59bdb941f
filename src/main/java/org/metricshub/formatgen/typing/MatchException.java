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


/**
 * Thrown when a sample does not fit a format tree: the sample is too short,
 * or an expression refers to something the sample has not bound.
 */
public class MatchException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int tokenPosition;

	/**
	 * @param message what went wrong
	 */
	public MatchException(String message) {
		this(-1, message);
	}

	/**
	 * @param tokenPosition index of the sample token being read, 0-based
	 * @param message what went wrong
	 */
	public MatchException(int tokenPosition, String message) {
		super(message);
		this.tokenPosition = tokenPosition;
	}

	/**
	 * Returns the position of the sample token being read when the error
	 * occurred, or {@code -1} if unavailable.
	 *
	 * @return the 0-based token position or {@code -1}
	 */
	public int getTokenPosition() {
		return tokenPosition;
	}
}
