package org.metricshub.formatgen.backend;

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
 * The code of one kind of query record.
 */
public final class QueryCase {

	private final long discriminator;
	private final String inputPart;
	private final String formalArguments;
	private final String actualArguments;

	/**
	 * @param discriminator value of the query type that selects this case
	 * @param inputPart the statements reading the record
	 * @param formalArguments parameter list for the variables of the record
	 * @param actualArguments argument list for the variables of the record
	 */
	public QueryCase(long discriminator, String inputPart, String formalArguments, String actualArguments) {
		this.discriminator = discriminator;
		this.inputPart = inputPart;
		this.formalArguments = formalArguments;
		this.actualArguments = actualArguments;
	}

	public long getDiscriminator() {
		return discriminator;
	}

	public String getInputPart() {
		return inputPart;
	}

	public String getFormalArguments() {
		return formalArguments;
	}

	public String getActualArguments() {
		return actualArguments;
	}

	@Override
	public String toString() {
		return "QueryCase[" + discriminator + "](" + formalArguments + ")";
	}
}
