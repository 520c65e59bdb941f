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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The pieces of code generated for a problem, ready to be substituted into a
 * program skeleton.
 * <p>
 * {@link #getInputPart()} reads the whole input, declaring each variable just
 * before it is first read. {@link #getDeclarations()} declares all the
 * variables at once, for skeletons that keep declarations apart. Query
 * problems also expose their setup reading and one {@link QueryCase} per
 * kind of query record.
 */
public final class ContextBundle {

	private String declarations = "";
	private String inputPart = "";
	private String formalArguments = "";
	private String actualArguments = "";
	private boolean multipleCases;
	private String caseCountVariable;
	private String caseCountPart;
	private boolean queryMode;
	private String setupPart;
	private String queryCountVariable;
	private String queryTypeVariable;
	private List<QueryCase> queryCases = Collections.emptyList();

	public String getDeclarations() {
		return declarations;
	}

	void setDeclarations(String declarations) {
		this.declarations = declarations;
	}

	public String getInputPart() {
		return inputPart;
	}

	void setInputPart(String inputPart) {
		this.inputPart = inputPart;
	}

	public String getFormalArguments() {
		return formalArguments;
	}

	void setFormalArguments(String formalArguments) {
		this.formalArguments = formalArguments;
	}

	public String getActualArguments() {
		return actualArguments;
	}

	void setActualArguments(String actualArguments) {
		this.actualArguments = actualArguments;
	}

	/**
	 * @return whether the input starts with a number of test cases
	 */
	public boolean isMultipleCases() {
		return multipleCases;
	}

	void setMultipleCases(boolean multipleCases) {
		this.multipleCases = multipleCases;
	}

	/**
	 * @return the variable holding the number of test cases, or {@code null}
	 */
	public String getCaseCountVariable() {
		return caseCountVariable;
	}

	void setCaseCountVariable(String caseCountVariable) {
		this.caseCountVariable = caseCountVariable;
	}

	/**
	 * @return the statements reading the number of test cases, or {@code null}
	 */
	public String getCaseCountPart() {
		return caseCountPart;
	}

	void setCaseCountPart(String caseCountPart) {
		this.caseCountPart = caseCountPart;
	}

	public boolean isQueryMode() {
		return queryMode;
	}

	void setQueryMode(boolean queryMode) {
		this.queryMode = queryMode;
	}

	/**
	 * @return the statements reading the setup part of a query problem, or {@code null}
	 */
	public String getSetupPart() {
		return setupPart;
	}

	void setSetupPart(String setupPart) {
		this.setupPart = setupPart;
	}

	/**
	 * @return the variable holding the number of queries, or {@code null} when it could not be found
	 */
	public String getQueryCountVariable() {
		return queryCountVariable;
	}

	void setQueryCountVariable(String queryCountVariable) {
		this.queryCountVariable = queryCountVariable;
	}

	/**
	 * @return the variable holding the kind of the current query, or {@code null}
	 */
	public String getQueryTypeVariable() {
		return queryTypeVariable;
	}

	void setQueryTypeVariable(String queryTypeVariable) {
		this.queryTypeVariable = queryTypeVariable;
	}

	public List<QueryCase> getQueryCases() {
		return queryCases;
	}

	void setQueryCases(List<QueryCase> queryCases) {
		this.queryCases = Collections.unmodifiableList(new ArrayList<QueryCase>(queryCases));
	}
}
