package org.metricshub.formatgen.util;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;
import org.metricshub.formatgen.backend.TemplateRegistry;

/**
 * A simple container for the parameters of one code generation.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking FormatGen programmatically, from within Java code.
 */
public class GeneratorSettings {

	/**
	 * Name of the bundled template configuration;
	 * <code>cpp</code> by default.
	 */
	private String templateName = TemplateRegistry.DEFAULT_NAME;

	/**
	 * Path of a template configuration file that overrides
	 * {@link #templateName}; <code>null</code> by default.
	 */
	private String templatePath = null;

	/**
	 * Whether each sample starts with the number of test cases;
	 * <code>false</code> by default.
	 */
	private boolean multipleCases = false;

	/**
	 * Whether the formats after the first one describe query records;
	 * <code>false</code> by default.
	 */
	private boolean queryMode = false;

	/**
	 * Whether a sample that does not match its format aborts the generation;
	 * <code>true</code> by default. Otherwise the failure is logged and
	 * default types are used.
	 */
	private boolean strictTyping = true;

	/**
	 * Whether to print the normalized format trees;
	 * <code>false</code> by default.
	 */
	private boolean dumpTree = false;

	/**
	 * Variable that holds the number of test cases;
	 * <code>T</code> by default.
	 */
	private String testCaseVariable = "T";

	/**
	 * Variable that holds the kind of the current query record;
	 * <code>type</code> by default.
	 */
	private String queryTypeVariable = "type";

	/**
	 * Where the generated sections are printed;
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("templateName = ").append(getTemplateName()).append(newLine);
		desc.append("templatePath = ").append(getTemplatePath()).append(newLine);
		desc.append("multipleCases = ").append(isMultipleCases()).append(newLine);
		desc.append("queryMode = ").append(isQueryMode()).append(newLine);
		desc.append("strictTyping = ").append(isStrictTyping()).append(newLine);
		desc.append("testCaseVariable = ").append(getTestCaseVariable()).append(newLine);
		desc.append("queryTypeVariable = ").append(getQueryTypeVariable()).append(newLine);

		return desc.toString();
	}

	public String getTemplateName() {
		return templateName;
	}

	public void setTemplateName(String templateName) {
		this.templateName = templateName;
	}

	public String getTemplatePath() {
		return templatePath;
	}

	public void setTemplatePath(String templatePath) {
		this.templatePath = templatePath;
	}

	public boolean isMultipleCases() {
		return multipleCases;
	}

	public void setMultipleCases(boolean multipleCases) {
		this.multipleCases = multipleCases;
	}

	public boolean isQueryMode() {
		return queryMode;
	}

	public void setQueryMode(boolean queryMode) {
		this.queryMode = queryMode;
	}

	public boolean isStrictTyping() {
		return strictTyping;
	}

	public void setStrictTyping(boolean strictTyping) {
		this.strictTyping = strictTyping;
	}

	public boolean isDumpTree() {
		return dumpTree;
	}

	public void setDumpTree(boolean dumpTree) {
		this.dumpTree = dumpTree;
	}

	public String getTestCaseVariable() {
		return testCaseVariable;
	}

	public void setTestCaseVariable(String testCaseVariable) {
		this.testCaseVariable = testCaseVariable;
	}

	public String getQueryTypeVariable() {
		return queryTypeVariable;
	}

	public void setQueryTypeVariable(String queryTypeVariable) {
		this.queryTypeVariable = queryTypeVariable;
	}

	/**
	 * @return the output stream
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "PrintStream reference is intentionally shared so callers can control output.")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * Sets the PrintStream to print to (instead of System.out by default)
	 *
	 * @param pOutputStream PrintStream to use for the generated sections
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller-supplied PrintStream must be used directly; no defensive copy possible.")
	public void setOutputStream(PrintStream pOutputStream) {
		outputStream = pOutputStream;
	}
}
