package org.metricshub.formatgen;

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
 * What is known of a problem statement: its input format strings, its
 * samples, and whether each input starts with a number of test cases.
 * <p>
 * A problem usually has one format. Query problems have the format of the
 * setup first, then the format of every kind of query record.
 */
public final class ProblemInput {

	private final List<String> formats;
	private final List<Sample> samples;
	private final boolean multipleCases;

	/**
	 * @param formats input format strings
	 * @param samples samples of the problem
	 * @param multipleCases whether each input starts with a number of test cases
	 */
	public ProblemInput(List<String> formats, List<Sample> samples, boolean multipleCases) {
		if (formats.isEmpty()) {
			throw new IllegalArgumentException("A problem needs at least one input format");
		}
		this.formats = Collections.unmodifiableList(new ArrayList<String>(formats));
		this.samples = Collections.unmodifiableList(new ArrayList<Sample>(samples));
		this.multipleCases = multipleCases;
	}

	/**
	 * Creates a problem with a single format.
	 *
	 * @param format the input format string
	 * @param sampleInputs sample inputs, without outputs
	 * @return the problem
	 */
	public static ProblemInput of(String format, String... sampleInputs) {
		List<Sample> samples = new ArrayList<Sample>(sampleInputs.length);
		for (String input : sampleInputs) {
			samples.add(new Sample(input));
		}
		return new ProblemInput(Collections.singletonList(format), samples, false);
	}

	public List<String> getFormats() {
		return formats;
	}

	public List<Sample> getSamples() {
		return samples;
	}

	public boolean isMultipleCases() {
		return multipleCases;
	}

	/**
	 * @return the sample inputs
	 */
	public List<String> getSampleInputs() {
		List<String> inputs = new ArrayList<String>(samples.size());
		for (Sample sample : samples) {
			inputs.add(sample.getInput());
		}
		return inputs;
	}
}
