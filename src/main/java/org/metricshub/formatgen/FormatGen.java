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

import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.metricshub.formatgen.backend.ContextBundle;
import org.metricshub.formatgen.backend.TemplateConfig;
import org.metricshub.formatgen.backend.TemplateConfigException;
import org.metricshub.formatgen.backend.TemplateRegistry;
import org.metricshub.formatgen.backend.UniversalGenerator;
import org.metricshub.formatgen.frontend.Analyzer;
import org.metricshub.formatgen.frontend.Diagnostic;
import org.metricshub.formatgen.frontend.Lexer;
import org.metricshub.formatgen.frontend.ParseResult;
import org.metricshub.formatgen.frontend.Parser;
import org.metricshub.formatgen.frontend.Token;
import org.metricshub.formatgen.frontend.ast.Format;
import org.metricshub.formatgen.intermediate.InputPart;
import org.metricshub.formatgen.intermediate.VariableDescriptor;
import org.metricshub.formatgen.intermediate.VariableExtractor;
import org.metricshub.formatgen.typing.MatchException;
import org.metricshub.formatgen.typing.Matcher;
import org.metricshub.formatgen.typing.TypeInferencer;
import org.metricshub.formatgen.typing.TypingResult;
import org.metricshub.formatgen.util.FormatGenLogger;
import org.metricshub.formatgen.util.GeneratorSettings;
import org.slf4j.Logger;

/**
 * Entry point into the whole pipeline, when FormatGen is used as a library.
 * <p>
 * A format string is tokenized, parsed, normalized, typed against the sample
 * inputs, and its variables are extracted; the resulting {@link InputPart}s
 * are then handed to the {@link UniversalGenerator}.
 *
 * <pre>
 * ContextBundle bundle = new FormatGen().generate(ProblemInput.of("N\na_1 a_2 … a_N", "3\n1 2 3"));
 * </pre>
 */
public class FormatGen {

	private static final Logger LOG = FormatGenLogger.getLogger(FormatGen.class);

	private final GeneratorSettings settings;

	/**
	 * Creates a pipeline with default settings.
	 */
	public FormatGen() {
		this(new GeneratorSettings());
	}

	/**
	 * @param settings options of the pipeline
	 */
	public FormatGen(GeneratorSettings settings) {
		this.settings = settings;
	}

	/**
	 * A format string, normalized but not typed yet.
	 */
	private static final class AnalyzedFormat {
		private final Format tree;
		private final List<Diagnostic> diagnostics;
		private final Long discriminator;

		private AnalyzedFormat(Format tree, List<Diagnostic> diagnostics, Long discriminator) {
			this.tree = tree;
			this.diagnostics = diagnostics;
			this.discriminator = discriminator;
		}
	}

	/**
	 * Runs the front end and the type inference on one format string.
	 *
	 * @param format the format string
	 * @param sampleInputs the sample inputs this format describes
	 * @return the processed format
	 * @throws org.metricshub.formatgen.frontend.ast.LexerException when the format contains an unknown character
	 * @throws MatchException when a sample does not fit the format, with strict typing
	 */
	public InputPart process(String format, List<String> sampleInputs) {
		return type(analyze(format), sampleInputs);
	}

	/**
	 * Parses and normalizes a format string, without typing.
	 *
	 * @param format the format string
	 * @return the normalized tree
	 */
	public Format normalize(String format) {
		return analyze(format).tree;
	}

	private AnalyzedFormat analyze(String format) {
		List<Token> tokens = new Lexer(format).tokenize();
		LOG.debug("{} tokens in format", tokens.size());
		ParseResult parsed = new Parser(tokens).parse();
		for (Diagnostic diagnostic : parsed.getDiagnostics()) {
			LOG.warn("Format {}", diagnostic);
		}
		Format tree = new Analyzer().analyze(parsed.getRoot());
		Long discriminator = parsed.getStatementLiterals().isEmpty() ? null : parsed.getStatementLiterals().get(0);
		return new AnalyzedFormat(tree, parsed.getDiagnostics(), discriminator);
	}

	private InputPart type(AnalyzedFormat analyzed, List<String> sampleInputs) {
		TypingResult typing = new TypeInferencer(settings.isStrictTyping()).infer(analyzed.tree, sampleInputs);
		List<VariableDescriptor> variables = new VariableExtractor().extract(analyzed.tree, typing);
		return new InputPart(variables, typing.getTree(), analyzed.diagnostics, analyzed.discriminator);
	}

	/**
	 * Processes every format of a problem.
	 * <p>
	 * Formats that follow each other in the input are typed against what the
	 * previous formats left of each sample. In query mode, the first format is
	 * the setup, and every other format is typed against the sample lines
	 * that follow the setup and start with its discriminator.
	 *
	 * @param problem the formats and samples
	 * @return one part per format
	 */
	public List<InputPart> process(ProblemInput problem) {
		List<String> inputs = new ArrayList<String>();
		for (String input : problem.getSampleInputs()) {
			inputs.add(isMultipleCases(problem) ? dropFirstLine(input) : input);
		}
		if (settings.isQueryMode() && problem.getFormats().size() > 1) {
			return processQueries(problem.getFormats(), inputs);
		}
		return processSequence(problem.getFormats(), inputs);
	}

	/**
	 * Processes every format of a problem and generates the code reading its input.
	 *
	 * @param problem the formats and samples
	 * @return the generated pieces of code
	 */
	public ContextBundle generate(ProblemInput problem) {
		LOG.debug("Generating with settings:\n{}", settings.toDescriptionString());
		UniversalGenerator generator = new UniversalGenerator(getTemplateConfig(), settings);
		return generator.generate(process(problem), isMultipleCases(problem));
	}

	/**
	 * @return the template configuration selected by the settings
	 * @throws TemplateConfigException when it cannot be found or read
	 */
	public TemplateConfig getTemplateConfig() {
		if (settings.getTemplatePath() != null) {
			try {
				return TemplateConfig.load(Paths.get(settings.getTemplatePath()));
			} catch (IOException e) {
				throw new TemplateConfigException("Cannot read template configuration " + settings.getTemplatePath(), e);
			}
		}
		return TemplateRegistry.resolve(settings.getTemplateName());
	}

	private boolean isMultipleCases(ProblemInput problem) {
		return settings.isMultipleCases() || problem.isMultipleCases();
	}

	private List<InputPart> processSequence(List<String> formats, List<String> inputs) {
		List<InputPart> parts = new ArrayList<InputPart>(formats.size());
		List<String> remaining = new ArrayList<String>(inputs);
		for (String format : formats) {
			InputPart part = process(format, remaining);
			parts.add(part);
			for (int s = 0; s < remaining.size(); s++) {
				remaining.set(s, dropTokens(remaining.get(s), consumedTokens(part.getTree(), remaining.get(s))));
			}
		}
		return parts;
	}

	private List<InputPart> processQueries(List<String> formats, List<String> inputs) {
		InputPart setup = process(formats.get(0), inputs);

		List<List<String>> records = new ArrayList<List<String>>();
		for (String input : inputs) {
			records.add(recordLines(setup.getTree(), input));
		}

		List<InputPart> parts = new ArrayList<InputPart>(formats.size());
		parts.add(setup);
		for (int p = 1; p < formats.size(); p++) {
			AnalyzedFormat analyzed = analyze(formats.get(p));
			String discriminator = String.valueOf(analyzed.discriminator != null ? analyzed.discriminator.longValue() : p);
			List<String> matching = new ArrayList<String>();
			for (List<String> lines : records) {
				for (String line : lines) {
					String[] tokens = line.trim().split("\\s+", 2);
					if (tokens[0].equals(discriminator)) {
						matching.add(tokens.length > 1 ? tokens[1] : "");
					}
				}
			}
			LOG.debug("{} records of kind {}", matching.size(), discriminator);
			parts.add(type(analyzed, matching));
		}
		return parts;
	}

	/**
	 * @return the lines of a sample that follow the setup part
	 */
	private static List<String> recordLines(Format setup, String input) {
		List<String> lines = new ArrayList<String>(Arrays.asList(input.split("\n")));
		int consumed;
		try {
			consumed = new Matcher().match(setup, input).getConsumedTokens();
		} catch (MatchException e) {
			LOG.debug("Setup does not match the sample ({}), assuming it is the first line", e.getMessage());
			return lines.isEmpty() ? lines : lines.subList(1, lines.size());
		}
		int line = 0;
		while (consumed > 0 && line < lines.size()) {
			consumed -= countTokens(lines.get(line));
			line++;
		}
		List<String> result = new ArrayList<String>();
		for (String remaining : lines.subList(line, lines.size())) {
			if (!remaining.trim().isEmpty()) {
				result.add(remaining);
			}
		}
		return result;
	}

	private static int consumedTokens(Format tree, String input) {
		try {
			return new Matcher().match(tree, input).getConsumedTokens();
		} catch (MatchException e) {
			LOG.debug("Cannot tell how much of the sample the format reads: {}", e.getMessage());
			return 0;
		}
	}

	private static int countTokens(String text) {
		String trimmed = text.trim();
		return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
	}

	private static String dropTokens(String text, int count) {
		if (count == 0) {
			return text;
		}
		String trimmed = text.trim();
		if (trimmed.isEmpty()) {
			return trimmed;
		}
		List<String> tokens = Arrays.asList(trimmed.split("\\s+"));
		if (count >= tokens.size()) {
			return "";
		}
		StringBuilder sb = new StringBuilder();
		for (String token : tokens.subList(count, tokens.size())) {
			if (sb.length() > 0) {
				sb.append(' ');
			}
			sb.append(token);
		}
		return sb.toString();
	}

	private static String dropFirstLine(String input) {
		int newLine = input.indexOf('\n');
		return newLine < 0 ? "" : input.substring(newLine + 1);
	}

	/**
	 * @return the settings of this pipeline
	 */
	public GeneratorSettings getSettings() {
		return settings;
	}

	/**
	 * Convenience for a single format with its samples.
	 *
	 * @param format the format string
	 * @param sampleInputs the sample inputs
	 * @return the processed format
	 */
	public InputPart process(String format, String... sampleInputs) {
		return process(format, sampleInputs.length == 0 ? Collections.<String>emptyList() : Arrays.asList(sampleInputs));
	}
}
