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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.formatgen.backend.ContextBundle;
import org.metricshub.formatgen.backend.QueryCase;
import org.metricshub.formatgen.backend.TemplateConfigException;
import org.metricshub.formatgen.backend.TemplateRegistry;
import org.metricshub.formatgen.frontend.ast.LexerException;
import org.metricshub.formatgen.intermediate.InputPart;
import org.metricshub.formatgen.util.FormatFileSource;
import org.metricshub.formatgen.util.FormatSource;
import org.metricshub.formatgen.util.GeneratorSettings;

/**
 * Command-line interface for FormatGen.
 * <p>
 * Reads one or more format strings and sample input files, and prints the
 * generated pieces of code, one section per piece.
 */
public final class Cli {

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "FormatGen.jar";
		}
		JAR_NAME = myName;
	}

	private final GeneratorSettings settings = new GeneratorSettings();

	private final List<FormatSource> formatSources = new ArrayList<FormatSource>();
	private final List<String> sampleFiles = new ArrayList<String>();
	private boolean listTemplates;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output stream.
	 */
	public Cli() {
		this(System.out);
	}

	/**
	 * @param out stream where the generated code is written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out) {
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link GeneratorSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public GeneratorSettings getSettings() {
		return settings;
	}

	/**
	 * @return a copy of the format sources
	 */
	public List<FormatSource> getFormatSources() {
		return new ArrayList<FormatSource>(formatSources);
	}

	/**
	 * @return a copy of the sample file names
	 */
	public List<String> getSampleFiles() {
		return new ArrayList<String>(sampleFiles);
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options: format string and sample files follow
				break;
			} else if (arg.equals("-")) {
				++argIdx;
				break;
			} else if (arg.equals("-f")) {
				// -f filename : load a format from file
				checkParameterHasArgument(args, argIdx);
				formatSources.add(new FormatFileSource(args[++argIdx]));
			} else if (arg.equals("-c") || arg.equals("--template")) {
				// -c/--template name : bundled template configuration
				checkParameterHasArgument(args, argIdx);
				settings.setTemplateName(args[++argIdx]);
			} else if (arg.equals("--config")) {
				// --config path : template configuration file
				checkParameterHasArgument(args, argIdx);
				settings.setTemplatePath(args[++argIdx]);
			} else if (arg.equals("-m") || arg.equals("--multiple-cases")) {
				settings.setMultipleCases(true);
			} else if (arg.equals("-q") || arg.equals("--query")) {
				settings.setQueryMode(true);
			} else if (arg.equals("--lenient")) {
				settings.setStrictTyping(false);
			} else if (arg.equals("--dump-tree")) {
				settings.setDumpTree(true);
			} else if (arg.equals("--list-templates")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When listing template configurations, we do not accept other arguments.");
				}
				listTemplates = true;
				return;
			} else if (arg.equals("-h") || arg.equals("-?")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (formatSources.isEmpty()) {
			if (argIdx >= args.length) {
				throw new IllegalArgumentException("Input format not provided.");
			}
			formatSources.add(new FormatSource(FormatSource.DESCRIPTION_INLINE_FORMAT, new StringReader(args[argIdx++])));
		}

		while (argIdx < args.length) {
			sampleFiles.add(args[argIdx++]);
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws IOException if a format or a sample cannot be read
	 */
	public void run() throws IOException {
		PrintStream out = settings.getOutputStream();
		if (printUsage) {
			usage(out);
			return;
		}
		if (listTemplates) {
			for (String name : TemplateRegistry.listNames()) {
				out.println(name);
			}
			return;
		}

		List<String> formats = new ArrayList<String>();
		for (FormatSource source : formatSources) {
			formats.add(source.readText());
		}
		List<Sample> samples = new ArrayList<Sample>();
		for (String file : sampleFiles) {
			samples.add(new Sample(new String(Files.readAllBytes(Paths.get(file)), StandardCharsets.UTF_8)));
		}
		ProblemInput problem = new ProblemInput(formats, samples, settings.isMultipleCases());
		FormatGen formatGen = new FormatGen(settings);

		if (settings.isDumpTree()) {
			List<InputPart> parts = formatGen.process(problem);
			for (int i = 0; i < parts.size(); i++) {
				out.println("# " + formatSources.get(i).getDescription());
				parts.get(i).getTree().dump(out);
			}
			return;
		}

		print(formatGen.generate(problem), out);
	}

	private static void print(ContextBundle bundle, PrintStream out) {
		if (bundle.isMultipleCases()) {
			section(out, "case_count", bundle.getCaseCountPart());
		}
		section(out, "declarations", bundle.getDeclarations());
		section(out, "input", bundle.getInputPart());
		section(out, "formal_arguments", bundle.getFormalArguments());
		section(out, "actual_arguments", bundle.getActualArguments());
		if (bundle.isQueryMode()) {
			section(out, "setup", bundle.getSetupPart());
			for (QueryCase queryCase : bundle.getQueryCases()) {
				section(out, "query " + queryCase.getDiscriminator(), queryCase.getInputPart());
				section(out, "query " + queryCase.getDiscriminator() + " formal_arguments", queryCase.getFormalArguments());
				section(out, "query " + queryCase.getDiscriminator() + " actual_arguments", queryCase.getActualArguments());
			}
		}
	}

	private static void section(PrintStream out, String name, String text) {
		out.println("[" + name + "]");
		out.println(text);
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-c|--template name]" +
								" [--config filename]" +
								" [-m|--multiple-cases]" +
								" [-q|--query]" +
								" [--lenient]" +
								" [--dump-tree]" +
								" [-f format-filename]..." +
								" [format]" +
								" [sample-filename]...");
		dest.println();
		dest.println("java -jar " + JAR_NAME + " --list-templates");
		dest.println();
		dest.println(" -f filename = Use contents of filename as an input format. May be repeated.");
		dest.println(" -c name, --template name = Use a bundled template configuration (default " + TemplateRegistry.DEFAULT_NAME + ").");
		dest.println(" --config filename = Use the template configuration of a properties file.");
		dest.println(" -m, --multiple-cases = Each input starts with the number of test cases.");
		dest.println(" -q, --query = The formats after the first one describe query records.");
		dest.println(" --lenient = Use default types when a sample does not match its format.");
		dest.println(" --dump-tree = Print the normalized format trees and exit.");
		dest.println(" --list-templates = List the template configurations.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param os output stream for the generated code
	 * @return configured and executed CLI instance
	 * @throws IOException if a format or a sample cannot be read
	 */
	public static Cli create(String[] args, PrintStream os) throws IOException {
		Cli cli = new Cli(os);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		try {
			Cli cli = new Cli();
			cli.parse(args);
			cli.run();
		} catch (LexerException | TemplateConfigException e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		}
	}
}
