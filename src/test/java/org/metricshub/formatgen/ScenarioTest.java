package org.metricshub.formatgen;

import static org.junit.Assert.assertEquals;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;

/**
 * End-to-end scenarios. Each directory of src/test/resources/scenarios holds
 * the formats of a problem (format*.txt), its sample inputs (sample*.txt),
 * optional command line switches (options.txt, one per line) and the expected
 * output of the command line (expected.txt).
 */
@RunWith(Parameterized.class)
public class ScenarioTest {

	private static final String SCENARIOS_PATH = "/scenarios";
	private static Path scenariosDirectory;

	/**
	 * @return the names of the scenario directories
	 * @throws Exception when the scenarios cannot be found
	 */
	@Parameters(name = "scenario {0}")
	public static Iterable<String> scenarioList() throws Exception {
		URL url = ScenarioTest.class.getResource(SCENARIOS_PATH);
		if (url == null) {
			throw new IOException("Couldn't find resource " + SCENARIOS_PATH);
		}
		scenariosDirectory = Paths.get(url.toURI());
		if (!scenariosDirectory.toFile().isDirectory()) {
			throw new IOException(SCENARIOS_PATH + " is not a directory");
		}
		return Arrays
				.stream(scenariosDirectory.toFile().listFiles())
				.filter(File::isDirectory)
				.map(File::getName)
				.sorted()
				.collect(Collectors.toList());
	}

	/** Name of the scenario directory */
	@Parameter
	public String scenarioName;

	private static List<String> filesStartingWith(Path directory, String prefix) {
		return Arrays
				.stream(directory.toFile().listFiles())
				.filter(f -> f.getName().startsWith(prefix))
				.map(File::getPath)
				.sorted()
				.collect(Collectors.toList());
	}

	@Test
	public void test() throws Exception {
		Path directory = scenariosDirectory.resolve(scenarioName);

		List<String> args = new ArrayList<String>();
		Path options = directory.resolve("options.txt");
		if (options.toFile().exists()) {
			for (String line : Files.readAllLines(options, StandardCharsets.UTF_8)) {
				if (!line.trim().isEmpty()) {
					args.add(line.trim());
				}
			}
		}
		for (String format : filesStartingWith(directory, "format")) {
			args.add("-f");
			args.add(format);
		}
		args.addAll(filesStartingWith(directory, "sample"));

		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		try (PrintStream out = new PrintStream(bytes, true, "UTF-8")) {
			Cli.create(args.toArray(new String[0]), out);
		}

		String expected = new String(Files.readAllBytes(directory.resolve("expected.txt")), StandardCharsets.UTF_8);
		assertEquals(scenarioName, expected.replace("\r\n", "\n"), bytes.toString("UTF-8").replace("\r\n", "\n"));
	}
}
