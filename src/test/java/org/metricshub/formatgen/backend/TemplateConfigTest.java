package org.metricshub.formatgen.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TemplateConfigTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private static Properties cppProperties() throws IOException {
		Properties properties = new Properties();
		try (InputStream in = TemplateConfigTest.class.getResourceAsStream("/templates/cpp.properties")) {
			properties.load(in);
		}
		return properties;
	}

	@Test
	public void testSubstitute() {
		Map<String, String> parameters = new HashMap<String, String>();
		parameters.put("name", "A");
		parameters.put("index", "i");
		assertEquals("A[i]", TemplateConfig.substitute("{name}[{index}]", parameters));
		assertEquals("A[{other}]", TemplateConfig.substitute("{name}[{other}]", parameters));
	}

	@Test
	public void testSubstituteSpecialCharacters() {
		Map<String, String> parameters = new HashMap<String, String>();
		parameters.put("name", "$x\\y");
		assertEquals("read($x\\y)", TemplateConfig.substitute("read({name})", parameters));
	}

	@Test
	public void testMissingRequiredKey() throws IOException {
		Properties properties = cppProperties();
		properties.remove("input.float");
		TemplateConfigException e = assertThrows(TemplateConfigException.class, () -> new TemplateConfig("broken", properties));
		assertTrue(e.getMessage(), e.getMessage().contains("input.float"));
	}

	@Test
	public void testInvalidIndent() throws IOException {
		Properties properties = cppProperties();
		properties.setProperty("base_indent", "four");
		assertThrows(TemplateConfigException.class, () -> new TemplateConfig("broken", properties));
	}

	@Test
	public void testIndentAndLookup() throws IOException {
		Properties properties = cppProperties();
		properties.setProperty("base_indent", "2");
		TemplateConfig config = new TemplateConfig("custom", properties);
		assertEquals("  ", config.getIndent());
		assertTrue(config.has("allocate.seq"));
		assertFalse(config.has("no.such.key"));
		assertEquals("fallback", config.get("no.such.key", "fallback"));
		assertThrows(TemplateConfigException.class, () -> config.get("no.such.key"));
	}

	@Test
	public void testLoadFromFile() throws IOException {
		Path file = folder.newFile("mylang.properties").toPath();
		try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
			cppProperties().store(writer, null);
		}
		TemplateConfig config = TemplateConfig.load(file);
		assertEquals("mylang", config.getName());
		assertEquals(4, config.getBaseIndent());
	}
}
