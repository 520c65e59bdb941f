package org.metricshub.formatgen.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import org.junit.Test;

public class TemplateRegistryTest {

	@Test
	public void testBundledConfigurations() {
		TemplateConfig cpp = TemplateRegistry.resolve("cpp");
		assertEquals("cpp", cpp.getName());
		assertEquals("std::cin >> {name};", cpp.get("input.int"));
		assertSame(cpp, TemplateRegistry.resolve("CPP"));
		assertEquals("java", TemplateRegistry.resolve("java").getName());
	}

	@Test
	public void testUnknownConfiguration() {
		TemplateConfigException e = assertThrows(TemplateConfigException.class, () -> TemplateRegistry.resolve("cobol"));
		assertTrue(e.getMessage(), e.getMessage().startsWith("Unknown template configuration: cobol"));
	}

	@Test
	public void testRegister() throws IOException {
		Properties properties = new Properties();
		try (InputStream in = TemplateRegistryTest.class.getResourceAsStream("/templates/java.properties")) {
			properties.load(in);
		}
		TemplateConfig custom = new TemplateConfig("kotlinish", properties);
		TemplateRegistry.register("Kotlinish", custom);
		assertSame(custom, TemplateRegistry.resolve("kotlinish"));
		assertTrue(TemplateRegistry.listNames().contains("kotlinish"));
		assertThrows(IllegalArgumentException.class, () -> TemplateRegistry.register("", custom));
	}

	@Test
	public void testListNamesIsSorted() {
		List<String> names = TemplateRegistry.listNames();
		assertTrue(names.containsAll(Arrays.asList("cpp", "java")));
		List<String> sorted = new ArrayList<String>(names);
		Collections.sort(sorted);
		assertEquals(sorted, names);
	}
}
