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

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry of the template configurations known by name.
 * <p>
 * The bundled configurations are read from the {@code /templates/<name>.properties}
 * resources the first time they are asked for. Names are case-insensitive.
 */
public final class TemplateRegistry {

	/** Name of the configuration used when none is specified. */
	public static final String DEFAULT_NAME = "cpp";

	private static final List<String> BUNDLED = Collections.unmodifiableList(Arrays.asList("cpp", "java"));

	private static final ConcurrentMap<String, TemplateConfig> REGISTERED = new ConcurrentHashMap<String, TemplateConfig>();

	private TemplateRegistry() {}

	/**
	 * Registers a configuration under the supplied name, replacing any previous one.
	 *
	 * @param name identifying name
	 * @param config the configuration
	 */
	public static void register(String name, TemplateConfig config) {
		Objects.requireNonNull(name, "Template configuration name must not be null");
		if (name.isEmpty()) {
			throw new IllegalArgumentException("Template configuration name must not be empty");
		}
		REGISTERED.put(name.toLowerCase(Locale.ROOT), Objects.requireNonNull(config, "Template configuration must not be null"));
	}

	/**
	 * @return the names of the bundled and registered configurations, sorted
	 */
	public static List<String> listNames() {
		List<String> names = new ArrayList<String>(BUNDLED);
		for (String name : REGISTERED.keySet()) {
			if (!names.contains(name)) {
				names.add(name);
			}
		}
		Collections.sort(names);
		return Collections.unmodifiableList(names);
	}

	/**
	 * Resolves a configuration name.
	 *
	 * @param name name of the configuration, e.g. {@code cpp}
	 * @return the configuration
	 * @throws TemplateConfigException when no configuration has this name, or it cannot be read
	 */
	public static TemplateConfig resolve(String name) {
		if (name == null || name.isEmpty()) {
			throw new TemplateConfigException("Template configuration name must not be empty");
		}
		String key = name.toLowerCase(Locale.ROOT);
		TemplateConfig config = REGISTERED.get(key);
		if (config != null) {
			return config;
		}
		config = loadBundled(key);
		TemplateConfig existing = REGISTERED.putIfAbsent(key, config);
		return existing != null ? existing : config;
	}

	private static TemplateConfig loadBundled(String key) {
		InputStream in = TemplateRegistry.class.getResourceAsStream("/templates/" + key + ".properties");
		if (in == null) {
			throw new TemplateConfigException("Unknown template configuration: " + key + " (available: " + listNames() + ")");
		}
		try {
			return TemplateConfig.load(key, in);
		} catch (IOException e) {
			throw new TemplateConfigException("Cannot read template configuration " + key, e);
		}
	}
}
