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
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The templates of a target language.
 * <p>
 * Templates are strings with {@code {name}} placeholders. They are keyed by
 * role ({@code declare}, {@code input}, {@code arg}...) and by scalar type
 * ({@code int}, {@code float}, {@code str}) or dimensionality ({@code seq},
 * {@code 2d_seq}), e.g. {@code input.int} or {@code access.2d_seq}. A
 * placeholder with no value is left as is.
 */
public final class TemplateConfig {

	private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)\\}");

	/** Keys every configuration must define. */
	public static final List<String> REQUIRED_KEYS = Collections.unmodifiableList(Arrays.asList(
			"base_indent",
			"loop.header",
			"loop.footer",
			"type.int",
			"type.float",
			"type.str",
			"default.int",
			"default.float",
			"default.str",
			"declare.int",
			"declare.float",
			"declare.str",
			"input.int",
			"input.float",
			"input.str",
			"arg.int",
			"arg.float",
			"arg.str",
			"arg.seq",
			"arg.2d_seq",
			"access.seq",
			"access.2d_seq",
			"declare_and_allocate.seq",
			"declare_and_allocate.2d_seq"));

	/** Default marker emitted for what cannot be generated. */
	public static final String DEFAULT_UNRESOLVED = "/* unresolved: {name} */";

	private final String name;
	private final Properties properties;

	/**
	 * @param name name of the configuration, e.g. {@code cpp}
	 * @param properties the templates
	 * @throws TemplateConfigException when a required key is missing or {@code base_indent} is not a number
	 */
	public TemplateConfig(String name, Properties properties) {
		this.name = Objects.requireNonNull(name, "name");
		this.properties = new Properties();
		this.properties.putAll(properties);
		for (String key : REQUIRED_KEYS) {
			if (this.properties.getProperty(key) == null) {
				throw new TemplateConfigException("Template configuration " + name + " has no " + key + " template");
			}
		}
		getBaseIndent();
	}

	/**
	 * Reads a configuration from a properties stream, in UTF-8.
	 *
	 * @param name name of the configuration
	 * @param in the stream to read
	 * @return the configuration
	 * @throws IOException when the stream cannot be read
	 */
	public static TemplateConfig load(String name, InputStream in) throws IOException {
		Properties properties = new Properties();
		try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
			properties.load(reader);
		}
		return new TemplateConfig(name, properties);
	}

	/**
	 * Reads a configuration from a properties file, in UTF-8.
	 *
	 * @param path the file to read
	 * @return the configuration, named after the file
	 * @throws IOException when the file cannot be read
	 */
	public static TemplateConfig load(Path path) throws IOException {
		String fileName = path.getFileName().toString();
		int dot = fileName.lastIndexOf('.');
		try (InputStream in = Files.newInputStream(path)) {
			return load(dot > 0 ? fileName.substring(0, dot) : fileName, in);
		}
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the number of spaces of one indentation level
	 */
	public int getBaseIndent() {
		String value = properties.getProperty("base_indent").trim();
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new TemplateConfigException("Invalid base_indent in " + name + ": " + value, e);
		}
	}

	/**
	 * @return one indentation level
	 */
	public String getIndent() {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < getBaseIndent(); i++) {
			sb.append(' ');
		}
		return sb.toString();
	}

	/**
	 * @param key a template key
	 * @return whether the configuration defines it
	 */
	public boolean has(String key) {
		return properties.getProperty(key) != null;
	}

	/**
	 * @param key a template key
	 * @return the template
	 * @throws TemplateConfigException when the key is not defined
	 */
	public String get(String key) {
		String value = properties.getProperty(key);
		if (value == null) {
			throw new TemplateConfigException("Template configuration " + name + " has no " + key + " template");
		}
		return value;
	}

	/**
	 * @param key a template key
	 * @param defaultValue what to return when the key is not defined
	 * @return the template, or {@code defaultValue}
	 */
	public String get(String key, String defaultValue) {
		return properties.getProperty(key, defaultValue);
	}

	/**
	 * @param key a template key
	 * @param parameters placeholder values
	 * @return the template with its placeholders substituted
	 */
	public String format(String key, Map<String, String> parameters) {
		return substitute(get(key), parameters);
	}

	/**
	 * Substitutes {@code {name}} placeholders. Placeholders without a value stay verbatim.
	 *
	 * @param template the template
	 * @param parameters placeholder values
	 * @return the substituted text
	 */
	public static String substitute(String template, Map<String, String> parameters) {
		Matcher matcher = PLACEHOLDER.matcher(template);
		StringBuffer sb = new StringBuffer();
		while (matcher.find()) {
			String value = parameters.get(matcher.group(1));
			matcher.appendReplacement(sb, Matcher.quoteReplacement(value == null ? matcher.group() : value));
		}
		matcher.appendTail(sb);
		return sb.toString();
	}

	@Override
	public String toString() {
		return "TemplateConfig[" + name + "]";
	}
}
