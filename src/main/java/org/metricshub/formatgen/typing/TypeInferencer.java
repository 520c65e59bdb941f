package org.metricshub.formatgen.typing;

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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.formatgen.frontend.ast.Expression;
import org.metricshub.formatgen.frontend.ast.Expressions;
import org.metricshub.formatgen.frontend.ast.Format;
import org.metricshub.formatgen.frontend.ast.Item;
import org.metricshub.formatgen.frontend.ast.Loop;
import org.metricshub.formatgen.frontend.ast.Statement;
import org.metricshub.formatgen.util.FormatGenLogger;
import org.slf4j.Logger;

/**
 * Infers the type of every variable of a format from sample inputs.
 * <p>
 * Each sample is matched against the tree; the values read for a variable are
 * classified and unified, first within the sample, then across samples. When a
 * sample does not fit the tree, the tree is matched once more with its
 * single-read loops collapsed (see {@link LoopCollapser}); if that fails too,
 * the first failure is reported.
 * <p>
 * An integer variable used in a loop bound or in an index ends up typed
 * {@link VarType#INDEX_INT}.
 */
public class TypeInferencer {

	private static final Logger LOG = FormatGenLogger.getLogger(TypeInferencer.class);

	private final Matcher matcher = new Matcher();
	private final boolean strict;

	/**
	 * Creates a strict inferencer.
	 */
	public TypeInferencer() {
		this(true);
	}

	/**
	 * @param strict when {@code false}, samples that do not fit the tree are
	 *        logged and the result carries no type instead of failing
	 */
	public TypeInferencer(boolean strict) {
		this.strict = strict;
	}

	/**
	 * @param format the normalized tree
	 * @param instances the sample inputs
	 * @return the inferred types
	 * @throws MatchException when a sample does not fit, even after collapsing, in strict mode
	 * @throws TypingException when a value cannot be classified
	 */
	public TypingResult infer(Format format, List<String> instances) {
		if (instances.isEmpty()) {
			return new TypingResult(Collections.<String, VarType>emptyMap(), Collections.<String>emptySet(), format);
		}
		try {
			return finish(inferAll(format, instances), Collections.<String>emptySet(), format);
		} catch (MatchException e) {
			Set<String> collapsedNames = new LinkedHashSet<String>();
			Format collapsed = new LoopCollapser().collapse(format, collapsedNames);
			if (collapsedNames.isEmpty()) {
				return fail(format, e);
			}
			LOG.warn("Samples do not match the format ({}), retrying with {} read as single tokens", e.getMessage(), collapsedNames);
			try {
				return finish(inferAll(collapsed, instances), collapsedNames, collapsed);
			} catch (MatchException retryFailure) {
				LOG.debug("Collapsed format does not match either: {}", retryFailure.getMessage());
				return fail(format, e);
			}
		}
	}

	private TypingResult fail(Format format, MatchException e) {
		if (strict) {
			throw e;
		}
		LOG.warn("Type inference failed, falling back to default types: {}", e.getMessage());
		return new TypingResult(Collections.<String, VarType>emptyMap(), Collections.<String>emptySet(), format);
	}

	private Map<String, VarType> inferAll(Format format, List<String> instances) {
		Map<String, VarType> types = null;
		for (String instance : instances) {
			Map<String, VarType> instanceTypes = typesOf(matcher.match(format, instance));
			types = types == null ? instanceTypes : unify(types, instanceTypes);
		}
		return types;
	}

	private static Map<String, VarType> typesOf(MatchEnvironment environment) {
		Map<String, VarType> types = new LinkedHashMap<String, VarType>();
		for (String name : environment.getNames()) {
			VarType type = null;
			for (String value : environment.getValues(name)) {
				VarType candidate = VarType.classify(value);
				type = type == null ? candidate : type.unify(candidate);
			}
			if (type == null) {
				throw new TypingException("Failed to infer type: " + name + " has no values");
			}
			types.put(name, type);
		}
		return types;
	}

	private static Map<String, VarType> unify(Map<String, VarType> first, Map<String, VarType> second) {
		Map<String, VarType> result = new LinkedHashMap<String, VarType>(first);
		for (Map.Entry<String, VarType> entry : second.entrySet()) {
			VarType existing = result.get(entry.getKey());
			result.put(entry.getKey(), existing == null ? entry.getValue() : existing.unify(entry.getValue()));
		}
		return result;
	}

	private TypingResult finish(Map<String, VarType> inferred, Set<String> collapsedNames, Format tree) {
		Map<String, VarType> types = new LinkedHashMap<String, VarType>(inferred);
		Set<String> indexNames = new HashSet<String>();
		collectIndexNames(tree.getChildren(), indexNames);
		for (Map.Entry<String, VarType> entry : types.entrySet()) {
			if (entry.getValue() == VarType.INT && indexNames.contains(entry.getKey())) {
				entry.setValue(VarType.INDEX_INT);
			}
		}
		LOG.debug("Inferred types {}", types);
		return new TypingResult(types, collapsedNames, new Format(annotate(tree.getChildren(), types)));
	}

	/**
	 * Collects the names used in loop bounds and index expressions.
	 */
	private static void collectIndexNames(List<Statement> statements, Set<String> names) {
		for (Statement statement : statements) {
			if (statement instanceof Loop) {
				Loop loop = (Loop) statement;
				Expressions.collectNames(loop.getStart(), names);
				Expressions.collectNames(loop.getEnd(), names);
				collectIndexNames(loop.getBody(), names);
			} else {
				for (Expression index : ((Item) statement).getIndices()) {
					Expressions.collectNames(index, names);
				}
			}
		}
	}

	private static List<Statement> annotate(List<Statement> statements, Map<String, VarType> types) {
		List<Statement> result = new ArrayList<Statement>(statements.size());
		for (Statement statement : statements) {
			if (statement instanceof Loop) {
				Loop loop = (Loop) statement;
				result.add(loop.withBody(annotate(loop.getBody(), types)));
			} else {
				Item item = (Item) statement;
				result.add(item.withType(types.get(item.getName())));
			}
		}
		return result;
	}
}
