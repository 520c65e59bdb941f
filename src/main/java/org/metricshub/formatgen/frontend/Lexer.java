package org.metricshub.formatgen.frontend;

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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.formatgen.frontend.ast.LexerException;

/**
 * Turns a format string into tokens.
 * <p>
 * The text is first normalized: LaTeX styling macros around plain text
 * ({@code \mathrm{...}}, {@code \operatorname{...}}, {@code \text{...}}) are
 * reduced to their content, and Unicode subscript glyphs are replaced by their
 * ASCII equivalent, each run of glyphs being introduced by a single
 * {@code _}: {@code aₙ₋₁} becomes {@code a_n-1}.
 * <p>
 * Tokens are then recognized by an ordered list of rules, the first rule
 * matching at the current position wins.
 */
public class Lexer {

	private static final class Rule {
		private final TokenType type;
		private final Pattern pattern;

		private Rule(TokenType type, String regex) {
			this.type = type;
			this.pattern = Pattern.compile(regex);
		}
	}

	private static final List<Rule> RULES;

	static {
		List<Rule> rules = new ArrayList<Rule>();
		rules.add(new Rule(TokenType.NEWLINE, "\\r\\n|\\r|\\n"));
		rules.add(new Rule(TokenType.SPACE, "[ \\t\\u00a0]+"));
		rules.add(new Rule(TokenType.DOTS, "\\\\ldots|\\\\cdots|\\\\dots|\\.\\.\\.|…"));
		rules.add(new Rule(TokenType.VDOTS, "\\\\vdots|⋮"));
		rules.add(new Rule(TokenType.SUBSCRIPT, "_"));
		rules.add(new Rule(TokenType.NUMBER, "[0-9]+"));
		rules.add(new Rule(TokenType.IDENT, "[a-zA-Z][a-zA-Z0-9]*"));
		rules.add(new Rule(TokenType.BINOP, "[-+*/]"));
		rules.add(new Rule(TokenType.LPAREN, "[{(\\[]"));
		rules.add(new Rule(TokenType.RPAREN, "[})\\]]"));
		rules.add(new Rule(TokenType.COMMA, ","));
		RULES = Collections.unmodifiableList(rules);
	}

	private static final Pattern STYLE_MACRO = Pattern.compile("\\\\(?:mathrm|operatorname|text)\\{([^{}]+)\\}");

	private static final Map<Character, Character> SUBSCRIPTS = new HashMap<Character, Character>();

	static {
		String glyphs = "₀₁₂₃₄₅₆₇₈₉ₐₑₕᵢⱼₖₗₘₙₒₚᵣₛₜᵤᵥₓ₋";
		String ascii = "0123456789aehijklmnoprstuvx-";
		for (int i = 0; i < glyphs.length(); i++) {
			SUBSCRIPTS.put(glyphs.charAt(i), ascii.charAt(i));
		}
	}

	private final String input;
	private int pos;
	private int line = 1;
	private int column = 1;

	/**
	 * @param text the raw format string
	 */
	public Lexer(String text) {
		this.input = normalize(text);
	}

	/**
	 * Applies the pre-tokenization rewriting described in the class documentation.
	 *
	 * @param text raw format string
	 * @return the normalized text
	 */
	static String normalize(String text) {
		String current = text;
		Matcher matcher = STYLE_MACRO.matcher(current);
		while (matcher.find()) {
			current = matcher.replaceAll("$1");
			matcher = STYLE_MACRO.matcher(current);
		}

		StringBuilder result = new StringBuilder(current.length() + 8);
		boolean inSubscript = false;
		for (int i = 0; i < current.length(); i++) {
			char c = current.charAt(i);
			Character replacement = SUBSCRIPTS.get(c);
			if (replacement != null) {
				if (!inSubscript) {
					result.append('_');
					inSubscript = true;
				}
				result.append(replacement.charValue());
			} else {
				inSubscript = false;
				result.append(c);
			}
		}
		return result.toString();
	}

	/**
	 * Tokenizes the whole input. Space tokens are dropped.
	 *
	 * @return the tokens, the last one being {@link TokenType#EOF}
	 * @throws LexerException when no rule matches at some position
	 */
	public List<Token> tokenize() {
		List<Token> tokens = new ArrayList<Token>();
		while (pos < input.length()) {
			Token token = next();
			if (token.getType() != TokenType.SPACE) {
				tokens.add(token);
			}
		}
		tokens.add(new Token(TokenType.EOF, null, line, column));
		return tokens;
	}

	private Token next() {
		for (Rule rule : RULES) {
			Matcher matcher = rule.pattern.matcher(input);
			matcher.region(pos, input.length());
			if (matcher.lookingAt()) {
				String text = matcher.group();
				Object value = rule.type == TokenType.NUMBER ? (Object) number(text) : text;
				Token token = new Token(rule.type, value, line, column);
				pos += text.length();
				if (rule.type == TokenType.NEWLINE) {
					line++;
					column = 1;
				} else {
					column += text.length();
				}
				return token;
			}
		}
		throw new LexerException(line, column, input.charAt(pos));
	}

	private Long number(String text) {
		try {
			return Long.valueOf(text);
		} catch (NumberFormatException e) {
			LexerException error = new LexerException("Number too large", line, column, text.charAt(0));
			error.initCause(e);
			throw error;
		}
	}
}
