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
import java.util.List;
import org.metricshub.formatgen.frontend.ast.BinaryOperation;
import org.metricshub.formatgen.frontend.ast.Expression;
import org.metricshub.formatgen.frontend.ast.Item;
import org.metricshub.formatgen.frontend.ast.Marker;
import org.metricshub.formatgen.frontend.ast.NumberLiteral;
import org.metricshub.formatgen.frontend.ast.RawFormat;
import org.metricshub.formatgen.frontend.ast.RawStatement;

/**
 * Recursive-descent parser turning the tokens of a format string into a raw
 * tree.
 * <p>
 * The parser never fails: an unexpected token is skipped, an unparseable
 * operand is replaced by the placeholder item {@value #ERROR_NAME}, a missing
 * closing bracket is assumed. Each of these recoveries is recorded as a
 * {@link Diagnostic} of the {@link ParseResult}.
 * <p>
 * Opening brackets {@code ( [ {} all belong to one class, and so do the
 * closing ones: problem statements mix them freely.
 */
public class Parser {

	/** Name of the placeholder item standing for an unparseable operand. */
	public static final String ERROR_NAME = "ERROR";

	private final List<Token> tokens;
	private int pos;
	private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
	private final List<Long> statementLiterals = new ArrayList<Long>();

	/**
	 * @param tokens tokens ending with {@link TokenType#EOF}; space tokens are ignored
	 */
	public Parser(List<Token> tokens) {
		this.tokens = new ArrayList<Token>(tokens.size());
		for (Token token : tokens) {
			if (token.getType() != TokenType.SPACE) {
				this.tokens.add(token);
			}
		}
		if (this.tokens.isEmpty() || this.tokens.get(this.tokens.size() - 1).getType() != TokenType.EOF) {
			this.tokens.add(new Token(TokenType.EOF, null, 0, 0));
		}
	}

	/**
	 * Parses the whole token sequence.
	 *
	 * @return the raw tree with the diagnostics collected on the way
	 */
	public ParseResult parse() {
		return new ParseResult(FORMAT(), diagnostics, statementLiterals);
	}

	// FORMAT : { STATEMENT } EOF
	private RawFormat FORMAT() {
		List<RawStatement> children = new ArrayList<RawStatement>();
		while (peek().getType() != TokenType.EOF) {
			RawStatement statement = STATEMENT();
			if (statement != null) {
				children.add(statement);
			}
		}
		return new RawFormat(children);
	}

	// STATEMENT : ITEM | NEWLINE | DOTS | VDOTS | COMMA
	private RawStatement STATEMENT() {
		Token token = peek();
		switch (token.getType()) {
		case IDENT:
			return ITEM(true);
		case NEWLINE:
			consume();
			return Marker.BREAK;
		case DOTS:
			consume();
			return Marker.DOTS;
		case VDOTS:
			consume();
			return Marker.VDOTS;
		case COMMA:
			consume();
			return null;
		case NUMBER:
			consume();
			statementLiterals.add(token.getNumber());
			return null;
		default:
			consume();
			report(token, "unexpected " + describe(token) + " skipped");
			return null;
		}
	}

	// ITEM : IDENT { SUBSCRIPT ( LPAREN [ EXPRESSION { COMMA EXPRESSION } ] RPAREN | EXPRESSION ) }
	//
	// Without brackets, the operands of the index expression are not
	// subscripted themselves, so that A_i_j has two indices.
	private Item ITEM(boolean allowNestedSubscripts) {
		Token identifier = consume();
		if (!allowNestedSubscripts) {
			return new Item(identifier.getText());
		}
		List<Expression> indices = new ArrayList<Expression>();
		while (peek().getType() == TokenType.SUBSCRIPT) {
			consume();
			if (peek().getType() == TokenType.LPAREN) {
				consume();
				if (peek().getType() == TokenType.RPAREN) {
					// explicitly empty index list
					consume();
					continue;
				}
				indices.add(EXPRESSION(true));
				while (peek().getType() == TokenType.COMMA) {
					consume();
					indices.add(EXPRESSION(true));
				}
				expectClosingBracket();
			} else {
				indices.add(EXPRESSION(false));
			}
		}
		return new Item(identifier.getText(), indices);
	}

	// EXPRESSION : TERM { (+|-) TERM }
	private Expression EXPRESSION(boolean bracketed) {
		Expression left = TERM(bracketed);
		while (isOperator('+') || isOperator('-')) {
			char operator = consume().getText().charAt(0);
			left = new BinaryOperation(operator, left, TERM(bracketed));
		}
		return left;
	}

	// TERM : ATOM { (*|/) ATOM }
	private Expression TERM(boolean bracketed) {
		Expression left = ATOM(bracketed);
		while (isOperator('*') || isOperator('/')) {
			char operator = consume().getText().charAt(0);
			left = new BinaryOperation(operator, left, ATOM(bracketed));
		}
		return left;
	}

	// ATOM : LPAREN EXPRESSION RPAREN | ITEM | NUMBER
	private Expression ATOM(boolean bracketed) {
		Token token = peek();
		switch (token.getType()) {
		case LPAREN:
			consume();
			Expression expression = EXPRESSION(true);
			expectClosingBracket();
			return expression;
		case IDENT:
			return ITEM(bracketed);
		case NUMBER:
			consume();
			return new NumberLiteral(token.getNumber());
		case EOF:
			report(token, "operand expected before end of format");
			return new Item(ERROR_NAME);
		default:
			consume();
			report(token, "operand expected, got " + describe(token));
			return new Item(ERROR_NAME);
		}
	}

	private void expectClosingBracket() {
		if (peek().getType() == TokenType.RPAREN) {
			consume();
		} else {
			report(peek(), "closing bracket expected, got " + describe(peek()));
		}
	}

	private boolean isOperator(char operator) {
		Token token = peek();
		return token.getType() == TokenType.BINOP && token.getText().charAt(0) == operator;
	}

	private void report(Token token, String message) {
		diagnostics.add(new Diagnostic(token.getLine(), token.getColumn(), message));
	}

	private static String describe(Token token) {
		switch (token.getType()) {
		case EOF:
			return "end of format";
		case NEWLINE:
			return "line break";
		default:
			return "'" + token.getText() + "'";
		}
	}

	private Token peek() {
		return tokens.get(pos);
	}

	private Token consume() {
		Token token = tokens.get(pos);
		if (token.getType() != TokenType.EOF) {
			pos++;
		}
		return token;
	}
}
