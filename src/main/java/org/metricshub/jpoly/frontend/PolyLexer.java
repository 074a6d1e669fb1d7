package org.metricshub.jpoly.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jpoly
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
import java.io.LineNumberReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jpoly.util.ScriptSource;

/**
 * Converts the text of a polynomial program into a stream of
 * {@link Token}s, with arbitrary lookahead.
 * <p>
 * Numerals are either {@code 0} or a non-zero digit followed by digits,
 * so {@code 007} reads as three numerals. Identifiers are an ASCII letter
 * followed by letters or digits. Any character that starts no token
 * produces an {@link TokenType#ERROR} token, left to the parser to reject.
 */
public class PolyLexer implements TokenStream {

	/**
	 * Keywords of the language and their token values.
	 * Keywords are case-sensitive.
	 */
	private static final Map<String, TokenType> KEYWORDS = new HashMap<String, TokenType>();

	static {
		KEYWORDS.put("TASKS", TokenType.KW_TASKS);
		KEYWORDS.put("POLY", TokenType.KW_POLY);
		KEYWORDS.put("EXECUTE", TokenType.KW_EXECUTE);
		KEYWORDS.put("INPUT", TokenType.KW_INPUT);
		KEYWORDS.put("OUTPUT", TokenType.KW_OUTPUT);
		KEYWORDS.put("INPUTS", TokenType.KW_INPUTS);
	}

	private static final Map<Character, TokenType> PUNCTUATION = new HashMap<Character, TokenType>();

	static {
		PUNCTUATION.put('=', TokenType.EQUAL);
		PUNCTUATION.put('+', TokenType.PLUS);
		PUNCTUATION.put('-', TokenType.MINUS);
		PUNCTUATION.put('^', TokenType.POWER);
		PUNCTUATION.put(',', TokenType.COMMA);
		PUNCTUATION.put(';', TokenType.SEMICOLON);
		PUNCTUATION.put('(', TokenType.LPAREN);
		PUNCTUATION.put(')', TokenType.RPAREN);
	}

	private final ScriptSource source;
	private final List<Token> lookahead = new ArrayList<Token>();
	private LineNumberReader reader;
	private int c;
	private boolean started;
	private final StringBuilder text = new StringBuilder();

	/**
	 * @param source the program text to tokenize
	 */
	public PolyLexer(ScriptSource source) {
		this.source = source;
	}

	/** {@inheritDoc} */
	@Override
	public Token getToken() throws IOException {
		if (!lookahead.isEmpty()) {
			return lookahead.remove(0);
		}
		return lexer();
	}

	/** {@inheritDoc} */
	@Override
	public Token peek(int offset) throws IOException {
		if (offset < 1) {
			throw new IllegalArgumentException("Peek offset must be at least 1: " + offset);
		}
		while (lookahead.size() < offset) {
			lookahead.add(lexer());
		}
		return lookahead.get(offset - 1);
	}

	private void read() throws IOException {
		text.append((char) c);
		c = reader.read();
	}

	private Token lexer() throws IOException {
		if (!started) {
			reader = new LineNumberReader(source.getReader());
			c = reader.read();
			started = true;
		}
		// clear whitespace
		while (c >= 0 && Character.isWhitespace(c)) {
			c = reader.read();
		}
		text.setLength(0);
		// the current character has been read already, so it sits on the counted line + 1
		int line = reader.getLineNumber() + 1;
		if (c < 0) {
			return new Token(TokenType.END_OF_FILE, "", line);
		}

		if (isDigit(c)) {
			if (c == '0') {
				read();
			} else {
				while (isDigit(c)) {
					read();
				}
			}
			return new Token(TokenType.NUM, text.toString(), line);
		}

		if (isLetter(c)) {
			read();
			while (isLetter(c) || isDigit(c)) {
				read();
			}
			TokenType kwToken = KEYWORDS.get(text.toString());
			return new Token(kwToken != null ? kwToken : TokenType.ID, text.toString(), line);
		}

		TokenType punctuation = PUNCTUATION.get((char) c);
		read();
		if (punctuation != null) {
			return new Token(punctuation, text.toString(), line);
		}
		return new Token(TokenType.ERROR, text.toString(), line);
	}

	private static boolean isDigit(int ch) {
		return ch >= '0' && ch <= '9';
	}

	private static boolean isLetter(int ch) {
		return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
	}
}
