package org.metricshub.jtmpl.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jtmpl
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
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

import org.metricshub.jtmpl.util.Literals;

/**
 * One lexical item produced by a {@link TokenSource}. Immutable.
 */
public final class Token {

	private final TokenType type;
	private final String text;
	private final int offset;
	private final int line;

	/**
	 * Creates a new token.
	 *
	 * @param type kind of the token
	 * @param text raw text of the token (the message for {@link TokenType#ERROR})
	 * @param offset char offset of the token in the template text
	 * @param line 1-based line number where the token starts
	 */
	public Token(TokenType type, String text, int offset, int line) {
		this.type = type;
		this.text = text;
		this.offset = offset;
		this.line = line;
	}

	public TokenType getType() {
		return type;
	}

	public String getText() {
		return text;
	}

	public int getOffset() {
		return offset;
	}

	public int getLine() {
		return line;
	}

	/**
	 * Diagnostic form of the token, as used in error messages.
	 *
	 * @return {@code EOF}, the error message, {@code <keyword>}, or the quoted
	 *         text (shortened when longer than 10 characters)
	 */
	@Override
	public String toString() {
		if (type == TokenType.EOF) {
			return "EOF";
		}
		if (type == TokenType.ERROR) {
			return text;
		}
		if (type.isKeyword()) {
			return "<" + text + ">";
		}
		if (text.length() > 10) {
			return Literals.quote(text.substring(0, 10)) + "...";
		}
		return Literals.quote(text);
	}
}
