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

/**
 * Lexer token types of the template language.
 * <p>
 * Keyword types render as {@code <keyword>} in diagnostics, see
 * {@link Token#toString()}.
 */
public enum TokenType {
	/** Literal text outside of actions */
	TEXT,
	/** Left action delimiter, <code>{{</code> by default */
	LEFT_DELIM,
	/** Right action delimiter, <code>}}</code> by default */
	RIGHT_DELIM,
	/** Run of spaces inside an action */
	SPACE,
	/** Lexical error; the token text is the error message */
	ERROR,
	/** End of the input */
	EOF,

	PIPE,
	VARIABLE,
	FIELD,
	IDENTIFIER,
	BOOL,
	NUMBER,
	CHAR_CONSTANT,
	STRING,
	RAW_STRING,
	/** <code>:=</code> */
	DECLARE,
	COMMA,
	LEFT_PAREN,
	RIGHT_PAREN,
	/** Any other printable ASCII character found inside an action */
	CHAR,

	// keywords
	DOT(true),
	NIL(true),
	IF(true),
	ELSE(true),
	END(true),
	RANGE(true),
	WITH(true),
	BLOCK(true),
	DEFINE(true),
	TEMPLATE(true);

	private final boolean keyword;

	TokenType() {
		this(false);
	}

	TokenType(boolean keyword) {
		this.keyword = keyword;
	}

	/**
	 * @return {@code true} if this type is produced for a reserved word
	 */
	public boolean isKeyword() {
		return keyword;
	}
}
