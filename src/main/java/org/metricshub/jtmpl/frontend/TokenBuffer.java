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

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Lookahead in front of a {@link TokenSource}.
 * <p>
 * Tokens that have been read can be pushed back, up to three at a time,
 * which is all the template grammar needs (to tell <code>$x := ...</code>
 * from <code>$x, $y := ...</code> and from a bare <code>$x</code>).
 * Every token handed out updates the current line.
 */
class TokenBuffer {

	private static final int MAX_PENDING = 3;

	private final TokenSource source;
	private final Deque<Token> pending = new ArrayDeque<Token>(MAX_PENDING);
	private int line = 1;

	TokenBuffer(TokenSource source) {
		this.source = source;
	}

	/**
	 * @return the next token, or {@code null} when the source is exhausted
	 */
	Token next() {
		Token token = pending.isEmpty() ? source.nextToken() : pending.pollFirst();
		if (token != null) {
			line = token.getLine();
		}
		return token;
	}

	void backup(Token t0) {
		pending.addFirst(t0);
		assert pending.size() <= MAX_PENDING;
	}

	void backup2(Token t0, Token t1) {
		pending.addFirst(t1);
		pending.addFirst(t0);
		assert pending.size() <= MAX_PENDING;
	}

	void backup3(Token t0, Token t1, Token t2) {
		pending.addFirst(t2);
		pending.addFirst(t1);
		pending.addFirst(t0);
		assert pending.size() <= MAX_PENDING;
	}

	Token peek() {
		Token token = next();
		if (token != null) {
			backup(token);
		}
		return token;
	}

	Token nextNonSpace() {
		Token token;
		do {
			token = next();
		} while (token != null && token.getType() == TokenType.SPACE);
		return token;
	}

	Token peekNonSpace() {
		Token token = nextNonSpace();
		if (token != null) {
			backup(token);
		}
		return token;
	}

	/**
	 * @return line of the last token handed out
	 */
	int getLine() {
		return line;
	}

	int pendingCount() {
		return pending.size();
	}
}
