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

import java.util.HashMap;
import java.util.Map;
import org.metricshub.jtmpl.util.Literals;

/**
 * Splits template text into {@link Token}s.
 * <p>
 * Outside of actions everything is literal text. Inside an action
 * (between the left and right delimiters) the lexer recognizes keywords,
 * identifiers, fields, variables, literals and punctuation. It also
 * handles trim markers (<code>{{- </code> and <code> -}}</code>), which
 * remove the white space on the corresponding side of the action, and
 * comments (<code>{{/* ... *&#47;}}</code>), which are dropped.
 * <p>
 * Tokens are produced on demand. The first lexical error is reported as an
 * {@link TokenType#ERROR} token, after which no more tokens are produced.
 */
public class Lexer implements TokenSource {

	/** Default left action delimiter */
	public static final String DEFAULT_LEFT_DELIM = "{{";

	/** Default right action delimiter */
	public static final String DEFAULT_RIGHT_DELIM = "}}";

	private static final String LEFT_COMMENT = "/*";
	private static final String RIGHT_COMMENT = "*/";
	private static final String SPACE_CHARS = " \t\r\n";
	private static final int TRIM_MARKER_LENGTH = 2;
	private static final int EOF = -1;

	/**
	 * Reserved words and their token types. <code>true</code> and
	 * <code>false</code> are not keywords, they are {@link TokenType#BOOL}s.
	 */
	private static final Map<String, TokenType> KEYWORDS = new HashMap<String, TokenType>();

	static {
		KEYWORDS.put("if", TokenType.IF);
		KEYWORDS.put("else", TokenType.ELSE);
		KEYWORDS.put("end", TokenType.END);
		KEYWORDS.put("range", TokenType.RANGE);
		KEYWORDS.put("with", TokenType.WITH);
		KEYWORDS.put("block", TokenType.BLOCK);
		KEYWORDS.put("define", TokenType.DEFINE);
		KEYWORDS.put("template", TokenType.TEMPLATE);
		KEYWORDS.put("nil", TokenType.NIL);
	}

	private final String input;
	private final String leftDelim;
	private final String rightDelim;

	/** Start of the token being scanned */
	private int start;
	/** Current position in the input */
	private int pos;
	/** Line of {@link #start} */
	private int startLine = 1;
	private int parenDepth;
	private boolean insideAction;
	private boolean done;

	/**
	 * Creates a lexer using the default <code>{{</code> and <code>}}</code>
	 * delimiters.
	 *
	 * @param input template text
	 */
	public Lexer(String input) {
		this(input, DEFAULT_LEFT_DELIM, DEFAULT_RIGHT_DELIM);
	}

	/**
	 * Creates a lexer with custom action delimiters.
	 *
	 * @param input template text
	 * @param leftDelim left delimiter; {@code null} or empty means the default
	 * @param rightDelim right delimiter; {@code null} or empty means the default
	 */
	public Lexer(String input, String leftDelim, String rightDelim) {
		this.input = input == null ? "" : input;
		this.leftDelim = leftDelim == null || leftDelim.isEmpty() ? DEFAULT_LEFT_DELIM : leftDelim;
		this.rightDelim = rightDelim == null || rightDelim.isEmpty() ? DEFAULT_RIGHT_DELIM : rightDelim;
	}

	/** {@inheritDoc} */
	@Override
	public Token nextToken() {
		if (done) {
			return null;
		}
		Token token = insideAction ? lexInsideAction() : lexText();
		if (token.getType() == TokenType.EOF || token.getType() == TokenType.ERROR) {
			done = true;
		}
		return token;
	}

	// SCANNING PRIMITIVES

	private int peekChar() {
		return pos < input.length() ? input.charAt(pos) : EOF;
	}

	private int nextChar() {
		if (pos >= input.length()) {
			// still advance so that backupChar() stays symmetrical
			pos++;
			return EOF;
		}
		return input.charAt(pos++);
	}

	private void backupChar() {
		pos--;
	}

	private boolean accept(String valid) {
		int c = nextChar();
		if (c != EOF && valid.indexOf(c) >= 0) {
			return true;
		}
		backupChar();
		return false;
	}

	private void acceptRun(String valid) {
		while (accept(valid)) {
			// keep going
		}
	}

	/**
	 * Builds a token from the pending input and moves {@link #start} past it.
	 */
	private Token emit(TokenType type) {
		Token token = new Token(type, input.substring(start, pos), start, startLine);
		ignore();
		return token;
	}

	/**
	 * Skips the pending input, keeping the line count in step.
	 */
	private void ignore() {
		for (int i = start; i < pos; i++) {
			if (input.charAt(i) == '\n') {
				startLine++;
			}
		}
		start = pos;
	}

	private Token error(String message) {
		return new Token(TokenType.ERROR, message, start, startLine);
	}

	private static boolean isSpace(int c) {
		return c == ' ' || c == '\t' || c == '\r' || c == '\n';
	}

	private static boolean isAlphaNumeric(int c) {
		return c == '_' || (c != EOF && Character.isLetterOrDigit((char) c));
	}

	private static String describe(int c) {
		return String.format("U+%04X '%c'", c, c);
	}

	private boolean hasLeftTrimMarker(int at) {
		return at + 1 < input.length() && input.charAt(at) == '-' && isSpace(input.charAt(at + 1));
	}

	private boolean hasRightTrimMarker(int at) {
		return at >= 0 && at + 1 < input.length() && isSpace(input.charAt(at)) && input.charAt(at + 1) == '-';
	}

	private boolean atRightDelim() {
		return input.startsWith(rightDelim, pos) || atTrimmedRightDelim();
	}

	private boolean atTrimmedRightDelim() {
		return hasRightTrimMarker(pos) && input.startsWith(rightDelim, pos + TRIM_MARKER_LENGTH);
	}

	private int leftTrimLength(int from) {
		int i = from;
		while (i < input.length() && SPACE_CHARS.indexOf(input.charAt(i)) >= 0) {
			i++;
		}
		return i - from;
	}

	private int rightTrimLength(int from, int to) {
		int i = to;
		while (i > from && SPACE_CHARS.indexOf(input.charAt(i - 1)) >= 0) {
			i--;
		}
		return to - i;
	}

	// STATES

	private Token lexText() {
		while (true) {
			int x = input.indexOf(leftDelim, pos);
			if (x < 0) {
				pos = input.length();
				if (pos > start) {
					return emit(TokenType.TEXT);
				}
				return emit(TokenType.EOF);
			}
			if (x > start) {
				pos = x;
				int trimLength = 0;
				if (hasLeftTrimMarker(pos + leftDelim.length())) {
					trimLength = rightTrimLength(start, pos);
				}
				pos -= trimLength;
				Token text = pos > start ? emit(TokenType.TEXT) : null;
				pos += trimLength;
				ignore();
				if (text != null) {
					return text;
				}
			}
			pos = x;
			Token token = lexLeftDelim();
			if (token != null) {
				return token;
			}
			// a comment was skipped, carry on with the text that follows
		}
	}

	/**
	 * Scans the left delimiter, or a whole comment.
	 *
	 * @return the delimiter token, an error token, or {@code null} when a
	 *         comment was skipped
	 */
	private Token lexLeftDelim() {
		pos += leftDelim.length();
		boolean trimSpace = hasLeftTrimMarker(pos);
		int afterMarker = trimSpace ? TRIM_MARKER_LENGTH : 0;
		if (input.startsWith(LEFT_COMMENT, pos + afterMarker)) {
			pos += afterMarker;
			ignore();
			return lexComment();
		}
		Token token = emit(TokenType.LEFT_DELIM);
		insideAction = true;
		pos += afterMarker;
		ignore();
		parenDepth = 0;
		return token;
	}

	private Token lexComment() {
		pos += LEFT_COMMENT.length();
		int x = input.indexOf(RIGHT_COMMENT, pos);
		if (x < 0) {
			return error("unclosed comment");
		}
		pos = x + RIGHT_COMMENT.length();
		boolean trimSpace = atTrimmedRightDelim();
		if (!trimSpace && !input.startsWith(rightDelim, pos)) {
			return error("comment ends before closing delimiter");
		}
		if (trimSpace) {
			pos += TRIM_MARKER_LENGTH;
		}
		pos += rightDelim.length();
		if (trimSpace) {
			pos += leftTrimLength(pos);
		}
		ignore();
		return null;
	}

	private Token lexRightDelim() {
		boolean trimSpace = atTrimmedRightDelim();
		if (trimSpace) {
			pos += TRIM_MARKER_LENGTH;
			ignore();
		}
		pos += rightDelim.length();
		Token token = emit(TokenType.RIGHT_DELIM);
		if (trimSpace) {
			pos += leftTrimLength(pos);
			ignore();
		}
		insideAction = false;
		return token;
	}

	private Token lexInsideAction() {
		if (atRightDelim()) {
			if (parenDepth == 0) {
				return lexRightDelim();
			}
			return error("unclosed left paren");
		}
		int c = nextChar();
		if (c == EOF) {
			return error("unclosed action");
		}
		if (isSpace(c)) {
			backupChar();
			return lexSpace();
		}
		switch (c) {
		case ':':
			if (nextChar() != '=') {
				return error("expected :=");
			}
			return emit(TokenType.DECLARE);
		case '|':
			return emit(TokenType.PIPE);
		case ',':
			return emit(TokenType.COMMA);
		case '"':
			return lexQuote();
		case '`':
			return lexRawQuote();
		case '$':
			return lexVariable();
		case '\'':
			return lexChar();
		case '(':
			parenDepth++;
			return emit(TokenType.LEFT_PAREN);
		case ')':
			if (parenDepth == 0) {
				return error("unexpected right paren");
			}
			parenDepth--;
			return emit(TokenType.RIGHT_PAREN);
		case '.':
			// ".field", unless a digit follows and this is a number like ".5"
			if (pos < input.length() && !Character.isDigit(input.charAt(pos))) {
				return lexFieldOrVariable(TokenType.FIELD);
			}
			backupChar();
			return lexNumber();
		default:
			break;
		}
		if (c == '+' || c == '-' || (c >= '0' && c <= '9')) {
			backupChar();
			return lexNumber();
		}
		if (isAlphaNumeric(c)) {
			backupChar();
			return lexIdentifier();
		}
		if (c < 0x7f && c >= 0x20) {
			return emit(TokenType.CHAR);
		}
		return error("unrecognized character in action: " + describe(c));
	}

	private Token lexSpace() {
		int numSpaces = 0;
		while (isSpace(peekChar())) {
			nextChar();
			numSpaces++;
		}
		// a trim-marked right delimiter starts with a space, leave that one alone
		if (hasRightTrimMarker(pos - 1) && input.startsWith(rightDelim, pos - 1 + TRIM_MARKER_LENGTH)) {
			backupChar();
			if (numSpaces == 1) {
				return lexRightDelim();
			}
		}
		return emit(TokenType.SPACE);
	}

	private Token lexIdentifier() {
		while (isAlphaNumeric(peekChar())) {
			nextChar();
		}
		if (!atTerminator()) {
			return error("bad character " + describe(peekChar()));
		}
		String word = input.substring(start, pos);
		TokenType keyword = KEYWORDS.get(word);
		if (keyword != null) {
			return emit(keyword);
		}
		if (word.equals("true") || word.equals("false")) {
			return emit(TokenType.BOOL);
		}
		return emit(TokenType.IDENTIFIER);
	}

	private Token lexVariable() {
		if (atTerminator()) {
			// plain "$"
			return emit(TokenType.VARIABLE);
		}
		return lexFieldOrVariable(TokenType.VARIABLE);
	}

	/**
	 * Scans the alphanumeric part of a field or a variable, the leading
	 * <code>.</code> or <code>$</code> being already consumed.
	 */
	private Token lexFieldOrVariable(TokenType type) {
		if (atTerminator()) {
			return emit(type == TokenType.VARIABLE ? TokenType.VARIABLE : TokenType.DOT);
		}
		while (isAlphaNumeric(peekChar())) {
			nextChar();
		}
		if (!atTerminator()) {
			return error("bad character " + describe(peekChar()));
		}
		return emit(type);
	}

	/**
	 * @return whether the character at the current position can legally follow
	 *         an identifier, field or variable
	 */
	private boolean atTerminator() {
		int c = peekChar();
		if (isSpace(c)) {
			return true;
		}
		switch (c) {
		case EOF:
		case '.':
		case ',':
		case '|':
		case ':':
		case ')':
		case '(':
			return true;
		default:
			return input.startsWith(rightDelim, pos);
		}
	}

	private Token lexChar() {
		while (true) {
			int c = nextChar();
			if (c == '\\') {
				c = nextChar();
				if (c != EOF && c != '\n') {
					continue;
				}
			}
			if (c == EOF || c == '\n') {
				return error("unterminated character constant");
			}
			if (c == '\'') {
				return emit(TokenType.CHAR_CONSTANT);
			}
		}
	}

	private Token lexQuote() {
		while (true) {
			int c = nextChar();
			if (c == '\\') {
				c = nextChar();
				if (c != EOF && c != '\n') {
					continue;
				}
			}
			if (c == EOF || c == '\n') {
				return error("unterminated quoted string");
			}
			if (c == '"') {
				return emit(TokenType.STRING);
			}
		}
	}

	private Token lexRawQuote() {
		while (true) {
			int c = nextChar();
			if (c == EOF) {
				return error("unterminated raw quoted string");
			}
			if (c == '`') {
				return emit(TokenType.RAW_STRING);
			}
		}
	}

	private Token lexNumber() {
		if (!scanNumber()) {
			return error("bad number syntax: " + Literals.quote(input.substring(start, Math.min(pos, input.length()))));
		}
		int sign = peekChar();
		if (sign == '+' || sign == '-') {
			// complex numbers like 1+2i are not supported
			scanNumber();
			return error("bad number syntax: " + Literals.quote(input.substring(start, Math.min(pos, input.length()))));
		}
		return emit(TokenType.NUMBER);
	}

	private boolean scanNumber() {
		accept("+-");
		String digits = "0123456789_";
		if (accept("0")) {
			if (accept("xX")) {
				digits = "0123456789abcdefABCDEF_";
			} else if (accept("oO")) {
				digits = "01234567_";
			} else if (accept("bB")) {
				digits = "01_";
			}
		}
		acceptRun(digits);
		if (accept(".")) {
			acceptRun(digits);
		}
		if (digits.length() == 11 && accept("eE")) {
			accept("+-");
			acceptRun("0123456789_");
		}
		if (digits.length() == 23 && accept("pP")) {
			accept("+-");
			acceptRun("0123456789_");
		}
		if (isAlphaNumeric(peekChar())) {
			nextChar();
			return false;
		}
		return true;
	}
}
