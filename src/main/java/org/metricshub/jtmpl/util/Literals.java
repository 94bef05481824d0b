package org.metricshub.jtmpl.util;

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

import java.math.BigInteger;

/**
 * Decoding and encoding of template literals: quoted strings, raw strings,
 * character constants and integer texts.
 */
public final class Literals {

	private static final BigInteger MAX_UNSIGNED = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);
	private static final BigInteger MIN_SIGNED = BigInteger.valueOf(Long.MIN_VALUE);
	private static final BigInteger MAX_SIGNED = BigInteger.valueOf(Long.MAX_VALUE);

	private Literals() {}

	/**
	 * Decodes a double-quoted string (with escape sequences) or a
	 * back-quoted raw string.
	 *
	 * @param quoted the literal, quotes included
	 * @return the decoded text
	 * @throws MalformedLiteralException when the literal is not properly quoted
	 *         or contains an invalid escape sequence
	 */
	public static String unquote(String quoted) throws MalformedLiteralException {
		int n = quoted.length();
		if (n < 2) {
			throw new MalformedLiteralException("unable to unquote string: " + quoted);
		}
		char quote = quoted.charAt(0);
		if (quote != quoted.charAt(n - 1)) {
			throw new MalformedLiteralException("unable to unquote string: " + quoted);
		}
		String body = quoted.substring(1, n - 1);
		if (quote == '`') {
			if (body.indexOf('`') >= 0) {
				throw new MalformedLiteralException("unable to unquote string: " + quoted);
			}
			return body.replace("\r", "");
		}
		if (quote != '"') {
			throw new MalformedLiteralException("unable to unquote string: " + quoted);
		}
		StringBuilder sb = new StringBuilder(body.length());
		int[] index = { 0 };
		while (index[0] < body.length()) {
			char c = body.charAt(index[0]);
			if (c == '"' || c == '\n') {
				throw new MalformedLiteralException("unable to unquote string: " + quoted);
			}
			sb.appendCodePoint(unquoteChar(body, index, '"', quoted));
		}
		return sb.toString();
	}

	/**
	 * Decodes a character constant such as <code>'a'</code> or
	 * <code>'\n'</code>.
	 *
	 * @param quoted the constant, single quotes included
	 * @return the code point of the character
	 * @throws MalformedLiteralException when the constant does not hold
	 *         exactly one valid character
	 */
	public static int unquoteCharConstant(String quoted) throws MalformedLiteralException {
		int n = quoted.length();
		if (n < 3 || quoted.charAt(0) != '\'' || quoted.charAt(n - 1) != '\'') {
			throw new MalformedLiteralException("malformed character constant: " + quoted);
		}
		String body = quoted.substring(1, n - 1);
		if (body.charAt(0) == '\'' || body.charAt(0) == '\n') {
			throw new MalformedLiteralException("malformed character constant: " + quoted);
		}
		int[] index = { 0 };
		int value = unquoteChar(body, index, '\'', quoted);
		if (index[0] != body.length()) {
			throw new MalformedLiteralException("malformed character constant: " + quoted);
		}
		return value;
	}

	/**
	 * Decodes one, possibly escaped, character of {@code s} at
	 * {@code index[0]} and advances the index past it.
	 */
	private static int unquoteChar(String s, int[] index, char quote, String literal) throws MalformedLiteralException {
		int i = index[0];
		char c = s.charAt(i);
		if (c != '\\') {
			int cp = s.codePointAt(i);
			index[0] = i + Character.charCount(cp);
			return cp;
		}
		if (i + 1 >= s.length()) {
			throw new MalformedLiteralException("unable to unquote string: " + literal);
		}
		char e = s.charAt(i + 1);
		index[0] = i + 2;
		switch (e) {
		case 'a':
			return 0x07;
		case 'b':
			return '\b';
		case 'f':
			return '\f';
		case 'n':
			return '\n';
		case 'r':
			return '\r';
		case 't':
			return '\t';
		case 'v':
			return 0x0B;
		case '\\':
			return '\\';
		case 'x':
			return hexEscape(s, index, 2, literal);
		case 'u':
			return hexEscape(s, index, 4, literal);
		case 'U':
			return hexEscape(s, index, 8, literal);
		case '0':
		case '1':
		case '2':
		case '3':
		case '4':
		case '5':
		case '6':
		case '7':
			if (i + 4 > s.length()) {
				throw new MalformedLiteralException("unable to unquote string: " + literal);
			}
			int value = 0;
			for (int j = i + 1; j < i + 4; j++) {
				int digit = digit(s.charAt(j), 8);
				if (digit < 0) {
					throw new MalformedLiteralException("unable to unquote string: " + literal);
				}
				value = value * 8 + digit;
			}
			if (value > 255) {
				throw new MalformedLiteralException("unable to unquote string: " + literal);
			}
			index[0] = i + 4;
			return value;
		default:
			if (e == quote && (quote == '\'' || quote == '"')) {
				return e;
			}
			throw new MalformedLiteralException("unable to unquote string: " + literal);
		}
	}

	private static int hexEscape(String s, int[] index, int length, String literal) throws MalformedLiteralException {
		int from = index[0];
		if (from + length > s.length()) {
			throw new MalformedLiteralException("unable to unquote string: " + literal);
		}
		int value = 0;
		for (int j = from; j < from + length; j++) {
			int digit = digit(s.charAt(j), 16);
			if (digit < 0) {
				throw new MalformedLiteralException("unable to unquote string: " + literal);
			}
			value = value * 16 + digit;
		}
		if (length > 2 && (!Character.isValidCodePoint(value) || isSurrogate(value))) {
			throw new MalformedLiteralException("unable to unquote string: " + literal);
		}
		index[0] = from + length;
		return value;
	}

	/**
	 * Like {@link Character#digit(char, int)}, for ASCII digits and letters only.
	 */
	private static int digit(char c, int radix) {
		return c < 0x80 ? Character.digit(c, radix) : -1;
	}

	private static boolean isSurrogate(int codePoint) {
		return codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE;
	}

	/**
	 * Quotes a string the way it would be written in a template, escaping
	 * quotes, backslashes and control characters.
	 *
	 * @param s text to quote
	 * @return the double-quoted literal
	 */
	public static String quote(String s) {
		StringBuilder sb = new StringBuilder(s.length() + 2);
		sb.append('"');
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
			case '"':
				sb.append("\\\"");
				break;
			case '\\':
				sb.append("\\\\");
				break;
			case '\n':
				sb.append("\\n");
				break;
			case '\r':
				sb.append("\\r");
				break;
			case '\t':
				sb.append("\\t");
				break;
			case '\b':
				sb.append("\\b");
				break;
			case '\f':
				sb.append("\\f");
				break;
			case 0x07:
				sb.append("\\a");
				break;
			case 0x0B:
				sb.append("\\v");
				break;
			default:
				if (c < 0x20 || c == 0x7f) {
					sb.append(String.format("\\x%02x", (int) c));
				} else {
					sb.append(c);
				}
			}
		}
		sb.append('"');
		return sb.toString();
	}

	/**
	 * Parses integer text with an optional sign and an optional radix prefix
	 * (<code>0x</code>, <code>0o</code>, <code>0b</code>, or a leading
	 * <code>0</code> for octal). Underscores may separate digits.
	 *
	 * @param text integer text
	 * @param unsigned {@code true} to reject a sign
	 * @return the value, or {@code null} if {@code text} is not an integer
	 */
	public static BigInteger parseInteger(String text, boolean unsigned) {
		String t = text;
		boolean negative = false;
		if (!t.isEmpty() && (t.charAt(0) == '+' || t.charAt(0) == '-')) {
			if (unsigned) {
				return null;
			}
			negative = t.charAt(0) == '-';
			t = t.substring(1);
		}
		int radix = 10;
		boolean prefixed = false;
		if (t.length() > 1 && t.charAt(0) == '0') {
			char p = Character.toLowerCase(t.charAt(1));
			prefixed = true;
			if (p == 'x') {
				radix = 16;
				t = t.substring(2);
			} else if (p == 'o') {
				radix = 8;
				t = t.substring(2);
			} else if (p == 'b') {
				radix = 2;
				t = t.substring(2);
			} else {
				radix = 8;
				t = t.substring(1);
			}
		}
		if (t.indexOf('_') >= 0) {
			if (!underscoresOk(t, prefixed)) {
				return null;
			}
			t = t.replace("_", "");
		}
		if (t.isEmpty()) {
			return null;
		}
		for (int i = 0; i < t.length(); i++) {
			if (digit(t.charAt(i), radix) < 0) {
				return null;
			}
		}
		BigInteger value = new BigInteger(t, radix);
		return negative ? value.negate() : value;
	}

	/**
	 * Underscores must sit between digits, or right after a radix prefix.
	 */
	private static boolean underscoresOk(String digits, boolean prefixed) {
		if (digits.endsWith("_") || digits.contains("__")) {
			return false;
		}
		return prefixed || !digits.startsWith("_");
	}

	/**
	 * @param value integer value
	 * @return whether {@code value} fits in a signed 64-bit integer
	 */
	public static boolean fitsSigned(BigInteger value) {
		return value.compareTo(MIN_SIGNED) >= 0 && value.compareTo(MAX_SIGNED) <= 0;
	}

	/**
	 * @param value integer value
	 * @return whether {@code value} fits in an unsigned 64-bit integer
	 */
	public static boolean fitsUnsigned(BigInteger value) {
		return value.signum() >= 0 && value.compareTo(MAX_UNSIGNED) <= 0;
	}
}
