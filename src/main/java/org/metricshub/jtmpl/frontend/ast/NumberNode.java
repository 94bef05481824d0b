package org.metricshub.jtmpl.frontend.ast;

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

import java.math.BigDecimal;
import java.math.BigInteger;
import org.metricshub.jtmpl.util.Literals;
import org.metricshub.jtmpl.util.MalformedLiteralException;

/**
 * A numeric constant, or a character constant.
 * <p>
 * The same text may be representable as several types: <code>1</code> is a
 * signed integer, an unsigned integer and a float, while <code>-1</code> is
 * not unsigned and <code>1.5</code> is only a float. Each
 * {@code isXxx()} method tells whether the corresponding value is valid.
 */
public final class NumberNode extends Node {

	private static final double TWO_POW_63 = 9.223372036854775808E18;
	private static final double TWO_POW_64 = 1.8446744073709551616E19;

	private final String text;
	private boolean isInt;
	private boolean isUint;
	private boolean isFloat;
	private long intValue;
	private long uintValue;
	private double floatValue;

	private NumberNode(int treeId, int position, String text) {
		super(treeId, position);
		this.text = text;
	}

	/**
	 * Builds a number node from its source text.
	 *
	 * @param treeId owning tree
	 * @param position offset of the literal
	 * @param text the literal as written
	 * @param charConstant whether {@code text} is a character constant such as
	 *        <code>'a'</code>
	 * @return the node
	 * @throws MalformedLiteralException if {@code text} is not a valid number
	 */
	public static NumberNode parse(int treeId, int position, String text, boolean charConstant)
			throws MalformedLiteralException {
		NumberNode n = new NumberNode(treeId, position, text);
		if (charConstant) {
			int rune = Literals.unquoteCharConstant(text);
			n.isInt = true;
			n.intValue = rune;
			n.isUint = true;
			n.uintValue = rune;
			n.isFloat = true;
			n.floatValue = rune;
			return n;
		}
		BigInteger unsigned = Literals.parseInteger(text, true);
		if (unsigned != null && Literals.fitsUnsigned(unsigned)) {
			n.isUint = true;
			n.uintValue = unsigned.longValue();
		}
		BigInteger signed = Literals.parseInteger(text, false);
		if (signed != null && Literals.fitsSigned(signed)) {
			n.isInt = true;
			n.intValue = signed.longValue();
			if (n.intValue == 0) {
				// -0
				n.isUint = true;
				n.uintValue = 0;
			}
		}
		if (n.isInt) {
			n.isFloat = true;
			n.floatValue = n.intValue;
		} else if (n.isUint) {
			n.isFloat = true;
			n.floatValue = new BigDecimal(new BigInteger(Long.toUnsignedString(n.uintValue))).doubleValue();
		} else if (signed != null) {
			throw new MalformedLiteralException("integer overflow: " + Literals.quote(text));
		} else {
			n.parseFloat();
		}
		if (!n.isInt && !n.isUint && !n.isFloat) {
			throw new MalformedLiteralException("illegal number syntax: " + Literals.quote(text));
		}
		return n;
	}

	private void parseFloat() {
		if (!containsAny(text, ".eEpP")) {
			return;
		}
		if (containsAny(text, "pP") && !containsAny(text, "xX")) {
			return;
		}
		double f;
		try {
			f = Double.parseDouble(text.replace("_", ""));
		} catch (NumberFormatException e) {
			return;
		}
		// out of range
		if (Double.isInfinite(f)) {
			return;
		}
		isFloat = true;
		floatValue = f;
		// an integral float also yields the integer forms
		if (f == Math.rint(f)) {
			if (f >= -TWO_POW_63 && f < TWO_POW_63) {
				isInt = true;
				intValue = (long) f;
			}
			if (f >= 0 && f < TWO_POW_64) {
				isUint = true;
				uintValue = new BigDecimal(f).toBigInteger().longValue();
			}
		}
	}

	private static boolean containsAny(String s, String chars) {
		for (int i = 0; i < chars.length(); i++) {
			if (s.indexOf(chars.charAt(i)) >= 0) {
				return true;
			}
		}
		return false;
	}

	@Override
	public NodeType getType() {
		return NodeType.NUMBER;
	}

	public String getText() {
		return text;
	}

	public boolean isInt() {
		return isInt;
	}

	public boolean isUint() {
		return isUint;
	}

	public boolean isFloat() {
		return isFloat;
	}

	public long getIntValue() {
		return intValue;
	}

	/**
	 * @return the unsigned value, to be read with
	 *         {@link Long#toUnsignedString(long)} and friends
	 */
	public long getUintValue() {
		return uintValue;
	}

	public double getFloatValue() {
		return floatValue;
	}

	@Override
	public String toString() {
		return text;
	}
}
