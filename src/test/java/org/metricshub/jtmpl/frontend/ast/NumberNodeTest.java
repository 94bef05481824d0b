package org.metricshub.jtmpl.frontend.ast;

import static org.junit.Assert.*;

import org.junit.Test;
import org.metricshub.jtmpl.util.MalformedLiteralException;

public class NumberNodeTest {

	private static NumberNode number(String text) throws MalformedLiteralException {
		return NumberNode.parse(1, 0, text, false);
	}

	@Test
	public void testSmallInteger() throws Exception {
		NumberNode n = number("42");
		assertTrue(n.isInt());
		assertTrue(n.isUint());
		assertTrue(n.isFloat());
		assertEquals(42, n.getIntValue());
		assertEquals(42, n.getUintValue());
		assertEquals(42.0, n.getFloatValue(), 0.0);
		assertEquals("42", n.toString());
	}

	@Test
	public void testNegativeIsNotUnsigned() throws Exception {
		NumberNode n = number("-7");
		assertTrue(n.isInt());
		assertFalse(n.isUint());
		assertEquals(-7.0, n.getFloatValue(), 0.0);
	}

	@Test
	public void testNegativeZeroIsUnsigned() throws Exception {
		assertTrue(number("-0").isUint());
	}

	@Test
	public void testRadixPrefixes() throws Exception {
		assertEquals(255, number("0xff").getIntValue());
		assertEquals(8, number("0o10").getIntValue());
		assertEquals(8, number("010").getIntValue());
		assertEquals(5, number("0b101").getIntValue());
		assertEquals(1000000, number("1_000_000").getIntValue());
	}

	@Test
	public void testLargestUnsigned() throws Exception {
		NumberNode n = number("18446744073709551615");
		assertFalse(n.isInt());
		assertTrue(n.isUint());
		assertEquals("18446744073709551615", Long.toUnsignedString(n.getUintValue()));
		assertTrue(n.isFloat());
	}

	@Test
	public void testFloats() throws Exception {
		NumberNode half = number("1.5");
		assertTrue(half.isFloat());
		assertFalse(half.isInt());
		assertFalse(half.isUint());

		NumberNode thousand = number("1e3");
		assertTrue(thousand.isInt());
		assertEquals(1000, thousand.getIntValue());

		assertEquals(16.0, number("0x1p4").getFloatValue(), 0.0);

		NumberNode negative = number("-2.0");
		assertTrue(negative.isInt());
		assertFalse(negative.isUint());
	}

	@Test
	public void testCharacterConstant() throws Exception {
		NumberNode n = NumberNode.parse(1, 0, "'\\n'", true);
		assertTrue(n.isInt() && n.isUint() && n.isFloat());
		assertEquals(10, n.getIntValue());
		assertEquals(0x263a, NumberNode.parse(1, 0, "'☺'", true).getIntValue());
	}

	@Test
	public void testErrors() {
		MalformedLiteralException e = assertThrows(MalformedLiteralException.class, () -> number("99999999999999999999"));
		assertEquals("integer overflow: \"99999999999999999999\"", e.getMessage());
		e = assertThrows(MalformedLiteralException.class, () -> number("09"));
		assertEquals("illegal number syntax: \"09\"", e.getMessage());
		e = assertThrows(MalformedLiteralException.class, () -> number("1__0"));
		assertEquals("illegal number syntax: \"1__0\"", e.getMessage());
		assertThrows(MalformedLiteralException.class, () -> NumberNode.parse(1, 0, "'ab'", true));
	}

	@Test
	public void testFloatOutOfRange() {
		MalformedLiteralException e = assertThrows(MalformedLiteralException.class, () -> number("1e400"));
		assertEquals("illegal number syntax: \"1e400\"", e.getMessage());
		assertThrows(MalformedLiteralException.class, () -> number("-1e400"));
		assertThrows(MalformedLiteralException.class, () -> number("0x1p2000"));
	}
}
