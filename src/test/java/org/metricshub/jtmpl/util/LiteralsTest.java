package org.metricshub.jtmpl.util;

import static org.junit.Assert.*;

import java.math.BigInteger;
import org.junit.Test;

public class LiteralsTest {

	@Test
	public void testUnquoteEscapes() throws Exception {
		assertEquals("", Literals.unquote("\"\""));
		assertEquals("a\tb\nc", Literals.unquote("\"a\\tb\\nc\""));
		assertEquals("\u0007\b\f\r\u000B\\\"", Literals.unquote("\"\\a\\b\\f\\r\\v\\\\\\\"\""));
		assertEquals("!", Literals.unquote("\"\\x21\""));
		assertEquals("\u00e9", Literals.unquote("\"\\u00e9\""));
		assertEquals(new String(Character.toChars(0x1F600)), Literals.unquote("\"\\U0001F600\""));
		assertEquals("S", Literals.unquote("\"\\123\""));
	}

	@Test
	public void testEscapeDigitsAreAscii() {
		// Arabic-Indic digits
		assertThrows(MalformedLiteralException.class, () -> Literals.unquote("\"\\x\u0663\u0663\""));
		assertThrows(MalformedLiteralException.class, () -> Literals.unquote("\"\\u\uff10041\""));
		assertThrows(MalformedLiteralException.class, () -> Literals.unquote("\"\\1\u0662\u0663\""));
		assertNull(Literals.parseInteger("1\u0663", false));
	}

	@Test
	public void testSurrogateEscapesAreRejected() {
		assertThrows(MalformedLiteralException.class, () -> Literals.unquote("\"\\ud800\""));
		assertThrows(MalformedLiteralException.class, () -> Literals.unquote("\"\\uDFFF\""));
		assertThrows(MalformedLiteralException.class, () -> Literals.unquote("\"\\U0000d800\""));
		assertThrows(MalformedLiteralException.class, () -> Literals.unquoteCharConstant("'\\ud800'"));
	}

	@Test
	public void testUnquoteRaw() throws Exception {
		assertEquals("a\\n\nb", Literals.unquote("`a\\n\r\nb`"));
	}

	@Test
	public void testUnquoteErrors() {
		assertThrows(MalformedLiteralException.class, () -> Literals.unquote("\"abc"));
		assertThrows(MalformedLiteralException.class, () -> Literals.unquote("'a'"));
		assertThrows(MalformedLiteralException.class, () -> Literals.unquote("\"\\q\""));
		assertThrows(MalformedLiteralException.class, () -> Literals.unquote("\"\\400\""));
		assertThrows(MalformedLiteralException.class, () -> Literals.unquote("\"\\x4\""));
		MalformedLiteralException e = assertThrows(MalformedLiteralException.class, () -> Literals.unquote("\"a\nb\""));
		assertEquals("unable to unquote string: \"a\nb\"", e.getMessage());
	}

	@Test
	public void testCharConstants() throws Exception {
		assertEquals('x', Literals.unquoteCharConstant("'x'"));
		assertEquals('\'', Literals.unquoteCharConstant("'\\''"));
		assertEquals(0, Literals.unquoteCharConstant("'\\x00'"));
		MalformedLiteralException e = assertThrows(MalformedLiteralException.class, () -> Literals.unquoteCharConstant("''"));
		assertEquals("malformed character constant: ''", e.getMessage());
	}

	@Test
	public void testQuote() {
		assertEquals("\"plain\"", Literals.quote("plain"));
		assertEquals("\"a\\\"b\\\\c\\n\\t\"", Literals.quote("a\"b\\c\n\t"));
		assertEquals("\"\\x01\"", Literals.quote("\u0001"));
	}

	@Test
	public void testParseInteger() {
		assertEquals(BigInteger.valueOf(26), Literals.parseInteger("0x1A", true));
		assertEquals(BigInteger.valueOf(-26), Literals.parseInteger("-0x1a", false));
		assertNull(Literals.parseInteger("-1", true));
		assertEquals(BigInteger.valueOf(15), Literals.parseInteger("0x_f", true));
		assertNull(Literals.parseInteger("_1", true));
		assertNull(Literals.parseInteger("1_", true));
		assertNull(Literals.parseInteger("0x", true));
		assertNull(Literals.parseInteger("1.0", true));
	}

	@Test
	public void testRanges() {
		BigInteger maxLong = BigInteger.valueOf(Long.MAX_VALUE);
		assertTrue(Literals.fitsSigned(maxLong));
		assertFalse(Literals.fitsSigned(maxLong.add(BigInteger.ONE)));
		assertTrue(Literals.fitsUnsigned(maxLong.add(BigInteger.ONE)));
		assertFalse(Literals.fitsUnsigned(BigInteger.ONE.shiftLeft(64)));
		assertFalse(Literals.fitsUnsigned(BigInteger.ONE.negate()));
	}
}
