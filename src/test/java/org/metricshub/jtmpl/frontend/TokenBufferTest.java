package org.metricshub.jtmpl.frontend;

import static org.junit.Assert.*;

import org.junit.Test;

public class TokenBufferTest {

	private static TokenBuffer buffer(String input) {
		return new TokenBuffer(new Lexer(input));
	}

	@Test
	public void testNextUntilExhausted() {
		TokenBuffer tokens = buffer("text");
		assertEquals(TokenType.TEXT, tokens.next().getType());
		assertEquals(TokenType.EOF, tokens.next().getType());
		assertNull(tokens.next());
		assertNull(tokens.peek());
		assertNull(tokens.nextNonSpace());
	}

	@Test
	public void testBackupRestoresOrder() {
		TokenBuffer tokens = buffer("{{$x := 1}}");
		Token t0 = tokens.next();
		Token t1 = tokens.next();
		Token t2 = tokens.next();
		tokens.backup3(t0, t1, t2);
		assertEquals(3, tokens.pendingCount());
		assertSame(t0, tokens.next());
		assertSame(t1, tokens.next());
		assertSame(t2, tokens.next());
		assertEquals(TokenType.DECLARE, tokens.next().getType());

		Token a = tokens.next();
		Token b = tokens.next();
		tokens.backup2(a, b);
		assertSame(a, tokens.next());
		assertSame(b, tokens.next());
		assertEquals(0, tokens.pendingCount());
	}

	@Test
	public void testPeekDoesNotConsume() {
		TokenBuffer tokens = buffer("{{.}}");
		Token peeked = tokens.peek();
		assertEquals(TokenType.LEFT_DELIM, peeked.getType());
		assertSame(peeked, tokens.next());
	}

	@Test
	public void testNonSpaceVariants() {
		TokenBuffer tokens = buffer("{{   .x   .y}}");
		tokens.next();
		Token x = tokens.peekNonSpace();
		assertEquals(".x", x.getText());
		assertSame(x, tokens.nextNonSpace());
		assertEquals(".y", tokens.nextNonSpace().getText());
		assertEquals(TokenType.RIGHT_DELIM, tokens.nextNonSpace().getType());
	}

	@Test
	public void testLineFollowsReturnedTokens() {
		TokenBuffer tokens = buffer("a\n\nb{{.}}");
		assertEquals(1, tokens.getLine());
		tokens.next();
		assertEquals(1, tokens.getLine());
		Token delim = tokens.next();
		assertEquals(3, tokens.getLine());
		tokens.backup(delim);
		tokens.next();
		assertEquals(3, tokens.getLine());
	}
}
