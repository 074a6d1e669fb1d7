package org.metricshub.jpoly.frontend;

import static org.junit.Assert.*;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.metricshub.jpoly.util.ScriptSource;

public class PolyLexerTest {

	private static PolyLexer lexer(String text) {
		return new PolyLexer(new ScriptSource("test", new StringReader(text)));
	}

	private static List<Token> tokens(String text) throws Exception {
		PolyLexer lexer = lexer(text);
		List<Token> result = new ArrayList<Token>();
		Token t = lexer.getToken();
		while (t.getType() != TokenType.END_OF_FILE) {
			result.add(t);
			t = lexer.getToken();
		}
		return result;
	}

	@Test
	public void testKeywordsAndIdentifiers() throws Exception {
		List<Token> tokens = tokens("TASKS POLY EXECUTE INPUT OUTPUT INPUTS tasks x1 INPUTSx");
		assertEquals(TokenType.KW_TASKS, tokens.get(0).getType());
		assertEquals(TokenType.KW_POLY, tokens.get(1).getType());
		assertEquals(TokenType.KW_EXECUTE, tokens.get(2).getType());
		assertEquals(TokenType.KW_INPUT, tokens.get(3).getType());
		assertEquals(TokenType.KW_OUTPUT, tokens.get(4).getType());
		assertEquals(TokenType.KW_INPUTS, tokens.get(5).getType());
		assertEquals(TokenType.ID, tokens.get(6).getType());
		assertEquals("x1", tokens.get(7).getLexeme());
		assertEquals(TokenType.ID, tokens.get(8).getType());
		assertEquals(9, tokens.size());
	}

	@Test
	public void testNumerals() throws Exception {
		List<Token> tokens = tokens("0 120 007");
		assertEquals(5, tokens.size());
		assertEquals("0", tokens.get(0).getLexeme());
		assertEquals("120", tokens.get(1).getLexeme());
		assertEquals("0", tokens.get(2).getLexeme());
		assertEquals("0", tokens.get(3).getLexeme());
		assertEquals("7", tokens.get(4).getLexeme());
		for (Token t : tokens) {
			assertEquals(TokenType.NUM, t.getType());
		}
	}

	@Test
	public void testNumeralFollowedByIdentifier() throws Exception {
		List<Token> tokens = tokens("2x");
		assertEquals(2, tokens.size());
		assertEquals(TokenType.NUM, tokens.get(0).getType());
		assertEquals(TokenType.ID, tokens.get(1).getType());
	}

	@Test
	public void testPunctuationAndErrors() throws Exception {
		List<Token> tokens = tokens("=+-^,;()*");
		TokenType[] expected = {
				TokenType.EQUAL,
				TokenType.PLUS,
				TokenType.MINUS,
				TokenType.POWER,
				TokenType.COMMA,
				TokenType.SEMICOLON,
				TokenType.LPAREN,
				TokenType.RPAREN,
				TokenType.ERROR };
		assertEquals(expected.length, tokens.size());
		for (int i = 0; i < expected.length; i++) {
			assertEquals(expected[i], tokens.get(i).getType());
		}
		assertEquals("*", tokens.get(8).getLexeme());
	}

	@Test
	public void testLineNumbers() throws Exception {
		List<Token> tokens = tokens("TASKS 2\n\nPOLY\r\n  f = x;\n");
		assertEquals(1, tokens.get(0).getLine());
		assertEquals(1, tokens.get(1).getLine());
		assertEquals(3, tokens.get(2).getLine());
		assertEquals(4, tokens.get(3).getLine());
		assertEquals(4, tokens.get(6).getLine());
	}

	@Test
	public void testPeekDoesNotConsume() throws Exception {
		PolyLexer lexer = lexer("a ( b");
		assertEquals(TokenType.LPAREN, lexer.peek(2).getType());
		assertEquals("a", lexer.peek(1).getLexeme());
		assertEquals("b", lexer.peek(3).getLexeme());
		assertEquals(TokenType.END_OF_FILE, lexer.peek(5).getType());
		assertEquals("a", lexer.getToken().getLexeme());
		assertEquals(TokenType.LPAREN, lexer.getToken().getType());
		assertEquals("b", lexer.getToken().getLexeme());
		assertEquals(TokenType.END_OF_FILE, lexer.getToken().getType());
		assertEquals(TokenType.END_OF_FILE, lexer.getToken().getType());
		assertThrows(IllegalArgumentException.class, () -> lexer.peek(0));
	}
}
