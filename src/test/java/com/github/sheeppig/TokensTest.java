package com.github.sheeppig;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

public class TokensTest {

    @Test
    public void testConsumeStatementEatsTheNewline() {
        var tokens = Tokens.of(Token.identifier("a"), Token.NEWLINE, Token.identifier("b"), Token.END_OF_MODULE);
        var statement = tokens.consumeStatement();
        assertEquals(List.of(Token.identifier("a")), statement.tokens());
        assertEquals(Token.identifier("b"), tokens.peek());
    }

    @Test
    public void testConsumeStatementStopsBeforeClosingBrace() {
        var tokens = Tokens.of(Token.identifier("a"), Token.operator(Operator.PLUS), Token.integer(1),
            Token.CLOSE_BRACE, Token.END_OF_MODULE);
        var statement = tokens.consumeStatement();
        assertEquals(3, statement.size());
        assertEquals(Token.CLOSE_BRACE, tokens.next());

        var atEnd = Tokens.of(Token.identifier("a"), Token.END_OF_MODULE).consumeStatement();
        assertEquals(List.of(Token.identifier("a")), atEnd.tokens());
    }

    @Test
    public void testConsumeStatementKeepsNewlinesInsideBrackets() {
        var tokens = Tokens.of(Token.identifier("f"), Token.OPEN_PAREN, Token.OPEN_BRACKET, Token.integer(1),
            Token.NEWLINE, Token.CLOSE_BRACKET, Token.NEWLINE, Token.CLOSE_PAREN, Token.NEWLINE,
            Token.identifier("b"), Token.END_OF_MODULE);
        var statement = tokens.consumeStatement();
        assertEquals(8, statement.size());
        assertEquals(Token.CLOSE_PAREN, statement.tokens().get(7));
        assertEquals(Token.identifier("b"), tokens.peek());
    }

    @Test
    public void testConsumeStatementNeedsATerminator() {
        var tokens = Tokens.of(Token.identifier("a"));
        var e = assertThrows(ParseException.class, tokens::consumeStatement);
        assertEquals(ErrorKind.UNEXPECTED_END_OF_INPUT, e.kind());
    }

    @Test
    public void testExpectations() {
        var tokens = Tokens.of(Token.keyword(Keyword.IF), Token.identifier("x"));
        tokens.nextKeyword(Keyword.IF, "'if'");

        var e = assertThrows(ParseException.class, () -> tokens.next(TokenType.COLON, "':'"));
        assertEquals(ErrorKind.EXPECTED_TOKEN, e.kind());
        assertEquals(Token.identifier("x"), e.token().orElseThrow());
        assertEquals("Parse error: Expected ':', found " + Token.identifier("x"), e.getMessage());

        assertEquals(Identifier.of("x"), tokens.nextIdentifier("a name"));
        assertFalse(tokens.hasNext());
        assertFalse(tokens.matches(TokenType.IDENTIFIER));
        e = assertThrows(ParseException.class, tokens::peek);
        assertEquals(ErrorKind.UNEXPECTED_END_OF_INPUT, e.kind());
    }

    @Test
    public void testMismatchedPositions() {
        assertThrows(IllegalArgumentException.class, () -> new Tokens(List.of(Token.NEWLINE), List.of()));
    }

}
