package com.github.sheeppig;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

public class PreprocessorTest {

    @ParameterizedTest
    @MethodSource("preprocessed")
    public void testPreprocess(String code, List<Token> expected) {
        var tokens = new Preprocessor().preprocess(new Tokenizer().tokenize(code));
        assertEquals(expected, tokens.tokens());
    }

    @ParameterizedTest
    @MethodSource("preprocessed")
    public void testIdempotence(String code, List<Token> ignored) {
        var preprocessor = new Preprocessor();
        var once = preprocessor.preprocess(new Tokenizer().tokenize(code));
        var twice = preprocessor.preprocess(once);
        assertEquals(once.tokens(), twice.tokens());
        assertEquals(once.positions(), twice.positions());
    }

    private static List<Token> tokens(Token... tokens) {
        var list = new ArrayList<>(List.of(tokens));
        list.add(Token.END_OF_MODULE);
        return list;
    }

    private static Object[][] preprocessed() {
        return new Object[][] {
            {
                "a.b.c",
                tokens(Token.identifier("a", "b", "c"))
            }, {
                "math . trig",
                tokens(Token.identifier("math", "trig"))
            }, {
                "f(\n  a,\n  b\n)",
                tokens(Token.identifier("f"), Token.OPEN_PAREN, Token.identifier("a"), Token.LIST_SEPARATOR,
                    Token.identifier("b"), Token.NEWLINE, Token.CLOSE_PAREN)
            }, {
                "{\n  x\n}",
                tokens(Token.OPEN_BRACE, Token.identifier("x"), Token.NEWLINE, Token.CLOSE_BRACE)
            }, {
                "[\n1,\n2]",
                tokens(Token.OPEN_BRACKET, Token.integer(1), Token.LIST_SEPARATOR, Token.integer(2), Token.CLOSE_BRACKET)
            }, {
                "a\n# only a comment\n\nb\n",
                tokens(Token.identifier("a"), Token.NEWLINE, Token.identifier("b"), Token.NEWLINE)
            }, {
                "x = a.b + c",
                tokens(Token.identifier("x"), Token.ASSIGN, Token.identifier("a", "b"), Token.operator(Operator.PLUS),
                    Token.identifier("c"))
            }, {
                "",
                tokens()
            }
        };
    }

    @Test
    public void testDanglingDotIsAnError() {
        var preprocessor = new Preprocessor();
        var tokenizer = new Tokenizer();

        var e = assertThrows(ParseException.class, () -> preprocessor.preprocess(tokenizer.tokenize("a.(b)")));
        assertEquals(ErrorKind.EXPECTED_TOKEN, e.kind());
        assertEquals(Token.OPEN_PAREN, e.token().orElseThrow());

        e = assertThrows(ParseException.class, () -> preprocessor.preprocess(Tokens.of(Token.identifier("a"), Token.DOT)));
        assertEquals(ErrorKind.EXPECTED_TOKEN, e.kind());
        assertTrue(e.token().isEmpty());
    }

    @Test
    public void testPositionsFollowTheirTokens() {
        var tokens = new Preprocessor().preprocess(new Tokenizer().tokenize("(\n x.y)"));
        assertEquals(List.of(Token.OPEN_PAREN, Token.identifier("x", "y"), Token.CLOSE_PAREN, Token.END_OF_MODULE),
            tokens.tokens());
        assertEquals(List.of(new Position(1, 1), new Position(2, 2), new Position(2, 5), new Position(2, 6)),
            tokens.positions());
    }

}
