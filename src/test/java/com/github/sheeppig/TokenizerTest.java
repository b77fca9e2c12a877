package com.github.sheeppig;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.sheeppig.Literal.BooleanLiteral;
import com.github.sheeppig.Literal.CharLiteral;
import com.github.sheeppig.Literal.FloatLiteral;
import com.github.sheeppig.Literal.IntegerLiteral;
import com.github.sheeppig.Literal.NoneLiteral;
import com.github.sheeppig.Literal.StringLiteral;

public class TokenizerTest {

    @ParameterizedTest
    @MethodSource("tokenStreams")
    public void testTokenize(String code, List<Token> expected) {
        var tokens = new Tokenizer().tokenize(code);
        assertEquals(expected, tokens.tokens());
    }

    @ParameterizedTest
    @MethodSource("lexicalErrors")
    public void testLexicalError(String code, ErrorKind expected) {
        var e = assertThrows(ParseException.class, () -> new Tokenizer().tokenize(code));
        assertEquals(expected, e.kind());
        assertEquals(ErrorKind.Phase.LEXICAL, e.kind().phase());
        assertTrue(e.getMessage().startsWith("Lexical error: "), e.getMessage());
    }

    private static List<Token> tokens(Token... tokens) {
        var list = new ArrayList<>(List.of(tokens));
        list.add(Token.END_OF_MODULE);
        return list;
    }

    private static Object[][] tokenStreams() {
        return new Object[][] {
            {
                "",
                tokens()
            }, {
                "x: int = 1 + 2",
                tokens(Token.identifier("x"), Token.COLON, Token.identifier("int"), Token.ASSIGN,
                    Token.integer(1), Token.operator(Operator.PLUS), Token.integer(2))
            }, {
                "a ** b * c",
                tokens(Token.identifier("a"), Token.operator(Operator.POWER), Token.identifier("b"),
                    Token.operator(Operator.TIMES), Token.identifier("c"))
            }, {
                "a <<= 2",
                tokens(Token.identifier("a"), Token.binaryAssign(Operator.BITWISE_LEFT_SHIFT), Token.integer(2))
            }, {
                "a **= b",
                tokens(Token.identifier("a"), Token.binaryAssign(Operator.POWER), Token.identifier("b"))
            }, {
                "a <= b == c != d",
                tokens(Token.identifier("a"), Token.operator(Operator.LESS_THAN_OR_EQUAL), Token.identifier("b"),
                    Token.operator(Operator.EQUAL), Token.identifier("c"), Token.operator(Operator.NOT_EQUAL),
                    Token.identifier("d"))
            }, {
                "!a && ~b || c",
                tokens(Token.operator(Operator.NOT), Token.identifier("a"), Token.operator(Operator.AND),
                    Token.operator(Operator.BITWISE_NOT), Token.identifier("b"), Token.operator(Operator.OR),
                    Token.identifier("c"))
            }, {
                "fun var using as from return if else while for in",
                tokens(Token.keyword(Keyword.FUNCTION), Token.keyword(Keyword.VARIABLE), Token.keyword(Keyword.USING),
                    Token.keyword(Keyword.AS), Token.keyword(Keyword.FROM), Token.keyword(Keyword.RETURN),
                    Token.keyword(Keyword.IF), Token.keyword(Keyword.ELSE), Token.keyword(Keyword.WHILE),
                    Token.keyword(Keyword.FOR), Token.keyword(Keyword.IN))
            }, {
                "true false None funny _x1",
                tokens(Token.literal(new BooleanLiteral(true)), Token.literal(new BooleanLiteral(false)),
                    Token.literal(new NoneLiteral()), Token.identifier("funny"), Token.identifier("_x1"))
            }, {
                "1_000 2.5 .5 1e3 2.5E-2",
                tokens(Token.integer(1000), Token.literal(new FloatLiteral(2.5)), Token.literal(new FloatLiteral(0.5)),
                    Token.literal(new FloatLiteral(1000.0)), Token.literal(new FloatLiteral(0.025)))
            }, {
                "'a' '\\n' \"hi\\t\\\"there\\\"\"",
                tokens(Token.literal(new CharLiteral('a')), Token.literal(new CharLiteral('\n')),
                    Token.literal(new StringLiteral("hi\t\"there\"")))
            }, {
                "a.b",
                tokens(Token.identifier("a"), Token.DOT, Token.identifier("b"))
            }, {
                "f(x, [1]) { y ? z : w }",
                tokens(Token.identifier("f"), Token.OPEN_PAREN, Token.identifier("x"), Token.LIST_SEPARATOR,
                    Token.OPEN_BRACKET, Token.integer(1), Token.CLOSE_BRACKET, Token.CLOSE_PAREN, Token.OPEN_BRACE,
                    Token.identifier("y"), Token.TERNARY_CONDITION, Token.identifier("z"), Token.COLON,
                    Token.identifier("w"), Token.CLOSE_BRACE)
            }, {
                "a\n\n\nb",
                tokens(Token.identifier("a"), Token.NEWLINE, Token.identifier("b"))
            }, {
                "a # comment\n  # another\nb",
                tokens(Token.identifier("a"), Token.NEWLINE, Token.identifier("b"))
            }, {
                "a /* spans\nlines */ b",
                tokens(Token.identifier("a"), Token.identifier("b"))
            }, {
                "a /* never closed\nb c",
                tokens(Token.identifier("a"))
            }, {
                "a + \\\n  b",
                tokens(Token.identifier("a"), Token.operator(Operator.PLUS), Token.identifier("b"))
            }
        };
    }

    private static Object[][] lexicalErrors() {
        return new Object[][] {
            { "'ab'", ErrorKind.MALFORMED_LITERAL },
            { "''", ErrorKind.MALFORMED_LITERAL },
            { "'a", ErrorKind.UNTERMINATED_LITERAL },
            { "\"no end", ErrorKind.UNTERMINATED_LITERAL },
            { "\"bad \\q escape\"", ErrorKind.MALFORMED_LITERAL },
            { "1.2.3", ErrorKind.MALFORMED_LITERAL },
            { "1e", ErrorKind.MALFORMED_LITERAL },
            { "99999999999999999999", ErrorKind.MALFORMED_LITERAL },
            { "a $ b", ErrorKind.UNEXPECTED_CHARACTER },
            { "a \\ b", ErrorKind.UNEXPECTED_CHARACTER },
        };
    }

    @Test
    public void testPositions() {
        var tokens = new Tokenizer().tokenize("a = 1\n  b");
        assertEquals(List.of(new Position(1, 1), new Position(1, 3), new Position(1, 5), new Position(1, 6),
            new Position(2, 3), new Position(2, 4)), tokens.positions());

        var e = assertThrows(ParseException.class, () -> new Tokenizer().tokenize("x\n  @"));
        assertEquals(new Position(2, 3), e.position());
        assertTrue(e.getMessage().endsWith(" at 2:3"), e.getMessage());
    }

    @Test
    public void testWhitespaceInsensitivity() {
        var tokenizer = new Tokenizer();
        var dense = tokenizer.tokenize("x:int=(1+2)*f(a,b)[0]").tokens();
        var spaced = tokenizer.tokenize("  x :\tint =  ( 1 + 2 ) *  f ( a , b ) [ 0 ]   ").tokens();
        assertEquals(dense, spaced);
    }

    @Test
    public void testNumericLiteralsAreRecovered() {
        var random = new Random(42);
        var tokenizer = new Tokenizer();
        for (int i = 0; i < 200; i++) {
            long integer = random.nextLong() & Long.MAX_VALUE;
            assertEquals(List.of(Token.integer(integer), Token.END_OF_MODULE),
                tokenizer.tokenize(Long.toString(integer)).tokens());

            double real = random.nextDouble() * Math.pow(10, random.nextInt(20) - 10);
            assertEquals(List.of(Token.literal(new FloatLiteral(real)), Token.END_OF_MODULE),
                tokenizer.tokenize(Double.toString(real)).tokens());
        }
    }

    @Test
    public void testEndOfModuleIsAlwaysLast() {
        for (var code : List.of("", "\n", "a", "a\n", "fun f() {\n}\n", "/* open")) {
            var tokens = new Tokenizer().tokenize(code).tokens();
            assertEquals(Token.END_OF_MODULE, tokens.get(tokens.size() - 1), code);
            assertEquals(1, tokens.stream().filter(Token.END_OF_MODULE::equals).count(), code);
        }
    }

}
