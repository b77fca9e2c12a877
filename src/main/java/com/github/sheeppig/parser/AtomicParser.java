package com.github.sheeppig.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.github.sheeppig.Token;
import com.github.sheeppig.TokenType;
import com.github.sheeppig.Tokens;
import com.github.sheeppig.parser.Module.ArrayIndex;
import com.github.sheeppig.parser.Module.ArrayLiteral;
import com.github.sheeppig.parser.Module.Atomic;
import com.github.sheeppig.parser.Module.AtomicExpression;
import com.github.sheeppig.parser.Module.Expression;
import com.github.sheeppig.parser.Module.FunctionCall;
import com.github.sheeppig.parser.Module.IdentifierExpression;
import com.github.sheeppig.parser.Module.Index;
import com.github.sheeppig.parser.Module.LiteralExpression;
import com.github.sheeppig.parser.Module.Parenthesized;
import com.github.sheeppig.parser.Module.SingleIndex;
import com.github.sheeppig.parser.Module.SliceIndex;

import lombok.RequiredArgsConstructor;

/**
 * Primary expressions: literals, names, calls, parenthesized expressions and array literals,
 * each optionally followed by any number of {@code [index]} suffixes.
 */
@RequiredArgsConstructor
class AtomicParser {

    private final ExpressionParser expressionParser;

    Atomic parseAtomic(Tokens tokens) {
        if (!tokens.hasNext()) {
            throw tokens.expected("an expression");
        }
        var token = tokens.peek();

        AtomicExpression atom = switch (token.type()) {
            case LITERAL -> {
                tokens.next();
                yield new LiteralExpression(((Token.LiteralToken) token).literal());
            }
            case IDENTIFIER -> parseNameExpression(tokens);
            case OPEN_PAREN -> parseParenthesized(tokens);
            case OPEN_BRACKET -> new ArrayLiteral(parseList(tokens, TokenType.CLOSE_BRACKET, "an array element"));
            default -> throw tokens.expected("an expression");
        };

        while (tokens.matches(TokenType.OPEN_BRACKET)) {
            atom = new ArrayIndex(atom, parseIndex(tokens));
        }
        return new Atomic(atom);
    }

    // <> name ("(" arguments ")")?
    private AtomicExpression parseNameExpression(Tokens tokens) {
        var name = tokens.nextIdentifier("a name");
        if (tokens.matches(TokenType.OPEN_PAREN)) {
            return new FunctionCall(name, parseList(tokens, TokenType.CLOSE_PAREN, "an argument"));
        }
        return new IdentifierExpression(name);
    }

    private Parenthesized parseParenthesized(Tokens tokens) {
        tokens.next(TokenType.OPEN_PAREN, "'('");
        tokens.skipNewlines();
        var value = expressionParser.parseExpression(tokens);
        tokens.skipNewlines();
        tokens.next(TokenType.CLOSE_PAREN, "')' to close the parenthesized expression");
        return new Parenthesized(value);
    }

    /**
     * Comma separated expressions between the opening token at the cursor and {@code closing}.
     * Newlines between elements are ignored; an empty slot is an error.
     */
    private List<Expression> parseList(Tokens tokens, TokenType closing, String element) {
        tokens.next();
        List<Expression> values = new ArrayList<>();

        tokens.skipNewlines();
        if (tokens.matches(closing)) {
            tokens.next();
            return values;
        }

        while (true) {
            tokens.skipNewlines();
            if (tokens.matches(TokenType.LIST_SEPARATOR, closing)) {
                throw tokens.expected(element);
            }
            values.add(expressionParser.parseExpression(tokens));
            tokens.skipNewlines();
            if (tokens.matches(closing)) {
                tokens.next();
                return values;
            }
            tokens.next(TokenType.LIST_SEPARATOR, "',' or '" + closing.constantPattern() + "' after " + element);
        }
    }

    // <> "[" expression "]" | "[" expression? ":" expression? "]"
    private Index parseIndex(Tokens tokens) {
        tokens.next(TokenType.OPEN_BRACKET, "'['");
        tokens.skipNewlines();

        Optional<Expression> start = Optional.empty();
        if (!tokens.matches(TokenType.COLON)) {
            start = Optional.of(expressionParser.parseExpression(tokens));
            tokens.skipNewlines();
        }

        if (!tokens.matches(TokenType.COLON)) {
            tokens.next(TokenType.CLOSE_BRACKET, "']' to close the index");
            return new SingleIndex(start.get());
        }

        tokens.next();
        tokens.skipNewlines();
        Optional<Expression> end = Optional.empty();
        if (!tokens.matches(TokenType.CLOSE_BRACKET)) {
            end = Optional.of(expressionParser.parseExpression(tokens));
            tokens.skipNewlines();
        }
        tokens.next(TokenType.CLOSE_BRACKET, "']' to close the slice");
        return new SliceIndex(start, end);
    }

}
