package com.github.sheeppig.parser;

import java.util.Optional;

import com.github.sheeppig.Operator;
import com.github.sheeppig.Token;
import com.github.sheeppig.TokenType;
import com.github.sheeppig.Tokens;
import com.github.sheeppig.parser.Module.BinaryOperation;
import com.github.sheeppig.parser.Module.Expression;
import com.github.sheeppig.parser.Module.TernaryCondition;
import com.github.sheeppig.parser.Module.UnaryOperation;

/**
 * Precedence climbing over {@link Precedence}. Consumes exactly one expression and leaves the
 * cursor on the first token after it.
 */
public class ExpressionParser {

    private final AtomicParser atomicParser = new AtomicParser(this);

    // <> level0 ("?" expression ":" expression)?
    public Expression parseExpression(Tokens tokens) {
        var condition = parseLevel(tokens, Precedence.loosest());

        if (!tokens.matches(TokenType.TERNARY_CONDITION)) {
            return condition;
        }
        tokens.next();
        var trueValue = parseExpression(tokens);
        tokens.next(TokenType.COLON, "':' after the true branch of a ternary condition");
        var falseValue = parseExpression(tokens);
        return new TernaryCondition(condition, trueValue, falseValue);
    }

    Expression parseLevel(Tokens tokens, Precedence level) {
        return switch (level.associativity) {
            case LEFT -> parseLeftAssociative(tokens, level);
            case RIGHT -> parseRightAssociative(tokens, level);
            case PREFIX -> parsePrefix(tokens, level);
        };
    }

    // <> tighter (op tighter)*
    private Expression parseLeftAssociative(Tokens tokens, Precedence level) {
        var expr = parseTighter(tokens, level);

        var operator = matchOperator(tokens, level);
        while (operator.isPresent()) {
            tokens.next();
            var right = parseTighter(tokens, level);
            expr = new BinaryOperation(expr, operator.get(), right);
            operator = matchOperator(tokens, level);
        }
        return expr;
    }

    // <> tighter (op self)?
    private Expression parseRightAssociative(Tokens tokens, Precedence level) {
        var left = parseTighter(tokens, level);

        var operator = matchOperator(tokens, level);
        if (operator.isEmpty()) {
            return left;
        }
        tokens.next();
        var right = parseLevel(tokens, level);
        return new BinaryOperation(left, operator.get(), right);
    }

    // <> op self | tighter
    private Expression parsePrefix(Tokens tokens, Precedence level) {
        var operator = matchOperator(tokens, level);
        if (operator.isEmpty()) {
            return parseTighter(tokens, level);
        }
        tokens.next();
        var operand = parseLevel(tokens, level);
        return new UnaryOperation(operator.get(), operand);
    }

    private Expression parseTighter(Tokens tokens, Precedence level) {
        return level.tighter()
            .map(tighter -> parseLevel(tokens, tighter))
            .orElseGet(() -> atomicParser.parseAtomic(tokens));
    }

    private static Optional<Operator> matchOperator(Tokens tokens, Precedence level) {
        if (tokens.matches(TokenType.OPERATOR)) {
            var operator = ((Token.OperatorToken) tokens.peek()).operator();
            if (level.contains(operator)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

}
