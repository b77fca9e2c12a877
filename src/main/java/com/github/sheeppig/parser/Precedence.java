package com.github.sheeppig.parser;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import com.github.sheeppig.Operator;

/**
 * Operator classes from loosest to tightest binding. The declaration order is the precedence
 * order; {@link ExpressionParser} walks it with a single routine.
 */
enum Precedence {
    LOGICAL_OR(Associativity.LEFT, Operator.OR),
    LOGICAL_AND(Associativity.LEFT, Operator.AND),
    BITWISE_OR(Associativity.LEFT, Operator.BITWISE_OR),
    BITWISE_XOR(Associativity.LEFT, Operator.BITWISE_XOR),
    BITWISE_AND(Associativity.LEFT, Operator.BITWISE_AND),
    EQUALITY(Associativity.LEFT, Operator.EQUAL, Operator.NOT_EQUAL),
    RELATIONAL(Associativity.LEFT, Operator.LESS_THAN, Operator.LESS_THAN_OR_EQUAL, Operator.GREATER_THAN, Operator.GREATER_THAN_OR_EQUAL),
    SHIFT(Associativity.LEFT, Operator.BITWISE_LEFT_SHIFT, Operator.BITWISE_RIGHT_SHIFT),
    ADDITIVE(Associativity.LEFT, Operator.PLUS, Operator.MINUS),
    MULTIPLICATIVE(Associativity.LEFT, Operator.TIMES, Operator.DIVIDE, Operator.MODULO),
    UNARY(Associativity.PREFIX, Operator.PLUS, Operator.MINUS, Operator.NOT, Operator.BITWISE_NOT),
    POWER(Associativity.RIGHT, Operator.POWER);

    enum Associativity {
        LEFT, RIGHT, PREFIX
    }

    static final Precedence[] LEVELS = values();

    final Associativity associativity;
    final Set<Operator> operators;

    private Precedence(Associativity associativity, Operator first, Operator... rest) {
        this.associativity = associativity;
        this.operators = EnumSet.of(first, rest);
    }

    boolean contains(Operator operator) {
        return operators.contains(operator);
    }

    /**
     * The next tighter level; empty after {@link #POWER}, whose operands are atoms.
     */
    Optional<Precedence> tighter() {
        return ordinal() + 1 < LEVELS.length ? Optional.of(LEVELS[ordinal() + 1]) : Optional.empty();
    }

    static Precedence loosest() {
        return LEVELS[0];
    }
}
