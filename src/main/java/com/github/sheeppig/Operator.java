package com.github.sheeppig;

public enum Operator {
    // arithmetic
    PLUS("+", true),
    MINUS("-", true),
    TIMES("*", true),
    DIVIDE("/", true),
    MODULO("%", true),
    POWER("**", true),

    // logical
    AND("&&"),
    OR("||"),
    NOT("!"),

    // bitwise
    BITWISE_AND("&", true),
    BITWISE_OR("|", true),
    BITWISE_XOR("^", true),
    BITWISE_LEFT_SHIFT("<<", true),
    BITWISE_RIGHT_SHIFT(">>", true),
    BITWISE_NOT("~"),

    // relational
    EQUAL("=="),
    NOT_EQUAL("!="),
    LESS_THAN("<"),
    GREATER_THAN(">"),
    LESS_THAN_OR_EQUAL("<="),
    GREATER_THAN_OR_EQUAL(">=");

    final String symbol;
    final boolean compoundAssignable;

    private Operator(String symbol) {
        this(symbol, false);
    }
    private Operator(String symbol, boolean compoundAssignable) {
        this.symbol = symbol;
        this.compoundAssignable = compoundAssignable;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Whether {@code symbol + "="} is a compound assignment, e.g. {@code +=} or {@code <<=}.
     */
    public boolean compoundAssignable() {
        return compoundAssignable;
    }
}
