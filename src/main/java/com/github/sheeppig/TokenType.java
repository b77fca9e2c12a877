package com.github.sheeppig;

public enum TokenType {
    OPEN_PAREN("("),
    CLOSE_PAREN(")"),
    OPEN_BRACE("{"),
    CLOSE_BRACE("}"),
    OPEN_BRACKET("["),
    CLOSE_BRACKET("]"),

    LIST_SEPARATOR(","),
    DOT("."),
    COLON(":"),

    NEWLINE,
    END_OF_MODULE,

    OPERATOR,
    BINARY_ASSIGN,
    TERNARY_CONDITION("?"),
    ASSIGN("="),

    KEYWORD,
    LITERAL,
    IDENTIFIER;

    final String constantPattern;

    private TokenType() {
        this(null);
    }
    private TokenType(String constantPattern) {
        this.constantPattern = constantPattern;
    }

    public String constantPattern() {
        return constantPattern;
    }

    /**
     * Whether tokens of this type carry no payload and are represented by {@link Token.Symbol}.
     */
    public boolean isSymbol() {
        return switch (this) {
            case OPERATOR, BINARY_ASSIGN, KEYWORD, LITERAL, IDENTIFIER -> false;
            default -> true;
        };
    }
}
