package com.github.sheeppig;

/**
 * A lexical unit. Tokens are values: two tokens are equal when their type and payload are equal.
 * Source positions are kept alongside by {@link Tokens}.
 */
public sealed interface Token {

    Token OPEN_PAREN = new Symbol(TokenType.OPEN_PAREN);
    Token CLOSE_PAREN = new Symbol(TokenType.CLOSE_PAREN);
    Token OPEN_BRACE = new Symbol(TokenType.OPEN_BRACE);
    Token CLOSE_BRACE = new Symbol(TokenType.CLOSE_BRACE);
    Token OPEN_BRACKET = new Symbol(TokenType.OPEN_BRACKET);
    Token CLOSE_BRACKET = new Symbol(TokenType.CLOSE_BRACKET);
    Token LIST_SEPARATOR = new Symbol(TokenType.LIST_SEPARATOR);
    Token DOT = new Symbol(TokenType.DOT);
    Token COLON = new Symbol(TokenType.COLON);
    Token NEWLINE = new Symbol(TokenType.NEWLINE);
    Token END_OF_MODULE = new Symbol(TokenType.END_OF_MODULE);
    Token TERNARY_CONDITION = new Symbol(TokenType.TERNARY_CONDITION);
    Token ASSIGN = new Symbol(TokenType.ASSIGN);

    TokenType type();

    static Token operator(Operator operator) {
        return new OperatorToken(operator);
    }

    static Token binaryAssign(Operator operator) {
        return new BinaryAssign(operator);
    }

    static Token keyword(Keyword keyword) {
        return new KeywordToken(keyword);
    }

    static Token literal(Literal literal) {
        return new LiteralToken(literal);
    }

    static Token identifier(String... names) {
        return new IdentifierToken(Identifier.of(names));
    }

    static Token integer(long value) {
        return literal(new Literal.IntegerLiteral(value));
    }

    record Symbol(TokenType type) implements Token {
        public Symbol {
            if (!type.isSymbol()) {
                throw new IllegalArgumentException(type + " tokens carry a payload");
            }
        }
    }

    record OperatorToken(Operator operator) implements Token {
        @Override
        public TokenType type() {
            return TokenType.OPERATOR;
        }
    }

    record BinaryAssign(Operator operator) implements Token {
        public BinaryAssign {
            if (!operator.compoundAssignable()) {
                throw new IllegalArgumentException(operator + " has no compound assignment");
            }
        }

        @Override
        public TokenType type() {
            return TokenType.BINARY_ASSIGN;
        }
    }

    record KeywordToken(Keyword keyword) implements Token {
        @Override
        public TokenType type() {
            return TokenType.KEYWORD;
        }
    }

    record LiteralToken(Literal literal) implements Token {
        @Override
        public TokenType type() {
            return TokenType.LITERAL;
        }
    }

    record IdentifierToken(Identifier identifier) implements Token {
        @Override
        public TokenType type() {
            return TokenType.IDENTIFIER;
        }
    }

}
