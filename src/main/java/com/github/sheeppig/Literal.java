package com.github.sheeppig;

import java.util.Optional;

public sealed interface Literal {

    record FloatLiteral(double value) implements Literal {}
    record IntegerLiteral(long value) implements Literal {}
    record CharLiteral(char value) implements Literal {}
    record StringLiteral(String value) implements Literal {}
    record BooleanLiteral(boolean value) implements Literal {}
    record NoneLiteral() implements Literal {}

    static Optional<Literal> fromWord(String word) {
        return switch (word) {
            case "true" -> Optional.of(new BooleanLiteral(true));
            case "false" -> Optional.of(new BooleanLiteral(false));
            case "None" -> Optional.of(new NoneLiteral());
            default -> Optional.empty();
        };
    }

}
