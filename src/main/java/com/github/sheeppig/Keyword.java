package com.github.sheeppig;

import java.util.Optional;

public enum Keyword {
    USING("using"),
    AS("as"),
    FROM("from"),
    FUNCTION("fun"),
    RETURN("return"),
    VARIABLE("var"),
    IF("if"),
    ELSE("else"),
    FOR("for"),
    IN("in"),
    WHILE("while");

    final String word;

    private Keyword(String word) {
        this.word = word;
    }

    public String word() {
        return word;
    }

    public static Optional<Keyword> fromWord(String word) {
        for (var keyword : values()) {
            if (keyword.word.equals(word)) {
                return Optional.of(keyword);
            }
        }
        return Optional.empty();
    }
}
