package com.github.sheeppig;

import java.util.Optional;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Fatal error of the front end. Carries the kind of error, the token that was found instead of
 * what was expected (empty when the input ended) and where in the source it happened.
 */
public class ParseException extends RuntimeException {

    @Accessors(fluent = true)
    @Getter
    private final ErrorKind kind;
    @Accessors(fluent = true)
    @Getter
    private final String detail;
    @Accessors(fluent = true)
    @Getter
    private final Optional<Token> token;
    @Accessors(fluent = true)
    @Getter
    private final Position position;

    public ParseException(ErrorKind kind, String detail, Optional<Token> token, Position position) {
        super(format(kind, detail, token, position));
        this.kind = kind;
        this.detail = detail;
        this.token = token;
        this.position = position;
    }

    /**
     * Errors raised while scanning characters; there is no token to report, only the position.
     */
    public static ParseException lexical(ErrorKind kind, String detail, Position position) {
        return new ParseException(kind, detail, Optional.empty(), position);
    }

    public boolean atEndOfInput() {
        return token.isEmpty() && kind.phase() == ErrorKind.Phase.SYNTACTIC;
    }

    private static String format(ErrorKind kind, String detail, Optional<Token> token, Position position) {
        var message = new StringBuilder(kind.phase() == ErrorKind.Phase.LEXICAL ? "Lexical error: " : "Parse error: ");
        message.append(detail);
        if (kind.phase() == ErrorKind.Phase.SYNTACTIC) {
            message.append(", found ").append(token.map(Object::toString).orElse("end of input"));
        }
        if (position.isKnown()) {
            message.append(" at ").append(position);
        }
        return message.toString();
    }
}
