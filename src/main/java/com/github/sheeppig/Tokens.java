package com.github.sheeppig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Token sequence with a cursor. A single instance is threaded through the parsers; statement
 * parsing works on slices obtained from {@link #consumeStatement()}.
 */
public class Tokens {

    private final List<Token> tokens;
    private final List<Position> positions;
    private int index;

    public Tokens(List<Token> tokens, List<Position> positions) {
        if (tokens.size() != positions.size()) {
            throw new IllegalArgumentException("got " + tokens.size() + " tokens but " + positions.size() + " positions");
        }
        this.tokens = List.copyOf(tokens);
        this.positions = List.copyOf(positions);
    }

    public static Tokens of(List<Token> tokens) {
        return new Tokens(tokens, Collections.nCopies(tokens.size(), Position.UNKNOWN));
    }

    public static Tokens of(Token... tokens) {
        return of(List.of(tokens));
    }

    public List<Token> tokens() {
        return tokens;
    }

    public List<Position> positions() {
        return positions;
    }

    public int size() {
        return tokens.size();
    }

    public boolean hasNext() {
        return index < tokens.size();
    }

    public Token peek() {
        if (!hasNext()) {
            throw error(ErrorKind.UNEXPECTED_END_OF_INPUT, "Unexpected end of input");
        }
        return tokens.get(index);
    }

    public Token next() {
        var token = peek();
        index++;
        return token;
    }

    public boolean matches(TokenType... types) {
        if (!hasNext()) {
            return false;
        }
        TokenType peekType = tokens.get(index).type();
        for (var type : types) {
            if (peekType == type) {
                return true;
            }
        }
        return false;
    }

    public boolean matches(Token token) {
        return hasNext() && tokens.get(index).equals(token);
    }

    public boolean matches(Keyword keyword) {
        return matches(Token.keyword(keyword));
    }

    /**
     * Consumes the next token, which must be of the given type.
     *
     * @param expected human readable description of the expected construct, used in the error
     */
    public Token next(TokenType type, String expected) {
        if (!matches(type)) {
            throw expected(expected);
        }
        return next();
    }

    public Identifier nextIdentifier(String expected) {
        return ((Token.IdentifierToken) next(TokenType.IDENTIFIER, expected)).identifier();
    }

    public void nextKeyword(Keyword keyword, String expected) {
        if (!matches(keyword)) {
            throw expected(expected);
        }
        index++;
    }

    public void skipNewlines() {
        while (matches(TokenType.NEWLINE)) {
            index++;
        }
    }

    /**
     * Cuts the tokens of one statement out of this sequence. A newline ends the statement and is
     * consumed, unless it sits inside an open {@code (} or {@code [}; a closing brace or the end of
     * the module ends it and is left for the enclosing construct.
     */
    public Tokens consumeStatement() {
        int start = index;
        int depth = 0;
        while (true) {
            if (!hasNext()) {
                throw error(ErrorKind.UNEXPECTED_END_OF_INPUT, "Expected a newline or '}' to end the statement");
            }
            var type = tokens.get(index).type();
            if (type == TokenType.CLOSE_BRACE || type == TokenType.END_OF_MODULE) {
                return slice(start, index);
            }
            if (type == TokenType.NEWLINE && depth == 0) {
                var statement = slice(start, index);
                index++;
                return statement;
            }
            if (type == TokenType.OPEN_PAREN || type == TokenType.OPEN_BRACKET) {
                depth++;
            } else if ((type == TokenType.CLOSE_PAREN || type == TokenType.CLOSE_BRACKET) && depth > 0) {
                depth--;
            }
            index++;
        }
    }

    private Tokens slice(int from, int to) {
        return new Tokens(tokens.subList(from, to), positions.subList(from, to));
    }

    /**
     * Position of the next token, or of the last token when the sequence is exhausted.
     */
    public Position position() {
        if (hasNext()) {
            return positions.get(index);
        }
        return positions.isEmpty() ? Position.UNKNOWN : positions.get(positions.size() - 1);
    }

    public ParseException error(ErrorKind kind, String detail) {
        Optional<Token> found = hasNext() ? Optional.of(tokens.get(index)) : Optional.empty();
        return new ParseException(kind, detail, found, position());
    }

    /**
     * Error for a missing construct; running out of tokens is reported as such.
     */
    public ParseException expected(String expected) {
        return error(hasNext() ? ErrorKind.EXPECTED_TOKEN : ErrorKind.UNEXPECTED_END_OF_INPUT, "Expected " + expected);
    }

    static class Builder {
        private final List<Token> tokens = new ArrayList<>();
        private final List<Position> positions = new ArrayList<>();

        void add(Token token, Position position) {
            tokens.add(token);
            positions.add(position);
        }

        Optional<Token> last() {
            return tokens.isEmpty() ? Optional.empty() : Optional.of(tokens.get(tokens.size() - 1));
        }

        Tokens build() {
            return new Tokens(tokens, positions);
        }
    }

}
