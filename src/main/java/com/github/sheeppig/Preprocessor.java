package com.github.sheeppig;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Normalizes the tokenizer output in one forward pass:
 * <ul>
 * <li>a newline directly after another newline is dropped,</li>
 * <li>a newline directly after {@code (}, <code>{</code>, {@code [} or {@code ,} is dropped,</li>
 * <li>{@code a.b.c} is fused into a single compound identifier token.</li>
 * </ul>
 * Applying it to its own output changes nothing.
 */
public class Preprocessor {

    public Tokens preprocess(Tokens input) {
        var tokens = input.tokens();
        var positions = input.positions();
        var output = new Tokens.Builder();

        int index = 0;
        while (index < tokens.size()) {
            var token = tokens.get(index);
            var position = positions.get(index);
            index++;

            if (token.type() == TokenType.NEWLINE) {
                if (output.last().filter(Preprocessor::absorbsNewline).isEmpty()) {
                    output.add(token, position);
                }
            } else if (token.type() == TokenType.IDENTIFIER) {
                List<String> segments = new ArrayList<>(((Token.IdentifierToken) token).identifier().segments());
                while (index < tokens.size() && tokens.get(index).type() == TokenType.DOT) {
                    int after = index + 1;
                    if (after >= tokens.size() || tokens.get(after).type() != TokenType.IDENTIFIER) {
                        Optional<Token> found = after < tokens.size() ? Optional.of(tokens.get(after)) : Optional.empty();
                        var foundPosition = after < tokens.size() ? positions.get(after) : positions.get(index);
                        throw new ParseException(ErrorKind.EXPECTED_TOKEN, "Expected identifier after '.'", found, foundPosition);
                    }
                    segments.addAll(((Token.IdentifierToken) tokens.get(after)).identifier().segments());
                    index = after + 1;
                }
                output.add(new Token.IdentifierToken(Identifier.of(segments.toArray(String[]::new))), position);
            } else {
                output.add(token, position);
            }
        }

        return output.build();
    }

    private static boolean absorbsNewline(Token previous) {
        return switch (previous.type()) {
            case NEWLINE, OPEN_PAREN, OPEN_BRACE, OPEN_BRACKET, LIST_SEPARATOR -> true;
            default -> false;
        };
    }

}
