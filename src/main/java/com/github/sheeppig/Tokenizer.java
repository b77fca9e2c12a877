package com.github.sheeppig;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import com.github.sheeppig.Literal.CharLiteral;
import com.github.sheeppig.Literal.FloatLiteral;
import com.github.sheeppig.Literal.StringLiteral;

/**
 * Turns source text into a flat token sequence ending in {@link Token#END_OF_MODULE}.
 * <p>
 * At every position the patterns are tried in order and the first one that matches wins.
 * Fixed-text tokens are tried longest first, so {@code **} beats {@code *} and {@code <<=} beats
 * {@code <<}.
 */
public class Tokenizer {

    List<Pattern> patterns = new ArrayList<>();

    {
        patterns.add(new WhitespacePattern());
        patterns.add(new LineContinuationPattern());
        patterns.add(new InlineCommentPattern());
        patterns.add(new BlockCommentPattern());
        patterns.add(new NumberPattern());
        patterns.add(new CharPattern());
        patterns.add(new StringPattern());
        patterns.add(new WordPattern());

        List<StaticPattern> staticPatterns = new ArrayList<>();
        for (var tokenType : TokenType.values()) {
            if (tokenType.constantPattern() != null) {
                staticPatterns.add(new StaticPattern(tokenType.constantPattern(), new Token.Symbol(tokenType)));
            }
        }
        for (var operator : Operator.values()) {
            staticPatterns.add(new StaticPattern(operator.symbol(), Token.operator(operator)));
            if (operator.compoundAssignable()) {
                staticPatterns.add(new StaticPattern(operator.symbol() + "=", Token.binaryAssign(operator)));
            }
        }
        staticPatterns.sort(Comparator.comparingInt((StaticPattern sp) -> sp.pattern.length()).reversed());
        patterns.addAll(staticPatterns);
    }

    public Tokens tokenize(String programString) {
        var source = new Source(programString);
        var tokens = new Tokens.Builder();

        int index = 0;
        while (index < programString.length()) {
            boolean gotMatch = false;
            for (var pattern : patterns) {
                var result = pattern.match(source, index);
                if (result.isPresent()) {
                    var lexeme = result.get();
                    if (lexeme.token().isPresent()) {
                        var token = lexeme.token().get();
                        boolean repeatedNewline = token.equals(Token.NEWLINE)
                            && tokens.last().filter(Token.NEWLINE::equals).isPresent();
                        if (!repeatedNewline) {
                            tokens.add(token, source.position(index));
                        }
                    }
                    index = lexeme.end();
                    gotMatch = true;
                    break;
                }
            }
            if (!gotMatch) {
                throw ParseException.lexical(ErrorKind.UNEXPECTED_CHARACTER,
                    "Unexpected character '" + programString.charAt(index) + "'", source.position(index));
            }
        }

        tokens.add(Token.END_OF_MODULE, source.position(index));

        return tokens.build();
    }

    /**
     * What a pattern consumed: up to {@code end} (exclusive), emitting at most one token.
     */
    record Lexeme(Optional<Token> token, int end) {
        static Lexeme of(Token token, int end) {
            return new Lexeme(Optional.of(token), end);
        }
        static Lexeme skip(int end) {
            return new Lexeme(Optional.empty(), end);
        }
    }

    interface Pattern {
        Optional<Lexeme> match(Source source, int index);
    }

    static class Source {
        final String text;
        final int[] lineStarts;

        Source(String text) {
            this.text = text;
            List<Integer> starts = new ArrayList<>();
            starts.add(0);
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    starts.add(i + 1);
                }
            }
            this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
        }

        int length() {
            return text.length();
        }

        boolean has(int index) {
            return index < text.length();
        }

        char charAt(int index) {
            return text.charAt(index);
        }

        boolean isAt(int index, char c) {
            return has(index) && text.charAt(index) == c;
        }

        Position position(int index) {
            int line = Arrays.binarySearch(lineStarts, index);
            if (line < 0) {
                line = -line - 2;
            }
            return new Position(line + 1, index - lineStarts[line] + 1);
        }
    }

    static class StaticPattern implements Pattern {
        String pattern;
        Token token;

        public StaticPattern(String pattern, Token token) {
            this.pattern = pattern;
            this.token = token;
        }

        @Override
        public Optional<Lexeme> match(Source source, int index) {
            if (source.text.startsWith(pattern, index)) {
                return Optional.of(Lexeme.of(token, index + pattern.length()));
            } else {
                return Optional.empty();
            }
        }
    }

    static boolean isLayout(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }

    static boolean isNewline(char c) {
        return c == '\n' || c == '\r';
    }

    /**
     * Skips spaces, tabs, line breaks and {@code #} comments.
     *
     * @return the end of the skipped run and whether it contained a line break
     */
    static LayoutRun skipLayout(Source source, int index) {
        boolean sawNewline = false;
        while (source.has(index)) {
            char c = source.charAt(index);
            if (isLayout(c)) {
                sawNewline |= isNewline(c);
                index++;
            } else if (c == '#') {
                index = skipToEndOfLine(source, index);
            } else {
                break;
            }
        }
        return new LayoutRun(index, sawNewline);
    }

    record LayoutRun(int end, boolean sawNewline) {}

    static int skipToEndOfLine(Source source, int index) {
        while (source.has(index) && !isNewline(source.charAt(index))) {
            index++;
        }
        return index;
    }

    static class WhitespacePattern implements Pattern {
        @Override
        public Optional<Lexeme> match(Source source, int index) {
            if (!isLayout(source.charAt(index))) {
                return Optional.empty();
            }
            var run = skipLayout(source, index);
            if (run.sawNewline()) {
                return Optional.of(Lexeme.of(Token.NEWLINE, run.end()));
            }
            return Optional.of(Lexeme.skip(run.end()));
        }
    }

    static class LineContinuationPattern implements Pattern {
        @Override
        public Optional<Lexeme> match(Source source, int index) {
            if (source.charAt(index) != '\\') {
                return Optional.empty();
            }
            if (!source.has(index + 1) || !isNewline(source.charAt(index + 1))) {
                throw ParseException.lexical(ErrorKind.UNEXPECTED_CHARACTER,
                    "Unexpected character '\\', a backslash must be followed by a line break", source.position(index));
            }
            return Optional.of(Lexeme.skip(skipLayout(source, index + 1).end()));
        }
    }

    static class InlineCommentPattern implements Pattern {
        @Override
        public Optional<Lexeme> match(Source source, int index) {
            if (source.charAt(index) == '#') {
                return Optional.of(Lexeme.skip(skipToEndOfLine(source, index)));
            } else {
                return Optional.empty();
            }
        }
    }

    static class BlockCommentPattern implements Pattern {
        @Override
        public Optional<Lexeme> match(Source source, int index) {
            if (!source.text.startsWith("/*", index)) {
                return Optional.empty();
            }
            int close = source.text.indexOf("*/", index + 2);
            // unterminated comments swallow the rest of the input
            int end = close < 0 ? source.length() : close + 2;
            return Optional.of(Lexeme.skip(end));
        }
    }

    // digits ('_'? digits)* ('.' digits?)? ([eE] [+-]? digits)?, or the same starting at '.'
    static class NumberPattern implements Pattern {
        @Override
        public Optional<Lexeme> match(Source source, int index) {
            char first = source.charAt(index);
            boolean leadingDot = first == '.' && source.has(index + 1) && isDigit(source.charAt(index + 1));
            if (!isDigit(first) && !leadingDot) {
                return Optional.empty();
            }

            int start = index;
            var number = new StringBuilder();
            boolean isFloat = false;
            boolean isExponent = false;

            while (source.has(index)) {
                char c = source.charAt(index);
                if (isDigit(c)) {
                    number.append(c);
                } else if (c == '.') {
                    if (isFloat) {
                        throw ParseException.lexical(ErrorKind.MALFORMED_LITERAL,
                            "Unexpected extra decimal point in number literal", source.position(index));
                    }
                    isFloat = true;
                    number.append(c);
                } else if (c == 'e' || c == 'E') {
                    isFloat = true;
                    isExponent = true;
                    number.append(c);
                    index++;
                    break;
                } else if (c != '_') {
                    break;
                }
                index++;
            }

            if (isExponent) {
                if (source.isAt(index, '+') || source.isAt(index, '-')) {
                    number.append(source.charAt(index));
                    index++;
                }
                while (source.has(index) && (isDigit(source.charAt(index)) || source.charAt(index) == '_')) {
                    if (source.charAt(index) != '_') {
                        number.append(source.charAt(index));
                    }
                    index++;
                }
            }

            Token token;
            try {
                if (isFloat) {
                    token = Token.literal(new FloatLiteral(Double.parseDouble(number.toString())));
                } else {
                    token = Token.integer(Long.parseLong(number.toString()));
                }
            } catch (NumberFormatException e) {
                throw ParseException.lexical(ErrorKind.MALFORMED_LITERAL,
                    "Malformed number literal '" + source.text.substring(start, index) + "'", source.position(start));
            }
            return Optional.of(Lexeme.of(token, index));
        }

        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }
    }

    /**
     * Decodes the escape whose letter is at {@code index} (the backslash is before it).
     */
    static char escapedChar(Source source, int index) {
        if (!source.has(index)) {
            throw ParseException.lexical(ErrorKind.UNTERMINATED_LITERAL,
                "Unexpected end of input in escape sequence", source.position(index));
        }
        return switch (source.charAt(index)) {
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            case '\'' -> '\'';
            case '"' -> '"';
            case '\\' -> '\\';
            case '0' -> '\0';
            default -> throw ParseException.lexical(ErrorKind.MALFORMED_LITERAL,
                "Unrecognised escape sequence '\\" + source.charAt(index) + "'", source.position(index - 1));
        };
    }

    static class CharPattern implements Pattern {
        @Override
        public Optional<Lexeme> match(Source source, int index) {
            if (source.charAt(index) != '\'') {
                return Optional.empty();
            }
            int start = index;
            index++;
            if (!source.has(index)) {
                throw unterminated(source, start);
            }

            char value = source.charAt(index);
            if (value == '\'') {
                throw ParseException.lexical(ErrorKind.MALFORMED_LITERAL, "Empty character literal", source.position(start));
            }
            if (value == '\\') {
                value = escapedChar(source, index + 1);
                index += 2;
            } else {
                index++;
            }

            if (!source.has(index)) {
                throw unterminated(source, start);
            }
            if (source.charAt(index) != '\'') {
                throw ParseException.lexical(ErrorKind.MALFORMED_LITERAL,
                    "Character literal must contain exactly one character", source.position(start));
            }
            return Optional.of(Lexeme.of(Token.literal(new CharLiteral(value)), index + 1));
        }

        private static ParseException unterminated(Source source, int start) {
            return ParseException.lexical(ErrorKind.UNTERMINATED_LITERAL, "Unterminated character literal", source.position(start));
        }
    }

    static class StringPattern implements Pattern {
        @Override
        public Optional<Lexeme> match(Source source, int index) {
            if (source.charAt(index) != '"') {
                return Optional.empty();
            }
            int start = index;
            index++;
            var string = new StringBuilder();
            while (true) {
                if (!source.has(index)) {
                    throw ParseException.lexical(ErrorKind.UNTERMINATED_LITERAL,
                        "Unterminated string literal", source.position(start));
                }
                char cur = source.charAt(index);
                if (cur == '"') {
                    break;
                }
                if (cur == '\\') {
                    string.append(escapedChar(source, index + 1));
                    index += 2;
                } else {
                    string.append(cur);
                    index++;
                }
            }
            return Optional.of(Lexeme.of(Token.literal(new StringLiteral(string.toString())), index + 1));
        }
    }

    /**
     * Identifiers, keywords and the word literals {@code true}, {@code false} and {@code None}.
     */
    static class WordPattern implements Pattern {
        @Override
        public Optional<Lexeme> match(Source source, int index) {
            if (!isWordStart(source.charAt(index))) {
                return Optional.empty();
            }
            int start = index;
            while (source.has(index) && isWordPart(source.charAt(index))) {
                index++;
            }
            var word = source.text.substring(start, index);
            return Optional.of(Lexeme.of(classify(word), index));
        }

        static Token classify(String word) {
            var keyword = Keyword.fromWord(word);
            if (keyword.isPresent()) {
                return Token.keyword(keyword.get());
            }
            var literal = Literal.fromWord(word);
            if (literal.isPresent()) {
                return Token.literal(literal.get());
            }
            return Token.identifier(word);
        }

        private static boolean isWordStart(char c) {
            return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
        }

        private static boolean isWordPart(char c) {
            return isWordStart(c) || (c >= '0' && c <= '9');
        }
    }

}
