package com.github.sheeppig;

/**
 * 1-based line and column of a character in the source text. {@link #UNKNOWN} is used for
 * tokens that were not produced from source, e.g. in hand-built token lists.
 */
public record Position(int line, int column) {

    public static final Position UNKNOWN = new Position(0, 0);

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public String toString() {
        return isKnown() ? line + ":" + column : "?";
    }
}
