package com.github.sheeppig;

public enum ErrorKind {
    UNEXPECTED_CHARACTER(Phase.LEXICAL),
    MALFORMED_LITERAL(Phase.LEXICAL),
    UNTERMINATED_LITERAL(Phase.LEXICAL),

    EXPECTED_TOKEN(Phase.SYNTACTIC),
    UNEXPECTED_TOKEN(Phase.SYNTACTIC),
    UNEXPECTED_END_OF_INPUT(Phase.SYNTACTIC),
    INVALID_REFERENCE(Phase.SYNTACTIC),
    MISPLACED_DECLARATION(Phase.SYNTACTIC),
    UNSUPPORTED(Phase.SYNTACTIC);

    public enum Phase {
        LEXICAL, SYNTACTIC
    }

    final Phase phase;

    private ErrorKind(Phase phase) {
        this.phase = phase;
    }

    public Phase phase() {
        return phase;
    }
}
