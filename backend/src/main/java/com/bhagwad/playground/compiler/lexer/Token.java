package com.bhagwad.playground.compiler.lexer;

/**
 * Positions are 1-based. For string literals the lexeme is the decoded text.
 */
public record Token(TokenKind kind, String lexeme, int line, int column, int width) {

    public boolean is(TokenKind other) {
        return kind == other;
    }

    public String describe() {
        return switch (kind) {
            case EOF -> "end of input";
            case IDENTIFIER -> "identifier '" + lexeme + "'";
            case INTEGER -> "integer " + lexeme;
            case STRING -> "string \"" + lexeme + "\"";
            default -> "'" + lexeme + "'";
        };
    }
}
