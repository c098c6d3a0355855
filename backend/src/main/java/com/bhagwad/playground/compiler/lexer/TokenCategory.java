package com.bhagwad.playground.compiler.lexer;

public enum TokenCategory {
    KEYWORD,
    TYPE_KEYWORD,
    LITERAL,
    IDENTIFIER,
    OPERATOR,
    PUNCTUATION,
    END
}
