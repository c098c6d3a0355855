package com.bhagwad.playground.compiler.lexer;

public enum TokenKind {
    // keywords
    SHLOKA("'shloka'", TokenCategory.KEYWORD),
    DHARMA("'dharma'", TokenCategory.KEYWORD),
    ADHARMA("'adharma'", TokenCategory.KEYWORD),
    KARMA("'karma'", TokenCategory.KEYWORD),
    ARJUNA("'arjuna'", TokenCategory.KEYWORD),
    MANIFEST("'manifest'", TokenCategory.KEYWORD),
    MOKSHA("'moksha'", TokenCategory.KEYWORD),
    MAYA("'maya'", TokenCategory.KEYWORD),
    SANKALPA("'sankalpa'", TokenCategory.KEYWORD),
    YUGA("'yuga'", TokenCategory.KEYWORD),
    MEDITATION("'meditation'", TokenCategory.KEYWORD),
    DISTURBANCE("'disturbance'", TokenCategory.KEYWORD),
    FROM("'from'", TokenCategory.KEYWORD),
    TO("'to'", TokenCategory.KEYWORD),
    IN("'in'", TokenCategory.KEYWORD),
    WHILE("'while'", TokenCategory.KEYWORD),

    // type keywords (the three gunas and the array prefix)
    SATTVA("'sattva'", TokenCategory.TYPE_KEYWORD),
    RAJAS("'rajas'", TokenCategory.TYPE_KEYWORD),
    TAMAS("'tamas'", TokenCategory.TYPE_KEYWORD),
    COSMIC("'cosmic'", TokenCategory.TYPE_KEYWORD),

    // literals and names
    BOOLEAN("boolean literal", TokenCategory.LITERAL),
    INTEGER("integer literal", TokenCategory.LITERAL),
    STRING("string literal", TokenCategory.LITERAL),
    IDENTIFIER("identifier", TokenCategory.IDENTIFIER),

    // operators
    PLUS("'+'", TokenCategory.OPERATOR),
    MINUS("'-'", TokenCategory.OPERATOR),
    STAR("'*'", TokenCategory.OPERATOR),
    SLASH("'/'", TokenCategory.OPERATOR),
    PERCENT("'%'", TokenCategory.OPERATOR),
    EQUAL_EQUAL("'=='", TokenCategory.OPERATOR),
    BANG_EQUAL("'!='", TokenCategory.OPERATOR),
    LESS("'<'", TokenCategory.OPERATOR),
    GREATER("'>'", TokenCategory.OPERATOR),
    LESS_EQUAL("'<='", TokenCategory.OPERATOR),
    GREATER_EQUAL("'>='", TokenCategory.OPERATOR),
    AND_AND("'&&'", TokenCategory.OPERATOR),
    OR_OR("'||'", TokenCategory.OPERATOR),
    BANG("'!'", TokenCategory.OPERATOR),
    ASSIGN("'='", TokenCategory.OPERATOR),
    ARROW("'->'", TokenCategory.OPERATOR),
    DOT("'.'", TokenCategory.OPERATOR),

    // punctuation
    LEFT_PAREN("'('", TokenCategory.PUNCTUATION),
    RIGHT_PAREN("')'", TokenCategory.PUNCTUATION),
    LEFT_BRACE("'{'", TokenCategory.PUNCTUATION),
    RIGHT_BRACE("'}'", TokenCategory.PUNCTUATION),
    LEFT_BRACKET("'['", TokenCategory.PUNCTUATION),
    RIGHT_BRACKET("']'", TokenCategory.PUNCTUATION),
    COMMA("','", TokenCategory.PUNCTUATION),
    SEMICOLON("';'", TokenCategory.PUNCTUATION),

    EOF("end of input", TokenCategory.END);

    private final String display;
    private final TokenCategory category;

    TokenKind(String display, TokenCategory category) {
        this.display = display;
        this.category = category;
    }

    public String display() {
        return display;
    }

    public TokenCategory category() {
        return category;
    }
}
