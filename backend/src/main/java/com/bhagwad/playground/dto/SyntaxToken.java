package com.bhagwad.playground.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One highlighted token. Positions are 1-based; the end column is exclusive.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyntaxToken(
    int startLine,
    int startColumn,
    int endLine,
    int endColumn,
    TokenType tokenType,
    String value,
    String semanticInfo
) {
    public enum TokenType {
        KEYWORD,
        BUILT_IN_TYPE,
        BOOLEAN_LITERAL,
        NUMBER_LITERAL,
        STRING_LITERAL,
        IDENTIFIER,
        USER_FUNCTION,
        USER_NAMESPACE,
        USER_VARIABLE,
        USER_CONSTANT,
        PARAMETER,
        OPERATOR,
        PUNCTUATION
    }

    public SyntaxToken withType(TokenType type, String info) {
        return new SyntaxToken(startLine, startColumn, endLine, endColumn, type, value, info);
    }
}
