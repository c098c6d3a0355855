package com.bhagwad.playground.exception;

public enum SemanticErrorKind {
    CONSTANT_REASSIGNMENT,
    INVALID_ASSIGNMENT,
    DUPLICATE_FUNCTION,
    DUPLICATE_PARAMETER,
    DUPLICATE_DECLARATION,
    UNRESOLVED_IDENTIFIER,
    UNEXPECTED_RETURN_VALUE,
    MISSING_RETURN_VALUE,
    DUPLICATE_ENTRY,
    MISSING_ENTRY
}
