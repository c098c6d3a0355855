package com.bhagwad.playground.exception;

/**
 * A syntactically valid program that breaks one of the language's static rules.
 */
public class SemanticException extends CompilationException {

    private final SemanticErrorKind kind;

    public SemanticException(SemanticErrorKind kind, String message, int line, int column) {
        super(message, line, column);
        this.kind = kind;
    }

    public SemanticErrorKind getKind() {
        return kind;
    }
}
