package com.bhagwad.playground.exception;

/**
 * Illegal character or unterminated string literal.
 */
public class LexException extends CompilationException {

    public LexException(String message, int line, int column) {
        super(message, line, column);
    }
}
