package com.bhagwad.playground.exception;

/**
 * Base of every error a Bhagwad compilation can report. Carries the 1-based source position
 * of the offending construct so callers can point at it.
 */
public class CompilationException extends Exception {

    private final int line;
    private final int column;

    public CompilationException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public CompilationException(String message, int line, int column, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Message prefixed with the source position, the way it is shown to users.
     */
    public String describe() {
        return "line " + line + ", column " + column + ": " + getMessage();
    }
}
