package com.bhagwad.playground.exception;

/**
 * The generated program could not be run by the host interpreter.
 */
public class ExecutionException extends Exception {

    public ExecutionException(String message) {
        super(message);
    }

    public ExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
