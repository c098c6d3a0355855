package com.bhagwad.playground.exception;

public class MissingEntryException extends SemanticException {

    public MissingEntryException(int line, int column) {
        super(SemanticErrorKind.MISSING_ENTRY,
                "program has no 'arjuna' entry block", line, column);
    }
}
