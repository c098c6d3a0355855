package com.bhagwad.playground.exception;

public class DuplicateEntryException extends SemanticException {

    public DuplicateEntryException(int line, int column) {
        super(SemanticErrorKind.DUPLICATE_ENTRY,
                "a program may contain only one 'arjuna' entry block", line, column);
    }
}
