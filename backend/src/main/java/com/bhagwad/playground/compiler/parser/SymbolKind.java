package com.bhagwad.playground.compiler.parser;

enum SymbolKind {
    FUNCTION,
    NAMESPACE,
    VARIABLE,
    CONSTANT,
    PARAMETER,
    LOOP_VARIABLE,
    ERROR_BINDING;

    public boolean isAssignable() {
        return this != FUNCTION && this != NAMESPACE && this != CONSTANT;
    }
}
