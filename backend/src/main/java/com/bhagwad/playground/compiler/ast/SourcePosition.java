package com.bhagwad.playground.compiler.ast;

public record SourcePosition(int line, int column) {
    public static final SourcePosition NONE = new SourcePosition(0, 0);
}
