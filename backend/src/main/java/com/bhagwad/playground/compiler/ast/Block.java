package com.bhagwad.playground.compiler.ast;

import java.util.List;

public record Block(List<Statement> statements, SourcePosition position) {
    public Block {
        statements = List.copyOf(statements);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }
}
