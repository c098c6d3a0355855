package com.bhagwad.playground.compiler.ast;

public record EntryBlock(Block body, SourcePosition position) implements TopLevelDecl {
    @Override
    public <R> R accept(TopLevelVisitor<R> visitor) {
        return visitor.visitEntry(this);
    }
}
