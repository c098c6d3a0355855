package com.bhagwad.playground.compiler.ast;

public record LoopWhile(Expr condition, Block body, SourcePosition position) implements Statement {
    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitLoopWhile(this);
    }
}
