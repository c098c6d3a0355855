package com.bhagwad.playground.compiler.ast;

public record LoopForIn(String variable, Expr iterable, Block body, SourcePosition position) implements Statement {
    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitLoopForIn(this);
    }
}
