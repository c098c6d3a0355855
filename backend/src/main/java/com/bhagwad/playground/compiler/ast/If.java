package com.bhagwad.playground.compiler.ast;

public record If(Expr condition, Block thenBlock, Block elseBlock, SourcePosition position) implements Statement {
    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
