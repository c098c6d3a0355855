package com.bhagwad.playground.compiler.ast;

public record Assign(LValue target, Expr value, SourcePosition position) implements Statement {
    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitAssign(this);
    }
}
