package com.bhagwad.playground.compiler.ast;

public record Print(Expr expr, SourcePosition position) implements Statement {
    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitPrint(this);
    }
}
