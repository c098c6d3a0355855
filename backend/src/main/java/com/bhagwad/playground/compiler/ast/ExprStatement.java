package com.bhagwad.playground.compiler.ast;

public record ExprStatement(Expr expr, SourcePosition position) implements Statement {
    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitExprStatement(this);
    }
}
