package com.bhagwad.playground.compiler.ast;

public record IndexAccess(Expr base, Expr index, SourcePosition position) implements LValue {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitIndex(this);
    }
}
