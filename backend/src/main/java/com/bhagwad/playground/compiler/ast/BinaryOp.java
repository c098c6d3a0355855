package com.bhagwad.playground.compiler.ast;

public record BinaryOp(BinaryOperator operator, Expr left, Expr right, SourcePosition position) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}
