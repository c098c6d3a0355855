package com.bhagwad.playground.compiler.ast;

public record UnaryOp(UnaryOperator operator, Expr operand, SourcePosition position) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }
}
