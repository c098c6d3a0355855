package com.bhagwad.playground.compiler.ast;

public record BooleanLiteral(boolean value, SourcePosition position) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBoolean(this);
    }
}
