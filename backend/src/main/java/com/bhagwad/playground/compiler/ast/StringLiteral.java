package com.bhagwad.playground.compiler.ast;

public record StringLiteral(String value, SourcePosition position) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitString(this);
    }
}
