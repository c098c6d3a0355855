package com.bhagwad.playground.compiler.ast;

public record Identifier(String name, SourcePosition position) implements LValue {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
