package com.bhagwad.playground.compiler.ast;

public record FieldAccess(Expr base, String field, SourcePosition position) implements LValue {
    public static final String LENGTH = "length";

    public boolean isLength() {
        return LENGTH.equals(field);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitField(this);
    }
}
