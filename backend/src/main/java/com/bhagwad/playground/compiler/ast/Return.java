package com.bhagwad.playground.compiler.ast;

/**
 * {@code moksha [expr]}; {@code value} is {@code null} for a bare return.
 */
public record Return(Expr value, SourcePosition position) implements Statement {
    public boolean hasValue() {
        return value != null;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }
}
