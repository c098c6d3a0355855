package com.bhagwad.playground.compiler.ast;

/**
 * {@code karma i from a to b { ... }}. Both bounds are inclusive.
 */
public record LoopRange(String variable, Expr from, Expr to, Block body, SourcePosition position)
        implements Statement {
    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitLoopRange(this);
    }
}
