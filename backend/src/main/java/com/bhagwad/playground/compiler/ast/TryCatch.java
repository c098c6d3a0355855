package com.bhagwad.playground.compiler.ast;

/**
 * {@code meditation { ... } disturbance (err) { ... }}. Inside the catch block {@code errorName}
 * is bound to the error's text.
 */
public record TryCatch(Block tryBlock, String errorName, Block catchBlock, SourcePosition position)
        implements Statement {
    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitTryCatch(this);
    }
}
