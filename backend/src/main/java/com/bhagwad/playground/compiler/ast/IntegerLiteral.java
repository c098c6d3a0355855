package com.bhagwad.playground.compiler.ast;

import java.math.BigInteger;

public record IntegerLiteral(BigInteger value, SourcePosition position) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitInteger(this);
    }
}
