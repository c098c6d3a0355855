package com.bhagwad.playground.compiler.ast;

import java.util.List;

public record Call(Expr callee, List<Expr> args, SourcePosition position) implements Expr {
    public Call {
        args = List.copyOf(args);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
