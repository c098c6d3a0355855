package com.bhagwad.playground.compiler.ast;

import java.util.List;

public record ArrayLiteral(List<Expr> elements, SourcePosition position) implements Expr {
    public ArrayLiteral {
        elements = List.copyOf(elements);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitArray(this);
    }
}
