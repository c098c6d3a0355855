package com.bhagwad.playground.compiler.ast;

public sealed interface Expr
        permits IntegerLiteral, StringLiteral, BooleanLiteral, BinaryOp, UnaryOp, Call, ArrayLiteral, LValue {
    SourcePosition position();

    <R> R accept(ExprVisitor<R> visitor);
}
