package com.bhagwad.playground.compiler.ast;

public sealed interface Statement
        permits VarDecl, Assign, If, LoopRange, LoopWhile, LoopForIn, Print, Return, TryCatch, ExprStatement {
    SourcePosition position();

    <R> R accept(StatementVisitor<R> visitor);
}
