package com.bhagwad.playground.compiler.ast;

public interface StatementVisitor<R> {
    R visitVarDecl(VarDecl decl);

    R visitAssign(Assign assign);

    R visitIf(If stmt);

    R visitLoopRange(LoopRange loop);

    R visitLoopWhile(LoopWhile loop);

    R visitLoopForIn(LoopForIn loop);

    R visitPrint(Print print);

    R visitReturn(Return ret);

    R visitTryCatch(TryCatch tryCatch);

    R visitExprStatement(ExprStatement stmt);
}
