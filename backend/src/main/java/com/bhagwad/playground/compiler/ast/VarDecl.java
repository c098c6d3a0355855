package com.bhagwad.playground.compiler.ast;

public record VarDecl(String name, Type declaredType, Expr init, boolean constant, SourcePosition position)
        implements Statement {
    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitVarDecl(this);
    }
}
