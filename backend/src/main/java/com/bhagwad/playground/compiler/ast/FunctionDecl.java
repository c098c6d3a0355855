package com.bhagwad.playground.compiler.ast;

import java.util.List;

public record FunctionDecl(String name, List<Param> params, Type returnType, Block body, SourcePosition position)
        implements TopLevelDecl {
    public FunctionDecl {
        params = List.copyOf(params);
    }

    public boolean hasReturnType() {
        return returnType != null;
    }

    @Override
    public <R> R accept(TopLevelVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }
}
