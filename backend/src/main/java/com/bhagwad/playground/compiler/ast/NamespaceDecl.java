package com.bhagwad.playground.compiler.ast;

import java.util.List;

public record NamespaceDecl(String name, List<FunctionDecl> members, SourcePosition position) implements TopLevelDecl {
    public NamespaceDecl {
        members = List.copyOf(members);
    }

    @Override
    public <R> R accept(TopLevelVisitor<R> visitor) {
        return visitor.visitNamespace(this);
    }
}
