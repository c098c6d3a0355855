package com.bhagwad.playground.compiler.ast;

public interface TopLevelVisitor<R> {
    R visitNamespace(NamespaceDecl namespace);

    R visitFunction(FunctionDecl function);

    R visitEntry(EntryBlock entry);
}
