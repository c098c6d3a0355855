package com.bhagwad.playground.compiler.ast;

public sealed interface TopLevelDecl permits NamespaceDecl, FunctionDecl, EntryBlock {
    SourcePosition position();

    <R> R accept(TopLevelVisitor<R> visitor);
}
