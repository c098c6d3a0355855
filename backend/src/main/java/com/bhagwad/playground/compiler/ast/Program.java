package com.bhagwad.playground.compiler.ast;

import java.util.List;

public record Program(List<TopLevelDecl> declarations) {
    public Program {
        declarations = List.copyOf(declarations);
    }
}
