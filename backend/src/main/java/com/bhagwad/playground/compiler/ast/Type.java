package com.bhagwad.playground.compiler.ast;

public sealed interface Type permits ScalarType, ArrayType, NamedType {
    String describe();
}
