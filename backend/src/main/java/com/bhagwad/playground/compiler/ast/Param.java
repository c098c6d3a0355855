package com.bhagwad.playground.compiler.ast;

public record Param(Type type, String name, SourcePosition position) {
}
