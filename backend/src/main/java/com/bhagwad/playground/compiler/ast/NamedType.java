package com.bhagwad.playground.compiler.ast;

public record NamedType(String name) implements Type {
    @Override
    public String describe() {
        return name;
    }
}
