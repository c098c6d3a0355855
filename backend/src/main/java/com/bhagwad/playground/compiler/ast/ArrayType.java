package com.bhagwad.playground.compiler.ast;

public record ArrayType(Type elementType, int dims) implements Type {
    public ArrayType {
        if (dims < 1) {
            throw new IllegalArgumentException("array type needs at least one dimension");
        }
        if (elementType instanceof ArrayType) {
            throw new IllegalArgumentException("element type must not itself be an array type");
        }
    }

    public Type indexed() {
        return dims == 1 ? elementType : new ArrayType(elementType, dims - 1);
    }

    @Override
    public String describe() {
        return "cosmic " + elementType.describe() + "[]".repeat(dims);
    }
}
