package com.bhagwad.playground.compiler.generator;

import com.bhagwad.playground.compiler.ast.Type;

import java.util.HashMap;
import java.util.Map;

final class Bindings {

    enum Kind {
        VALUE,
        FUNCTION,
        NAMESPACE
    }

    record Binding(String pythonName, Type type, Kind kind) {
    }

    private final Bindings parent;
    private final Map<String, Binding> names = new HashMap<>();

    Bindings(Bindings parent) {
        this.parent = parent;
    }

    Bindings child() {
        return new Bindings(this);
    }

    Binding resolve(String name) {
        for (Bindings b = this; b != null; b = b.parent) {
            Binding binding = b.names.get(name);
            if (binding != null) {
                return binding;
            }
        }
        return null;
    }

    void define(String name, Binding binding) {
        names.put(name, binding);
    }
}
