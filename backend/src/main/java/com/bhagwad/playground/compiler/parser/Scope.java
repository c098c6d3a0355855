package com.bhagwad.playground.compiler.parser;

import com.bhagwad.playground.compiler.ast.SourcePosition;

import java.util.HashMap;
import java.util.Map;

final class Scope {

    record Symbol(String name, SymbolKind kind, SourcePosition position) {
    }

    private final Scope parent;
    private final Map<String, Symbol> symbols = new HashMap<>();

    Scope(Scope parent) {
        this.parent = parent;
    }

    Scope child() {
        return new Scope(this);
    }

    Symbol lookupLocal(String name) {
        return symbols.get(name);
    }

    Symbol resolve(String name) {
        for (Scope s = this; s != null; s = s.parent) {
            Symbol symbol = s.symbols.get(name);
            if (symbol != null) {
                return symbol;
            }
        }
        return null;
    }

    void define(String name, SymbolKind kind, SourcePosition position) {
        symbols.put(name, new Symbol(name, kind, position));
    }
}
