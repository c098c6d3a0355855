package com.bhagwad.playground.compiler.ast;

import java.util.Locale;

public record ScalarType(Guna guna) implements Type {
    public static final ScalarType SATTVA = new ScalarType(Guna.SATTVA);
    public static final ScalarType RAJAS = new ScalarType(Guna.RAJAS);
    public static final ScalarType TAMAS = new ScalarType(Guna.TAMAS);

    @Override
    public String describe() {
        return guna.name().toLowerCase(Locale.ROOT);
    }
}
