package com.bhagwad.playground.compiler.ast;

public enum Guna {
    SATTVA,
    RAJAS,
    TAMAS
}
