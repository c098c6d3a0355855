package com.bhagwad.playground.compiler.ast;

public sealed interface LValue extends Expr permits Identifier, IndexAccess, FieldAccess {
}
