package com.bhagwad.playground.compiler.ast;

public interface ExprVisitor<R> {
    R visitInteger(IntegerLiteral literal);

    R visitString(StringLiteral literal);

    R visitBoolean(BooleanLiteral literal);

    R visitIdentifier(Identifier identifier);

    R visitBinary(BinaryOp binary);

    R visitUnary(UnaryOp unary);

    R visitCall(Call call);

    R visitIndex(IndexAccess index);

    R visitField(FieldAccess field);

    R visitArray(ArrayLiteral array);
}
