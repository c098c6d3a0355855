package com.bhagwad.playground.compiler.generator;

import com.bhagwad.playground.compiler.ast.ArrayLiteral;
import com.bhagwad.playground.compiler.ast.ArrayType;
import com.bhagwad.playground.compiler.ast.BinaryOp;
import com.bhagwad.playground.compiler.ast.BooleanLiteral;
import com.bhagwad.playground.compiler.ast.Call;
import com.bhagwad.playground.compiler.ast.Expr;
import com.bhagwad.playground.compiler.ast.ExprVisitor;
import com.bhagwad.playground.compiler.ast.FieldAccess;
import com.bhagwad.playground.compiler.ast.Identifier;
import com.bhagwad.playground.compiler.ast.IndexAccess;
import com.bhagwad.playground.compiler.ast.IntegerLiteral;
import com.bhagwad.playground.compiler.ast.ScalarType;
import com.bhagwad.playground.compiler.ast.StringLiteral;
import com.bhagwad.playground.compiler.ast.Type;
import com.bhagwad.playground.compiler.ast.UnaryOp;

import java.util.Map;

/**
 * Best-effort static type of an expression, used to decide whether '+' concatenates text.
 * Returns {@code null} when the type cannot be known without running the program.
 */
final class TypeInference {

    private final Map<String, Map<String, Bindings.Binding>> namespaceMembers;

    TypeInference(Map<String, Map<String, Bindings.Binding>> namespaceMembers) {
        this.namespaceMembers = namespaceMembers;
    }

    Type infer(Expr expr, Bindings scope) {
        return expr.accept(new Visitor(scope));
    }

    static boolean isText(Type type) {
        return ScalarType.RAJAS.equals(type);
    }

    static Type elementOf(Type type) {
        if (type instanceof ArrayType array) {
            return array.indexed();
        }
        return isText(type) ? ScalarType.RAJAS : null;
    }

    private final class Visitor implements ExprVisitor<Type> {
        private final Bindings scope;

        Visitor(Bindings scope) {
            this.scope = scope;
        }

        @Override
        public Type visitInteger(IntegerLiteral literal) {
            return ScalarType.SATTVA;
        }

        @Override
        public Type visitString(StringLiteral literal) {
            return ScalarType.RAJAS;
        }

        @Override
        public Type visitBoolean(BooleanLiteral literal) {
            return ScalarType.TAMAS;
        }

        @Override
        public Type visitIdentifier(Identifier identifier) {
            Bindings.Binding binding = scope.resolve(identifier.name());
            if (binding == null || binding.kind() != Bindings.Kind.VALUE) {
                return null;
            }
            return binding.type();
        }

        @Override
        public Type visitBinary(BinaryOp binary) {
            return switch (binary.operator()) {
                case ADD -> {
                    Type left = binary.left().accept(this);
                    Type right = binary.right().accept(this);
                    if (isText(left) || isText(right)) {
                        yield ScalarType.RAJAS;
                    }
                    yield ScalarType.SATTVA.equals(left) && ScalarType.SATTVA.equals(right) ? ScalarType.SATTVA : null;
                }
                case SUBTRACT, MULTIPLY, MODULO -> ScalarType.SATTVA;
                // true division yields a float
                case DIVIDE -> null;
                case EQUAL, NOT_EQUAL, LESS, GREATER, LESS_EQUAL, GREATER_EQUAL, AND, OR -> ScalarType.TAMAS;
            };
        }

        @Override
        public Type visitUnary(UnaryOp unary) {
            return switch (unary.operator()) {
                case NEGATE -> ScalarType.SATTVA;
                case NOT -> ScalarType.TAMAS;
            };
        }

        @Override
        public Type visitCall(Call call) {
            Bindings.Binding callee = null;
            if (call.callee() instanceof Identifier id) {
                callee = scope.resolve(id.name());
            } else if (call.callee() instanceof FieldAccess field) {
                callee = member(field);
            }
            if (callee == null || callee.kind() != Bindings.Kind.FUNCTION) {
                return null;
            }
            return callee.type();
        }

        @Override
        public Type visitIndex(IndexAccess index) {
            return elementOf(index.base().accept(this));
        }

        @Override
        public Type visitField(FieldAccess field) {
            if (member(field) != null) {
                return null;
            }
            return field.isLength() ? ScalarType.SATTVA : null;
        }

        @Override
        public Type visitArray(ArrayLiteral array) {
            for (Expr element : array.elements()) {
                Type type = element.accept(this);
                if (type instanceof ArrayType nested) {
                    return new ArrayType(nested.elementType(), nested.dims() + 1);
                }
                if (type != null) {
                    return new ArrayType(type, 1);
                }
            }
            return null;
        }

        private Bindings.Binding member(FieldAccess field) {
            if (!(field.base() instanceof Identifier id)) {
                return null;
            }
            Bindings.Binding base = scope.resolve(id.name());
            if (base == null || base.kind() != Bindings.Kind.NAMESPACE) {
                return null;
            }
            return namespaceMembers.getOrDefault(id.name(), Map.of()).get(field.field());
        }
    }
}
