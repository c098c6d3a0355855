package com.bhagwad.playground.compiler.generator;

import com.bhagwad.playground.compiler.ast.ArrayLiteral;
import com.bhagwad.playground.compiler.ast.ArrayType;
import com.bhagwad.playground.compiler.ast.Assign;
import com.bhagwad.playground.compiler.ast.BinaryOp;
import com.bhagwad.playground.compiler.ast.BinaryOperator;
import com.bhagwad.playground.compiler.ast.Block;
import com.bhagwad.playground.compiler.ast.BooleanLiteral;
import com.bhagwad.playground.compiler.ast.Call;
import com.bhagwad.playground.compiler.ast.EntryBlock;
import com.bhagwad.playground.compiler.ast.Expr;
import com.bhagwad.playground.compiler.ast.ExprStatement;
import com.bhagwad.playground.compiler.ast.ExprVisitor;
import com.bhagwad.playground.compiler.ast.FieldAccess;
import com.bhagwad.playground.compiler.ast.FunctionDecl;
import com.bhagwad.playground.compiler.ast.Identifier;
import com.bhagwad.playground.compiler.ast.If;
import com.bhagwad.playground.compiler.ast.IndexAccess;
import com.bhagwad.playground.compiler.ast.IntegerLiteral;
import com.bhagwad.playground.compiler.ast.LoopForIn;
import com.bhagwad.playground.compiler.ast.LoopRange;
import com.bhagwad.playground.compiler.ast.LoopWhile;
import com.bhagwad.playground.compiler.ast.NamespaceDecl;
import com.bhagwad.playground.compiler.ast.Param;
import com.bhagwad.playground.compiler.ast.Print;
import com.bhagwad.playground.compiler.ast.Program;
import com.bhagwad.playground.compiler.ast.Return;
import com.bhagwad.playground.compiler.ast.ScalarType;
import com.bhagwad.playground.compiler.ast.Statement;
import com.bhagwad.playground.compiler.ast.StatementVisitor;
import com.bhagwad.playground.compiler.ast.StringLiteral;
import com.bhagwad.playground.compiler.ast.TopLevelDecl;
import com.bhagwad.playground.compiler.ast.TopLevelVisitor;
import com.bhagwad.playground.compiler.ast.TryCatch;
import com.bhagwad.playground.compiler.ast.Type;
import com.bhagwad.playground.compiler.ast.UnaryOp;
import com.bhagwad.playground.compiler.ast.VarDecl;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a checked program as a standalone Python 3 module. Python has no block scope, so a
 * local that would shadow a visible binding gets a fresh internal name.
 */
public final class PythonGenerator {

    static final String HEADER = "#!/usr/bin/env python3";
    static final String GENERATED_NOTICE = "# Generated by the Bhagwad compiler. Do not edit.";

    public String generate(Program program) {
        return new Emitter(program).emit();
    }

    static String hint(Type type) {
        if (type instanceof ScalarType scalar) {
            return switch (scalar.guna()) {
                case SATTVA -> "int";
                case RAJAS -> "str";
                case TAMAS -> "bool";
            };
        }
        if (type instanceof ArrayType) {
            return "list";
        }
        // named types are opaque
        return null;
    }

    static String defaultValue(Type type) {
        if (type instanceof ScalarType scalar) {
            return switch (scalar.guna()) {
                case SATTVA -> "0";
                case RAJAS -> "\"\"";
                case TAMAS -> "False";
            };
        }
        if (type instanceof ArrayType) {
            return "[]";
        }
        return "None";
    }

    static String stringLiteral(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    private static final class Emitter implements TopLevelVisitor<Void>, StatementVisitor<Void>, ExprVisitor<String> {

        private final Program program;
        private final PythonWriter out = new PythonWriter();
        private final Bindings globals = new Bindings(null);
        private final Map<String, Map<String, Bindings.Binding>> namespaceMembers = new HashMap<>();
        private final TypeInference types = new TypeInference(namespaceMembers);

        private Bindings scope = globals;
        private int serial;
        private boolean hasEntry;

        Emitter(Program program) {
            this.program = program;
        }

        String emit() {
            indexDeclarations();

            out.line(HEADER);
            out.line(GENERATED_NOTICE);
            for (TopLevelDecl decl : program.declarations()) {
                out.blankLine().blankLine();
                decl.accept(this);
            }
            if (hasEntry) {
                out.blankLine().blankLine();
                out.line("if __name__ == \"__main__\":");
                out.indent();
                out.line(PythonNames.ENTRY_FUNCTION + "()");
                out.dedent();
            }
            return out.toString();
        }

        // functions and namespaces are hoisted
        private void indexDeclarations() {
            for (TopLevelDecl decl : program.declarations()) {
                if (decl instanceof FunctionDecl function) {
                    globals.define(function.name(), functionBinding(function));
                } else if (decl instanceof NamespaceDecl namespace) {
                    globals.define(namespace.name(), new Bindings.Binding(
                            PythonNames.escape(namespace.name()), null, Bindings.Kind.NAMESPACE));
                    Map<String, Bindings.Binding> members = new LinkedHashMap<>();
                    for (FunctionDecl member : namespace.members()) {
                        Bindings.Binding binding = functionBinding(member);
                        members.put(member.name(), binding);
                        globals.define(member.name(), binding);
                    }
                    namespaceMembers.put(namespace.name(), members);
                }
            }
        }

        private static Bindings.Binding functionBinding(FunctionDecl function) {
            return new Bindings.Binding(PythonNames.escape(function.name()), function.returnType(), Bindings.Kind.FUNCTION);
        }

        // top level

        @Override
        public Void visitNamespace(NamespaceDecl namespace) {
            String className = PythonNames.escape(namespace.name());
            out.line("class " + className + ":");
            out.indent();
            if (namespace.members().isEmpty()) {
                out.line("pass");
            }
            boolean first = true;
            for (FunctionDecl member : namespace.members()) {
                if (!first) {
                    out.blankLine();
                }
                first = false;
                out.line("@staticmethod");
                emitFunction(member);
            }
            out.dedent();

            if (!namespace.members().isEmpty()) {
                out.blankLine().blankLine();
                for (FunctionDecl member : namespace.members()) {
                    String alias = PythonNames.escape(member.name());
                    out.line(alias + " = " + className + "." + alias);
                }
            }
            return null;
        }

        @Override
        public Void visitFunction(FunctionDecl function) {
            emitFunction(function);
            return null;
        }

        @Override
        public Void visitEntry(EntryBlock entry) {
            hasEntry = true;
            out.line("def " + PythonNames.ENTRY_FUNCTION + "():");
            emitBlock(entry.body(), globals.child());
            return null;
        }

        private void emitFunction(FunctionDecl function) {
            Bindings params = globals.child();
            Bindings saved = scope;
            scope = params;

            List<String> rendered = new ArrayList<>();
            for (Param param : function.params()) {
                String name = declareLocal(param.name(), param.type());
                String hint = hint(param.type());
                rendered.add(hint == null ? name : name + ": " + hint);
            }

            StringBuilder header = new StringBuilder("def ")
                    .append(PythonNames.escape(function.name()))
                    .append('(').append(String.join(", ", rendered)).append(')');
            String returnHint = function.hasReturnType() ? hint(function.returnType()) : "None";
            if (returnHint != null) {
                header.append(" -> ").append(returnHint);
            }
            out.line(header.append(':').toString());

            emitBlock(function.body(), params.child());
            scope = saved;
        }

        // statements

        private void emitBlock(Block block, Bindings blockScope) {
            Bindings saved = scope;
            scope = blockScope;
            out.indent();
            if (block.isEmpty()) {
                out.line("pass");
            }
            for (Statement statement : block.statements()) {
                statement.accept(this);
            }
            out.dedent();
            scope = saved;
        }

        private String declareLocal(String sourceName, Type type) {
            String pythonName = scope.resolve(sourceName) == null
                    ? PythonNames.escape(sourceName)
                    : PythonNames.internal(sourceName, ++serial);
            scope.define(sourceName, new Bindings.Binding(pythonName, type, Bindings.Kind.VALUE));
            return pythonName;
        }

        @Override
        public Void visitVarDecl(VarDecl decl) {
            String value;
            Type type = decl.declaredType();
            if (decl.init() != null) {
                value = expr(decl.init());
                if (type == null) {
                    type = types.infer(decl.init(), scope);
                }
            } else {
                value = defaultValue(type);
            }
            // the initializer is rendered first: it still sees the binding being shadowed
            String name = declareLocal(decl.name(), type);
            out.line(name + " = " + value);
            return null;
        }

        @Override
        public Void visitAssign(Assign assign) {
            out.line(expr(assign.target()) + " = " + expr(assign.value()));
            return null;
        }

        @Override
        public Void visitIf(If stmt) {
            out.line("if " + expr(stmt.condition()) + ":");
            emitBlock(stmt.thenBlock(), scope.child());
            if (stmt.elseBlock() != null) {
                out.line("else:");
                emitBlock(stmt.elseBlock(), scope.child());
            }
            return null;
        }

        @Override
        public Void visitLoopRange(LoopRange loop) {
            String from = expr(loop.from());
            String to = expr(loop.to());
            Bindings body = scope.child();
            Bindings saved = scope;
            scope = body;
            String variable = declareLocal(loop.variable(), ScalarType.SATTVA);
            scope = saved;
            // both bounds are inclusive
            out.line("for " + variable + " in range(" + from + ", " + to + " + 1):");
            emitBlock(loop.body(), body);
            return null;
        }

        @Override
        public Void visitLoopWhile(LoopWhile loop) {
            out.line("while " + expr(loop.condition()) + ":");
            emitBlock(loop.body(), scope.child());
            return null;
        }

        @Override
        public Void visitLoopForIn(LoopForIn loop) {
            String iterable = expr(loop.iterable());
            Type element = TypeInference.elementOf(types.infer(loop.iterable(), scope));
            Bindings body = scope.child();
            Bindings saved = scope;
            scope = body;
            String variable = declareLocal(loop.variable(), element);
            scope = saved;
            out.line("for " + variable + " in " + iterable + ":");
            emitBlock(loop.body(), body);
            return null;
        }

        @Override
        public Void visitPrint(Print print) {
            out.line("print(" + expr(print.expr()) + ")");
            return null;
        }

        @Override
        public Void visitReturn(Return ret) {
            out.line(ret.hasValue() ? "return " + expr(ret.value()) : "return");
            return null;
        }

        @Override
        public Void visitTryCatch(TryCatch tryCatch) {
            out.line("try:");
            emitBlock(tryCatch.tryBlock(), scope.child());

            String caught = PythonNames.internal("error", ++serial);
            out.line("except Exception as " + caught + ":");
            Bindings handler = scope.child();
            Bindings saved = scope;
            scope = handler;
            out.indent();
            out.line(declareLocal(tryCatch.errorName(), ScalarType.RAJAS) + " = str(" + caught + ")");
            for (Statement statement : tryCatch.catchBlock().statements()) {
                statement.accept(this);
            }
            out.dedent();
            scope = saved;
            return null;
        }

        @Override
        public Void visitExprStatement(ExprStatement stmt) {
            out.line(expr(stmt.expr()));
            return null;
        }

        // expressions

        private String expr(Expr expr) {
            return expr.accept(this);
        }

        @Override
        public String visitInteger(IntegerLiteral literal) {
            return literal.value().toString();
        }

        @Override
        public String visitString(StringLiteral literal) {
            return stringLiteral(literal.value());
        }

        @Override
        public String visitBoolean(BooleanLiteral literal) {
            return literal.value() ? "True" : "False";
        }

        @Override
        public String visitIdentifier(Identifier identifier) {
            Bindings.Binding binding = scope.resolve(identifier.name());
            if (binding == null) {
                throw new IllegalStateException("unresolved identifier '" + identifier.name() + "' reached the generator");
            }
            return binding.pythonName();
        }

        @Override
        public String visitBinary(BinaryOp binary) {
            String left = expr(binary.left());
            String right = expr(binary.right());
            if (binary.operator() == BinaryOperator.ADD) {
                Type leftType = types.infer(binary.left(), scope);
                Type rightType = types.infer(binary.right(), scope);
                if (TypeInference.isText(leftType) || TypeInference.isText(rightType)) {
                    left = TypeInference.isText(leftType) ? left : "str(" + left + ")";
                    right = TypeInference.isText(rightType) ? right : "str(" + right + ")";
                }
            }
            return "(" + left + " " + pythonOperator(binary.operator()) + " " + right + ")";
        }

        private static String pythonOperator(BinaryOperator operator) {
            return switch (operator) {
                case AND -> "and";
                case OR -> "or";
                default -> operator.symbol();
            };
        }

        @Override
        public String visitUnary(UnaryOp unary) {
            return switch (unary.operator()) {
                case NEGATE -> "(-" + expr(unary.operand()) + ")";
                case NOT -> "(not " + expr(unary.operand()) + ")";
            };
        }

        @Override
        public String visitCall(Call call) {
            String args = call.args().stream()
                    .map(this::expr)
                    .collect(Collectors.joining(", "));
            return expr(call.callee()) + "(" + args + ")";
        }

        @Override
        public String visitIndex(IndexAccess index) {
            return expr(index.base()) + "[" + expr(index.index()) + "]";
        }

        @Override
        public String visitField(FieldAccess field) {
            if (field.base() instanceof Identifier id) {
                Bindings.Binding base = scope.resolve(id.name());
                if (base != null && base.kind() == Bindings.Kind.NAMESPACE) {
                    return base.pythonName() + "." + PythonNames.escape(field.field());
                }
            }
            if (field.isLength()) {
                return "len(" + expr(field.base()) + ")";
            }
            return expr(field.base()) + "." + PythonNames.escape(field.field());
        }

        @Override
        public String visitArray(ArrayLiteral array) {
            return array.elements().stream()
                    .map(this::expr)
                    .collect(Collectors.joining(", ", "[", "]"));
        }
    }
}
