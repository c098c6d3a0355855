package com.bhagwad.playground.compiler.parser;

import com.bhagwad.playground.compiler.ast.ArrayLiteral;
import com.bhagwad.playground.compiler.ast.Assign;
import com.bhagwad.playground.compiler.ast.BinaryOp;
import com.bhagwad.playground.compiler.ast.Block;
import com.bhagwad.playground.compiler.ast.BooleanLiteral;
import com.bhagwad.playground.compiler.ast.Call;
import com.bhagwad.playground.compiler.ast.EntryBlock;
import com.bhagwad.playground.compiler.ast.Expr;
import com.bhagwad.playground.compiler.ast.ExprStatement;
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
import com.bhagwad.playground.compiler.ast.SourcePosition;
import com.bhagwad.playground.compiler.ast.Statement;
import com.bhagwad.playground.compiler.ast.StringLiteral;
import com.bhagwad.playground.compiler.ast.TopLevelDecl;
import com.bhagwad.playground.compiler.ast.TryCatch;
import com.bhagwad.playground.compiler.ast.UnaryOp;
import com.bhagwad.playground.compiler.ast.VarDecl;
import com.bhagwad.playground.exception.SemanticErrorKind;
import com.bhagwad.playground.exception.SemanticException;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

final class SemanticAnalyzer {

    private final Map<String, Set<String>> namespaceMembers = new HashMap<>();

    private record FunctionContext(String name, boolean returnsValue, String returnType) {
    }

    void analyze(Program program) throws SemanticException {
        Scope global = new Scope(null);

        for (TopLevelDecl decl : program.declarations()) {
            if (decl instanceof FunctionDecl function) {
                declareFunction(global, function);
            } else if (decl instanceof NamespaceDecl namespace) {
                declareNamespace(global, namespace);
            }
        }

        for (TopLevelDecl decl : program.declarations()) {
            if (decl instanceof FunctionDecl function) {
                checkFunction(global, function);
            } else if (decl instanceof NamespaceDecl namespace) {
                for (FunctionDecl member : namespace.members()) {
                    checkFunction(global, member);
                }
            } else if (decl instanceof EntryBlock entry) {
                checkBlock(entry.body(), global.child(), new FunctionContext("arjuna", false, null));
            }
        }
    }

    private void declareFunction(Scope global, FunctionDecl function) throws SemanticException {
        Scope.Symbol existing = global.lookupLocal(function.name());
        if (existing != null) {
            SemanticErrorKind kind = existing.kind() == SymbolKind.FUNCTION
                    ? SemanticErrorKind.DUPLICATE_FUNCTION
                    : SemanticErrorKind.DUPLICATE_DECLARATION;
            throw error(kind, "function '" + function.name() + "' is already declared at line "
                    + existing.position().line(), function.position());
        }
        global.define(function.name(), SymbolKind.FUNCTION, function.position());
    }

    private void declareNamespace(Scope global, NamespaceDecl namespace) throws SemanticException {
        Scope.Symbol existing = global.lookupLocal(namespace.name());
        if (existing != null) {
            throw error(SemanticErrorKind.DUPLICATE_DECLARATION, "namespace '" + namespace.name()
                    + "' collides with a declaration at line " + existing.position().line(), namespace.position());
        }
        global.define(namespace.name(), SymbolKind.NAMESPACE, namespace.position());

        Set<String> members = new HashSet<>();
        for (FunctionDecl member : namespace.members()) {
            if (!members.add(member.name())) {
                throw error(SemanticErrorKind.DUPLICATE_FUNCTION, "function '" + member.name()
                        + "' is declared twice in namespace '" + namespace.name() + "'", member.position());
            }
            // flat visibility: members share the program scope
            declareFunction(global, member);
        }
        namespaceMembers.put(namespace.name(), members);
    }

    private void checkFunction(Scope global, FunctionDecl function) throws SemanticException {
        Scope params = global.child();
        for (Param param : function.params()) {
            if (params.lookupLocal(param.name()) != null) {
                throw error(SemanticErrorKind.DUPLICATE_PARAMETER, "parameter '" + param.name()
                        + "' is declared twice in function '" + function.name() + "'", param.position());
            }
            params.define(param.name(), SymbolKind.PARAMETER, param.position());
        }
        FunctionContext context = new FunctionContext(function.name(), function.hasReturnType(),
                function.hasReturnType() ? function.returnType().describe() : null);
        checkBlock(function.body(), params.child(), context);
    }

    private void checkBlock(Block block, Scope scope, FunctionContext context) throws SemanticException {
        for (Statement statement : block.statements()) {
            checkStatement(statement, scope, context);
        }
    }

    private void checkStatement(Statement statement, Scope scope, FunctionContext context) throws SemanticException {
        if (statement instanceof VarDecl decl) {
            if (decl.init() != null) {
                checkExpr(decl.init(), scope);
            }
            declareLocal(scope, decl.name(), decl.constant() ? SymbolKind.CONSTANT : SymbolKind.VARIABLE,
                    decl.position());
        } else if (statement instanceof Assign assign) {
            checkAssignTarget(assign, scope);
            checkExpr(assign.value(), scope);
        } else if (statement instanceof If ifStmt) {
            checkExpr(ifStmt.condition(), scope);
            checkBlock(ifStmt.thenBlock(), scope.child(), context);
            if (ifStmt.elseBlock() != null) {
                checkBlock(ifStmt.elseBlock(), scope.child(), context);
            }
        } else if (statement instanceof LoopRange loop) {
            checkExpr(loop.from(), scope);
            checkExpr(loop.to(), scope);
            Scope body = scope.child();
            body.define(loop.variable(), SymbolKind.LOOP_VARIABLE, loop.position());
            checkBlock(loop.body(), body, context);
        } else if (statement instanceof LoopWhile loop) {
            checkExpr(loop.condition(), scope);
            checkBlock(loop.body(), scope.child(), context);
        } else if (statement instanceof LoopForIn loop) {
            checkExpr(loop.iterable(), scope);
            Scope body = scope.child();
            body.define(loop.variable(), SymbolKind.LOOP_VARIABLE, loop.position());
            checkBlock(loop.body(), body, context);
        } else if (statement instanceof Print print) {
            checkExpr(print.expr(), scope);
        } else if (statement instanceof Return ret) {
            checkReturn(ret, scope, context);
        } else if (statement instanceof TryCatch tryCatch) {
            checkBlock(tryCatch.tryBlock(), scope.child(), context);
            Scope handler = scope.child();
            handler.define(tryCatch.errorName(), SymbolKind.ERROR_BINDING, tryCatch.position());
            checkBlock(tryCatch.catchBlock(), handler, context);
        } else if (statement instanceof ExprStatement exprStatement) {
            checkExpr(exprStatement.expr(), scope);
        } else {
            throw new IllegalStateException("unhandled statement " + statement);
        }
    }

    private void declareLocal(Scope scope, String name, SymbolKind kind, SourcePosition position)
            throws SemanticException {
        Scope.Symbol existing = scope.lookupLocal(name);
        if (existing != null) {
            throw error(SemanticErrorKind.DUPLICATE_DECLARATION, "'" + name + "' is already declared in this block at line "
                    + existing.position().line(), position);
        }
        scope.define(name, kind, position);
    }

    private void checkAssignTarget(Assign assign, Scope scope) throws SemanticException {
        if (assign.target() instanceof Identifier id) {
            Scope.Symbol symbol = resolve(id, scope);
            if (symbol.kind() == SymbolKind.CONSTANT) {
                throw error(SemanticErrorKind.CONSTANT_REASSIGNMENT, "cannot reassign constant '" + id.name()
                        + "' declared with 'sankalpa' at line " + symbol.position().line(), assign.position());
            }
            if (!symbol.kind().isAssignable()) {
                throw error(SemanticErrorKind.INVALID_ASSIGNMENT, "cannot assign to "
                        + symbol.kind().name().toLowerCase() + " '" + id.name() + "'", assign.position());
            }
            return;
        }
        if (assign.target() instanceof FieldAccess field) {
            if (field.isLength()) {
                throw error(SemanticErrorKind.INVALID_ASSIGNMENT, "cannot assign to 'length'", assign.position());
            }
            if (field.base() instanceof Identifier id && resolve(id, scope).kind() == SymbolKind.NAMESPACE) {
                throw error(SemanticErrorKind.INVALID_ASSIGNMENT, "cannot assign to function '" + id.name() + "."
                        + field.field() + "'", assign.position());
            }
        }
        checkExpr(assign.target(), scope);
    }

    private void checkReturn(Return ret, Scope scope, FunctionContext context) throws SemanticException {
        if (ret.hasValue() && !context.returnsValue()) {
            throw error(SemanticErrorKind.UNEXPECTED_RETURN_VALUE, "'" + context.name()
                    + "' declares no return type, so 'moksha' cannot return a value", ret.position());
        }
        if (!ret.hasValue() && context.returnsValue()) {
            throw error(SemanticErrorKind.MISSING_RETURN_VALUE, "'" + context.name() + "' must return a "
                    + context.returnType() + " value", ret.position());
        }
        if (ret.hasValue()) {
            checkExpr(ret.value(), scope);
        }
    }

    private void checkExpr(Expr expr, Scope scope) throws SemanticException {
        if (expr instanceof Identifier id) {
            resolve(id, scope);
        } else if (expr instanceof BinaryOp binary) {
            checkExpr(binary.left(), scope);
            checkExpr(binary.right(), scope);
        } else if (expr instanceof UnaryOp unary) {
            checkExpr(unary.operand(), scope);
        } else if (expr instanceof Call call) {
            checkExpr(call.callee(), scope);
            for (Expr arg : call.args()) {
                checkExpr(arg, scope);
            }
        } else if (expr instanceof IndexAccess index) {
            checkExpr(index.base(), scope);
            checkExpr(index.index(), scope);
        } else if (expr instanceof FieldAccess field) {
            checkField(field, scope);
        } else if (expr instanceof ArrayLiteral array) {
            for (Expr element : array.elements()) {
                checkExpr(element, scope);
            }
        } else if (!(expr instanceof IntegerLiteral || expr instanceof StringLiteral || expr instanceof BooleanLiteral)) {
            throw new IllegalStateException("unhandled expression " + expr);
        }
    }

    private void checkField(FieldAccess field, Scope scope) throws SemanticException {
        if (field.base() instanceof Identifier id) {
            Scope.Symbol symbol = resolve(id, scope);
            if (symbol.kind() == SymbolKind.NAMESPACE) {
                if (!namespaceMembers.getOrDefault(id.name(), Set.of()).contains(field.field())) {
                    throw error(SemanticErrorKind.UNRESOLVED_IDENTIFIER, "namespace '" + id.name()
                            + "' has no function '" + field.field() + "'", field.position());
                }
            }
            return;
        }
        checkExpr(field.base(), scope);
    }

    private static Scope.Symbol resolve(Identifier id, Scope scope) throws SemanticException {
        Scope.Symbol symbol = scope.resolve(id.name());
        if (symbol == null) {
            throw error(SemanticErrorKind.UNRESOLVED_IDENTIFIER, "'" + id.name() + "' is not declared", id.position());
        }
        return symbol;
    }

    private static SemanticException error(SemanticErrorKind kind, String message, SourcePosition position) {
        return new SemanticException(kind, message, position.line(), position.column());
    }
}
