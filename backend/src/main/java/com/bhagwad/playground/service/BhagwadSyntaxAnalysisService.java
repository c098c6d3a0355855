package com.bhagwad.playground.service;

import com.bhagwad.playground.compiler.BhagwadCompiler;
import com.bhagwad.playground.compiler.ast.Assign;
import com.bhagwad.playground.compiler.ast.Block;
import com.bhagwad.playground.compiler.ast.EntryBlock;
import com.bhagwad.playground.compiler.ast.ExprStatement;
import com.bhagwad.playground.compiler.ast.FunctionDecl;
import com.bhagwad.playground.compiler.ast.If;
import com.bhagwad.playground.compiler.ast.LoopForIn;
import com.bhagwad.playground.compiler.ast.LoopRange;
import com.bhagwad.playground.compiler.ast.LoopWhile;
import com.bhagwad.playground.compiler.ast.NamespaceDecl;
import com.bhagwad.playground.compiler.ast.Param;
import com.bhagwad.playground.compiler.ast.Print;
import com.bhagwad.playground.compiler.ast.Program;
import com.bhagwad.playground.compiler.ast.Return;
import com.bhagwad.playground.compiler.ast.Statement;
import com.bhagwad.playground.compiler.ast.StatementVisitor;
import com.bhagwad.playground.compiler.ast.TopLevelDecl;
import com.bhagwad.playground.compiler.ast.TopLevelVisitor;
import com.bhagwad.playground.compiler.ast.TryCatch;
import com.bhagwad.playground.compiler.ast.VarDecl;
import com.bhagwad.playground.compiler.lexer.Token;
import com.bhagwad.playground.compiler.lexer.TokenKind;
import com.bhagwad.playground.dto.SyntaxAnalysisRequest;
import com.bhagwad.playground.dto.SyntaxAnalysisResponse;
import com.bhagwad.playground.dto.SyntaxToken;
import com.bhagwad.playground.dto.SyntaxToken.TokenType;
import com.bhagwad.playground.exception.CompilationException;
import com.bhagwad.playground.exception.LexException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Token classification for editor highlighting.
 *
 * Tokens come straight from the compiler's lexer. When the whole program also parses,
 * identifiers are refined by what the program declares under that name; otherwise they stay
 * plain identifiers.
 */
@Service
public class BhagwadSyntaxAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(BhagwadSyntaxAnalysisService.class);

    private final BhagwadCompiler compiler;

    public BhagwadSyntaxAnalysisService(BhagwadCompiler compiler) {
        this.compiler = compiler;
    }

    public SyntaxAnalysisResponse analyzeSyntax(SyntaxAnalysisRequest request) {
        long startTime = System.currentTimeMillis();
        String sourceCode = sanitizeInput(request.sourceCode());

        List<Token> lexed;
        try {
            lexed = compiler.tokenize(sourceCode);
        } catch (LexException e) {
            long analysisTime = System.currentTimeMillis() - startTime;
            logger.debug("Lexical error during syntax analysis: {}", e.describe());
            return SyntaxAnalysisResponse.error(e.describe(), e.getLine(), e.getColumn(), analysisTime);
        }

        List<SyntaxToken> tokens = new ArrayList<>();
        for (Token token : lexed) {
            if (!token.is(TokenKind.EOF)) {
                tokens.add(toSyntaxToken(token));
            }
        }

        try {
            Program program = compiler.parse(lexed);
            Map<String, Declaration> declarations = new DeclarationCollector().collect(program);
            enhanceTokensWithSemanticInfo(tokens, declarations);
            logger.debug("Enhanced {} tokens with {} declared names", tokens.size(), declarations.size());
        } catch (CompilationException e) {
            logger.debug("Program does not compile, using lexical classification only: {}", e.describe());
        }

        long analysisTime = System.currentTimeMillis() - startTime;
        logger.debug("Syntax analysis completed in {}ms with {} tokens", analysisTime, tokens.size());
        return SyntaxAnalysisResponse.success(tokens, analysisTime);
    }

    static SyntaxToken toSyntaxToken(Token token) {
        return new SyntaxToken(
                token.line(), token.column(),
                token.line(), token.column() + token.width(),
                staticType(token.kind()), token.lexeme(), null);
    }

    static TokenType staticType(TokenKind kind) {
        return switch (kind.category()) {
            case KEYWORD -> TokenType.KEYWORD;
            case TYPE_KEYWORD -> TokenType.BUILT_IN_TYPE;
            case IDENTIFIER -> TokenType.IDENTIFIER;
            case OPERATOR -> TokenType.OPERATOR;
            case PUNCTUATION, END -> TokenType.PUNCTUATION;
            case LITERAL -> switch (kind) {
                case BOOLEAN -> TokenType.BOOLEAN_LITERAL;
                case INTEGER -> TokenType.NUMBER_LITERAL;
                default -> TokenType.STRING_LITERAL;
            };
        };
    }

    private void enhanceTokensWithSemanticInfo(List<SyntaxToken> tokens, Map<String, Declaration> declarations) {
        for (int i = 0; i < tokens.size(); i++) {
            SyntaxToken token = tokens.get(i);
            if (token.tokenType() != TokenType.IDENTIFIER) {
                continue;
            }
            Declaration declaration = declarations.get(token.value());
            if (declaration != null) {
                tokens.set(i, token.withType(declaration.type(), declaration.info()));
            }
        }
    }

    private String sanitizeInput(String input) {
        if (input == null) {
            return "";
        }
        return input.replace("\0", "")
                .replace("\r\n", "\n")
                .replace("\r", "\n");
    }

    private record Declaration(TokenType type, String info, int rank) {
    }

    /**
     * Collects every name the program declares. Classification is by name only, so when one
     * name is declared in several roles the strongest one wins: functions and namespaces, then
     * constants, then parameters, then variables.
     */
    private static final class DeclarationCollector implements TopLevelVisitor<Void>, StatementVisitor<Void> {
        private final Map<String, Declaration> declarations = new HashMap<>();

        Map<String, Declaration> collect(Program program) {
            for (TopLevelDecl decl : program.declarations()) {
                decl.accept(this);
            }
            return declarations;
        }

        private void declare(String name, TokenType type, String info, int rank) {
            Declaration candidate = new Declaration(type, info, rank);
            declarations.merge(name, candidate, (current, next) -> next.rank() < current.rank() ? next : current);
        }

        private void block(Block block) {
            for (Statement statement : block.statements()) {
                statement.accept(this);
            }
        }

        @Override
        public Void visitNamespace(NamespaceDecl namespace) {
            declare(namespace.name(), TokenType.USER_NAMESPACE, "yuga " + namespace.name(), 0);
            for (FunctionDecl member : namespace.members()) {
                member.accept(this);
            }
            return null;
        }

        @Override
        public Void visitFunction(FunctionDecl function) {
            String params = function.params().stream()
                    .map(p -> p.type().describe() + " " + p.name())
                    .collect(Collectors.joining(", "));
            String signature = "shloka " + function.name() + "(" + params + ")"
                    + (function.hasReturnType() ? " -> " + function.returnType().describe() : "");
            declare(function.name(), TokenType.USER_FUNCTION, signature, 0);
            for (Param param : function.params()) {
                declare(param.name(), TokenType.PARAMETER, "parameter " + param.type().describe(), 2);
            }
            block(function.body());
            return null;
        }

        @Override
        public Void visitEntry(EntryBlock entry) {
            block(entry.body());
            return null;
        }

        @Override
        public Void visitVarDecl(VarDecl decl) {
            String type = decl.declaredType() == null ? "" : " " + decl.declaredType().describe();
            if (decl.constant()) {
                declare(decl.name(), TokenType.USER_CONSTANT, "sankalpa" + type, 1);
            } else {
                declare(decl.name(), TokenType.USER_VARIABLE, "maya" + type, 3);
            }
            return null;
        }

        @Override
        public Void visitAssign(Assign assign) {
            return null;
        }

        @Override
        public Void visitIf(If stmt) {
            block(stmt.thenBlock());
            if (stmt.elseBlock() != null) {
                block(stmt.elseBlock());
            }
            return null;
        }

        @Override
        public Void visitLoopRange(LoopRange loop) {
            declare(loop.variable(), TokenType.USER_VARIABLE, "loop variable sattva", 3);
            block(loop.body());
            return null;
        }

        @Override
        public Void visitLoopWhile(LoopWhile loop) {
            block(loop.body());
            return null;
        }

        @Override
        public Void visitLoopForIn(LoopForIn loop) {
            declare(loop.variable(), TokenType.USER_VARIABLE, "loop variable", 3);
            block(loop.body());
            return null;
        }

        @Override
        public Void visitPrint(Print print) {
            return null;
        }

        @Override
        public Void visitReturn(Return ret) {
            return null;
        }

        @Override
        public Void visitTryCatch(TryCatch tryCatch) {
            block(tryCatch.tryBlock());
            declare(tryCatch.errorName(), TokenType.USER_VARIABLE, "disturbance rajas", 3);
            block(tryCatch.catchBlock());
            return null;
        }

        @Override
        public Void visitExprStatement(ExprStatement stmt) {
            return null;
        }
    }
}
