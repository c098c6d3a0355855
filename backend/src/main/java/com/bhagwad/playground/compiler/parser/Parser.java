package com.bhagwad.playground.compiler.parser;

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
import com.bhagwad.playground.compiler.ast.FieldAccess;
import com.bhagwad.playground.compiler.ast.FunctionDecl;
import com.bhagwad.playground.compiler.ast.Identifier;
import com.bhagwad.playground.compiler.ast.If;
import com.bhagwad.playground.compiler.ast.IndexAccess;
import com.bhagwad.playground.compiler.ast.IntegerLiteral;
import com.bhagwad.playground.compiler.ast.LValue;
import com.bhagwad.playground.compiler.ast.LoopForIn;
import com.bhagwad.playground.compiler.ast.LoopRange;
import com.bhagwad.playground.compiler.ast.LoopWhile;
import com.bhagwad.playground.compiler.ast.NamedType;
import com.bhagwad.playground.compiler.ast.NamespaceDecl;
import com.bhagwad.playground.compiler.ast.Param;
import com.bhagwad.playground.compiler.ast.Print;
import com.bhagwad.playground.compiler.ast.Program;
import com.bhagwad.playground.compiler.ast.Return;
import com.bhagwad.playground.compiler.ast.ScalarType;
import com.bhagwad.playground.compiler.ast.SourcePosition;
import com.bhagwad.playground.compiler.ast.Statement;
import com.bhagwad.playground.compiler.ast.StringLiteral;
import com.bhagwad.playground.compiler.ast.TopLevelDecl;
import com.bhagwad.playground.compiler.ast.TryCatch;
import com.bhagwad.playground.compiler.ast.Type;
import com.bhagwad.playground.compiler.ast.UnaryOp;
import com.bhagwad.playground.compiler.ast.UnaryOperator;
import com.bhagwad.playground.compiler.ast.VarDecl;
import com.bhagwad.playground.compiler.lexer.Token;
import com.bhagwad.playground.compiler.lexer.TokenKind;
import com.bhagwad.playground.exception.CompilationException;
import com.bhagwad.playground.exception.DuplicateEntryException;
import com.bhagwad.playground.exception.MissingEntryException;
import com.bhagwad.playground.exception.SyntaxException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent parser with one token of lookahead, followed by {@link SemanticAnalyzer}.
 */
public final class Parser {

    private static final Set<TokenKind> TOP_LEVEL_START = EnumSet.of(TokenKind.YUGA, TokenKind.SHLOKA, TokenKind.ARJUNA);

    private static final Set<TokenKind> SCALAR_TYPES = EnumSet.of(TokenKind.SATTVA, TokenKind.RAJAS, TokenKind.TAMAS);

    private static final Set<TokenKind> TYPE_START = EnumSet.of(
            TokenKind.SATTVA, TokenKind.RAJAS, TokenKind.TAMAS, TokenKind.COSMIC, TokenKind.IDENTIFIER);

    private static final Set<TokenKind> EXPRESSION_START = EnumSet.of(
            TokenKind.INTEGER, TokenKind.STRING, TokenKind.BOOLEAN, TokenKind.IDENTIFIER,
            TokenKind.LEFT_PAREN, TokenKind.LEFT_BRACKET, TokenKind.MINUS, TokenKind.BANG);

    private static final Set<TokenKind> STATEMENT_START;

    static {
        Set<TokenKind> s = EnumSet.of(
                TokenKind.MAYA, TokenKind.SANKALPA, TokenKind.SATTVA, TokenKind.RAJAS, TokenKind.TAMAS,
                TokenKind.COSMIC, TokenKind.DHARMA, TokenKind.KARMA, TokenKind.MANIFEST, TokenKind.MOKSHA,
                TokenKind.MEDITATION);
        s.addAll(EXPRESSION_START);
        STATEMENT_START = s;
    }

    private static final Map<TokenKind, BinaryOperator> EQUALITY_OPS = Map.of(
            TokenKind.EQUAL_EQUAL, BinaryOperator.EQUAL,
            TokenKind.BANG_EQUAL, BinaryOperator.NOT_EQUAL);

    private static final Map<TokenKind, BinaryOperator> RELATIONAL_OPS = Map.of(
            TokenKind.LESS, BinaryOperator.LESS,
            TokenKind.GREATER, BinaryOperator.GREATER,
            TokenKind.LESS_EQUAL, BinaryOperator.LESS_EQUAL,
            TokenKind.GREATER_EQUAL, BinaryOperator.GREATER_EQUAL);

    private static final Map<TokenKind, BinaryOperator> ADDITIVE_OPS = Map.of(
            TokenKind.PLUS, BinaryOperator.ADD,
            TokenKind.MINUS, BinaryOperator.SUBTRACT);

    private static final Map<TokenKind, BinaryOperator> MULTIPLICATIVE_OPS = Map.of(
            TokenKind.STAR, BinaryOperator.MULTIPLY,
            TokenKind.SLASH, BinaryOperator.DIVIDE,
            TokenKind.PERCENT, BinaryOperator.MODULO);

    public Program parse(List<Token> tokens) throws CompilationException {
        Cursor c = new Cursor(tokens);

        List<TopLevelDecl> declarations = new ArrayList<>();
        boolean sawEntry = false;
        while (!c.isAtEnd()) {
            Token t = c.peek();
            switch (t.kind()) {
                case YUGA -> declarations.add(parseNamespace(c));
                case SHLOKA -> declarations.add(parseFunction(c));
                case ARJUNA -> {
                    if (sawEntry) {
                        throw new DuplicateEntryException(t.line(), t.column());
                    }
                    sawEntry = true;
                    declarations.add(parseEntry(c));
                }
                default -> throw new SyntaxException(TOP_LEVEL_START, t, "at top level");
            }
        }

        if (!sawEntry) {
            Token eof = c.peek();
            throw new MissingEntryException(eof.line(), eof.column());
        }

        Program program = new Program(declarations);
        new SemanticAnalyzer().analyze(program);
        return program;
    }

    private NamespaceDecl parseNamespace(Cursor c) throws CompilationException {
        Token kw = c.expect(TokenKind.YUGA, null);
        Token name = c.expect(TokenKind.IDENTIFIER, "as namespace name");
        c.expect(TokenKind.LEFT_BRACE, "to open namespace '" + name.lexeme() + "'");

        List<FunctionDecl> members = new ArrayList<>();
        while (!c.check(TokenKind.RIGHT_BRACE)) {
            if (!c.check(TokenKind.SHLOKA)) {
                throw new SyntaxException(EnumSet.of(TokenKind.SHLOKA, TokenKind.RIGHT_BRACE), c.peek(),
                        "inside namespace '" + name.lexeme() + "'");
            }
            members.add(parseFunction(c));
        }
        c.expect(TokenKind.RIGHT_BRACE, null);
        return new NamespaceDecl(name.lexeme(), members, positionOf(kw));
    }

    private FunctionDecl parseFunction(Cursor c) throws CompilationException {
        Token kw = c.expect(TokenKind.SHLOKA, null);
        Token name = c.expect(TokenKind.IDENTIFIER, "as function name");
        c.expect(TokenKind.LEFT_PAREN, "after function name");

        List<Param> params = new ArrayList<>();
        if (!c.check(TokenKind.RIGHT_PAREN)) {
            while (true) {
                Token start = c.peek();
                Type type = parseType(c, "for parameter");
                Token paramName = c.expect(TokenKind.IDENTIFIER, "as parameter name");
                params.add(new Param(type, paramName.lexeme(), positionOf(start)));
                if (c.match(TokenKind.COMMA)) {
                    continue;
                }
                break;
            }
        }
        c.expect(TokenKind.RIGHT_PAREN, "to close parameter list");

        Type returnType = null;
        if (c.match(TokenKind.ARROW)) {
            returnType = parseType(c, "as return type");
        }

        Block body = parseBlock(c);
        return new FunctionDecl(name.lexeme(), params, returnType, body, positionOf(kw));
    }

    private EntryBlock parseEntry(Cursor c) throws CompilationException {
        Token kw = c.expect(TokenKind.ARJUNA, null);
        return new EntryBlock(parseBlock(c), positionOf(kw));
    }

    private Block parseBlock(Cursor c) throws CompilationException {
        Token open = c.expect(TokenKind.LEFT_BRACE, "to open block");
        List<Statement> statements = new ArrayList<>();
        while (true) {
            while (c.match(TokenKind.SEMICOLON)) {
                // empty statement
            }
            if (c.check(TokenKind.RIGHT_BRACE)) {
                break;
            }
            statements.add(parseStatement(c));
        }
        c.expect(TokenKind.RIGHT_BRACE, "to close block");
        return new Block(statements, positionOf(open));
    }

    private Statement parseStatement(Cursor c) throws CompilationException {
        Token t = c.peek();
        return switch (t.kind()) {
            case MAYA, SANKALPA -> parseVarDecl(c);
            case SATTVA, RAJAS, TAMAS, COSMIC -> parseTypedDecl(c);
            case DHARMA -> parseIf(c);
            case KARMA -> parseLoop(c);
            case MANIFEST -> {
                c.next();
                yield new Print(parseExpr(c), positionOf(t));
            }
            case MOKSHA -> parseReturn(c);
            case MEDITATION -> parseTryCatch(c);
            default -> {
                if (!EXPRESSION_START.contains(t.kind())) {
                    throw new SyntaxException(STATEMENT_START, t, "at start of statement");
                }
                yield parseAssignOrExpr(c);
            }
        };
    }

    private VarDecl parseVarDecl(Cursor c) throws CompilationException {
        Token kw = c.next();
        boolean constant = kw.is(TokenKind.SANKALPA);

        Type type = null;
        Token name;
        if (SCALAR_TYPES.contains(c.peek().kind()) || c.check(TokenKind.COSMIC)) {
            type = parseType(c, null);
            name = c.expect(TokenKind.IDENTIFIER, "as variable name");
        } else {
            Token first = c.expect(TokenKind.IDENTIFIER, "after " + kw.kind().display());
            if (c.check(TokenKind.IDENTIFIER) || c.check(TokenKind.LEFT_BRACKET)) {
                type = withDims(new NamedType(first.lexeme()), parseDims(c));
                name = c.expect(TokenKind.IDENTIFIER, "as variable name");
            } else {
                name = first;
            }
        }

        Expr init = null;
        if (c.match(TokenKind.ASSIGN)) {
            init = parseExpr(c);
        } else if (constant) {
            throw new SyntaxException(EnumSet.of(TokenKind.ASSIGN), c.peek(),
                    "to initialise constant '" + name.lexeme() + "'");
        }
        return new VarDecl(name.lexeme(), type, init, constant, positionOf(kw));
    }

    private VarDecl parseTypedDecl(Cursor c) throws CompilationException {
        Token start = c.peek();
        Type type = parseType(c, null);
        Token name = c.expect(TokenKind.IDENTIFIER, "as variable name");
        Expr init = null;
        if (c.match(TokenKind.ASSIGN)) {
            init = parseExpr(c);
        }
        return new VarDecl(name.lexeme(), type, init, false, positionOf(start));
    }

    private Type parseType(Cursor c, String context) throws CompilationException {
        Token t = c.peek();
        switch (t.kind()) {
            case SATTVA -> {
                c.next();
                return withDims(ScalarType.SATTVA, parseDims(c));
            }
            case RAJAS -> {
                c.next();
                return withDims(ScalarType.RAJAS, parseDims(c));
            }
            case TAMAS -> {
                c.next();
                return withDims(ScalarType.TAMAS, parseDims(c));
            }
            case IDENTIFIER -> {
                c.next();
                return withDims(new NamedType(t.lexeme()), parseDims(c));
            }
            case COSMIC -> {
                c.next();
                Type element = parseType(c, "after 'cosmic'");
                if (!(element instanceof ArrayType)) {
                    throw new SyntaxException(EnumSet.of(TokenKind.LEFT_BRACKET), c.peek(),
                            "after 'cosmic " + element.describe() + "'");
                }
                return element;
            }
            default -> throw new SyntaxException(TYPE_START, t, context);
        }
    }

    private int parseDims(Cursor c) throws CompilationException {
        int dims = 0;
        while (c.match(TokenKind.LEFT_BRACKET)) {
            c.expect(TokenKind.RIGHT_BRACKET, "in array type");
            dims++;
        }
        return dims;
    }

    private static Type withDims(Type element, int dims) {
        return dims == 0 ? element : new ArrayType(element, dims);
    }

    private If parseIf(Cursor c) throws CompilationException {
        Token kw = c.expect(TokenKind.DHARMA, null);
        c.expect(TokenKind.LEFT_PAREN, "after 'dharma'");
        Expr condition = parseExpr(c);
        c.expect(TokenKind.RIGHT_PAREN, "after condition");
        Block thenBlock = parseBlock(c);

        Block elseBlock = null;
        if (c.match(TokenKind.ADHARMA)) {
            elseBlock = parseBlock(c);
        }
        return new If(condition, thenBlock, elseBlock, positionOf(kw));
    }

    private Statement parseLoop(Cursor c) throws CompilationException {
        Token kw = c.expect(TokenKind.KARMA, null);

        if (c.match(TokenKind.WHILE)) {
            c.expect(TokenKind.LEFT_PAREN, "after 'while'");
            Expr condition = parseExpr(c);
            c.expect(TokenKind.RIGHT_PAREN, "after loop condition");
            return new LoopWhile(condition, parseBlock(c), positionOf(kw));
        }

        if (!c.check(TokenKind.IDENTIFIER)) {
            throw new SyntaxException(EnumSet.of(TokenKind.IDENTIFIER, TokenKind.WHILE), c.peek(), "after 'karma'");
        }
        Token variable = c.next();

        if (c.match(TokenKind.FROM)) {
            Expr from = parseExpr(c);
            c.expect(TokenKind.TO, "after loop start value");
            Expr to = parseExpr(c);
            return new LoopRange(variable.lexeme(), from, to, parseBlock(c), positionOf(kw));
        }
        if (c.match(TokenKind.IN)) {
            Expr iterable = parseExpr(c);
            return new LoopForIn(variable.lexeme(), iterable, parseBlock(c), positionOf(kw));
        }
        throw new SyntaxException(EnumSet.of(TokenKind.FROM, TokenKind.IN), c.peek(), "after loop variable");
    }

    private Return parseReturn(Cursor c) throws CompilationException {
        Token kw = c.expect(TokenKind.MOKSHA, null);
        if (c.check(TokenKind.RIGHT_BRACE) || c.check(TokenKind.SEMICOLON)) {
            return new Return(null, positionOf(kw));
        }
        return new Return(parseExpr(c), positionOf(kw));
    }

    private TryCatch parseTryCatch(Cursor c) throws CompilationException {
        Token kw = c.expect(TokenKind.MEDITATION, null);
        Block tryBlock = parseBlock(c);
        c.expect(TokenKind.DISTURBANCE, "after 'meditation' block");
        c.expect(TokenKind.LEFT_PAREN, "after 'disturbance'");
        Token errorName = c.expect(TokenKind.IDENTIFIER, "as error name");
        c.expect(TokenKind.RIGHT_PAREN, "after error name");
        Block catchBlock = parseBlock(c);
        return new TryCatch(tryBlock, errorName.lexeme(), catchBlock, positionOf(kw));
    }

    private Statement parseAssignOrExpr(Cursor c) throws CompilationException {
        Expr expr = parseExpr(c);
        if (!c.check(TokenKind.ASSIGN)) {
            return new ExprStatement(expr, expr.position());
        }
        Token eq = c.next();
        if (!(expr instanceof LValue target) || !isRootedAtIdentifier(expr)) {
            throw new SyntaxException(EnumSet.noneOf(TokenKind.class), eq, "left side of '=' is not assignable");
        }
        Expr value = parseExpr(c);
        return new Assign(target, value, expr.position());
    }

    private static boolean isRootedAtIdentifier(Expr expr) {
        if (expr instanceof Identifier) {
            return true;
        }
        if (expr instanceof IndexAccess index) {
            return isRootedAtIdentifier(index.base());
        }
        if (expr instanceof FieldAccess field) {
            return isRootedAtIdentifier(field.base());
        }
        return false;
    }

    // expressions, lowest precedence first

    private Expr parseExpr(Cursor c) throws CompilationException {
        return parseOr(c);
    }

    private Expr parseOr(Cursor c) throws CompilationException {
        Expr left = parseAnd(c);
        while (c.match(TokenKind.OR_OR)) {
            left = new BinaryOp(BinaryOperator.OR, left, parseAnd(c), left.position());
        }
        return left;
    }

    private Expr parseAnd(Cursor c) throws CompilationException {
        Expr left = parseEquality(c);
        while (c.match(TokenKind.AND_AND)) {
            left = new BinaryOp(BinaryOperator.AND, left, parseEquality(c), left.position());
        }
        return left;
    }

    private Expr parseEquality(Cursor c) throws CompilationException {
        Expr left = parseRelational(c);
        BinaryOperator op;
        while ((op = EQUALITY_OPS.get(c.peek().kind())) != null) {
            c.next();
            left = new BinaryOp(op, left, parseRelational(c), left.position());
        }
        return left;
    }

    private Expr parseRelational(Cursor c) throws CompilationException {
        Expr left = parseAdditive(c);
        BinaryOperator op;
        while ((op = RELATIONAL_OPS.get(c.peek().kind())) != null) {
            c.next();
            left = new BinaryOp(op, left, parseAdditive(c), left.position());
        }
        return left;
    }

    private Expr parseAdditive(Cursor c) throws CompilationException {
        Expr left = parseMultiplicative(c);
        BinaryOperator op;
        while ((op = ADDITIVE_OPS.get(c.peek().kind())) != null) {
            c.next();
            left = new BinaryOp(op, left, parseMultiplicative(c), left.position());
        }
        return left;
    }

    private Expr parseMultiplicative(Cursor c) throws CompilationException {
        Expr left = parseUnary(c);
        BinaryOperator op;
        while ((op = MULTIPLICATIVE_OPS.get(c.peek().kind())) != null) {
            c.next();
            left = new BinaryOp(op, left, parseUnary(c), left.position());
        }
        return left;
    }

    private Expr parseUnary(Cursor c) throws CompilationException {
        Token t = c.peek();
        if (c.match(TokenKind.MINUS)) {
            return new UnaryOp(UnaryOperator.NEGATE, parseUnary(c), positionOf(t));
        }
        if (c.match(TokenKind.BANG)) {
            return new UnaryOp(UnaryOperator.NOT, parseUnary(c), positionOf(t));
        }
        return parsePostfix(c);
    }

    private Expr parsePostfix(Cursor c) throws CompilationException {
        Expr expr = parsePrimary(c);
        while (true) {
            if (c.check(TokenKind.LEFT_PAREN)) {
                Token open = c.next();
                if (!(expr instanceof Identifier) && !(expr instanceof FieldAccess)) {
                    throw new SyntaxException(EnumSet.noneOf(TokenKind.class), open,
                            "only named functions can be called");
                }
                expr = new Call(expr, parseArguments(c), expr.position());
            } else if (c.match(TokenKind.LEFT_BRACKET)) {
                Expr index = parseExpr(c);
                c.expect(TokenKind.RIGHT_BRACKET, "after index");
                expr = new IndexAccess(expr, index, expr.position());
            } else if (c.match(TokenKind.DOT)) {
                Token field = c.expect(TokenKind.IDENTIFIER, "after '.'");
                expr = new FieldAccess(expr, field.lexeme(), expr.position());
            } else {
                return expr;
            }
        }
    }

    private List<Expr> parseArguments(Cursor c) throws CompilationException {
        List<Expr> args = new ArrayList<>();
        if (!c.check(TokenKind.RIGHT_PAREN)) {
            do {
                args.add(parseExpr(c));
            } while (c.match(TokenKind.COMMA));
        }
        c.expect(TokenKind.RIGHT_PAREN, "after arguments");
        return args;
    }

    private Expr parsePrimary(Cursor c) throws CompilationException {
        Token t = c.peek();
        switch (t.kind()) {
            case INTEGER -> {
                c.next();
                return new IntegerLiteral(new BigInteger(t.lexeme()), positionOf(t));
            }
            case STRING -> {
                c.next();
                return new StringLiteral(t.lexeme(), positionOf(t));
            }
            case BOOLEAN -> {
                c.next();
                return new BooleanLiteral(t.lexeme().toLowerCase(Locale.ROOT).equals("true"), positionOf(t));
            }
            case IDENTIFIER -> {
                c.next();
                return new Identifier(t.lexeme(), positionOf(t));
            }
            case LEFT_PAREN -> {
                c.next();
                Expr inner = parseExpr(c);
                c.expect(TokenKind.RIGHT_PAREN, "to close parenthesised expression");
                return inner;
            }
            case LEFT_BRACKET -> {
                c.next();
                List<Expr> elements = new ArrayList<>();
                if (!c.check(TokenKind.RIGHT_BRACKET)) {
                    do {
                        elements.add(parseExpr(c));
                    } while (c.match(TokenKind.COMMA));
                }
                c.expect(TokenKind.RIGHT_BRACKET, "to close array literal");
                return new ArrayLiteral(elements, positionOf(t));
            }
            default -> throw new SyntaxException(EXPRESSION_START, t, "to start an expression");
        }
    }

    private static SourcePosition positionOf(Token t) {
        return new SourcePosition(t.line(), t.column());
    }

    private static final class Cursor {
        private final List<Token> tokens;
        private int pos;

        Cursor(List<Token> tokens) {
            if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenKind.EOF)) {
                throw new IllegalArgumentException("token list must end with EOF");
            }
            this.tokens = tokens;
            this.pos = 0;
        }

        boolean isAtEnd() {
            return peek().is(TokenKind.EOF);
        }

        Token peek() {
            return tokens.get(pos);
        }

        Token next() {
            Token t = tokens.get(pos);
            if (!t.is(TokenKind.EOF)) {
                pos++;
            }
            return t;
        }

        boolean check(TokenKind kind) {
            return peek().is(kind);
        }

        boolean match(TokenKind kind) {
            if (check(kind)) {
                next();
                return true;
            }
            return false;
        }

        Token expect(TokenKind kind, String context) throws SyntaxException {
            Token t = peek();
            if (!t.is(kind)) {
                throw new SyntaxException(EnumSet.of(kind), t, context);
            }
            return next();
        }
    }
}
