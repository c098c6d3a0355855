package com.bhagwad.playground.compiler.lexer;

import com.bhagwad.playground.exception.LexException;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private final Lexer lexer = new Lexer();

    private List<TokenKind> kinds(String source) throws LexException {
        return lexer.tokenize(source).stream().map(Token::kind).collect(Collectors.toList());
    }

    @Test
    public void typedVariableDeclaration() throws Exception {
        assertEquals(
                List.of(TokenKind.MAYA, TokenKind.SATTVA, TokenKind.IDENTIFIER, TokenKind.ASSIGN, TokenKind.INTEGER, TokenKind.EOF),
                kinds("maya sattva x = 10"));
    }

    @Test
    public void emptyInputIsJustEof() throws Exception {
        List<Token> tokens = lexer.tokenize("");
        assertEquals(1, tokens.size());
        assertEquals(TokenKind.EOF, tokens.get(0).kind());
        assertEquals(1, tokens.get(0).line());
        assertEquals(1, tokens.get(0).column());
    }

    @Test
    public void commentsAndWhitespaceAreSkipped() throws Exception {
        assertEquals(List.of(TokenKind.MANIFEST, TokenKind.INTEGER, TokenKind.EOF),
                kinds("// opening verse\n\t manifest 1 // trailing\r\n// last"));
    }

    @Test
    public void keywordsAreCaseInsensitiveAndKeepTheirSpelling() throws Exception {
        List<Token> tokens = lexer.tokenize("Maya SHLOKA True");
        assertEquals(TokenKind.MAYA, tokens.get(0).kind());
        assertEquals("Maya", tokens.get(0).lexeme());
        assertEquals(TokenKind.SHLOKA, tokens.get(1).kind());
        assertEquals(TokenKind.BOOLEAN, tokens.get(2).kind());
    }

    @Test
    public void identifiersMayContainDigitsAndUnderscores() throws Exception {
        List<Token> tokens = lexer.tokenize("_x1 maya_ karma2");
        assertEquals(TokenKind.IDENTIFIER, tokens.get(0).kind());
        assertEquals(TokenKind.IDENTIFIER, tokens.get(1).kind());
        assertEquals("maya_", tokens.get(1).lexeme());
        assertEquals(TokenKind.IDENTIFIER, tokens.get(2).kind());
    }

    @Test
    public void twoCharacterOperatorsWinOverSingleOnes() throws Exception {
        assertEquals(
                List.of(TokenKind.EQUAL_EQUAL, TokenKind.BANG_EQUAL, TokenKind.LESS_EQUAL, TokenKind.GREATER_EQUAL,
                        TokenKind.ARROW, TokenKind.AND_AND, TokenKind.OR_OR, TokenKind.ASSIGN, TokenKind.BANG,
                        TokenKind.LESS, TokenKind.MINUS, TokenKind.EOF),
                kinds("== != <= >= -> && || = ! < -"));
    }

    @Test
    public void negativeNumbersAreTwoTokens() throws Exception {
        assertEquals(List.of(TokenKind.MINUS, TokenKind.INTEGER, TokenKind.EOF), kinds("-5"));
    }

    @Test
    public void stringEscapesAreDecoded() throws Exception {
        Token token = lexer.tokenize("\"a\\n\\t\\\"b\\\\\"").get(0);
        assertEquals(TokenKind.STRING, token.kind());
        assertEquals("a\n\t\"b\\", token.lexeme());
        assertEquals(12, token.width());
    }

    @Test
    public void singleQuotedStrings() throws Exception {
        Token token = lexer.tokenize("'it\\'s \"fine\"'").get(0);
        assertEquals("it's \"fine\"", token.lexeme());
    }

    @Test
    public void positionsAreOneBased() throws Exception {
        List<Token> tokens = lexer.tokenize("arjuna {\n  manifest \"hi\"\n}");
        Token manifest = tokens.get(2);
        assertEquals(TokenKind.MANIFEST, manifest.kind());
        assertEquals(2, manifest.line());
        assertEquals(3, manifest.column());
        Token string = tokens.get(3);
        assertEquals(12, string.column());
        assertEquals(4, string.width());
        Token close = tokens.get(4);
        assertEquals(3, close.line());
        assertEquals(1, close.column());
    }

    @Test
    public void unterminatedStringPointsAtOpeningQuote() {
        LexException e = assertThrows(LexException.class, () -> lexer.tokenize("manifest \"never closed\nmaya"));
        assertEquals(1, e.getLine());
        assertEquals(10, e.getColumn());
        assertTrue(e.getMessage().contains("unterminated"));
    }

    @Test
    public void unexpectedCharacterIsReported() {
        LexException e = assertThrows(LexException.class, () -> lexer.tokenize("maya x = 1\nmaya y = @"));
        assertEquals(2, e.getLine());
        assertEquals(10, e.getColumn());
        assertEquals("line 2, column 10: unexpected character '@'", e.describe());
    }

    @Test
    public void singleAmpersandIsNotAnOperator() {
        assertThrows(LexException.class, () -> lexer.tokenize("a & b"));
    }

    @Test
    public void tokenCategories() {
        assertEquals(TokenCategory.KEYWORD, TokenKind.KARMA.category());
        assertEquals(TokenCategory.TYPE_KEYWORD, TokenKind.COSMIC.category());
        assertEquals(TokenCategory.LITERAL, TokenKind.BOOLEAN.category());
        assertEquals(TokenCategory.END, TokenKind.EOF.category());
    }
}
