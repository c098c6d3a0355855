package com.bhagwad.playground.service;

import com.bhagwad.playground.compiler.BhagwadCompiler;
import com.bhagwad.playground.dto.SyntaxAnalysisRequest;
import com.bhagwad.playground.dto.SyntaxAnalysisResponse;
import com.bhagwad.playground.dto.SyntaxToken;
import com.bhagwad.playground.dto.SyntaxToken.TokenType;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BhagwadSyntaxAnalysisServiceTest {

    private final BhagwadSyntaxAnalysisService service = new BhagwadSyntaxAnalysisService(new BhagwadCompiler());

    private SyntaxAnalysisResponse analyze(String source) {
        return service.analyzeSyntax(new SyntaxAnalysisRequest(source));
    }

    private static SyntaxToken find(List<SyntaxToken> tokens, String value, int occurrence) {
        return tokens.stream()
                .filter(t -> t.value().equals(value))
                .skip(occurrence)
                .findFirst()
                .orElseThrow(() -> new AssertionError("no token " + value));
    }

    @Test
    public void tokensHaveOneBasedRanges() {
        SyntaxAnalysisResponse response = analyze("arjuna {\n  manifest \"hi\"\n}");
        assertTrue(response.success());
        assertEquals(5, response.tokens().size());

        SyntaxToken manifest = response.tokens().get(2);
        assertEquals(TokenType.KEYWORD, manifest.tokenType());
        assertEquals(2, manifest.startLine());
        assertEquals(3, manifest.startColumn());
        assertEquals(2, manifest.endLine());
        assertEquals(11, manifest.endColumn());

        SyntaxToken string = response.tokens().get(3);
        assertEquals(TokenType.STRING_LITERAL, string.tokenType());
        assertEquals(12, string.startColumn());
        assertEquals(16, string.endColumn());
    }

    @Test
    public void staticClassification() {
        List<SyntaxToken> tokens = analyze("arjuna { maya sattva x = 1 + 2\n maya tamas b = true; }").tokens();
        assertEquals(TokenType.BUILT_IN_TYPE, find(tokens, "sattva", 0).tokenType());
        assertEquals(TokenType.NUMBER_LITERAL, find(tokens, "1", 0).tokenType());
        assertEquals(TokenType.OPERATOR, find(tokens, "+", 0).tokenType());
        assertEquals(TokenType.BOOLEAN_LITERAL, find(tokens, "true", 0).tokenType());
        assertEquals(TokenType.PUNCTUATION, find(tokens, ";", 0).tokenType());
        assertEquals(TokenType.PUNCTUATION, find(tokens, "{", 0).tokenType());
    }

    @Test
    public void identifiersAreClassifiedFromDeclarations() {
        String source = "yuga Vedas { shloka square(sattva n) -> sattva { moksha n * n } }\n"
                + "arjuna {\n"
                + "  sankalpa LIMIT = 3\n"
                + "  maya total = Vedas.square(LIMIT)\n"
                + "  manifest total\n"
                + "}";
        List<SyntaxToken> tokens = analyze(source).tokens();

        SyntaxToken namespace = find(tokens, "Vedas", 1);
        assertEquals(TokenType.USER_NAMESPACE, namespace.tokenType());

        SyntaxToken call = find(tokens, "square", 1);
        assertEquals(TokenType.USER_FUNCTION, call.tokenType());
        assertEquals("shloka square(sattva n) -> sattva", call.semanticInfo());

        assertEquals(TokenType.PARAMETER, find(tokens, "n", 2).tokenType());
        assertEquals(TokenType.USER_CONSTANT, find(tokens, "LIMIT", 1).tokenType());
        assertEquals(TokenType.USER_VARIABLE, find(tokens, "total", 1).tokenType());
    }

    @Test
    public void unparsableProgramKeepsLexicalTypes() {
        SyntaxAnalysisResponse response = analyze("arjuna { maya total = ");
        assertTrue(response.success());
        assertEquals(TokenType.IDENTIFIER, find(response.tokens(), "total", 0).tokenType());
        assertNull(find(response.tokens(), "total", 0).semanticInfo());
    }

    @Test
    public void lexicalErrorIsReported() {
        SyntaxAnalysisResponse response = analyze("arjuna {\n manifest $ }");
        assertFalse(response.success());
        assertTrue(response.tokens().isEmpty());
        assertEquals(2, response.errorLine());
        assertEquals(11, response.errorColumn());
    }

    @Test
    public void carriageReturnsAreNormalised() {
        SyntaxAnalysisResponse response = analyze("arjuna {\r\n manifest 1\r\n}");
        SyntaxToken close = response.tokens().get(response.tokens().size() - 1);
        assertEquals(3, close.startLine());
        assertEquals(1, close.startColumn());
    }
}
