package com.bhagwad.playground.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyntaxAnalysisResponse(
        boolean success,
        List<SyntaxToken> tokens,
        String error,
        Integer errorLine,
        Integer errorColumn,
        long analysisTimeMs) {

    public static SyntaxAnalysisResponse success(List<SyntaxToken> tokens, long analysisTimeMs) {
        return new SyntaxAnalysisResponse(true, tokens, null, null, null, analysisTimeMs);
    }

    public static SyntaxAnalysisResponse error(String error, long analysisTimeMs) {
        return new SyntaxAnalysisResponse(false, List.of(), error, null, null, analysisTimeMs);
    }

    public static SyntaxAnalysisResponse error(String error, int line, int column, long analysisTimeMs) {
        return new SyntaxAnalysisResponse(false, List.of(), error, line, column, analysisTimeMs);
    }
}
