package com.bhagwad.playground.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompileResponse(
        boolean success,
        String output,
        String error,
        Integer errorLine,
        Integer errorColumn,
        String generatedCode,
        Long executionTimeMs,
        String resultType
) {

    public static CompileResponse success(String output, String generatedCode, long executionTimeMs) {
        return new CompileResponse(
                true,
                output,
                null,
                null,
                null,
                generatedCode,
                executionTimeMs,
                "success");
    }

    public static CompileResponse transpiled(String generatedCode) {
        return new CompileResponse(
                true,
                null,
                null,
                null,
                null,
                generatedCode,
                null,
                "success");
    }

    public static CompileResponse compilationError(String error) {
        return compilationError(error, null, null);
    }

    public static CompileResponse compilationError(String error, Integer line, Integer column) {
        return new CompileResponse(
                false,
                null,
                error,
                line,
                column,
                null,
                null,
                "compilation_error");
    }

    public static CompileResponse runtimeError(String error, String generatedCode, long executionTimeMs) {
        return new CompileResponse(
                false,
                null,
                error,
                null,
                null,
                generatedCode,
                executionTimeMs,
                "runtime_error");
    }

    public static CompileResponse timeout(String message, String generatedCode) {
        return new CompileResponse(
                false,
                null,
                message,
                null,
                null,
                generatedCode,
                null,
                "timeout");
    }
}
