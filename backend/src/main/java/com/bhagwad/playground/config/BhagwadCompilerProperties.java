package com.bhagwad.playground.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

@ConfigurationProperties(prefix = "bhagwad.compiler")
@Validated
public record BhagwadCompilerProperties(
    @NotBlank
    String pythonPath,

    @NotBlank
    String tempDirectory,

    @Positive
    Long executionTimeoutMs,

    @Positive
    Integer maxSourceCodeLength,

    @Positive
    Integer maxOutputLength
) {

    public BhagwadCompilerProperties {
        if (pythonPath == null) {
            pythonPath = "python3";
        }
        if (tempDirectory == null) {
            tempDirectory = System.getProperty("java.io.tmpdir") + "/bhagwad";
        }
        if (executionTimeoutMs == null) {
            executionTimeoutMs = 10000L;
        }
        if (maxSourceCodeLength == null) {
            maxSourceCodeLength = 10000;
        }
        if (maxOutputLength == null) {
            maxOutputLength = 50000;
        }
    }
}
