package com.bhagwad.playground.service;

import com.bhagwad.playground.compiler.BhagwadCompiler;
import com.bhagwad.playground.config.BhagwadCompilerProperties;
import com.bhagwad.playground.dto.CompileResponse;
import com.bhagwad.playground.exception.CompilationException;
import com.bhagwad.playground.exception.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

@Service
public class BhagwadCompilerService {

    private static final Logger logger = LoggerFactory.getLogger(BhagwadCompilerService.class);

    private static final String SCRIPT_NAME = "main.py";
    private static final String OUTPUT_NAME = "output.txt";

    private final BhagwadCompilerProperties properties;
    private final BhagwadCompiler compiler;

    public BhagwadCompilerService(BhagwadCompilerProperties properties, BhagwadCompiler compiler) {
        this.properties = properties;
        this.compiler = compiler;
    }

    public CompileResponse compileAndExecute(String sourceCode) {
        CompileResponse rejected = checkSource(sourceCode);
        if (rejected != null) {
            return rejected;
        }

        String sessionId = UUID.randomUUID().toString().substring(0, 8);
        long startTime = System.currentTimeMillis();

        String python;
        try {
            python = compiler.compile(sourceCode);
        } catch (CompilationException e) {
            logger.info("Compilation failed for session {}: {}", sessionId, e.describe());
            return CompileResponse.compilationError(e.describe(), e.getLine(), e.getColumn());
        }

        Path sessionDir = Path.of(properties.tempDirectory()).resolve("session_" + sessionId);
        try {
            Files.createDirectories(sessionDir);
            Path script = sessionDir.resolve(SCRIPT_NAME);
            Files.writeString(script, python, StandardCharsets.UTF_8);
            logger.info("Created temporary script: {}", script);

            ExecutionResult result = executeScript(sessionDir);
            long executionTime = System.currentTimeMillis() - startTime;

            if (result.timedOut()) {
                return CompileResponse.timeout(
                        "Program execution timeout exceeded (" + properties.executionTimeoutMs() + " ms)", python);
            }
            if (result.success()) {
                return CompileResponse.success(result.output(), python, executionTime);
            }
            return CompileResponse.runtimeError(result.output(), python, executionTime);

        } catch (ExecutionException e) {
            long executionTime = System.currentTimeMillis() - startTime;
            logger.error("Execution failed for session {}: {}", sessionId, e.getMessage());
            return CompileResponse.runtimeError(e.getMessage(), python, executionTime);
        } catch (IOException e) {
            logger.error("Unexpected error for session {}: {}", sessionId, e.getMessage(), e);
            return CompileResponse.compilationError("Internal server error: " + e.getMessage());
        } finally {
            cleanupDirectory(sessionDir);
        }
    }

    /**
     * Compiles without running anything; the response carries the generated Python.
     */
    public CompileResponse transpile(String sourceCode) {
        CompileResponse rejected = checkSource(sourceCode);
        if (rejected != null) {
            return rejected;
        }
        try {
            return CompileResponse.transpiled(compiler.compile(sourceCode));
        } catch (CompilationException e) {
            logger.info("Transpilation failed: {}", e.describe());
            return CompileResponse.compilationError(e.describe(), e.getLine(), e.getColumn());
        }
    }

    private CompileResponse checkSource(String sourceCode) {
        if (sourceCode == null || sourceCode.trim().isEmpty()) {
            return CompileResponse.compilationError("Source code cannot be empty");
        }
        if (sourceCode.length() > properties.maxSourceCodeLength()) {
            return CompileResponse.compilationError(
                "Source code exceeds maximum length of " + properties.maxSourceCodeLength() + " characters"
            );
        }
        return null;
    }

    private ExecutionResult executeScript(Path sessionDir) throws ExecutionException {
        Path outputFile = sessionDir.resolve(OUTPUT_NAME);
        // -I ignores PYTHON* variables, so UTF-8 output is requested with -X utf8
        ProcessBuilder processBuilder = new ProcessBuilder(
                properties.pythonPath(), "-I", "-X", "utf8", SCRIPT_NAME);
        processBuilder.directory(sessionDir.toFile());
        processBuilder.redirectErrorStream(true);
        processBuilder.redirectOutput(outputFile.toFile());

        try {
            logger.info("Executing program: {} {}", properties.pythonPath(), sessionDir.resolve(SCRIPT_NAME));
            Process process = processBuilder.start();

            boolean finished = process.waitFor(properties.executionTimeoutMs(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(2, TimeUnit.SECONDS);
                logger.warn("Program in {} exceeded {} ms and was killed", sessionDir, properties.executionTimeoutMs());
                return new ExecutionResult(false, true, "");
            }

            String output = readOutput(outputFile);
            int exitCode = process.exitValue();
            logger.info("Program execution finished with exit code: {}", exitCode);
            return new ExecutionResult(exitCode == 0, false, output);

        } catch (IOException e) {
            throw new ExecutionException("Failed to execute program: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionException("Interrupted while waiting for program", e);
        }
    }

    private String readOutput(Path outputFile) throws IOException {
        if (!Files.exists(outputFile)) {
            return "";
        }
        String output = Files.readString(outputFile, StandardCharsets.UTF_8).strip();
        if (output.length() > properties.maxOutputLength()) {
            output = output.substring(0, properties.maxOutputLength()) + "\n... (output truncated)";
        }
        return output;
    }

    private void cleanupDirectory(Path directory) {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder())
                    .forEach(path -> {
                        try {
                            Files.delete(path);
                        } catch (IOException e) {
                            logger.warn("Failed to delete: {}", path, e);
                        }
                    });
            logger.debug("Cleaned up isolated directory: {}", directory);
        } catch (IOException e) {
            logger.warn("Failed to cleanup directory: {}", directory, e);
        }
    }

    private record ExecutionResult(boolean success, boolean timedOut, String output) {}
}
