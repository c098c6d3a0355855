package com.bhagwad.playground.controller;

import com.bhagwad.playground.dto.CompileRequest;
import com.bhagwad.playground.dto.CompileResponse;
import com.bhagwad.playground.service.BhagwadCompilerService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api")
@Validated
public class CompileController {

    private static final Logger logger = LoggerFactory.getLogger(CompileController.class);

    private final BhagwadCompilerService compilerService;

    public CompileController(BhagwadCompilerService compilerService) {
        this.compilerService = compilerService;
    }

    @PostMapping("/compile")
    public ResponseEntity<CompileResponse> compile(@Valid @RequestBody CompileRequest request) {
        logger.info("Received compilation request (length: {} chars)", request.sourceCode().length());

        try {
            CompileResponse response = compilerService.compileAndExecute(request.sanitizedSourceCode());

            logger.info("Compilation completed - Success: {}, Type: {}",
                       response.success(), response.resultType());

            return ResponseEntity.ok(response);

        } catch (Exception e) {
            logger.error("Unexpected error during compilation: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError()
                .body(CompileResponse.compilationError("Internal server error: " + e.getMessage()));
        }
    }

    @PostMapping("/transpile")
    public ResponseEntity<CompileResponse> transpile(@Valid @RequestBody CompileRequest request) {
        logger.info("Received transpile request (length: {} chars)", request.sourceCode().length());

        try {
            return ResponseEntity.ok(compilerService.transpile(request.sanitizedSourceCode()));
        } catch (Exception e) {
            logger.error("Unexpected error during transpilation: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError()
                .body(CompileResponse.compilationError("Internal server error: " + e.getMessage()));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Bhagwad Playground Backend is healthy");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<CompileResponse> handleValidationException(MethodArgumentNotValidException e) {
        StringBuilder errorMessage = new StringBuilder("Validation error: ");

        e.getBindingResult().getFieldErrors().forEach(error ->
            errorMessage.append(error.getField())
                       .append(" - ")
                       .append(error.getDefaultMessage())
                       .append("; ")
        );

        logger.warn("Validation error: {}", errorMessage);

        return ResponseEntity.badRequest().body(CompileResponse.compilationError(errorMessage.toString()));
    }
}
