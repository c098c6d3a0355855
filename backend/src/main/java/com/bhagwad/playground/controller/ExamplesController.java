package com.bhagwad.playground.controller;

import com.bhagwad.playground.dto.ExampleProgram;
import com.bhagwad.playground.service.ExampleProgramService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/examples")
public class ExamplesController {

    private static final Logger logger = LoggerFactory.getLogger(ExamplesController.class);

    private final ExampleProgramService exampleService;

    public ExamplesController(ExampleProgramService exampleService) {
        this.exampleService = exampleService;
    }

    @GetMapping
    public ResponseEntity<List<String>> list() {
        return ResponseEntity.ok(exampleService.listNames());
    }

    @GetMapping("/{name}")
    public ResponseEntity<ExampleProgram> get(@PathVariable String name) {
        return exampleService.find(name)
            .map(ResponseEntity::ok)
            .orElseGet(() -> {
                logger.info("Unknown example requested: {}", name);
                return ResponseEntity.notFound().build();
            });
    }
}
