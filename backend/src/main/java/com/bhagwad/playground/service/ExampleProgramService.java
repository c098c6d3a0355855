package com.bhagwad.playground.service;

import com.bhagwad.playground.dto.ExampleProgram;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Serves the sample programs bundled under {@code classpath:examples/}. They are read once at
 * start-up; a name is the file name without the {@code .bhagwad} extension.
 */
@Service
public class ExampleProgramService {

    private static final Logger logger = LoggerFactory.getLogger(ExampleProgramService.class);

    static final String LOCATION_PATTERN = "classpath:examples/*.bhagwad";
    private static final String EXTENSION = ".bhagwad";

    private final Map<String, String> examples;

    public ExampleProgramService() {
        this(new PathMatchingResourcePatternResolver());
    }

    ExampleProgramService(ResourcePatternResolver resolver) {
        this.examples = load(resolver);
        logger.info("Loaded {} example programs: {}", examples.size(), examples.keySet());
    }

    public List<String> listNames() {
        return new ArrayList<>(examples.keySet());
    }

    public Optional<ExampleProgram> find(String name) {
        String source = examples.get(name);
        return source == null ? Optional.empty() : Optional.of(new ExampleProgram(name, source));
    }

    private static Map<String, String> load(ResourcePatternResolver resolver) {
        Map<String, String> loaded = new TreeMap<>();
        try {
            for (Resource resource : resolver.getResources(LOCATION_PATTERN)) {
                String fileName = resource.getFilename();
                if (fileName == null || !fileName.endsWith(EXTENSION)) {
                    continue;
                }
                String name = fileName.substring(0, fileName.length() - EXTENSION.length());
                loaded.put(name, resource.getContentAsString(StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load example programs from " + LOCATION_PATTERN, e);
        }
        return loaded;
    }
}
