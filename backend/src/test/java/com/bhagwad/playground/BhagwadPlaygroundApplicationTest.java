package com.bhagwad.playground;

import com.bhagwad.playground.config.BhagwadCompilerProperties;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "bhagwad.compiler.execution-timeout-ms=2500")
@AutoConfigureMockMvc
public class BhagwadPlaygroundApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private BhagwadCompilerProperties properties;

    @Test
    public void propertiesAreBound() {
        assertEquals(2500L, properties.executionTimeoutMs());
        assertEquals(10000, properties.maxSourceCodeLength());
    }

    @Test
    public void transpilesThroughTheWholeStack() throws Exception {
        mockMvc.perform(post("/api/transpile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceCode\":\"arjuna { manifest \\\"Om\\\" }\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.generatedCode").value(containsString("print(\"Om\")")));
    }

    @Test
    public void bundledExamplesAreListed() throws Exception {
        mockMvc.perform(get("/api/examples"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").value(hasItem("hello")));
    }
}
