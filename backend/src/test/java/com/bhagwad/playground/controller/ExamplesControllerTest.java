package com.bhagwad.playground.controller;

import com.bhagwad.playground.dto.ExampleProgram;
import com.bhagwad.playground.service.ExampleProgramService;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ExamplesController.class)
public class ExamplesControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ExampleProgramService exampleService;

    @Test
    public void listsExampleNames() throws Exception {
        when(exampleService.listNames()).thenReturn(List.of("hello", "loops"));

        mockMvc.perform(get("/api/examples"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("hello"))
                .andExpect(jsonPath("$[1]").value("loops"));
    }

    @Test
    public void servesExampleSource() throws Exception {
        when(exampleService.find("hello"))
                .thenReturn(Optional.of(new ExampleProgram("hello", "arjuna { manifest \"Om\" }")));

        mockMvc.perform(get("/api/examples/hello"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("hello"))
                .andExpect(jsonPath("$.sourceCode").value("arjuna { manifest \"Om\" }"));
    }

    @Test
    public void unknownExampleIsNotFound() throws Exception {
        when(exampleService.find("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/examples/nope"))
                .andExpect(status().isNotFound());
    }
}
