package com.bhagwad.playground.controller;

import com.bhagwad.playground.dto.CompileResponse;
import com.bhagwad.playground.service.BhagwadCompilerService;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CompileController.class)
public class CompileControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BhagwadCompilerService compilerService;

    @Test
    public void compileReturnsServiceResponse() throws Exception {
        when(compilerService.compileAndExecute("arjuna { manifest 1 }"))
                .thenReturn(CompileResponse.success("1", "print(1)\n", 12L));

        mockMvc.perform(post("/api/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceCode\":\"arjuna { manifest 1 }\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.output").value("1"))
                .andExpect(jsonPath("$.resultType").value("success"))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    public void compileNormalisesLineEndings() throws Exception {
        when(compilerService.compileAndExecute("arjuna {\nmanifest 1\n}"))
                .thenReturn(CompileResponse.success("1", "print(1)\n", 3L));

        mockMvc.perform(post("/api/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceCode\":\"arjuna {\\r\\nmanifest 1\\r\\n}\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
    }

    @Test
    public void compilationErrorIsStillOk() throws Exception {
        when(compilerService.compileAndExecute(anyString()))
                .thenReturn(CompileResponse.compilationError("line 1, column 19: 'x' is not declared", 1, 19));

        mockMvc.perform(post("/api/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceCode\":\"arjuna { manifest x }\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.resultType").value("compilation_error"))
                .andExpect(jsonPath("$.errorLine").value(1))
                .andExpect(jsonPath("$.errorColumn").value(19));
    }

    @Test
    public void blankSourceIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceCode\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value(startsWith("Validation error: sourceCode")));

        verify(compilerService, never()).compileAndExecute(anyString());
    }

    @Test
    public void unexpectedFailureIsServerError() throws Exception {
        when(compilerService.compileAndExecute(anyString())).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceCode\":\"arjuna { }\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Internal server error: boom"));
    }

    @Test
    public void transpileReturnsGeneratedCode() throws Exception {
        when(compilerService.transpile("arjuna { }"))
                .thenReturn(CompileResponse.transpiled("def __bhagwad_entry_() -> None:\n    pass\n"));

        mockMvc.perform(post("/api/transpile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceCode\":\"arjuna { }\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.generatedCode").value(startsWith("def __bhagwad_entry_()")))
                .andExpect(jsonPath("$.output").doesNotExist());
    }

    @Test
    public void healthCheck() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("Bhagwad Playground Backend is healthy"));
    }
}
