package com.quanta.playground.controller;

import com.quanta.playground.dto.CompileResponse;
import com.quanta.playground.dto.TranslateResponse;
import com.quanta.playground.service.QuantaCompilerService;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CompileController.class)
class CompileControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private QuantaCompilerService compilerService;

    @Test
    void compileReturnsServiceResponse() throws Exception {
        when(compilerService.compileAndExecute("write 1"))
                .thenReturn(CompileResponse.success("1", "print(1)", 12));

        mockMvc.perform(post("/api/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceCode\": \"write 1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.output").value("1"))
                .andExpect(jsonPath("$.generatedCode").value("print(1)"))
                .andExpect(jsonPath("$.resultType").value("success"))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void lineEndingsAreNormalizedBeforeCompiling() throws Exception {
        when(compilerService.compileAndExecute(anyString()))
                .thenReturn(CompileResponse.success("", "", 0));

        mockMvc.perform(post("/api/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceCode\": \"let x = 1\\r\\nwrite x\\r\"}"))
                .andExpect(status().isOk());

        verify(compilerService).compileAndExecute("let x = 1\nwrite x\n");
    }

    @Test
    void blankSourceIsAValidationError() throws Exception {
        mockMvc.perform(post("/api/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceCode\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.resultType").value("compilation_error"))
                .andExpect(jsonPath("$.error", startsWith("Validation error: sourceCode")));
    }

    @Test
    void unexpectedFailureIsInternalServerError() throws Exception {
        when(compilerService.compileAndExecute(anyString())).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceCode\": \"write 1\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Internal server error: boom"));
    }

    @Test
    void translateReturnsGeneratedCode() throws Exception {
        when(compilerService.translate("let x end")).thenReturn(TranslateResponse.success("x = None"));

        mockMvc.perform(post("/api/translate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceCode\": \"let x end\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.generatedCode").value("x = None"));
    }

    @Test
    void health() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("Quanta Playground Backend is healthy"));
    }
}
