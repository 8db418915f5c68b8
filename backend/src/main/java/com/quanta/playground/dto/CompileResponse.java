package com.quanta.playground.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompileResponse(
        boolean success,
        String output,
        String generatedCode,
        String error,
        Long executionTimeMs,
        String resultType
) {

    public static CompileResponse success(String output, String generatedCode, long executionTimeMs) {
        return new CompileResponse(
                true,
                output,
                generatedCode,
                null,
                executionTimeMs,
                "success");
    }

    public static CompileResponse compilationError(String error) {
        return new CompileResponse(
                false,
                null,
                null,
                error,
                null,
                "compilation_error");
    }

    public static CompileResponse runtimeError(String error, String generatedCode, long executionTimeMs) {
        return new CompileResponse(
                false,
                null,
                generatedCode,
                error,
                executionTimeMs,
                "runtime_error");
    }

    public static CompileResponse timeout(String message, String generatedCode) {
        return new CompileResponse(
                false,
                null,
                generatedCode,
                message,
                null,
                "timeout");
    }
}
