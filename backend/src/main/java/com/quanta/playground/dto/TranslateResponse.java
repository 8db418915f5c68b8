package com.quanta.playground.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TranslateResponse(
        boolean success,
        String generatedCode,
        String error) {

    public static TranslateResponse success(String generatedCode) {
        return new TranslateResponse(true, generatedCode, null);
    }

    public static TranslateResponse error(String error) {
        return new TranslateResponse(false, null, error);
    }
}
