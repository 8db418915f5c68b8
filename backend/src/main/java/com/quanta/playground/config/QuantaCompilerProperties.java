package com.quanta.playground.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;

@ConfigurationProperties(prefix = "quanta.compiler")
@Validated
public record QuantaCompilerProperties(
    @NotBlank
    @DefaultValue("python3")
    String pythonPath,

    @NotBlank
    @DefaultValue("/tmp/quanta-playground")
    String tempDirectory,

    @Positive
    @DefaultValue("10000")
    Long executionTimeoutMs,

    @Positive
    @DefaultValue("10000")
    Integer maxSourceCodeLength,

    @Positive
    @DefaultValue("50000")
    Integer maxOutputLength,

    @NotEmpty
    @DefaultValue("    ")
    String indentUnit,

    @DefaultValue("true")
    boolean endMarkers
) {
}
