package com.quanta.playground.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;

/**
 * Settings of the {@code index.quanta} runner.
 */
@ConfigurationProperties(prefix = "quanta.runner")
@Validated
public record QuantaRunnerProperties(
    @DefaultValue("false")
    boolean enabled,

    @NotBlank
    @DefaultValue(".")
    String directory,

    @NotBlank
    @DefaultValue("index.quanta")
    String fileName
) {
}
