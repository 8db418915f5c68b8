package com.quanta.playground.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CompileRequest(
    @NotBlank(message = "Source code cannot be blank")
    @Size(max = 10000, message = "Source code cannot exceed 10,000 characters")
    String sourceCode
) {

    /**
     * Source with NUL characters removed and line endings normalized to {@code \n}.
     */
    public String normalizedSourceCode() {
        if (sourceCode == null) {
            return "";
        }

        return sourceCode
            .replace("\0", "")
            .replace("\r\n", "\n")
            .replace("\r", "\n");
    }
}
