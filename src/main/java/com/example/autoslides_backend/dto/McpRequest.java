package com.example.autoslides_backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Tool invocation: the tool name plus its named arguments.
 */
public record McpRequest(
        @Schema(example = "write_script")
        @NotBlank String tool,
        Map<String, Object> args
) {
    public Map<String, Object> argsOrEmpty() {
        return args != null ? args : Map.of();
    }
}
