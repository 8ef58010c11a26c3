package com.example.autoslides_backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record McpResponse(String tool, @JsonProperty("return") Object result) {
}
