package com.example.autoslides_backend.dto;

import com.example.autoslides_backend.model.PipelineResult;
import com.example.autoslides_backend.util.PipelineStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record GenerateResponse(
        PipelineStatus status,
        @JsonProperty("artifact_path") String artifactPath,
        @JsonProperty("download_reference") String downloadReference,
        @JsonProperty("slide_count") int slideCount,
        List<String> warnings
) {
    public static GenerateResponse from(PipelineResult result) {
        return new GenerateResponse(result.status(), result.artifactPath(), result.downloadReference(),
                result.slides().size(), result.warnings());
    }
}
