package com.example.autoslides_backend.model;

import com.example.autoslides_backend.exception.ErrorCategory;
import com.example.autoslides_backend.util.PipelineStatus;

import java.util.List;

/**
 * Outcome of one pipeline run. Failed runs never carry an artifact.
 */
public record PipelineResult(PipelineStatus status,
                             String artifactPath,
                             String downloadReference,
                             List<String> warnings,
                             List<SlideSpec> slides,
                             ErrorCategory errorCategory,
                             String errorMessage) {

    public PipelineResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        slides = slides == null ? List.of() : List.copyOf(slides);
    }

    public static PipelineResult completed(String artifactPath, String downloadReference, List<String> warnings, List<SlideSpec> slides) {
        PipelineStatus status = warnings == null || warnings.isEmpty() ? PipelineStatus.SUCCESS : PipelineStatus.PARTIAL_SUCCESS;
        return new PipelineResult(status, artifactPath, downloadReference, warnings, slides, null, null);
    }

    public static PipelineResult failure(ErrorCategory category, String message) {
        return new PipelineResult(PipelineStatus.FAILURE, null, null, List.of(), List.of(), category, message);
    }

    public boolean isFailure() {
        return status == PipelineStatus.FAILURE;
    }
}
