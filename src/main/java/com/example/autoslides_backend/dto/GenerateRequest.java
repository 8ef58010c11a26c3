package com.example.autoslides_backend.dto;

import com.example.autoslides_backend.model.GenerationRequest;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Request payload for {@code POST /generate}. Upper bounds come from {@code deck.max-slides} and
 * {@code deck.max-images-per-slide} and are checked by the orchestrator.
 */
public record GenerateRequest(
        @Schema(example = "Wind energy")
        @NotBlank String topic,
        @JsonProperty("slide_count") @JsonAlias("slides")
        @Min(1) Integer slideCount,
        @Schema(example = "inspiring")
        String tone,
        @JsonProperty("images_per_slide")
        @Min(0) Integer imagesPerSlide,
        @JsonProperty("template_reference")
        String templateReference
) {
    public static final int DEFAULT_SLIDES = 6;
    public static final int DEFAULT_IMAGES_PER_SLIDE = 1;

    public GenerationRequest toGenerationRequest() {
        return new GenerationRequest(
                topic,
                slideCount != null ? slideCount : DEFAULT_SLIDES,
                tone != null && !tone.isBlank() ? tone.trim() : GenerationRequest.DEFAULT_TONE,
                imagesPerSlide != null ? imagesPerSlide : DEFAULT_IMAGES_PER_SLIDE,
                templateReference);
    }
}
