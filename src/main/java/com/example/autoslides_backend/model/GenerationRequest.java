package com.example.autoslides_backend.model;

/**
 * One accepted deck request. Created per call and consumed once by the orchestrator.
 *
 * @param topic             subject of the deck.
 * @param slideCount        number of slides to produce.
 * @param tone              free-form tone hint for the script, e.g. "informative".
 * @param imagesPerSlide    images wanted per slide, zero for text-only decks.
 * @param templateReference optional path of a .pptx/.potx template.
 */
public record GenerationRequest(String topic, int slideCount, String tone, int imagesPerSlide, String templateReference) {

    public static final String DEFAULT_TONE = "neutral";

    public String normalizedTone() {
        return tone != null && !tone.isBlank() ? tone.trim() : DEFAULT_TONE;
    }

    public String normalizedTemplateReference() {
        return templateReference != null && !templateReference.isBlank() ? templateReference.trim() : null;
    }
}
