package com.example.autoslides_backend.model;

import java.util.List;

/**
 * Ordered slides plus the template they are rendered with.
 */
public record Presentation(String topic, List<SlideSpec> slides, String templateReference) {

    public Presentation {
        slides = slides == null ? List.of() : List.copyOf(slides);
    }
}
