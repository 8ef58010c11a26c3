package com.example.autoslides_backend.model;

import java.util.List;

/**
 * A laid-out slide: script text, images and regions.
 *
 * @param index    1-based position in the deck.
 * @param title    non-blank title.
 * @param bullets  bullets as rendered, truncated to the character budget.
 * @param notes    speaker notes, never rendered on the slide itself.
 * @param images   images in placement order.
 * @param layout   region assignment.
 * @param warnings non-fatal composition issues for this slide.
 */
public record SlideSpec(int index,
                        String title,
                        List<String> bullets,
                        String notes,
                        List<ImageAsset> images,
                        SlideLayout layout,
                        List<String> warnings) {

    public SlideSpec {
        bullets = bullets == null ? List.of() : List.copyOf(bullets);
        images = images == null ? List.of() : List.copyOf(images);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
