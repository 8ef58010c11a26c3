package com.example.autoslides_backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Axis-aligned rectangle on the slide canvas, in points.
 */
public record Region(double x, double y, double width, double height) {

    public static final Region EMPTY = new Region(0, 0, 0, 0);

    @JsonIgnore
    public boolean isEmpty() {
        return width <= 0 || height <= 0;
    }
}
