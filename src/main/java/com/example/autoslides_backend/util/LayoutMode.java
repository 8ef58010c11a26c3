package com.example.autoslides_backend.util;

public enum LayoutMode {
    /** Text column left (55%), image column right (45%). */
    TEXT_AND_IMAGES,
    /** No images: the text column takes the full content width. */
    TEXT_ONLY
}
