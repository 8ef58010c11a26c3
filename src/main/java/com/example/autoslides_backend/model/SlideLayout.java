package com.example.autoslides_backend.model;

import com.example.autoslides_backend.util.LayoutMode;

import java.util.List;

/**
 * Region assignment of a composed slide.
 *
 * @param mode         whether the image column is present.
 * @param title        top band holding the title.
 * @param text         bullet column.
 * @param imageArea    image column; {@link Region#EMPTY} when the slide has no images.
 * @param imageSlots   one region per placed image, in image order.
 * @param bodyFontSize bullet font size in points.
 */
public record SlideLayout(LayoutMode mode,
                          Region title,
                          Region text,
                          Region imageArea,
                          List<Region> imageSlots,
                          double bodyFontSize) {

    public SlideLayout {
        imageSlots = imageSlots == null ? List.of() : List.copyOf(imageSlots);
    }
}
