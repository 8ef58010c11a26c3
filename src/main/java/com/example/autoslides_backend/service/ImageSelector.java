package com.example.autoslides_backend.service;

import com.example.autoslides_backend.model.ImageAsset;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Chooses the images of every slide from its search candidates, in slide order, so that the deck
 * repeats an image only when a slide has nothing new left.
 */
@Component
public class ImageSelector {

    /**
     * @param candidatesBySlide search results per slide, index 0 is slide 1.
     * @param perSlide          images wanted on each slide.
     * @return selected images per slide, same size and order as the input.
     */
    public List<List<ImageAsset>> select(List<List<ImageAsset>> candidatesBySlide, int perSlide) {
        List<List<ImageAsset>> selection = new ArrayList<>(candidatesBySlide.size());
        Set<String> used = new HashSet<>();
        for (List<ImageAsset> candidates : candidatesBySlide) {
            if (perSlide <= 0 || candidates == null || candidates.isEmpty()) {
                selection.add(List.of());
                continue;
            }
            List<ImageAsset> chosen = new ArrayList<>(perSlide);
            Set<String> onSlide = new HashSet<>();
            for (ImageAsset candidate : candidates) {
                if (chosen.size() == perSlide) break;
                if (candidate == null || candidate.sourceUrl() == null) continue;
                if (!used.contains(candidate.sourceUrl()) && onSlide.add(candidate.sourceUrl())) {
                    chosen.add(candidate);
                }
            }
            // exhausted: fall back to images already shown on earlier slides
            for (ImageAsset candidate : candidates) {
                if (chosen.size() == perSlide) break;
                if (candidate == null || candidate.sourceUrl() == null) continue;
                if (onSlide.add(candidate.sourceUrl())) {
                    chosen.add(candidate);
                }
            }
            for (ImageAsset asset : chosen) {
                used.add(asset.sourceUrl());
            }
            selection.add(List.copyOf(chosen));
        }
        return selection;
    }
}
