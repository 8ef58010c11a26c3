package com.example.autoslides_backend.engine.Interfaces;

import com.example.autoslides_backend.model.ImageAsset;

import java.util.List;

public interface ImageSearchEngine {
    record Query(String text, int count, String orientation) {}

    /**
     * Searches images for the query, retrying rate limits and transient failures internally.
     *
     * @return at most {@code query.count()} assets in provider order.
     * @throws com.example.autoslides_backend.exception.ImageFetchException when the service stays unusable.
     */
    List<ImageAsset> search(Query query);
}
