package com.example.autoslides_backend.model;

/**
 * Image found for a slide.
 *
 * @param sourceUrl      remote URL the image was found at; {@code null} for the placeholder.
 * @param localReference path of the downloaded bytes inside the run scratch directory, if any.
 * @param attribution    credit line required by the image provider.
 * @param width          pixel width reported by the provider, if known.
 * @param height         pixel height reported by the provider, if known.
 * @param placeholder    {@code true} for the sentinel drawn when no real image is available.
 */
public record ImageAsset(String sourceUrl,
                         String localReference,
                         String attribution,
                         Integer width,
                         Integer height,
                         boolean placeholder) {

    public static ImageAsset remote(String sourceUrl, String attribution, Integer width, Integer height) {
        return new ImageAsset(sourceUrl, null, attribution, width, height, false);
    }

    public static ImageAsset unavailable() {
        return new ImageAsset(null, null, null, null, null, true);
    }

    public ImageAsset withLocalReference(String path) {
        return new ImageAsset(sourceUrl, path, attribution, width, height, placeholder);
    }

    public boolean hasLocalCopy() {
        return localReference != null && !localReference.isBlank();
    }

    public boolean hasAttribution() {
        return attribution != null && !attribution.isBlank();
    }
}
