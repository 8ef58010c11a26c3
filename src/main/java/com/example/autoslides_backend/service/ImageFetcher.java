package com.example.autoslides_backend.service;

import com.example.autoslides_backend.config.UnsplashProperties;
import com.example.autoslides_backend.engine.Interfaces.ImageSearchEngine;
import com.example.autoslides_backend.engine.TransientFailures;
import com.example.autoslides_backend.engine.UpstreamStatusException;
import com.example.autoslides_backend.exception.ImageFetchException;
import com.example.autoslides_backend.exception.InvalidRequestException;
import com.example.autoslides_backend.model.ImageAsset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Image search and download for slides. Service failures degrade to "no images" and never abort a run.
 */
@Service
public class ImageFetcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImageFetcher.class);
    public static final int MAX_COUNT = 50;
    static final int MAX_IMAGE_BYTES = 10 * 1024 * 1024;

    private final ImageSearchEngine searchEngine;
    private final WebClient downloadClient;
    private final UnsplashProperties props;

    public ImageFetcher(ImageSearchEngine searchEngine,
                        @Qualifier("imageDownloadWebClient") WebClient downloadClient,
                        UnsplashProperties props) {
        this.searchEngine = searchEngine;
        this.downloadClient = downloadClient;
        this.props = props;
    }

    public List<ImageAsset> fetch(String query, int count) {
        return fetch(query, count, null);
    }

    /**
     * @param orientation optional {@code landscape}, {@code portrait} or {@code squarish}.
     * @return at most {@code count} assets in provider order; empty when the service is unavailable.
     */
    public List<ImageAsset> fetch(String query, int count, String orientation) {
        if (query == null || query.isBlank()) {
            throw new InvalidRequestException("image query must not be blank");
        }
        if (count < 0 || count > MAX_COUNT) {
            throw new InvalidRequestException("image count must be between 0 and " + MAX_COUNT + ", got " + count);
        }
        if (count == 0) {
            return List.of();
        }
        try {
            List<ImageAsset> found = searchEngine.search(new ImageSearchEngine.Query(query.trim(), count, orientation));
            LOGGER.debug("ImageFetcher DONE query='{}' wanted={} found={}", query, count, found.size());
            return found.size() > count ? List.copyOf(found.subList(0, count)) : List.copyOf(found);
        } catch (ImageFetchException e) {
            LOGGER.warn("ImageFetcher degraded to empty query='{}' cause={}", query, e.getMessage());
            return List.of();
        }
    }

    /**
     * Stores the image bytes in {@code directory}.
     *
     * @return the asset with its local reference set, or empty when the bytes could not be obtained.
     */
    public Optional<ImageAsset> download(ImageAsset asset, Path directory) {
        if (asset == null || asset.placeholder() || asset.sourceUrl() == null) {
            return Optional.empty();
        }
        byte[] bytes;
        try {
            bytes = fetchBytes(asset.sourceUrl());
        } catch (ImageFetchException e) {
            LOGGER.warn("ImageFetcher download failed url={} cause={}", asset.sourceUrl(), e.getMessage());
            return Optional.empty();
        }
        String extension = extensionFor(bytes);
        if (extension == null) {
            LOGGER.warn("ImageFetcher unsupported image format url={} size={}", asset.sourceUrl(), bytes.length);
            return Optional.empty();
        }
        if (Thread.currentThread().isInterrupted()) {
            LOGGER.debug("ImageFetcher download abandoned url={}", asset.sourceUrl());
            return Optional.empty();
        }
        if (!Files.isDirectory(directory)) {
            // the run owning this directory has already finished
            LOGGER.warn("ImageFetcher scratch directory gone url={} dir={}", asset.sourceUrl(), directory);
            return Optional.empty();
        }
        try {
            Path target = directory.resolve(sha256(asset.sourceUrl()) + extension);
            if (!Files.exists(target)) {
                Files.write(target, bytes);
            }
            return Optional.of(asset.withLocalReference(target.toString()));
        } catch (IOException e) {
            LOGGER.warn("ImageFetcher could not store image url={} dir={} cause={}", asset.sourceUrl(), directory, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Downloads raw image bytes with the same retry policy as the search.
     *
     * @throws ImageFetchException when the bytes cannot be obtained or exceed the size limit.
     */
    public byte[] fetchBytes(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new ImageFetchException("Invalid image URL: " + url, e);
        }
        if (uri.getScheme() == null || !(uri.getScheme().equals("http") || uri.getScheme().equals("https"))) {
            throw new ImageFetchException("Unsupported image URL scheme: " + url);
        }
        byte[] bytes;
        try {
            bytes = downloadClient.get()
                    .uri(uri)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp -> resp.releaseBody()
                            .then(Mono.just(new UpstreamStatusException(
                                    resp.statusCode().value(), "Image download error " + resp.statusCode()))))
                    .bodyToMono(byte[].class)
                    .timeout(Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds())))
                    .retryWhen(Retry.backoff(Math.max(0, props.getMaxRetries()), Duration.ofMillis(props.getRetryBackoffMillis()))
                            .filter(TransientFailures::isRetryable)
                            .doBeforeRetry(signal -> LOGGER.warn("Image download retry attempt={} url={} cause={}",
                                    signal.totalRetriesInARow() + 1, url, TransientFailures.describe(signal.failure())))
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .block();
        } catch (RuntimeException e) {
            if (TransientFailures.isInterruption(e)) {
                Thread.currentThread().interrupt();
            }
            throw new ImageFetchException("Image download failed for " + url + ": " + TransientFailures.describe(e), e);
        }
        if (bytes == null || bytes.length == 0) {
            throw new ImageFetchException("Image download returned no bytes for " + url);
        }
        if (bytes.length > MAX_IMAGE_BYTES) {
            throw new ImageFetchException("Image larger than " + MAX_IMAGE_BYTES + " bytes: " + url);
        }
        return bytes;
    }

    /** File extension derived from the magic bytes; {@code null} when the format cannot be embedded. */
    static String extensionFor(byte[] bytes) {
        if (bytes == null || bytes.length < 4) return null;
        if ((bytes[0] & 0xFF) == 0xFF && (bytes[1] & 0xFF) == 0xD8 && (bytes[2] & 0xFF) == 0xFF) return ".jpg";
        if ((bytes[0] & 0xFF) == 0x89 && bytes[1] == 'P' && bytes[2] == 'N' && bytes[3] == 'G') return ".png";
        if (bytes[0] == 'G' && bytes[1] == 'I' && bytes[2] == 'F') return ".gif";
        if (bytes[0] == 'B' && bytes[1] == 'M') return ".bmp";
        return null;
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
