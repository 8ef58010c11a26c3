package com.example.autoslides_backend.engine;

import com.example.autoslides_backend.config.UnsplashProperties;
import com.example.autoslides_backend.engine.Interfaces.ImageSearchEngine;
import com.example.autoslides_backend.exception.ImageFetchException;
import com.example.autoslides_backend.model.ImageAsset;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Unsplash photo search. Pages through {@code /search/photos} until enough results are collected.
 */
public class UnsplashImageSearchEngine implements ImageSearchEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(UnsplashImageSearchEngine.class);
    private static final int UNSPLASH_PAGE_LIMIT = 30;

    private final WebClient client;
    private final UnsplashProperties props;
    private final ObjectMapper om = new ObjectMapper();

    public UnsplashImageSearchEngine(WebClient client, UnsplashProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public List<ImageAsset> search(Query query) {
        int wanted = query.count();
        int perPage = Math.max(1, Math.min(Math.min(props.getMaxPerPage(), UNSPLASH_PAGE_LIMIT), wanted));
        String orientation = query.orientation() != null && !query.orientation().isBlank()
                ? query.orientation()
                : props.getOrientation();

        List<ImageAsset> collected = new ArrayList<>();
        int page = 1;
        while (collected.size() < wanted) {
            JsonNode payload;
            try {
                payload = fetchPage(query.text(), page, perPage, orientation);
            } catch (ImageFetchException ex) {
                if (collected.isEmpty()) {
                    throw ex;
                }
                LOGGER.warn("Unsplash paging stopped early query='{}' page={} collected={} cause={}",
                        query.text(), page, collected.size(), ex.getMessage());
                break;
            }
            JsonNode results = payload.path("results");
            if (!results.isArray() || results.isEmpty()) {
                break;
            }
            for (JsonNode photo : results) {
                toAsset(photo).ifPresent(collected::add);
            }
            page++;
            if (page > payload.path("total_pages").asInt(0)) {
                break;
            }
        }
        return collected.size() > wanted ? List.copyOf(collected.subList(0, wanted)) : List.copyOf(collected);
    }

    private JsonNode fetchPage(String text, int page, int perPage, String orientation) {
        String body;
        try {
            body = client.get()
                    .uri(builder -> {
                        builder.path("/search/photos")
                                .queryParam("query", "{query}")
                                .queryParam("page", page)
                                .queryParam("per_page", perPage);
                        if (orientation != null && !orientation.isBlank()) {
                            builder.queryParam("orientation", orientation);
                        }
                        return builder.build(text);
                    })
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(err -> new UpstreamStatusException(resp.statusCode().value(),
                                            "Unsplash API error %s: %s".formatted(resp.statusCode(), err))))
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds())))
                    .retryWhen(Retry.backoff(Math.max(0, props.getMaxRetries()), Duration.ofMillis(props.getRetryBackoffMillis()))
                            .filter(TransientFailures::isRetryable)
                            .doBeforeRetry(signal -> LOGGER.warn(
                                    "Unsplash retry attempt={} query='{}' page={} cause={}",
                                    signal.totalRetriesInARow() + 1, text, page,
                                    TransientFailures.describe(signal.failure())))
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .block();
        } catch (RuntimeException ex) {
            if (TransientFailures.isInterruption(ex)) {
                Thread.currentThread().interrupt();
            }
            throw new ImageFetchException("Unsplash search failed for '" + text + "': " + TransientFailures.describe(ex), ex);
        }
        if (body == null || body.isBlank()) {
            throw new ImageFetchException("Unsplash returned an empty body for '" + text + "'");
        }
        try {
            return om.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ImageFetchException("Unsplash returned malformed JSON for '" + text + "'", e);
        }
    }

    private Optional<ImageAsset> toAsset(JsonNode photo) {
        String url = textOrNull(photo.path("urls"), "regular");
        if (url == null) {
            return Optional.empty();
        }
        String author = textOrNull(photo.path("user"), "name");
        String attribution = author != null ? "Photo by " + author + " on Unsplash" : "Photo from Unsplash";
        String page = textOrNull(photo.path("links"), "html");
        if (page != null) {
            attribution = attribution + " (" + page + ")";
        }
        Integer width = photo.hasNonNull("width") ? photo.get("width").asInt() : null;
        Integer height = photo.hasNonNull("height") ? photo.get("height").asInt() : null;
        return Optional.of(ImageAsset.remote(url, attribution, width, height));
    }

    private String textOrNull(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field)) {
            return null;
        }
        String value = node.get(field).asText();
        return value != null && !value.isBlank() ? value : null;
    }
}
