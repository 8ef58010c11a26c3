package com.example.autoslides_backend.engine;

import com.example.autoslides_backend.config.OpenAIScriptProperties;
import com.example.autoslides_backend.engine.Interfaces.TextGenerationEngine;
import com.example.autoslides_backend.exception.GenerationException;
import com.example.autoslides_backend.exception.PipelineCancelledException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions client that asks for a JSON object answer.
 */
public class OpenAITextGenerationEngine implements TextGenerationEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAITextGenerationEngine.class);
    private static final Duration BLOCK_SLACK = Duration.ofSeconds(30);

    private final WebClient client;
    private final OpenAIScriptProperties props;
    private final ObjectMapper om = new ObjectMapper();

    public OpenAITextGenerationEngine(WebClient client, OpenAIScriptProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public Completion complete(Request request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", props.getModel());
        body.put("messages", List.of(Map.of("role", "user", "content", request.prompt())));
        body.put("response_format", Map.of("type", "json_object"));
        body.put("temperature", props.getTemperature());

        Duration callTimeout = Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));
        Mono<String> mono = client.post()
                .uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(text -> new UpstreamStatusException(resp.statusCode().value(),
                                        "OpenAI chat error %s: %s".formatted(resp.statusCode(), truncate(text, 500)))))
                .bodyToMono(String.class)
                .timeout(callTimeout)
                .retryWhen(Retry.backoff(Math.max(0, props.getMaxRetries()), Duration.ofMillis(props.getRetryBackoffMillis()))
                        .filter(TransientFailures::isRetryable)
                        .doBeforeRetry(signal -> LOGGER.warn(
                                "OpenAI chat retry attempt={} correlationId={} cause={}",
                                signal.totalRetriesInARow() + 1,
                                request.correlationId(),
                                TransientFailures.describe(signal.failure())))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));

        String payload;
        try {
            payload = mono.block(blockTimeout(callTimeout));
        } catch (RuntimeException ex) {
            if (TransientFailures.isInterruption(ex)) {
                Thread.currentThread().interrupt();
                throw new PipelineCancelledException("Text generation interrupted correlationId=" + request.correlationId(), ex);
            }
            UpstreamStatusException status = TransientFailures.findCause(ex, UpstreamStatusException.class);
            if (status != null && status.isAuthFailure()) {
                throw new GenerationException("Text generation rejected the credentials (HTTP " + status.getStatus() + ")", ex);
            }
            throw new GenerationException("Text generation failed: " + TransientFailures.describe(ex), ex);
        }
        if (payload == null || payload.isBlank()) {
            throw new GenerationException("Empty response from text generation");
        }

        JsonNode root;
        try {
            root = om.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new GenerationException("Text generation returned a non-JSON envelope", e);
        }
        JsonNode message = root.path("choices").path(0).path("message");
        String content = message.path("content").asText(null);
        if (content == null || content.isBlank()) {
            throw new GenerationException("Text generation returned no message content");
        }
        String model = root.path("model").asText(props.getModel());
        LOGGER.debug("OpenAI chat DONE correlationId={} model={} length={}", request.correlationId(), model, content.length());
        return new Completion(content, model, "openai");
    }

    private Duration blockTimeout(Duration callTimeout) {
        long attempts = Math.max(0, props.getMaxRetries()) + 1L;
        Duration backoffBudget = Duration.ofMillis(props.getRetryBackoffMillis()).multipliedBy(1L << Math.min(attempts, 10));
        return callTimeout.multipliedBy(attempts).plus(backoffBudget).plus(BLOCK_SLACK);
    }

    private static String truncate(String value, int max) {
        if (value == null) return "";
        return value.length() <= max ? value : value.substring(0, max) + "...";
    }
}
