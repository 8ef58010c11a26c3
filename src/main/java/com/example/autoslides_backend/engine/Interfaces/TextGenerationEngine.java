package com.example.autoslides_backend.engine.Interfaces;

public interface TextGenerationEngine {
    record Request(String prompt, String correlationId) {}
    record Completion(String content, String model, String provider) {}

    /**
     * Runs one completion, retrying transient failures internally.
     *
     * @throws com.example.autoslides_backend.exception.GenerationException when no completion can be obtained.
     */
    Completion complete(Request request);
}
