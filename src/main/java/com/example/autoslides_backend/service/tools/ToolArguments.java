package com.example.autoslides_backend.service.tools;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Argument shapes of the invocable tools. Unknown argument names are rejected by {@link ToolService}.
 */
public final class ToolArguments {
    private ToolArguments() {}

    public record WriteScript(String topic, @JsonAlias("slide_count") Integer slides, String tone) {}

    public record FetchImages(String query, @JsonAlias("count") Integer n, String orientation) {}

    /** {@code images} entries are URL strings or asset objects; {@code topic} names a blank title. */
    public record CreateSlide(String title, List<String> bullets, List<JsonNode> images, String notes, Integer index,
                              String topic) {}

    public record ExportArtifact(List<ExportSlide> slides,
                                 @JsonProperty("template_reference") @JsonAlias("templateReference") String templateReference,
                                 String topic,
                                 String filename) {}

    /** A slide as returned by {@code create_slide}; the layout is recomputed on export. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExportSlide(String title, List<String> bullets, List<JsonNode> images, String notes) {}
}
