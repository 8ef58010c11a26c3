package com.example.autoslides_backend.service;

import com.example.autoslides_backend.model.ScriptEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the {@code {"slides":[{"title","bullets","notes"}]}} answer of the text model.
 * Tolerates markdown fences and prose around the object, string bullets and missing fields.
 */
@Component
public class ScriptParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScriptParser.class);
    private static final Pattern FENCE = Pattern.compile("```(?:json)?\\s*(.*?)```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private final ObjectMapper objectMapper;

    public ScriptParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ScriptParseOutcome parse(String content, int requested) {
        if (content == null || content.isBlank()) {
            return ScriptParseOutcome.unusable(requested, "empty answer");
        }
        String json = extractObject(content);
        if (json == null) {
            return ScriptParseOutcome.unusable(requested, "no JSON object in answer");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            return ScriptParseOutcome.unusable(requested, "invalid JSON: " + e.getOriginalMessage());
        }
        JsonNode slides = root.path("slides");
        if (!slides.isArray()) {
            return ScriptParseOutcome.unusable(requested, "missing 'slides' array");
        }

        List<ScriptEntry> entries = new ArrayList<>();
        for (JsonNode node : slides) {
            if (entries.size() == requested) {
                LOGGER.debug("ScriptParser dropping extra slides requested={} received={}", requested, slides.size());
                break;
            }
            entries.add(toEntry(node));
        }
        ScriptParseOutcome.Kind kind = entries.size() < requested
                ? ScriptParseOutcome.Kind.SHORTFALL
                : ScriptParseOutcome.Kind.COMPLETE;
        return new ScriptParseOutcome(kind, entries, requested, null);
    }

    private ScriptEntry toEntry(JsonNode node) {
        if (node.isTextual()) {
            return new ScriptEntry(node.asText().trim(), List.of(), null);
        }
        String title = text(node.get("title"));
        List<String> bullets = new ArrayList<>();
        JsonNode rawBullets = node.get("bullets");
        if (rawBullets != null && rawBullets.isArray()) {
            for (JsonNode b : rawBullets) {
                String bullet = text(b);
                if (bullet != null && !bullet.isEmpty()) {
                    bullets.add(bullet);
                }
            }
        } else {
            String single = text(rawBullets);
            if (single != null && !single.isEmpty()) {
                bullets.add(single);
            }
        }
        String notes = text(node.get("notes"));
        return new ScriptEntry(title == null ? "" : title, bullets, notes == null || notes.isEmpty() ? null : notes);
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText().trim();
    }

    private static String extractObject(String content) {
        String body = content.trim();
        Matcher fence = FENCE.matcher(body);
        if (fence.find()) {
            body = fence.group(1).trim();
        }
        int start = body.indexOf('{');
        int end = body.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return body.substring(start, end + 1);
    }
}
