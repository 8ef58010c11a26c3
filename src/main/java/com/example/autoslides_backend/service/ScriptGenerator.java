package com.example.autoslides_backend.service;

import com.example.autoslides_backend.config.DeckProperties;
import com.example.autoslides_backend.engine.Interfaces.TextGenerationEngine;
import com.example.autoslides_backend.exception.GenerationException;
import com.example.autoslides_backend.exception.InvalidRequestException;
import com.example.autoslides_backend.model.GenerationRequest;
import com.example.autoslides_backend.model.ScriptEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Produces the slide script for a topic with a single text-generation call.
 */
@Service
public class ScriptGenerator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScriptGenerator.class);

    /**
     * Script plus the 1-based indices of slides that had to be padded with placeholder content.
     */
    public record GeneratedScript(List<ScriptEntry> entries, List<Integer> paddedSlides) {
        public GeneratedScript {
            entries = List.copyOf(entries);
            paddedSlides = List.copyOf(paddedSlides);
        }
    }

    private final TextGenerationEngine engine;
    private final ScriptParser parser;
    private final DeckProperties deckProperties;

    public ScriptGenerator(TextGenerationEngine engine, ScriptParser parser, DeckProperties deckProperties) {
        this.engine = engine;
        this.parser = parser;
        this.deckProperties = deckProperties;
    }

    public List<ScriptEntry> generate(String topic, int slideCount, String tone) {
        return generateScript(topic, slideCount, tone).entries();
    }

    public GeneratedScript generateScript(String topic, int slideCount, String tone) {
        validate(topic, slideCount);
        String effectiveTone = tone == null || tone.isBlank() ? GenerationRequest.DEFAULT_TONE : tone.trim();
        String cleanTopic = topic.trim();
        String correlationId = UUID.randomUUID().toString().substring(0, 8);

        LOGGER.info("ScriptGenerator START correlationId={} topic='{}' slides={} tone={}",
                correlationId, cleanTopic, slideCount, effectiveTone);
        TextGenerationEngine.Completion completion = engine.complete(
                new TextGenerationEngine.Request(buildPrompt(cleanTopic, slideCount, effectiveTone), correlationId));

        ScriptParseOutcome outcome = parser.parse(completion.content(), slideCount);
        if (outcome.kind() == ScriptParseOutcome.Kind.UNUSABLE) {
            LOGGER.error("ScriptGenerator UNUSABLE correlationId={} reason={}", correlationId, outcome.reason());
            throw new GenerationException("Text generation returned an unusable script: " + outcome.reason());
        }

        List<ScriptEntry> entries = new ArrayList<>(slideCount);
        for (int i = 0; i < outcome.entries().size(); i++) {
            ScriptEntry entry = outcome.entries().get(i);
            entries.add(entry.hasTitle() ? entry : entry.withTitle(placeholderTitle(cleanTopic, i + 1)));
        }
        List<Integer> padded = new ArrayList<>();
        while (entries.size() < slideCount) {
            int index = entries.size() + 1;
            entries.add(new ScriptEntry(placeholderTitle(cleanTopic, index), List.of(), null));
            padded.add(index);
        }
        if (!padded.isEmpty()) {
            LOGGER.warn("ScriptGenerator SHORTFALL correlationId={} requested={} received={} padded={}",
                    correlationId, slideCount, outcome.entries().size(), padded);
        }
        LOGGER.info("ScriptGenerator DONE correlationId={} topic='{}' slides={} model={}",
                correlationId, cleanTopic, entries.size(), completion.model());
        return new GeneratedScript(entries, padded);
    }

    public static String placeholderTitle(String topic, int index) {
        return topic + ": part " + index;
    }

    String buildPrompt(String topic, int slideCount, String tone) {
        return "Write the script of a " + slideCount + "-slide presentation about '" + topic + "' "
                + "in a " + tone + " tone. Answer with ONLY a JSON object of the form:\n"
                + "{\n  \"slides\": [\n    {\"title\": str, \"bullets\": [str, ...], \"notes\": str},\n    ...\n  ]\n}\n"
                + "Return exactly " + slideCount + " slides with 3 to 5 short bullets each. "
                + "No text outside the JSON. No comments.";
    }

    private void validate(String topic, int slideCount) {
        if (topic == null || topic.isBlank()) {
            throw new InvalidRequestException("topic must not be blank");
        }
        int max = deckProperties.getMaxSlides();
        if (slideCount < 1 || slideCount > max) {
            throw new InvalidRequestException("slide count must be between 1 and " + max + ", got " + slideCount);
        }
    }
}
