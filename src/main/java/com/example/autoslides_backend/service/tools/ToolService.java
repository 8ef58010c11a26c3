package com.example.autoslides_backend.service.tools;

import com.example.autoslides_backend.exception.InvalidRequestException;
import com.example.autoslides_backend.model.GenerationRequest;
import com.example.autoslides_backend.model.ImageAsset;
import com.example.autoslides_backend.model.ScriptEntry;
import com.example.autoslides_backend.model.SlideSpec;
import com.example.autoslides_backend.service.DeckExporter;
import com.example.autoslides_backend.service.ImageFetcher;
import com.example.autoslides_backend.service.ScriptGenerator;
import com.example.autoslides_backend.service.SlideComposer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Individually invocable pipeline stages, addressed by tool name. Each tool applies the same validation
 * and error categories as a full run.
 */
@Service
public class ToolService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ToolService.class);

    public static final String WRITE_SCRIPT = "write_script";
    public static final String FETCH_IMAGES = "fetch_images";
    public static final String CREATE_SLIDE = "create_slide";
    public static final String EXPORT_ARTIFACT = "export_artifact";
    public static final String EXPORT_PPTX = "export_pptx";
    public static final Set<String> TOOLS = Set.of(WRITE_SCRIPT, FETCH_IMAGES, CREATE_SLIDE, EXPORT_ARTIFACT, EXPORT_PPTX);

    private final ScriptGenerator scriptGenerator;
    private final ImageFetcher imageFetcher;
    private final SlideComposer slideComposer;
    private final DeckExporter deckExporter;
    private final ObjectMapper objectMapper;
    private final ObjectMapper strictMapper;

    public ToolService(ScriptGenerator scriptGenerator,
                       ImageFetcher imageFetcher,
                       SlideComposer slideComposer,
                       DeckExporter deckExporter,
                       ObjectMapper objectMapper) {
        this.scriptGenerator = scriptGenerator;
        this.imageFetcher = imageFetcher;
        this.slideComposer = slideComposer;
        this.deckExporter = deckExporter;
        this.objectMapper = objectMapper;
        this.strictMapper = objectMapper.copy().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public Object invoke(String tool, Map<String, Object> args) {
        if (tool == null || !TOOLS.contains(tool)) {
            throw new InvalidRequestException("Unknown tool: " + tool);
        }
        Map<String, Object> safeArgs = args != null ? args : Map.of();
        LOGGER.info("ToolService invoke tool={} args={}", tool, safeArgs.keySet());
        switch (tool) {
            case WRITE_SCRIPT:
                return writeScript(convert(tool, safeArgs, ToolArguments.WriteScript.class));
            case FETCH_IMAGES:
                return fetchImages(convert(tool, safeArgs, ToolArguments.FetchImages.class));
            case CREATE_SLIDE:
                return createSlide(convert(tool, safeArgs, ToolArguments.CreateSlide.class));
            default:
                return exportArtifact(convert(tool, safeArgs, ToolArguments.ExportArtifact.class));
        }
    }

    Map<String, Object> writeScript(ToolArguments.WriteScript args) {
        if (args.slides() == null) {
            throw new InvalidRequestException("write_script requires 'slides'");
        }
        List<ScriptEntry> entries = scriptGenerator.generate(args.topic(), args.slides(),
                args.tone() != null ? args.tone() : GenerationRequest.DEFAULT_TONE);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("topic", args.topic().trim());
        result.put("slides", entries);
        return result;
    }

    List<ImageAsset> fetchImages(ToolArguments.FetchImages args) {
        int n = args.n() != null ? args.n() : 1;
        return imageFetcher.fetch(args.query(), n, args.orientation());
    }

    SlideSpec createSlide(ToolArguments.CreateSlide args) {
        int index = args.index() != null ? args.index() : 1;
        ScriptEntry entry = titled(new ScriptEntry(args.title(), args.bullets(), args.notes()), args.topic(), index);
        return slideComposer.compose(index, entry, toAssets(args.images()));
    }

    String exportArtifact(ToolArguments.ExportArtifact args) {
        if (args.slides() == null || args.slides().isEmpty()) {
            throw new InvalidRequestException("export requires a non-empty 'slides' list");
        }
        List<SlideSpec> specs = new ArrayList<>(args.slides().size());
        for (int i = 0; i < args.slides().size(); i++) {
            ToolArguments.ExportSlide slide = args.slides().get(i);
            if (slide == null) {
                throw new InvalidRequestException("slide " + (i + 1) + " is null");
            }
            ScriptEntry entry = titled(new ScriptEntry(slide.title(), slide.bullets(), slide.notes()), args.topic(), i + 1);
            specs.add(slideComposer.compose(i + 1, entry, toAssets(slide.images())));
        }
        String naming = args.topic() != null && !args.topic().isBlank() ? args.topic() : stripExtension(args.filename());
        Path artifact = deckExporter.export(specs, args.templateReference(), naming);
        return artifact.toString();
    }

    /** Blank titles become {@code "<topic>: part <n>"}; without a topic the composer's {@code "Slide <n>"} applies. */
    private static ScriptEntry titled(ScriptEntry entry, String topic, int index) {
        if (entry.hasTitle() || topic == null || topic.isBlank()) {
            return entry;
        }
        return entry.withTitle(ScriptGenerator.placeholderTitle(topic.trim(), index));
    }

    private List<ImageAsset> toAssets(List<JsonNode> images) {
        if (images == null) {
            return List.of();
        }
        List<ImageAsset> assets = new ArrayList<>(images.size());
        for (JsonNode node : images) {
            if (node == null || node.isNull()) {
                continue;
            }
            if (node.isTextual()) {
                if (!node.asText().isBlank()) {
                    assets.add(ImageAsset.remote(node.asText().trim(), null, null, null));
                }
                continue;
            }
            try {
                // local paths from callers are not trusted; bytes are fetched from the source URL
                assets.add(objectMapper.treeToValue(node, ImageAsset.class).withLocalReference(null));
            } catch (JsonProcessingException e) {
                throw new InvalidRequestException("Invalid image entry: " + e.getOriginalMessage(), e);
            }
        }
        return assets;
    }

    private <T> T convert(String tool, Map<String, Object> args, Class<T> type) {
        try {
            return strictMapper.convertValue(args, type);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Invalid arguments for " + tool + ": " + rootMessage(e), e);
        }
    }

    private static String stripExtension(String filename) {
        if (filename == null) return null;
        String name = filename.trim();
        return name.toLowerCase().endsWith(".pptx") ? name.substring(0, name.length() - 5) : name;
    }

    private static String rootMessage(Throwable e) {
        Throwable cursor = e;
        while (cursor.getCause() != null && cursor.getCause() != cursor) {
            cursor = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null) return cursor.getClass().getSimpleName();
        int newline = message.indexOf('\n');
        return newline > 0 ? message.substring(0, newline) : message;
    }
}
