package com.example.autoslides_backend.service;

import com.example.autoslides_backend.config.DeckProperties;
import com.example.autoslides_backend.config.PipelineProperties;
import com.example.autoslides_backend.exception.AutoSlidesException;
import com.example.autoslides_backend.exception.ErrorCategory;
import com.example.autoslides_backend.exception.InvalidRequestException;
import com.example.autoslides_backend.exception.PipelineCancelledException;
import com.example.autoslides_backend.model.GenerationRequest;
import com.example.autoslides_backend.model.ImageAsset;
import com.example.autoslides_backend.model.PipelineResult;
import com.example.autoslides_backend.model.Presentation;
import com.example.autoslides_backend.model.ScriptEntry;
import com.example.autoslides_backend.model.SlideSpec;
import com.example.autoslides_backend.service.Interfaces.DeckStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs one deck request end to end: script, image search on the bounded pool, deck-wide image selection,
 * downloads, sequential composition in script order and the atomic export.
 */
@Service
public class PipelineOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final ScriptGenerator scriptGenerator;
    private final ImageFetcher imageFetcher;
    private final ImageSelector imageSelector;
    private final SlideComposer slideComposer;
    private final DeckExporter deckExporter;
    private final DeckStorage deckStorage;
    private final DeckProperties deckProperties;
    private final PipelineProperties pipelineProperties;
    private final Executor imageFetchExecutor;

    public PipelineOrchestrator(ScriptGenerator scriptGenerator,
                                ImageFetcher imageFetcher,
                                ImageSelector imageSelector,
                                SlideComposer slideComposer,
                                DeckExporter deckExporter,
                                DeckStorage deckStorage,
                                DeckProperties deckProperties,
                                PipelineProperties pipelineProperties,
                                @Qualifier("imageFetchExecutor") Executor imageFetchExecutor) {
        this.scriptGenerator = scriptGenerator;
        this.imageFetcher = imageFetcher;
        this.imageSelector = imageSelector;
        this.slideComposer = slideComposer;
        this.deckExporter = deckExporter;
        this.deckStorage = deckStorage;
        this.deckProperties = deckProperties;
        this.pipelineProperties = pipelineProperties;
        this.imageFetchExecutor = imageFetchExecutor;
    }

    /**
     * Never throws for pipeline failures; they come back as a {@code FAILURE} result with a category.
     */
    public PipelineResult run(GenerationRequest request) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        long started = System.currentTimeMillis();
        Path scratch = null;
        try {
            validate(request);
            String topic = request.topic().trim();
            int perSlide = request.imagesPerSlide();
            LOGGER.info("PipelineOrchestrator START runId={} topic='{}' slides={} imagesPerSlide={} tone={}",
                    runId, topic, request.slideCount(), perSlide, request.normalizedTone());

            ScriptGenerator.GeneratedScript script = scriptGenerator.generateScript(topic, request.slideCount(), request.normalizedTone());
            List<ScriptEntry> entries = script.entries();
            checkCancelled(runId);

            scratch = deckStorage.createScratchDirectory("run-" + runId + "-");
            List<List<ImageAsset>> candidates = searchImages(entries, topic, perSlide, runId);
            List<List<ImageAsset>> selected = imageSelector.select(candidates, perSlide);
            List<List<ImageAsset>> images = downloadImages(selected, scratch, runId);

            List<String> warnings = new ArrayList<>();
            Set<Integer> padded = new HashSet<>(script.paddedSlides());
            List<SlideSpec> slides = new ArrayList<>(entries.size());
            for (int i = 0; i < entries.size(); i++) {
                int index = i + 1;
                if (padded.contains(index)) {
                    warnings.add("slide " + index + ": script shortfall, placeholder content used");
                }
                if (perSlide > 0) {
                    int found = selected.get(i).size();
                    if (found == 0) {
                        warnings.add("no image found for slide " + index);
                    } else if (found < perSlide) {
                        warnings.add("only " + found + " of " + perSlide + " images found for slide " + index);
                    }
                }
                SlideSpec spec = slideComposer.compose(index, entries.get(i), images.get(i));
                warnings.addAll(spec.warnings());
                slides.add(spec);
            }
            checkCancelled(runId);

            Path artifact = deckExporter.export(new Presentation(topic, slides, request.normalizedTemplateReference()));
            String downloadReference = downloadReference(artifact);
            PipelineResult result = PipelineResult.completed(artifact.toString(), downloadReference, warnings, slides);
            LOGGER.info("PipelineOrchestrator DONE runId={} status={} slides={} warnings={} artifact={} tookMs={}",
                    runId, result.status(), slides.size(), warnings.size(), artifact.getFileName(),
                    System.currentTimeMillis() - started);
            return result;
        } catch (AutoSlidesException e) {
            if (e.getCategory().httpStatus().is5xxServerError()) {
                LOGGER.error("PipelineOrchestrator FAILED runId={} category={} message={}", runId, e.getCategory(), e.getMessage(), e);
            } else {
                LOGGER.warn("PipelineOrchestrator REJECTED runId={} category={} message={}", runId, e.getCategory(), e.getMessage());
            }
            return PipelineResult.failure(e.getCategory(), e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.error("PipelineOrchestrator FAILED runId={} unexpected error", runId, e);
            return PipelineResult.failure(ErrorCategory.INTERNAL_ERROR, "Unexpected error: " + e.getMessage());
        } finally {
            if (scratch != null) {
                deckStorage.deleteRecursively(scratch);
            }
        }
    }

    private List<List<ImageAsset>> searchImages(List<ScriptEntry> entries, String topic, int perSlide, String runId) {
        if (perSlide == 0) {
            return entries.stream().<List<ImageAsset>>map(e -> List.of()).toList();
        }
        int wanted = Math.min(ImageFetcher.MAX_COUNT, perSlide * Math.max(1, pipelineProperties.getCandidateMultiplier()));
        List<Future<List<ImageAsset>>> futures = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            String query = imageQuery(entries.get(i), topic);
            futures.add(submit(() -> imageFetcher.fetch(query, wanted), List.of(), "search", i + 1, runId));
        }
        return awaitInOrder(futures, runId);
    }

    private List<List<ImageAsset>> downloadImages(List<List<ImageAsset>> selected, Path scratch, String runId) {
        List<Future<List<ImageAsset>>> futures = new ArrayList<>(selected.size());
        for (int i = 0; i < selected.size(); i++) {
            List<ImageAsset> assets = selected.get(i);
            if (assets.isEmpty()) {
                futures.add(CompletableFuture.completedFuture(List.of()));
                continue;
            }
            futures.add(submit(() -> assets.stream()
                    .map(asset -> imageFetcher.download(asset, scratch).orElse(ImageAsset.unavailable()))
                    .toList(), assets, "download", i + 1, runId));
        }
        return awaitInOrder(futures, runId);
    }

    /**
     * Runs {@code task} on the image pool. The returned future is the task itself, so cancelling it
     * interrupts the worker; a failing task yields {@code fallback}.
     */
    private <T> Future<T> submit(Callable<T> task, T fallback, String phase, int slide, String runId) {
        FutureTask<T> future = new FutureTask<>(() -> {
            try {
                return task.call();
            } catch (RuntimeException e) {
                LOGGER.warn("PipelineOrchestrator {} failed runId={} slide={} cause={}", phase, runId, slide, e.getMessage());
                return fallback;
            }
        });
        try {
            imageFetchExecutor.execute(future);
            return future;
        } catch (RejectedExecutionException e) {
            LOGGER.warn("PipelineOrchestrator {} rejected runId={} slide={} cause={}", phase, runId, slide, e.getMessage());
            return CompletableFuture.completedFuture(fallback);
        }
    }

    /** Joins the per-slide futures by slide index, not by completion order. */
    private <T> List<T> awaitInOrder(List<Future<T>> futures, String runId) {
        List<T> results = new ArrayList<>(futures.size());
        for (Future<T> future : futures) {
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new PipelineCancelledException("Run " + runId + " was cancelled during the image phase", e);
            } catch (ExecutionException e) {
                // tasks only fail with errors; runtime exceptions already became the fallback
                throw new IllegalStateException("Image task failed without fallback", e.getCause());
            }
        }
        return results;
    }

    private void checkCancelled(String runId) {
        if (Thread.currentThread().isInterrupted()) {
            throw new PipelineCancelledException("Run " + runId + " was cancelled", null);
        }
    }

    static String imageQuery(ScriptEntry entry, String topic) {
        String title = entry.hasTitle() ? entry.title().trim() : topic;
        if (title.toLowerCase(Locale.ROOT).contains(topic.toLowerCase(Locale.ROOT))) {
            return title;
        }
        return title + " " + topic;
    }

    private String downloadReference(Path artifact) {
        String base = deckProperties.getDownloadBasePath();
        if (base == null || base.isBlank()) {
            return artifact.getFileName().toString();
        }
        return (base.endsWith("/") ? base : base + "/") + artifact.getFileName();
    }

    private void validate(GenerationRequest request) {
        if (request == null) {
            throw new InvalidRequestException("request must not be null");
        }
        if (request.topic() == null || request.topic().isBlank()) {
            throw new InvalidRequestException("topic must not be blank");
        }
        int maxSlides = deckProperties.getMaxSlides();
        if (request.slideCount() < 1 || request.slideCount() > maxSlides) {
            throw new InvalidRequestException("slide count must be between 1 and " + maxSlides + ", got " + request.slideCount());
        }
        int maxImages = deckProperties.getMaxImagesPerSlide();
        if (request.imagesPerSlide() < 0 || request.imagesPerSlide() > maxImages) {
            throw new InvalidRequestException("images per slide must be between 0 and " + maxImages + ", got " + request.imagesPerSlide());
        }
    }
}
