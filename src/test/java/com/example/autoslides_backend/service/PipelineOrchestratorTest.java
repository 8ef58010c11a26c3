package com.example.autoslides_backend.service;

import com.example.autoslides_backend.config.DeckProperties;
import com.example.autoslides_backend.config.PipelineProperties;
import com.example.autoslides_backend.config.UnsplashProperties;
import com.example.autoslides_backend.engine.Interfaces.ImageSearchEngine;
import com.example.autoslides_backend.engine.Interfaces.TextGenerationEngine;
import com.example.autoslides_backend.exception.ErrorCategory;
import com.example.autoslides_backend.exception.GenerationException;
import com.example.autoslides_backend.model.GenerationRequest;
import com.example.autoslides_backend.model.ImageAsset;
import com.example.autoslides_backend.model.PipelineResult;
import com.example.autoslides_backend.model.ScriptEntry;
import com.example.autoslides_backend.model.SlideSpec;
import com.example.autoslides_backend.util.LayoutMode;
import com.example.autoslides_backend.util.PipelineStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineOrchestratorTest {

    private static final String OCEAN_SCRIPT = """
            {"slides": [
              {"title": "Why the ocean matters", "bullets": ["Covers 71% of Earth", "Produces half our oxygen"], "notes": "Open with a question"},
              {"title": "Threats to marine life", "bullets": ["Overfishing", "Plastic pollution"]},
              {"title": "What we can do", "bullets": ["Reduce plastic", "Support protected areas"]}
            ]}
            """;

    @TempDir
    Path tempDir;

    @Mock
    private ImageFetcher imageFetcher;

    private String scriptContent;
    private RuntimeException engineFailure;
    private ExecutorService executor;
    private DeckProperties deckProperties;
    private PipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        deckProperties = new DeckProperties();
        executor = Executors.newFixedThreadPool(4);
        orchestrator = orchestrator(imageFetcher);
        lenient().when(imageFetcher.download(any(), any())).thenAnswer(inv -> Optional.of(inv.getArgument(0)));
    }

    private PipelineOrchestrator orchestrator(ImageFetcher fetcher) {
        TextGenerationEngine engine = request -> {
            if (engineFailure != null) {
                throw engineFailure;
            }
            return new TextGenerationEngine.Completion(scriptContent, "test-model", "test");
        };
        LocalDeckStorage storage = new LocalDeckStorage(tempDir);
        ScriptGenerator generator = new ScriptGenerator(engine, new ScriptParser(new ObjectMapper()), deckProperties);
        return new PipelineOrchestrator(
                generator,
                fetcher,
                new ImageSelector(),
                new SlideComposer(deckProperties),
                new DeckExporter(deckProperties, storage, fetcher),
                storage,
                deckProperties,
                new PipelineProperties(),
                executor
        );
    }

    @AfterEach
    void tearDown() throws Exception {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    private static String script(int slides) {
        return IntStream.rangeClosed(1, slides)
                .mapToObj(i -> "{\"title\": \"s" + i + "\", \"bullets\": [\"point " + i + "\"]}")
                .collect(Collectors.joining(",", "{\"slides\": [", "]}"));
    }

    private static ImageAsset asset(String url) {
        return ImageAsset.remote(url, "Photo by Test on Unsplash", 800, 600);
    }

    private List<Path> decks() throws Exception {
        try (Stream<Path> files = Files.list(tempDir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".pptx")).toList();
        }
    }

    @Test
    void oceanDeckWithOneImagelessSlideIsPartialSuccess() throws Exception {
        scriptContent = OCEAN_SCRIPT;
        when(imageFetcher.fetch(anyString(), anyInt())).thenAnswer(inv -> {
            String query = inv.getArgument(0);
            return query.startsWith("Threats") ? List.of() : List.of(asset("https://img/" + query.hashCode()));
        });

        PipelineResult result = orchestrator.run(new GenerationRequest("ocean conservation", 3, "informative", 1, null));

        assertThat(result.status()).isEqualTo(PipelineStatus.PARTIAL_SUCCESS);
        assertThat(result.warnings()).containsExactly("no image found for slide 2");
        assertThat(result.slides()).extracting(SlideSpec::title)
                .containsExactly("Why the ocean matters", "Threats to marine life", "What we can do");
        assertThat(result.slides().get(1).layout().mode()).isEqualTo(LayoutMode.TEXT_ONLY);
        assertThat(result.slides().get(0).images()).hasSize(1);
        assertThat(result.downloadReference()).isEqualTo("/v1/files/decks/ocean-conservation.pptx");

        Path artifact = Path.of(result.artifactPath());
        assertThat(artifact).exists();
        try (InputStream in = Files.newInputStream(artifact); XMLSlideShow ppt = new XMLSlideShow(in)) {
            assertThat(ppt.getSlides()).hasSize(3);
        }
        try (Stream<Path> scratch = Files.list(tempDir.resolve(".work"))) {
            assertThat(scratch).isEmpty();
        }
    }

    @Test
    void slidesStayInScriptOrderWhenSearchesFinishOutOfOrder() {
        scriptContent = script(4);
        when(imageFetcher.fetch(anyString(), anyInt())).thenAnswer(inv -> {
            String query = inv.getArgument(0);
            int n = Integer.parseInt(query.substring(1, 2));
            Thread.sleep((5 - n) * 60L);
            return List.of(asset("https://img/s" + n));
        });

        PipelineResult result = orchestrator.run(new GenerationRequest("topic", 4, null, 1, null));

        assertThat(result.status()).isEqualTo(PipelineStatus.SUCCESS);
        assertThat(result.warnings()).isEmpty();
        for (int i = 0; i < 4; i++) {
            SlideSpec slide = result.slides().get(i);
            assertThat(slide.index()).isEqualTo(i + 1);
            assertThat(slide.title()).isEqualTo("s" + (i + 1));
            assertThat(slide.images().get(0).sourceUrl()).isEqualTo("https://img/s" + (i + 1));
        }
    }

    @Test
    void everySearchFailingStillProducesADeck() throws Exception {
        scriptContent = script(3);
        when(imageFetcher.fetch(anyString(), anyInt())).thenThrow(new IllegalStateException("search down"));

        PipelineResult result = orchestrator.run(new GenerationRequest("topic", 3, null, 2, null));

        assertThat(result.status()).isEqualTo(PipelineStatus.PARTIAL_SUCCESS);
        assertThat(result.warnings()).containsExactly(
                "no image found for slide 1", "no image found for slide 2", "no image found for slide 3");
        assertThat(result.slides()).allMatch(s -> s.layout().mode() == LayoutMode.TEXT_ONLY);
        assertThat(decks()).hasSize(1);
    }

    @Test
    void partialImageResultsAreReported() {
        scriptContent = script(2);
        when(imageFetcher.fetch(anyString(), anyInt())).thenAnswer(inv -> {
            String query = inv.getArgument(0);
            return query.startsWith("s1")
                    ? List.of(asset("https://img/a"), asset("https://img/b"))
                    : List.of(asset("https://img/c"));
        });

        PipelineResult result = orchestrator.run(new GenerationRequest("topic", 2, null, 2, null));

        assertThat(result.status()).isEqualTo(PipelineStatus.PARTIAL_SUCCESS);
        assertThat(result.slides().get(0).images()).hasSize(2);
        assertThat(result.warnings()).contains("only 1 of 2 images found for slide 2");
    }

    @Test
    void generationFailureLeavesNoArtifact() throws Exception {
        engineFailure = new GenerationException("Text generation failed: HTTP 503");

        PipelineResult result = orchestrator.run(new GenerationRequest("topic", 3, null, 1, null));

        assertThat(result.status()).isEqualTo(PipelineStatus.FAILURE);
        assertThat(result.errorCategory()).isEqualTo(ErrorCategory.GENERATION_ERROR);
        assertThat(result.artifactPath()).isNull();
        assertThat(decks()).isEmpty();
        verify(imageFetcher, never()).fetch(anyString(), anyInt());
    }

    @Test
    void shortScriptIsPaddedWithWarning() {
        scriptContent = script(2);

        PipelineResult result = orchestrator.run(new GenerationRequest("solar power", 3, null, 0, null));

        assertThat(result.status()).isEqualTo(PipelineStatus.PARTIAL_SUCCESS);
        assertThat(result.slides()).hasSize(3);
        assertThat(result.slides().get(2).title()).isEqualTo("solar power: part 3");
        assertThat(result.warnings()).containsExactly("slide 3: script shortfall, placeholder content used");
    }

    @Test
    void textOnlyDeckNeverSearches() {
        scriptContent = script(2);

        PipelineResult result = orchestrator.run(new GenerationRequest("topic", 2, null, 0, null));

        assertThat(result.status()).isEqualTo(PipelineStatus.SUCCESS);
        assertThat(result.slides()).allMatch(s -> s.images().isEmpty() && s.layout().imageArea().isEmpty());
        verify(imageFetcher, never()).fetch(anyString(), anyInt());
    }

    @Test
    void singleSlideDeck() {
        scriptContent = script(1);
        when(imageFetcher.fetch(anyString(), anyInt())).thenReturn(List.of(asset("https://img/one")));

        PipelineResult result = orchestrator.run(new GenerationRequest("topic", 1, null, 1, null));

        assertThat(result.status()).isEqualTo(PipelineStatus.SUCCESS);
        assertThat(result.slides()).hasSize(1);
    }

    @Test
    void identicalInputsGiveIdenticalSlides() {
        scriptContent = OCEAN_SCRIPT;
        when(imageFetcher.fetch(anyString(), anyInt())).thenAnswer(inv -> List.of(asset("https://img/" + inv.getArgument(0))));
        GenerationRequest request = new GenerationRequest("ocean conservation", 3, "informative", 1, null);

        PipelineResult first = orchestrator.run(request);
        PipelineResult second = orchestrator.run(request);

        assertThat(second.slides()).isEqualTo(first.slides());
        assertThat(second.warnings()).isEqualTo(first.warnings());
        assertThat(second.artifactPath()).isNotEqualTo(first.artifactPath());
    }

    @Test
    void invalidRequestsAreRejectedBeforeGeneration() throws Exception {
        engineFailure = new IllegalStateException("must not be called");

        assertThat(orchestrator.run(new GenerationRequest(" ", 3, null, 1, null)).errorCategory())
                .isEqualTo(ErrorCategory.INVALID_REQUEST);
        assertThat(orchestrator.run(new GenerationRequest("topic", 0, null, 1, null)).errorCategory())
                .isEqualTo(ErrorCategory.INVALID_REQUEST);
        assertThat(orchestrator.run(new GenerationRequest("topic", 21, null, 1, null)).errorCategory())
                .isEqualTo(ErrorCategory.INVALID_REQUEST);
        assertThat(orchestrator.run(new GenerationRequest("topic", 3, null, 5, null)).errorCategory())
                .isEqualTo(ErrorCategory.INVALID_REQUEST);
        assertThat(decks()).isEmpty();
    }

    @Test
    void configuredDeckLimitsBoundTheRequest() {
        deckProperties.setMaxSlides(25);
        deckProperties.setMaxImagesPerSlide(6);
        scriptContent = script(25);

        PipelineResult result = orchestrator.run(new GenerationRequest("topic", 25, null, 0, null));

        assertThat(result.status()).isEqualTo(PipelineStatus.SUCCESS);
        assertThat(result.slides()).hasSize(25);
        assertThat(orchestrator.run(new GenerationRequest("topic", 26, null, 0, null)).errorCategory())
                .isEqualTo(ErrorCategory.INVALID_REQUEST);
        assertThat(orchestrator.run(new GenerationRequest("topic", 3, null, 7, null)).errorCategory())
                .isEqualTo(ErrorCategory.INVALID_REQUEST);
    }

    @Test
    void interruptedRunIsCancelled() throws Exception {
        scriptContent = script(2);
        Thread.currentThread().interrupt();
        PipelineResult result;
        try {
            result = orchestrator.run(new GenerationRequest("topic", 2, null, 1, null));
        } finally {
            Thread.interrupted();
        }

        assertThat(result.status()).isEqualTo(PipelineStatus.FAILURE);
        assertThat(result.errorCategory()).isEqualTo(ErrorCategory.CANCELLED);
        assertThat(decks()).isEmpty();
    }

    @Test
    void interruptDuringDownloadsCancelsRunAndLeavesNoScratchFiles() throws Exception {
        scriptContent = script(3);
        ImageSearchEngine search = query -> List.of(asset("https://img/" + query.text().replace(' ', '-') + ".png"));
        ExchangeFunction slowImages = request -> Mono.delay(Duration.ofMillis(600))
                .thenReturn(ClientResponse.create(HttpStatus.OK)
                        .body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(ImageFetcherTest.PNG)))
                        .build());
        UnsplashProperties unsplash = new UnsplashProperties();
        unsplash.setMaxRetries(0);
        unsplash.setTimeoutSeconds(5);
        PipelineOrchestrator slow = orchestrator(
                new ImageFetcher(search, WebClient.builder().exchangeFunction(slowImages).build(), unsplash));
        AtomicReference<PipelineResult> result = new AtomicReference<>();
        Thread caller = new Thread(() -> result.set(slow.run(new GenerationRequest("topic", 3, null, 1, null))));

        caller.start();
        Thread.sleep(250);
        caller.interrupt();
        caller.join(5000);

        assertThat(caller.isAlive()).isFalse();
        assertThat(result.get().status()).isEqualTo(PipelineStatus.FAILURE);
        assertThat(result.get().errorCategory()).isEqualTo(ErrorCategory.CANCELLED);
        // outlast the slow responses so late writers would show up
        Thread.sleep(800);
        try (Stream<Path> leftovers = Files.list(tempDir.resolve(".work"))) {
            assertThat(leftovers).isEmpty();
        }
        assertThat(decks()).isEmpty();
    }

    @Test
    void failedDownloadKeepsSlideWithUnavailableImage() {
        scriptContent = script(1);
        when(imageFetcher.fetch(anyString(), anyInt())).thenReturn(List.of(asset("https://img/broken")));
        when(imageFetcher.download(any(), any())).thenReturn(Optional.empty());

        PipelineResult result = orchestrator.run(new GenerationRequest("topic", 1, null, 1, null));

        assertThat(result.status()).isEqualTo(PipelineStatus.SUCCESS);
        ImageAsset image = result.slides().get(0).images().get(0);
        assertThat(image.placeholder()).isTrue();
        assertThat(image.sourceUrl()).isNull();
        assertThat(Path.of(result.artifactPath())).exists();
    }

    @Test
    void imageQueryAddsTopicOnlyWhenMissing() {
        assertThat(PipelineOrchestrator.imageQuery(new ScriptEntry("Ocean facts", List.of(), null), "ocean"))
                .isEqualTo("Ocean facts");
        assertThat(PipelineOrchestrator.imageQuery(new ScriptEntry("Reefs", List.of(), null), "ocean"))
                .isEqualTo("Reefs ocean");
    }
}
