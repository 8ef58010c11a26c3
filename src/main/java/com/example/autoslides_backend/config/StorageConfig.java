package com.example.autoslides_backend.config;

import com.example.autoslides_backend.service.LocalDeckStorage;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@EnableConfigurationProperties({DeckProperties.class, PipelineProperties.class})
@Configuration
public class StorageConfig {

    @Bean
    public LocalDeckStorage deckStorage(DeckProperties deck, PipelineProperties pipeline) {
        Path out = Path.of(deck.getOutputDir());
        Path scratch = pipeline.getScratchDir() == null || pipeline.getScratchDir().isBlank()
                ? null
                : Path.of(pipeline.getScratchDir());
        var storage = new LocalDeckStorage(out, scratch);
        org.slf4j.LoggerFactory.getLogger(StorageConfig.class)
                .info("Deck storage wired: out={}, scratch={}, template={}", storage.root(),
                        scratch != null ? scratch : "<out>/.work",
                        deck.hasTemplatePath() ? deck.getTemplatePath() : "<default>");
        return storage;
    }
}
