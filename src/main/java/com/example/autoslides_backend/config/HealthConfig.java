package com.example.autoslides_backend.config;

import com.example.autoslides_backend.service.LocalDeckStorage;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator deckOutputHealth(LocalDeckStorage storage) {
        return () -> {
            Path root = storage.root();
            if (Files.isDirectory(root) && Files.isWritable(root)) {
                return Health.up()
                        .withDetail("outputDir", root.toString())
                        .withDetail("decks", storage.countArtifacts())
                        .build();
            }
            return Health.down().withDetail("outputDir", root + " not writable").build();
        };
    }

    @Bean
    public HealthIndicator slideTemplateHealth(DeckProperties props) {
        return () -> {
            if (!props.hasTemplatePath()) {
                return Health.up().withDetail("template", "default").build();
            }
            Path template = Path.of(props.getTemplatePath());
            if (Files.isReadable(template)) {
                return Health.up().withDetail("template", template.toString()).build();
            }
            return Health.down().withDetail("template", template + " unreadable").build();
        };
    }
}
