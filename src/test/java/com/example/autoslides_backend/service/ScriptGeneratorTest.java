package com.example.autoslides_backend.service;

import com.example.autoslides_backend.config.DeckProperties;
import com.example.autoslides_backend.engine.Interfaces.TextGenerationEngine;
import com.example.autoslides_backend.exception.GenerationException;
import com.example.autoslides_backend.exception.InvalidRequestException;
import com.example.autoslides_backend.model.ScriptEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScriptGeneratorTest {

    @Mock
    private TextGenerationEngine engine;

    private ScriptGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new ScriptGenerator(engine, new ScriptParser(new ObjectMapper()), new DeckProperties());
    }

    private void answer(String content) {
        when(engine.complete(any())).thenReturn(new TextGenerationEngine.Completion(content, "gpt-4o-mini", "openai"));
    }

    @Test
    void promptCarriesTopicCountAndTone() {
        answer("{\"slides\":[{\"title\":\"A\",\"bullets\":[\"x\"]}]}");

        generator.generate("Wind energy", 1, "inspiring");

        ArgumentCaptor<TextGenerationEngine.Request> captor = ArgumentCaptor.forClass(TextGenerationEngine.Request.class);
        verify(engine).complete(captor.capture());
        assertThat(captor.getValue().prompt()).contains("1-slide", "'Wind energy'", "inspiring tone", "\"slides\"");
        assertThat(captor.getValue().correlationId()).hasSize(8);
    }

    @Test
    void padsShortfallWithTopicTitles() {
        answer("{\"slides\":[{\"title\":\"Why oceans matter\",\"bullets\":[\"x\"]}]}");

        ScriptGenerator.GeneratedScript script = generator.generateScript("ocean conservation", 3, null);

        assertThat(script.entries()).extracting(ScriptEntry::title)
                .containsExactly("Why oceans matter", "ocean conservation: part 2", "ocean conservation: part 3");
        assertThat(script.paddedSlides()).containsExactly(2, 3);
    }

    @Test
    void repairsBlankTitles() {
        answer("{\"slides\":[{\"title\":\"  \",\"bullets\":[\"x\"]},{\"title\":\"Two\"}]}");

        List<ScriptEntry> entries = generator.generate("Tides", 2, "neutral");

        assertThat(entries.get(0).title()).isEqualTo("Tides: part 1");
        assertThat(entries.get(0).bullets()).containsExactly("x");
        assertThat(entries.get(1).title()).isEqualTo("Two");
    }

    @Test
    void unusableAnswerRaisesGenerationException() {
        answer("I cannot help with that.");

        assertThatThrownBy(() -> generator.generate("Tides", 2, "neutral"))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("unusable");
    }

    @Test
    void validatesBeforeCallingTheModel() {
        assertThatThrownBy(() -> generator.generate(" ", 2, "neutral")).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> generator.generate("Tides", 0, "neutral")).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> generator.generate("Tides", 21, "neutral")).isInstanceOf(InvalidRequestException.class);
        verifyNoInteractions(engine);
    }
}
