package com.example.autoslides_backend.controller;

import com.example.autoslides_backend.service.FileService;
import com.example.autoslides_backend.service.Interfaces.DeckStorage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = FileController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(FileService.class)
class FileControllerTest {

    @TempDir
    static Path tempDir;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private DeckStorage deckStorage;

    @Test
    void servesPublishedDeckAsAttachment() throws Exception {
        Path deck = Files.write(tempDir.resolve("ocean.pptx"), new byte[]{1, 2, 3, 4});
        when(deckStorage.resolve("ocean.pptx")).thenReturn(Optional.of(deck));

        mockMvc.perform(get("/v1/files/decks/ocean.pptx"))
                .andExpect(status().isOk())
                .andExpect(content().contentType("application/vnd.openxmlformats-officedocument.presentationml.presentation"))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("filename=\"ocean.pptx\"")))
                .andExpect(header().exists(HttpHeaders.ETAG))
                .andExpect(content().bytes(new byte[]{1, 2, 3, 4}));
    }

    @Test
    void matchingEtagReturnsNotModified() throws Exception {
        Path deck = Files.write(tempDir.resolve("cached.pptx"), new byte[]{9});
        when(deckStorage.resolve("cached.pptx")).thenReturn(Optional.of(deck));
        String etag = "\"" + Files.getLastModifiedTime(deck).toMillis() + "-1\"";

        mockMvc.perform(get("/v1/files/decks/cached.pptx").header(HttpHeaders.IF_NONE_MATCH, etag))
                .andExpect(status().isNotModified());
    }

    @Test
    void unknownDeckIsNotFound() throws Exception {
        when(deckStorage.resolve("missing.pptx")).thenReturn(Optional.empty());

        mockMvc.perform(get("/v1/files/decks/missing.pptx"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.category").value("INVALID_REQUEST"));
    }
}
