package com.example.autoslides_backend.service;

import com.example.autoslides_backend.service.Interfaces.DeckStorage;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@Service
public class FileService {
    static final MediaType PPTX = MediaType.parseMediaType(
            "application/vnd.openxmlformats-officedocument.presentationml.presentation");

    private final DeckStorage storage;

    public FileService(DeckStorage storage) {
        this.storage = storage;
    }

    /** Serves a published deck; published files never change, so the ETag is stable. */
    public ResponseEntity<FileSystemResource> downloadDeck(String fileName, @Nullable String ifNoneMatch) throws IOException {
        if (fileName == null || fileName.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "File name is required");
        }
        Path file = storage.resolve(fileName)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Deck not found: " + fileName));

        FileSystemResource resource = new FileSystemResource(file);
        long length = resource.contentLength();
        long lastMod = Files.getLastModifiedTime(file).toMillis();
        String etag = "\"" + lastMod + "-" + length + "\"";
        CacheControl cache = CacheControl.noCache();

        if (ifNoneMatch != null && ifNoneMatch.contains(etag)) {
            return ResponseEntity.status(HttpStatus.NOT_MODIFIED)
                    .eTag(etag)
                    .lastModified(lastMod)
                    .cacheControl(cache)
                    .build();
        }
        return ResponseEntity.ok()
                .cacheControl(cache).eTag(etag).lastModified(lastMod)
                .contentType(PPTX)
                .header(HttpHeaders.CONTENT_DISPOSITION, attachment(file))
                .contentLength(length)
                .body(resource);
    }

    private static String attachment(Path file) {
        String fn = file.getFileName().toString();
        return "attachment; filename=\"" + fn + "\"; filename*=UTF-8''" + URLEncoder.encode(fn, StandardCharsets.UTF_8);
    }
}
