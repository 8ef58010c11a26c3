package com.example.autoslides_backend.service.Interfaces;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.Optional;

public interface DeckStorage {

    /** Writes the artifact bytes; the stream is owned by the storage and closed after the call. */
    @FunctionalInterface
    interface ArtifactWriter {
        void write(OutputStream out) throws IOException;
    }

    /**
     * Writes to a temporary file and atomically publishes it under {@code baseName + extension},
     * or {@code baseName-2 + extension}, {@code baseName-3 + extension}, ... when the name is taken.
     * Existing files are never overwritten.
     *
     * @return the published path
     */
    Path publish(String baseName, String extension, ArtifactWriter writer);

    /** Resolves a published artifact by file name; empty when it does not exist or escapes the root. */
    Optional<Path> resolve(String fileName);

    /** A fresh per-run working directory. */
    Path createScratchDirectory(String prefix);

    void deleteRecursively(Path directory);

    Path root();
}
