package com.example.autoslides_backend.service;

import com.example.autoslides_backend.exception.ConfigurationException;
import com.example.autoslides_backend.exception.ExportException;
import com.example.autoslides_backend.service.Interfaces.DeckStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;

public class LocalDeckStorage implements DeckStorage {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalDeckStorage.class);
    private static final String WORK_DIR = ".work";
    private static final int MAX_SUFFIX = 10_000;

    private final Path outputRoot;
    private final Path workRoot;
    private final Object publishLock = new Object();

    public LocalDeckStorage(Path outputRoot) {
        this(outputRoot, null);
    }

    public LocalDeckStorage(Path outputRoot, Path scratchRoot) {
        this.outputRoot = outputRoot.toAbsolutePath().normalize();
        this.workRoot = scratchRoot != null
                ? scratchRoot.toAbsolutePath().normalize()
                : this.outputRoot.resolve(WORK_DIR);
        try {
            Files.createDirectories(this.outputRoot);
            Files.createDirectories(this.workRoot);
            LOGGER.info("LocalDeckStorage ready. out={}, work={}", this.outputRoot, this.workRoot);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot create deck output directory " + this.outputRoot, e);
        }
    }

    @Override
    public Path publish(String baseName, String extension, ArtifactWriter writer) {
        Path tmp = null;
        try {
            tmp = Files.createTempFile(outputRoot, "." + baseName + "-", ".tmp");
            try (OutputStream out = Files.newOutputStream(tmp)) {
                writer.write(out);
            }
            synchronized (publishLock) {
                Path target = freeName(baseName, extension);
                moveIntoPlace(tmp, target);
                LOGGER.info("Deck published path={}", target);
                return target;
            }
        } catch (IOException | RuntimeException e) {
            deleteQuietly(tmp);
            if (e instanceof ExportException ex) {
                throw ex;
            }
            throw new ExportException("Writing deck '" + baseName + extension + "' failed: " + e.getMessage(), e);
        }
    }

    private Path freeName(String baseName, String extension) {
        Path candidate = outputRoot.resolve(baseName + extension);
        int suffix = 2;
        while (Files.exists(candidate)) {
            if (suffix > MAX_SUFFIX) {
                throw new ExportException("No free file name left for " + baseName + extension);
            }
            candidate = outputRoot.resolve(baseName + "-" + suffix + extension);
            suffix++;
        }
        return candidate;
    }

    private void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOGGER.warn("Atomic move not supported in {}, falling back to plain move", outputRoot);
            Files.move(tmp, target);
        }
    }

    @Override
    public Optional<Path> resolve(String fileName) {
        if (fileName == null || fileName.isBlank() || fileName.startsWith(".")) {
            return Optional.empty();
        }
        Path p = outputRoot.resolve(fileName).normalize();
        if (!outputRoot.equals(p.getParent()) || !Files.isRegularFile(p)) {
            return Optional.empty();
        }
        return Optional.of(p);
    }

    @Override
    public Path createScratchDirectory(String prefix) {
        try {
            Files.createDirectories(workRoot);
            return Files.createTempDirectory(workRoot, prefix);
        } catch (IOException e) {
            throw new ExportException("Cannot create scratch directory under " + workRoot, e);
        }
    }

    @Override
    public void deleteRecursively(Path directory) {
        if (directory == null || !Files.exists(directory)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            walk.sorted(Comparator.reverseOrder()).forEach(this::deleteQuietly);
        } catch (IOException e) {
            LOGGER.warn("Scratch cleanup failed dir={} cause={}", directory, e.getMessage());
        }
    }

    /** Number of published artifacts, used by the health endpoint. */
    public long countArtifacts() {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(outputRoot, "*.pptx")) {
            long n = 0;
            for (Path ignored : stream) {
                n++;
            }
            return n;
        } catch (IOException e) {
            return -1;
        }
    }

    @Override
    public Path root() {
        return outputRoot;
    }

    private void deleteQuietly(Path p) {
        if (p == null) return;
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            LOGGER.warn("Delete failed path={} cause={}", p, e.getMessage());
        }
    }
}
