package com.nikoh.matchmaking.service.ocr;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Image file that only lives for the duration of a try-with-resources block.
 */
@Slf4j
public final class TemporaryImage implements AutoCloseable {

    private final Path path;

    public TemporaryImage(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    @Override
    public void close() {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete temporary image {}: {}", path, e.getMessage());
        }
    }
}
