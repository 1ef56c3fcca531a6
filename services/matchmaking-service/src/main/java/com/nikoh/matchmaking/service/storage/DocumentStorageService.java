package com.nikoh.matchmaking.service.storage;

import com.nikoh.matchmaking.config.StorageProperties;
import com.nikoh.matchmaking.exception.MatchmakingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Local file store for uploaded documents and selfies.
 * Paths handed out are relative to the storage root.
 */
@Slf4j
@Service
public class DocumentStorageService {

    private final Path root;

    public DocumentStorageService(StorageProperties properties) {
        this.root = Paths.get(properties.getRootDir()).toAbsolutePath().normalize();
    }

    /**
     * Writes {@code content} to {@code directory/fileName}, replacing any existing file.
     *
     * @return path relative to the storage root
     */
    public String store(String directory, String fileName, byte[] content) {
        Path target = resolve(directory).resolve(fileName).normalize();
        ensureInsideRoot(target);
        try {
            Files.createDirectories(target.getParent());
            Path temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            try {
                Files.write(temp, content);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new MatchmakingException("STORAGE_ERROR", "Failed to store file " + fileName, e);
        }
        log.debug("Stored {} bytes at {}", content.length, target);
        return root.relativize(target).toString();
    }

    public boolean exists(String relativePath) {
        return relativePath != null && Files.isRegularFile(resolve(relativePath));
    }

    public byte[] read(String relativePath) {
        try {
            return Files.readAllBytes(resolve(relativePath));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + relativePath, e);
        }
    }

    /**
     * Absolute location of a stored file, for native libraries that read from disk
     */
    public Path locate(String relativePath) {
        return resolve(relativePath);
    }

    /**
     * Deletes the file and every parent directory left empty, stopping at the storage root.
     *
     * @return true if the file existed
     */
    public boolean delete(String relativePath) {
        if (relativePath == null) {
            return false;
        }
        Path file = resolve(relativePath);
        boolean deleted;
        try {
            deleted = Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", file, e.getMessage());
            return false;
        }
        pruneEmptyParents(file.getParent());
        return deleted;
    }

    private void pruneEmptyParents(Path directory) {
        Path current = directory;
        while (current != null && current.startsWith(root) && !current.equals(root)) {
            try {
                Files.deleteIfExists(current);
            } catch (DirectoryNotEmptyException e) {
                return;
            } catch (IOException e) {
                log.debug("Stopped pruning at {}: {}", current, e.getMessage());
                return;
            }
            current = current.getParent();
        }
    }

    private Path resolve(String relativePath) {
        Path path = root.resolve(relativePath).normalize();
        ensureInsideRoot(path);
        return path;
    }

    private void ensureInsideRoot(Path path) {
        if (!path.startsWith(root)) {
            throw new MatchmakingException("STORAGE_ERROR", "Path escapes storage root: " + path);
        }
    }
}
