package com.example.hydrant.tool;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Temporary file whose deletion is tied to a try-with-resources block.
 * Deletion failures are logged and never thrown.
 */
@Slf4j
public final class ScopedArtifact implements AutoCloseable {

    private final Path path;

    private ScopedArtifact(Path path) {
        this.path = path;
    }

    /**
     * Reserves a fresh path in {@code dir}. The file itself is left to the tool that writes it.
     */
    public static ScopedArtifact create(Path dir, String prefix, String suffix) throws IOException {
        Files.createDirectories(dir);
        Path path = Files.createTempFile(dir, prefix, suffix);
        Files.delete(path);
        return new ScopedArtifact(path);
    }

    public Path path() {
        return path;
    }

    @Override
    public void close() {
        try {
            if (Files.deleteIfExists(path)) {
                log.debug("Removed temporary artifact {}", path);
            }
        } catch (IOException e) {
            log.warn("Failed to remove temporary artifact {}: {}", path, e.getMessage());
        }
    }
}
