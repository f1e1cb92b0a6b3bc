package com.tts.resilience.health;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * Checks that a model file exists, or that a voices directory exists and is not empty.
 */
public class ArtifactPathHealthCheck implements HealthCheck {

    private final String name;
    private final Path path;
    private final boolean directory;

    private ArtifactPathHealthCheck(String name, Path path, boolean directory) {
        this.name = name;
        this.path = path;
        this.directory = directory;
    }

    public static ArtifactPathHealthCheck modelFile(String name, Path modelFile) {
        return new ArtifactPathHealthCheck(name, modelFile, false);
    }

    public static ArtifactPathHealthCheck nonEmptyDirectory(String name, Path dir) {
        return new ArtifactPathHealthCheck(name, dir, true);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public HealthStatus check() {
        if (!directory) {
            return Files.isRegularFile(path)
                    ? HealthStatus.up().withDetail("path", path.toString())
                    : HealthStatus.down("Model file missing: " + path);
        }
        if (!Files.isDirectory(path)) {
            return HealthStatus.down("Directory missing: " + path);
        }
        try (Stream<Path> files = Files.list(path)) {
            long count = files.count();
            return count > 0
                    ? HealthStatus.up().withDetail("path", path.toString()).withDetail("files", count)
                    : HealthStatus.down("Directory is empty: " + path);
        } catch (IOException e) {
            return HealthStatus.down("Cannot list " + path + ": " + e.getMessage());
        }
    }
}
