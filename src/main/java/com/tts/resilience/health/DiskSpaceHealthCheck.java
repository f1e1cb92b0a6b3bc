package com.tts.resilience.health;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.FileStore;
import java.nio.file.Path;

/**
 * Reports DOWN when the file store holding the artifact directory has less than
 * the configured free space.
 */
public class DiskSpaceHealthCheck implements HealthCheck {

    private static final long ONE_GB = 1024L * 1024 * 1024;

    private final Path path;
    private final long minFreeBytes;

    public DiskSpaceHealthCheck(Path path) {
        this(path, ONE_GB);
    }

    public DiskSpaceHealthCheck(Path path, long minFreeBytes) {
        this.path = path;
        this.minFreeBytes = minFreeBytes;
    }

    @Override
    public String getName() {
        return "diskSpace";
    }

    @Override
    public HealthStatus check() {
        try {
            FileStore store = Files.getFileStore(path);
            long free = store.getUsableSpace();
            HealthStatus base = free < minFreeBytes
                    ? HealthStatus.down("Low disk space: " + free / (1024 * 1024) + "MB free")
                    : HealthStatus.up();
            return base
                    .withDetail("path", path.toString())
                    .withDetail("freeBytes", free)
                    .withDetail("minFreeBytes", minFreeBytes);
        } catch (IOException e) {
            return HealthStatus.down("Disk space check failed: " + e.getMessage())
                    .withDetail("path", path.toString());
        }
    }
}
