package com.tts.resilience.reload;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;

/**
 * {@link FileChangeSource} backed by {@link WatchService}. Each subscription owns its own
 * watch service, so closing one subscription never affects another.
 *
 * <p>A file is watched through its parent directory and events for siblings are skipped.</p>
 */
public class WatchServiceChangeSource implements FileChangeSource {
    private static final Logger log = LoggerFactory.getLogger(WatchServiceChangeSource.class);

    @Override
    public ChangeSubscription subscribe(Path path) throws IOException {
        Path target = path.toAbsolutePath().normalize();
        boolean directory = Files.isDirectory(target);
        Path dir = directory ? target : target.getParent();
        if (dir == null || !Files.isDirectory(dir)) {
            throw new IOException("Cannot watch " + path + ": no such directory " + dir);
        }
        WatchService watchService = FileSystems.getDefault().newWatchService();
        try {
            dir.register(watchService,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY,
                    StandardWatchEventKinds.ENTRY_DELETE);
        } catch (IOException | RuntimeException e) {
            watchService.close();
            throw e;
        }
        log.debug("Watching {} via {}", target, dir);
        return new Subscription(watchService, dir, directory ? null : target);
    }

    private static final class Subscription implements ChangeSubscription {
        private final WatchService watchService;
        private final Path dir;
        private final Path file;
        private final ArrayDeque<FileChange> buffered = new ArrayDeque<>();
        private volatile boolean open = true;

        Subscription(WatchService watchService, Path dir, Path file) {
            this.watchService = watchService;
            this.dir = dir;
            this.file = file;
        }

        @Override
        public FileChange poll(Duration timeout) throws InterruptedException {
            long deadline = System.nanoTime() + timeout.toNanos();
            while (open) {
                FileChange next = buffered.poll();
                if (next != null) {
                    return next;
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return null;
                }
                WatchKey key;
                try {
                    key = watchService.poll(remaining, TimeUnit.NANOSECONDS);
                } catch (ClosedWatchServiceException e) {
                    open = false;
                    return null;
                }
                if (key == null) {
                    return null;
                }
                for (WatchEvent<?> event : key.pollEvents()) {
                    FileChange change = toChange(event);
                    if (change != null) {
                        buffered.add(change);
                    }
                }
                if (!key.reset()) {
                    log.warn("Watch on {} is no longer valid", dir);
                    close();
                }
            }
            return buffered.poll();
        }

        private FileChange toChange(WatchEvent<?> event) {
            Instant now = Instant.now();
            if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                return new FileChange(file != null ? file : dir, now, FileChange.Kind.OVERFLOW);
            }
            Path changed = dir.resolve((Path) event.context());
            if (file != null && !file.equals(changed)) {
                return null;
            }
            FileChange.Kind kind;
            if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE) {
                kind = FileChange.Kind.CREATED;
            } else if (event.kind() == StandardWatchEventKinds.ENTRY_DELETE) {
                kind = FileChange.Kind.DELETED;
            } else {
                kind = FileChange.Kind.MODIFIED;
            }
            return new FileChange(changed, now, kind);
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            open = false;
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Failed to close watch on {}: {}", dir, e.getMessage());
            }
        }
    }
}
