package com.tts.resilience.reload;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens change subscriptions for files or directories.
 */
@FunctionalInterface
public interface FileChangeSource {

    /**
     * Starts watching a path. For a file, changes to that file are reported; for a
     * directory, changes to its direct children.
     *
     * @throws IOException if the watch cannot be registered
     */
    ChangeSubscription subscribe(Path path) throws IOException;
}
