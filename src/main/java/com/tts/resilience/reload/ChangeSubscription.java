package com.tts.resilience.reload;

import java.time.Duration;

/**
 * A cancellable stream of change notifications for one watched path.
 * Closing releases the underlying OS watch; {@link #close()} may be called more than once
 * and from any thread, and unblocks a pending {@link #poll(Duration)}.
 */
public interface ChangeSubscription extends AutoCloseable {

    /**
     * Waits up to {@code timeout} for the next change.
     *
     * @return the change, or null on timeout or once the subscription is closed
     */
    FileChange poll(Duration timeout) throws InterruptedException;

    boolean isOpen();

    @Override
    void close();
}
