package com.tts.resilience.reload;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Change source driven by the test instead of the file system.
 */
class FakeChangeSource implements FileChangeSource {

    final List<FakeSubscription> subscriptions = new CopyOnWriteArrayList<>();

    @Override
    public ChangeSubscription subscribe(Path path) {
        FakeSubscription subscription = new FakeSubscription(path.toAbsolutePath().normalize());
        subscriptions.add(subscription);
        return subscription;
    }

    void emit(Path changed) {
        Path normalized = changed.toAbsolutePath().normalize();
        for (FakeSubscription subscription : subscriptions) {
            if (subscription.isOpen() && (normalized.equals(subscription.path)
                    || normalized.startsWith(subscription.path))) {
                subscription.queue.add(FileChange.modified(normalized));
            }
        }
    }

    long openCount() {
        return subscriptions.stream().filter(FakeSubscription::isOpen).count();
    }

    static final class FakeSubscription implements ChangeSubscription {
        final Path path;
        final BlockingQueue<FileChange> queue = new LinkedBlockingQueue<>();
        volatile boolean open = true;

        FakeSubscription(Path path) {
            this.path = path;
        }

        @Override
        public FileChange poll(Duration timeout) throws InterruptedException {
            if (!open) {
                return null;
            }
            return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            open = false;
        }
    }
}
