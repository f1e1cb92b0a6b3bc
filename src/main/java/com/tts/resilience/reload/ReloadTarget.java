package com.tts.resilience.reload;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * A watched path plus what to do when it changes: which cache keys to invalidate and
 * which callback to run once the debounce window has passed.
 */
public class ReloadTarget {

    private final String name;
    private final Path path;
    private final String cacheName;
    private final Set<String> invalidationKeys;
    private final Duration debounce;
    private final List<String> suffixes;
    private final ReloadCallback callback;

    private ReloadTarget(Builder builder) {
        this.name = builder.name;
        this.path = builder.path.toAbsolutePath().normalize();
        this.cacheName = builder.cacheName;
        this.invalidationKeys = Set.copyOf(builder.invalidationKeys);
        this.debounce = builder.debounce;
        this.suffixes = List.copyOf(builder.suffixes);
        this.callback = builder.callback;
    }

    public String getName() { return name; }
    public Path getPath() { return path; }
    public String getCacheName() { return cacheName; }
    public Set<String> getInvalidationKeys() { return invalidationKeys; }
    public Duration getDebounce() { return debounce; }
    public List<String> getSuffixes() { return suffixes; }
    public ReloadCallback getCallback() { return callback; }

    /**
     * Whether a change to {@code changed} concerns this target. With suffixes configured,
     * only files ending in one of them count.
     */
    public boolean accepts(Path changed) {
        if (suffixes.isEmpty()) {
            return true;
        }
        String fileName = changed.getFileName() == null
                ? "" : changed.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String suffix : suffixes) {
            if (fileName.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }

    public static Builder builder(String name, Path path) {
        return new Builder(name, path);
    }

    public static class Builder {
        private final String name;
        private final Path path;
        private String cacheName;
        private final Set<String> invalidationKeys = new LinkedHashSet<>();
        private Duration debounce = Duration.ofSeconds(2);
        private final Set<String> suffixes = new LinkedHashSet<>();
        private ReloadCallback callback = event -> { };

        private Builder(String name, Path path) {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("name must not be blank");
            if (path == null) throw new IllegalArgumentException("path must not be null");
            this.name = name;
            this.path = path;
        }

        /**
         * Cache to invalidate on firing. With no keys given, the whole cache is cleared.
         */
        public Builder cache(String cacheName, String... keys) {
            this.cacheName = cacheName;
            this.invalidationKeys.addAll(List.of(keys));
            return this;
        }

        public Builder debounce(Duration debounce) {
            if (debounce == null || debounce.isNegative()) {
                throw new IllegalArgumentException("debounce must be >= 0");
            }
            this.debounce = debounce;
            return this;
        }

        /**
         * Only react to files with one of these suffixes, e.g. {@code ".onnx", ".bin"}.
         */
        public Builder suffixes(String... suffixes) {
            for (String suffix : suffixes) {
                this.suffixes.add(suffix.toLowerCase(Locale.ROOT));
            }
            return this;
        }

        public Builder callback(ReloadCallback callback) {
            if (callback == null) throw new IllegalArgumentException("callback must not be null");
            this.callback = callback;
            return this;
        }

        public ReloadTarget build() {
            return new ReloadTarget(this);
        }
    }

    @Override
    public String toString() {
        return "ReloadTarget{" +
                "name='" + name + '\'' +
                ", path=" + path +
                ", cacheName='" + cacheName + '\'' +
                ", debounce=" + debounce +
                '}';
    }
}
