package com.tts.resilience.health;

/**
 * A named probe of one dependency (disk, memory, an artifact path, a cache, breakers).
 * Implementations may block; the registry bounds each run with a timeout.
 */
public interface HealthCheck {

    /**
     * Returns the name of this health check.
     */
    String getName();

    /**
     * Performs the health check and returns the current status.
     */
    HealthStatus check();
}
