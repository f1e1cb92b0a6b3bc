package com.tts.resilience.reload;

/**
 * Reacts to a fired reload, typically by re-reading a model or voice file.
 * Exceptions are caught and logged by the watcher.
 */
@FunctionalInterface
public interface ReloadCallback {

    void onReload(ReloadEvent event) throws Exception;
}
