package com.tts.resilience.degradation;

/**
 * Thrown when a component is marked failed and no fallback is registered for it,
 * so there is neither a primary result nor a primary error to return.
 */
public class ComponentUnavailableException extends RuntimeException {

    private final String componentId;

    public ComponentUnavailableException(String componentId) {
        super("Component '" + componentId + "' is unavailable and has no fallback");
        this.componentId = componentId;
    }

    public ComponentUnavailableException(String message, Throwable cause) {
        super(message, cause);
        this.componentId = null;
    }

    public String getComponentId() {
        return componentId;
    }
}
