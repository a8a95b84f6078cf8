package com.legendplatform.common.exception;

/**
 * Raised by or about a single engine. Carries the engine name so callers can attribute it.
 */
public class EngineException extends RuntimeException {
    private final String engineName;

    public EngineException(String engineName, String message) {
        super("[" + engineName + "] " + message);
        this.engineName = engineName;
    }

    public EngineException(String engineName, String message, Throwable cause) {
        super("[" + engineName + "] " + message, cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
