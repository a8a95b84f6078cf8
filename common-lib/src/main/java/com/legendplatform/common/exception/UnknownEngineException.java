package com.legendplatform.common.exception;

import java.util.List;

/**
 * Configuration error: a caller named engines that are not registered.
 * Signalled before any engine is scheduled.
 */
public class UnknownEngineException extends RuntimeException {
    private final List<String> engineNames;

    public UnknownEngineException(List<String> engineNames) {
        super("Unknown engine(s): " + String.join(", ", engineNames));
        this.engineNames = List.copyOf(engineNames);
    }

    public List<String> getEngineNames() {
        return engineNames;
    }
}
