package com.legendplatform.common.exception;

import java.time.Duration;

public class EngineTimeoutException extends EngineException {
    private final Duration timeout;

    public EngineTimeoutException(String engineName, Duration timeout, Throwable cause) {
        super(engineName, "Timed out after " + timeout.toMillis() + "ms", cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
