package com.legendplatform.common.exception;

/**
 * Registration-time failure: an engine with the same name is already registered.
 * Only the offending {@code register} call fails; the registry is left unchanged.
 */
public class DuplicateEngineException extends EngineException {

    public DuplicateEngineException(String engineName) {
        super(engineName, "An engine with this name is already registered");
    }
}
