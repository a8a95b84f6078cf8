package com.legendplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Result of running one engine: either a {@link ResultEnvelope} or a captured failure.
 *
 * <p>Failures never cross the scheduler's join as exceptions; they are recorded here
 * with {@link OutcomeStatus#FAILURE} or {@link OutcomeStatus#TIMEOUT} and an error message.
 * The engine's declared reliability and type travel with the outcome so the consensus
 * step needs no registry lookup.
 */
public record EngineOutcome(
    @JsonProperty("engineName")       String engineName,
    @JsonProperty("reliabilityLevel") ReliabilityLevel reliabilityLevel,
    @JsonProperty("engineType")       EngineType engineType,
    @JsonProperty("status")           OutcomeStatus status,
    @JsonProperty("envelope")         ResultEnvelope envelope,
    @JsonProperty("error")            String error,
    @JsonProperty("elapsedMs")        long elapsedMs
) {
    public EngineOutcome {
        Objects.requireNonNull(engineName, "engineName");
        Objects.requireNonNull(reliabilityLevel, "reliabilityLevel");
        Objects.requireNonNull(status, "status");
        if (status == OutcomeStatus.SUCCESS && envelope == null) {
            throw new IllegalArgumentException("successful outcome requires an envelope");
        }
        if (status != OutcomeStatus.SUCCESS && envelope != null) {
            throw new IllegalArgumentException(status + " outcome must not carry an envelope");
        }
    }

    public static EngineOutcome success(String engineName, ReliabilityLevel reliability, EngineType type,
                                        ResultEnvelope envelope, long elapsedMs) {
        return new EngineOutcome(engineName, reliability, type, OutcomeStatus.SUCCESS, envelope, null, elapsedMs);
    }

    public static EngineOutcome failure(String engineName, ReliabilityLevel reliability, EngineType type,
                                        String error, long elapsedMs) {
        return new EngineOutcome(engineName, reliability, type, OutcomeStatus.FAILURE, null, error, elapsedMs);
    }

    public static EngineOutcome timeout(String engineName, ReliabilityLevel reliability, EngineType type,
                                        String error, long elapsedMs) {
        return new EngineOutcome(engineName, reliability, type, OutcomeStatus.TIMEOUT, null, error, elapsedMs);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == OutcomeStatus.SUCCESS;
    }
}
