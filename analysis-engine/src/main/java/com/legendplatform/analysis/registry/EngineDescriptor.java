package com.legendplatform.analysis.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.legendplatform.analysis.engine.LegendEngine;
import com.legendplatform.common.model.EngineType;
import com.legendplatform.common.model.ReliabilityLevel;

public record EngineDescriptor(
    @JsonProperty("name")             String name,
    @JsonProperty("engineType")       EngineType engineType,
    @JsonProperty("reliabilityLevel") ReliabilityLevel reliabilityLevel,
    @JsonProperty("reliabilityWeight") double reliabilityWeight,
    @JsonProperty("description")      String description
) {
    public static EngineDescriptor of(LegendEngine engine) {
        return new EngineDescriptor(engine.name(), engine.engineType(), engine.reliabilityLevel(),
                                    engine.reliabilityLevel().weight(), engine.description());
    }
}
