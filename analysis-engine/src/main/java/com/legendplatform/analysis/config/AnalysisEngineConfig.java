package com.legendplatform.analysis.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.legendplatform.analysis.engine.LegendEngine;
import com.legendplatform.analysis.registry.EngineRegistry;
import com.legendplatform.analysis.scheduler.ExecutionScheduler;
import com.legendplatform.common.consensus.ConsensusStrategy;
import com.legendplatform.common.consensus.ReliabilityWeightedConsensusStrategy;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnalysisEngineConfig {

    /** Every {@link LegendEngine} bean, registered in {@code @Order} order. */
    @Bean
    public EngineRegistry engineRegistry(ObjectProvider<LegendEngine> engines) {
        return new EngineRegistry(engines.orderedStream().toList());
    }

    @Bean
    public ExecutionScheduler executionScheduler() {
        return new ExecutionScheduler();
    }

    @Bean
    public ConsensusStrategy consensusStrategy() {
        return new ReliabilityWeightedConsensusStrategy();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
