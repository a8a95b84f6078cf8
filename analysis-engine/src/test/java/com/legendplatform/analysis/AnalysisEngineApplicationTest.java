package com.legendplatform.analysis;

import com.legendplatform.analysis.engine.DowTheoryEngine;
import com.legendplatform.analysis.engine.VolumeBreakoutScanner;
import com.legendplatform.analysis.engine.WyckoffMethodEngine;
import com.legendplatform.analysis.engine.LegendEngine;
import com.legendplatform.analysis.registry.EngineRegistry;
import com.legendplatform.analysis.service.LegendAnalysisService;
import com.legendplatform.common.consensus.ConsensusResult;
import com.legendplatform.common.consensus.ConsensusSignal;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "analysis.engine-timeout=2s")
class AnalysisEngineApplicationTest {

    @Autowired
    private EngineRegistry registry;

    @Autowired
    private LegendAnalysisService analysisService;

    @Test
    void sampleEnginesRegisteredInOrder() {
        assertEquals(List.of(DowTheoryEngine.NAME, WyckoffMethodEngine.NAME, VolumeBreakoutScanner.NAME),
                     registry.snapshot().stream().map(LegendEngine::name).toList());
    }

    @Test
    void quickConsensusThroughContext() {
        ConsensusResult consensus = analysisService.quickConsensus("IBM", null, null).block(Duration.ofSeconds(10));
        assertEquals(ConsensusSignal.BULLISH, consensus.signal());
        assertEquals("1D", analysisService.defaultTimeframe());
    }
}
