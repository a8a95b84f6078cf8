package com.legendplatform.analysis.engine;

import com.legendplatform.common.model.AnalysisRequest;
import com.legendplatform.common.model.EngineType;
import com.legendplatform.common.model.ProgressSink;
import com.legendplatform.common.model.QualityMeta;
import com.legendplatform.common.model.ReliabilityLevel;
import com.legendplatform.common.model.ResultEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sample Wyckoff Method engine: accumulation/distribution phase facts with a
 * {@code position_bias}. Fixed illustrative output.
 */
@Component
@Order(2)
@ConditionalOnProperty(name = "analysis.sample-engines.enabled", havingValue = "true", matchIfMissing = true)
public class WyckoffMethodEngine implements LegendEngine {

    private static final Logger log = LoggerFactory.getLogger(WyckoffMethodEngine.class);

    public static final String NAME = "Wyckoff Method";

    @Override
    public String name() { return NAME; }

    @Override
    public ReliabilityLevel reliabilityLevel() { return ReliabilityLevel.MEDIUM; }

    @Override
    public EngineType engineType() { return EngineType.TRADITIONAL; }

    @Override
    public String description() {
        return "Market phase and composite operator analysis (sample data)";
    }

    @Override
    public Mono<ResultEnvelope> run(AnalysisRequest request, ProgressSink progress) {
        return Mono.fromCallable(() -> {
            log.info("[Wyckoff] Analyzing symbol={} timeframe={}", request.symbol(), request.timeframe());
            progress.report(NAME, "fetch", 25.0, "Fetching volume data");
            progress.report(NAME, "compute", 70.0, "Analyzing accumulation/distribution");
            progress.report(NAME, "score", 100.0, "Identifying market phases");

            Map<String, Object> facts = new LinkedHashMap<>();
            facts.put("current_phase",               "accumulation");
            facts.put("position_bias",               "bullish");
            facts.put("strength",                    0.65);
            facts.put("volume_spread_analysis",      "bullish");
            facts.put("supply_demand_balance",       "demand_exceeds_supply");
            facts.put("smart_money_activity",        "accumulating");
            facts.put("phase_progress",              0.65);
            facts.put("wyckoff_signal",              "spring_test_complete");
            facts.put("effort_vs_result",            "harmonious");

            QualityMeta quality = QualityMeta.of(800.0, 45.0, 0.95).withRisk(0.25, 0.6);
            return ResultEnvelope.of(NAME, request, facts, quality);
        });
    }
}
