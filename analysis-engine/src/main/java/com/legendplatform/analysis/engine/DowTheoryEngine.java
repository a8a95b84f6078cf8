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
import java.util.List;
import java.util.Map;

/**
 * Sample Dow Theory engine. Emits fixed illustrative facts in the shape a real
 * trend-confirmation engine would publish; it performs no indicator math.
 */
@Component
@Order(1)
@ConditionalOnProperty(name = "analysis.sample-engines.enabled", havingValue = "true", matchIfMissing = true)
public class DowTheoryEngine implements LegendEngine {

    private static final Logger log = LoggerFactory.getLogger(DowTheoryEngine.class);

    public static final String NAME = "Dow Theory";

    @Override
    public String name() { return NAME; }

    @Override
    public ReliabilityLevel reliabilityLevel() { return ReliabilityLevel.HIGH; }

    @Override
    public EngineType engineType() { return EngineType.TRADITIONAL; }

    @Override
    public String description() {
        return "Primary/secondary trend identification with volume confirmation (sample data)";
    }

    @Override
    public Mono<ResultEnvelope> run(AnalysisRequest request, ProgressSink progress) {
        return Mono.fromCallable(() -> {
            log.info("[DowTheory] Analyzing symbol={} timeframe={}", request.symbol(), request.timeframe());
            progress.report(NAME, "fetch", 20.0, "Fetching market data");
            progress.report(NAME, "compute", 60.0, "Analyzing trends");
            progress.report(NAME, "score", 100.0, "Generating scores");

            Map<String, Object> facts = new LinkedHashMap<>();
            facts.put("primary_trend",        "bullish");
            facts.put("secondary_trend",      "corrective");
            facts.put("confidence",           0.875);
            facts.put("trend_strength",       0.75);
            facts.put("confirmation_status",  "confirmed");
            facts.put("volume_confirmation",  true);
            facts.put("support_level",        150.25);
            facts.put("resistance_level",     175.80);
            facts.put("key_levels",           List.of(150.25, 162.50, 175.80));
            facts.put("analysis_notes",
                "Dow analysis for " + request.symbol() + " on " + request.timeframe() + " timeframe");

            QualityMeta quality = QualityMeta.of(1000.0, 60.0, 0.98)
                .withHistoricalValidationYears(100.0);
            return ResultEnvelope.of(NAME, request, facts, quality);
        });
    }
}
