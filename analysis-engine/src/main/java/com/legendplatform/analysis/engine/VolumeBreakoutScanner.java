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
 * Sample scanner-type engine. Scanners publish a numeric {@code signal_score}
 * and carry {@link ReliabilityLevel#VARIABLE} reliability.
 */
@Component
@Order(3)
@ConditionalOnProperty(name = "analysis.sample-engines.enabled", havingValue = "true", matchIfMissing = true)
public class VolumeBreakoutScanner implements LegendEngine {

    private static final Logger log = LoggerFactory.getLogger(VolumeBreakoutScanner.class);

    public static final String NAME = "Volume Breakout Scanner";

    @Override
    public String name() { return NAME; }

    @Override
    public ReliabilityLevel reliabilityLevel() { return ReliabilityLevel.VARIABLE; }

    @Override
    public EngineType engineType() { return EngineType.SCANNER; }

    @Override
    public String description() {
        return "Unusual volume breakout detection (sample data)";
    }

    @Override
    public Mono<ResultEnvelope> run(AnalysisRequest request, ProgressSink progress) {
        return Mono.fromCallable(() -> {
            log.info("[VolumeBreakout] Scanning symbol={} timeframe={}", request.symbol(), request.timeframe());
            progress.report(NAME, "scan", 50.0, "Scanning volume profile");
            progress.report(NAME, "score", 100.0, null);

            Map<String, Object> facts = new LinkedHashMap<>();
            facts.put("signal_score",      -0.2);
            facts.put("quality_score",     50.0);
            facts.put("volume_ratio",      1.4);
            facts.put("breakout_detected", false);

            QualityMeta quality = QualityMeta.of(120.0, 15.0, 0.9).withRisk(0.45, 0.8);
            return ResultEnvelope.of(NAME, request, facts, quality);
        });
    }
}
