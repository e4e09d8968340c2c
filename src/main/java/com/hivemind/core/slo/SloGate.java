package com.hivemind.core.slo;

import com.hivemind.core.config.HivemindProperties;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.model.SloResult;
import com.hivemind.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;

/**
 * Scores a completed run against the cost, latency, coverage and confidence thresholds.
 * <p>
 * {@link #evaluate} is a pure function of its inputs and the configured thresholds.
 * {@link #evaluateAndRecord} additionally appends the result to the store; it never
 * touches tasks or agents. A breach is reported in the result, never thrown.
 */
@Service
public class SloGate {

    private static final Logger log = LoggerFactory.getLogger(SloGate.class);

    private final HivemindProperties.Slo thresholds;
    private final TaskStore store;
    private final HivemindMetrics metrics;
    private final Clock clock;

    public SloGate(HivemindProperties properties, TaskStore store, HivemindMetrics metrics, Clock clock) {
        this.thresholds = properties.getSlo();
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
    }

    public SloResult evaluate(SloMeasurements m, String swarmId) {
        double cost = estimateCost(m.tokens());
        double maxDurationSeconds = thresholds.getMaxDuration().toMillis() / 1000.0;

        var costResult = new SloResult.Cost(m.tokens(), cost, thresholds.getMaxCostUsd(),
                cost > thresholds.getMaxCostUsd());
        var latency = new SloResult.Latency(m.durationSeconds(), maxDurationSeconds,
                m.durationSeconds() > maxDurationSeconds);
        var coverage = new SloResult.Coverage(m.coveragePercent(), thresholds.getMinCoveragePercent(),
                m.coveragePercent() < thresholds.getMinCoveragePercent());
        var confidence = new SloResult.Confidence(m.confidence(), thresholds.getMinConfidence(),
                m.confidence() < thresholds.getMinConfidence());

        boolean compliant = !(costResult.breach() || latency.breach() || coverage.breach() || confidence.breach());
        return new SloResult(swarmId, costResult, latency, coverage, confidence, compliant, clock.instant());
    }

    /**
     * Evaluates, appends the result to the store and records metrics.
     */
    public SloResult evaluateAndRecord(SloMeasurements m, String swarmId) {
        SloResult result = evaluate(m, swarmId);
        store.appendSloResult(result);
        metrics.recordSloEvaluation(result.compliant());

        var breaches = new ArrayList<String>();
        if (result.cost().breach()) breaches.add("cost");
        if (result.latency().breach()) breaches.add("latency");
        if (result.coverage().breach()) breaches.add("coverage");
        if (result.confidence().breach()) breaches.add("confidence");
        breaches.forEach(metrics::recordSloBreach);

        if (result.compliant()) {
            log.info("Swarm {} is SLO compliant (cost ${}, {}s, coverage {}%, confidence {})", swarmId,
                    result.cost().estimatedCost(), result.latency().durationSeconds(),
                    result.coverage().value(), result.confidence().value());
        } else {
            log.warn("Swarm {} breached SLO on {} (cost ${}, {}s, coverage {}%, confidence {})", swarmId, breaches,
                    result.cost().estimatedCost(), result.latency().durationSeconds(),
                    result.coverage().value(), result.confidence().value());
        }
        return result;
    }

    /** Token cost in USD, rounded to cents. */
    double estimateCost(long tokens) {
        return BigDecimal.valueOf(tokens)
                .multiply(BigDecimal.valueOf(thresholds.getPricePerThousandTokens()))
                .divide(BigDecimal.valueOf(1000), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
