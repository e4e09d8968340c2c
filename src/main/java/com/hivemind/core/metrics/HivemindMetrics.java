package com.hivemind.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for swarm execution.
 */
@Service
public class HivemindMetrics {

    private final MeterRegistry registry;

    public HivemindMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskExecution(String role, long ms) {
        Timer.builder("hivemind.task.duration")
                .tag("role", role)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskOutcome(String status) {
        Counter.builder("hivemind.tasks.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordRetry(int attempt) {
        Counter.builder("hivemind.recovery.retries")
                .description("Failed tasks re-queued by the recovery monitor")
                .register(registry)
                .increment();

        DistributionSummary.builder("hivemind.recovery.attempt")
                .register(registry)
                .record(attempt);
    }

    public void incrementEscalations(String reason) {
        Counter.builder("hivemind.escalations.total")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordSloEvaluation(boolean compliant) {
        Counter.builder("hivemind.slo.evaluations")
                .tag("result", compliant ? "compliant" : "breached")
                .register(registry)
                .increment();
    }

    /**
     * @param dimension "cost", "latency", "coverage" or "confidence"
     */
    public void recordSloBreach(String dimension) {
        Counter.builder("hivemind.slo.breaches")
                .description("SLO breaches by dimension")
                .tag("dimension", dimension)
                .register(registry)
                .increment();
    }

    public void recordSwarmResult(String status) {
        Counter.builder("hivemind.swarms.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordUndeliveredMessage() {
        Counter.builder("hivemind.messages.undelivered")
                .description("Messages dropped because the target agent is not registered")
                .register(registry)
                .increment();
    }
}
