package com.hivemind.core.slo;

/**
 * Raw measurements of one swarm run, as fed to the {@link SloGate}.
 *
 * @param tokens          total LLM tokens consumed by every task result
 * @param durationSeconds end-to-end wall-clock duration of the run
 * @param coveragePercent test coverage reached, 0..100
 * @param confidence      stack/plan inference confidence, 0..1
 */
public record SloMeasurements(
    long tokens,
    double durationSeconds,
    double coveragePercent,
    double confidence
) {

    public SloMeasurements {
        if (tokens < 0) {
            throw new IllegalArgumentException("tokens must be >= 0, got " + tokens);
        }
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("durationSeconds must be >= 0, got " + durationSeconds);
        }
    }
}
