package com.hivemind.dispatch.cli;

import com.hivemind.core.config.HivemindProperties;
import com.hivemind.core.model.SloResult;
import com.hivemind.core.slo.SloGate;
import com.hivemind.core.slo.SloMeasurements;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: hivemind slo
 * <p>
 * Evaluates a set of run measurements against the configured SLO thresholds
 * without storing anything. Exits with 1 when any dimension is breached.
 */
@Command(name = "slo", mixinStandardHelpOptions = true,
        description = "Evaluate run measurements against the SLO thresholds")
@Component
public class SloCommand implements Callable<Integer> {

    @Option(names = "--tokens", description = "Tokens consumed (default: ${DEFAULT-VALUE})", defaultValue = "0")
    private long tokens;

    @Option(names = "--cost", description = "Cost in USD; converted to tokens at the configured price, overrides --tokens")
    private Double cost;

    @Option(names = "--duration", description = "End-to-end duration in seconds", required = true)
    private double duration;

    @Option(names = "--coverage", description = "Test coverage percentage", required = true)
    private double coverage;

    @Option(names = "--confidence", description = "Stack inference confidence (0..1)", required = true)
    private double confidence;

    @Option(names = "--swarm", description = "Swarm ID to label the report with (default: ${DEFAULT-VALUE})",
            defaultValue = "adhoc")
    private String swarmId;

    private final SloGate sloGate;
    private final HivemindProperties properties;

    public SloCommand(SloGate sloGate, HivemindProperties properties) {
        this.sloGate = sloGate;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        long effectiveTokens = tokens;
        if (cost != null) {
            effectiveTokens = Math.round(cost / properties.getSlo().getPricePerThousandTokens() * 1000);
        }
        SloResult result = sloGate.evaluate(
                new SloMeasurements(effectiveTokens, duration, coverage, confidence), swarmId);
        ConsoleOutput.slo(result);
        return result.compliant() ? 0 : 1;
    }
}
