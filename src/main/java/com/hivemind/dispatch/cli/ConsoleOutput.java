package com.hivemind.dispatch.cli;

import com.hivemind.core.events.SwarmEvent;
import com.hivemind.core.model.SloResult;
import com.hivemind.core.scheduler.SwarmProgress;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Hivemind CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) HIVEMIND v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [HIVEMIND]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void progress(SwarmProgress p) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Progress: @|bold " + p.percent() + "%|@ (" +
                "@|fg(green) " + p.completed() + " completed|@, " +
                p.inProgress() + " in progress, " +
                p.pending() + " pending, " +
                (p.failed() > 0 ? "@|fg(red) " + p.failed() + " failed|@" : "0 failed") +
                ", " + p.total() + " total)"));
    }

    public static void slo(SloResult r) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold SLO Report|@"));
        dimension("Cost", "$" + r.cost().estimatedCost() + " (" + r.cost().tokens() + " tokens)",
                "<= $" + r.cost().threshold(), r.cost().breach());
        dimension("Latency", r.latency().durationSeconds() + "s",
                "<= " + r.latency().thresholdSeconds() + "s", r.latency().breach());
        dimension("Coverage", r.coverage().value() + "%",
                ">= " + r.coverage().threshold() + "%", r.coverage().breach());
        dimension("Confidence", String.valueOf(r.confidence().value()),
                ">= " + r.confidence().threshold(), r.confidence().breach());
        if (r.compliant()) {
            success("Compliant");
        } else {
            error("Not compliant");
        }
    }

    public static void watchEvent(SwarmEvent event) {
        String prefix = switch (event.eventType()) {
            case SwarmEvent.SWARM_CREATED -> "@|fg(cyan) [SWARM]|@";
            case SwarmEvent.TASK_STARTED, SwarmEvent.TASK_COMPLETED -> "@|fg(blue) [TASK]|@";
            case SwarmEvent.TASK_FAILED, SwarmEvent.TASK_RETRIES_EXHAUSTED -> "@|fg(red) [TASK]|@";
            case SwarmEvent.TASK_RETRIED -> "@|fg(yellow) [RETRY]|@";
            case SwarmEvent.SWARM_CYCLE_DETECTED -> "@|fg(red),bold [CYCLE]|@";
            case SwarmEvent.SLO_EVALUATED -> "@|fg(magenta) [SLO]|@";
            case SwarmEvent.SWARM_COMPLETED -> "@|fg(green),bold [COMPLETE]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.taskId() != null ? event.taskId() + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                prefix + " " + event.eventType() + " " + subject + event.payload()));
    }

    private static void dimension(String name, String value, String threshold, boolean breach) {
        String flag = breach ? "@|fg(red) BREACH|@" : "@|fg(green) OK|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + String.format("%-11s", name) + flag + "  " + value + " (" + threshold + ")"));
    }
}
