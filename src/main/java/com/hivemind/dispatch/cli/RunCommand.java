package com.hivemind.dispatch.cli;

import com.hivemind.core.engine.SwarmEngine;
import com.hivemind.core.engine.SwarmRunResult;
import com.hivemind.core.events.EventBus;
import com.hivemind.core.model.SwarmStatus;
import com.hivemind.core.planner.InvalidPlanException;
import com.hivemind.core.planner.ProjectScope;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: hivemind run &lt;project&gt;
 * <p>
 * Plans a swarm from the given scope, runs it to completion in the foreground
 * while printing its events, and prints the SLO report.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Plan and run a swarm")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project name")
    private String project;

    @Option(names = {"--goal", "-g"}, description = "What should be built")
    private String goal;

    @Option(names = {"--feature", "-f"}, description = "Feature to implement (repeatable)")
    private List<String> features;

    @Option(names = "--stack", description = "Tech stack entry, e.g. --stack frontend=Next.js (repeatable)")
    private Map<String, String> techStack;

    @Option(names = "--comparable", description = "Existing product to research (repeatable)")
    private List<String> comparables;

    @Option(names = "--confidence", description = "Stack inference confidence (0..1)")
    private Double stackConfidence;

    @Option(names = "--coverage-target", description = "Coverage the test task must reach (default: 95)")
    private Double coverageTarget;

    private final SwarmEngine engine;
    private final EventBus eventBus;

    public RunCommand(SwarmEngine engine, EventBus eventBus) {
        this.engine = engine;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        var subscription = eventBus.subscribeAll(ConsoleOutput::watchEvent);
        try {
            var scope = new ProjectScope(project, goal, features, techStack, comparables,
                    stackConfidence, coverageTarget);
            String swarmId = engine.submit(scope);
            ConsoleOutput.info("Swarm " + swarmId + " created for " + project);

            SwarmRunResult result = engine.run(swarmId);
            ConsoleOutput.progress(result.progress());
            if (!result.cyclePath().isEmpty()) {
                ConsoleOutput.error("Dependency cycle: " + String.join(" -> ", result.cyclePath()));
            }
            if (result.timedOut()) {
                ConsoleOutput.warn("Run timed out before every task settled");
            }
            if (result.slo() != null) {
                ConsoleOutput.slo(result.slo());
            }
            if (result.status() == SwarmStatus.COMPLETED) {
                ConsoleOutput.success("Swarm " + swarmId + " " + result.status());
                return 0;
            }
            ConsoleOutput.error("Swarm " + swarmId + " " + result.status());
            return 1;
        } catch (InvalidPlanException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        } finally {
            subscription.unsubscribe();
        }
    }
}
