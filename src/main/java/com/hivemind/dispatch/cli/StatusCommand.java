package com.hivemind.dispatch.cli;

import com.hivemind.core.config.HivemindProperties;
import com.hivemind.core.model.SwarmSnapshot;
import com.hivemind.core.model.SwarmStatus;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskStatus;
import com.hivemind.core.scheduler.DependencyScheduler;
import com.hivemind.core.scheduler.SchedulerStats;
import com.hivemind.core.store.SwarmNotFoundException;
import com.hivemind.core.store.TaskStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: hivemind status &lt;swarm-id&gt;
 * <p>
 * Shows the aggregate status, progress and task list of a swarm. Only swarms in the
 * configured store are visible, so with the default in-memory store this reports on
 * swarms created by the same process.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show swarm status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Swarm ID")
    private String swarmId;

    private final TaskStore store;
    private final DependencyScheduler scheduler;
    private final HivemindProperties properties;

    public StatusCommand(TaskStore store, DependencyScheduler scheduler, HivemindProperties properties) {
        this.store = store;
        this.scheduler = scheduler;
        this.properties = properties;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        SwarmSnapshot snapshot;
        try {
            snapshot = store.getSwarmStatus(swarmId);
        } catch (SwarmNotFoundException e) {
            ConsoleOutput.error("Swarm not found: " + swarmId);
            return;
        }

        System.out.println();
        System.out.println("SWARM " + snapshot.swarm().id() + " (" + snapshot.swarm().name() + ")");
        SwarmStatus status = snapshot.status(properties.getMaxRetries());
        switch (status) {
            case COMPLETED -> ConsoleOutput.success("Status: " + status);
            case ERROR -> ConsoleOutput.error("Status: " + status);
            default -> ConsoleOutput.info("Status: " + status);
        }

        SchedulerStats stats = scheduler.getStats(swarmId);
        ConsoleOutput.progress(stats.progress());
        ConsoleOutput.info("Ready tasks: " + stats.readyTasks());
        if (stats.hasCycle()) {
            ConsoleOutput.error("Dependency cycle: " + String.join(" -> ", stats.cyclePath()));
        }

        System.out.println();
        for (Task task : snapshot.tasks()) {
            String line = String.format("%-20s %-11s p%-3d %s (attempts: %d)",
                    task.id(), task.status(), task.priority(), task.description(), task.attempts());
            if (task.status() == TaskStatus.COMPLETED) {
                ConsoleOutput.success(line);
            } else if (task.status() == TaskStatus.FAILED) {
                ConsoleOutput.error(line);
            } else {
                ConsoleOutput.info(line);
            }
        }
    }
}
