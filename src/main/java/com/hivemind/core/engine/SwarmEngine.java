package com.hivemind.core.engine;

import com.hivemind.core.config.HivemindProperties;
import com.hivemind.core.coordinator.AgentRegistry;
import com.hivemind.core.coordinator.DryRunAgent;
import com.hivemind.core.coordinator.SwarmCoordinator;
import com.hivemind.core.events.EventBus;
import com.hivemind.core.events.SwarmEvent;
import com.hivemind.core.logging.MdcContext;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.model.AgentRecord;
import com.hivemind.core.model.SloResult;
import com.hivemind.core.model.Swarm;
import com.hivemind.core.model.SwarmSnapshot;
import com.hivemind.core.model.SwarmStatus;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskResult;
import com.hivemind.core.model.TaskStatus;
import com.hivemind.core.planner.InvalidPlanException;
import com.hivemind.core.planner.PlanValidator;
import com.hivemind.core.planner.ProjectScope;
import com.hivemind.core.planner.SwarmPlan;
import com.hivemind.core.planner.SwarmPlanner;
import com.hivemind.core.scheduler.DependencyScheduler;
import com.hivemind.core.slo.SloGate;
import com.hivemind.core.slo.SloMeasurements;
import com.hivemind.core.store.StaleRecordException;
import com.hivemind.core.store.TaskStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Drives a swarm from registration to its SLO report.
 * <p>
 * A run repeatedly asks the {@link DependencyScheduler} for the ready set and
 * dispatches it as a wave through the {@link SwarmCoordinator}, at most
 * {@code hivemind.engine.max-parallel} tasks at a time. Each task is claimed with a
 * PENDING → IN_PROGRESS compare-and-set, so a task has at most one owner. When
 * nothing is ready but failed tasks still have retries left, the run waits for the
 * {@link com.hivemind.core.recovery.RecoveryMonitor} to re-queue them. Once nothing
 * can make progress the {@link SloGate} scores the run.
 */
@Service
public class SwarmEngine {

    private static final Logger log = LoggerFactory.getLogger(SwarmEngine.class);

    private final TaskStore store;
    private final DependencyScheduler scheduler;
    private final SwarmCoordinator coordinator;
    private final AgentRegistry registry;
    private final SloGate sloGate;
    private final SwarmPlanner planner;
    private final PlanValidator validator;
    private final EventBus eventBus;
    private final HivemindMetrics metrics;
    private final HivemindProperties properties;
    private final Clock clock;

    private final ConcurrentHashMap<String, CompletableFuture<SwarmRunResult>> activeRuns = new ConcurrentHashMap<>();

    private final ExecutorService workers = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "hivemind-worker");
        t.setDaemon(true);
        return t;
    });

    private final ExecutorService runners = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "hivemind-run");
        t.setDaemon(true);
        return t;
    });

    public SwarmEngine(TaskStore store, DependencyScheduler scheduler, SwarmCoordinator coordinator,
                       AgentRegistry registry, SloGate sloGate, SwarmPlanner planner, PlanValidator validator,
                       EventBus eventBus, HivemindMetrics metrics, HivemindProperties properties, Clock clock) {
        this.store = store;
        this.scheduler = scheduler;
        this.coordinator = coordinator;
        this.registry = registry;
        this.sloGate = sloGate;
        this.planner = planner;
        this.validator = validator;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    // ── Registration ─────────────────────────────────────────────────────

    /**
     * Plans a swarm from {@code scope} and registers it.
     *
     * @return the new swarm id
     */
    public String submit(ProjectScope scope) {
        return createSwarm(planner.plan(scope));
    }

    /**
     * Validates and stores a plan, registers its agents with the coordinator and
     * announces them to each other.
     *
     * @return the new swarm id
     * @throws InvalidPlanException if the plan is invalid or cyclic, or reuses ids of an existing swarm
     */
    public synchronized String createSwarm(SwarmPlan plan) {
        validator.validate(plan);
        rejectTakenIds(plan);
        String swarmId = generateSwarmId();
        Instant now = clock.instant();

        var swarm = new Swarm(swarmId, plan.name(), plan.metadata(), now, false);
        List<AgentRecord> agents = plan.agents().stream()
                .map(a -> AgentRecord.register(a.id(), swarmId, a.role(), now))
                .toList();
        List<Task> tasks = plan.tasks().stream()
                .map(t -> Task.pending(t.id(), swarmId, t.agentId(), t.description(), t.priority(),
                        t.dependencies(), t.payload()))
                .toList();
        store.createSwarm(swarm, agents, tasks);

        enlist(swarmId, agents);
        for (var agent : plan.agents()) {
            coordinator.handshake(agent.id(), Map.of(
                    "role", agent.role().capabilityTag(),
                    "swarm", swarmId));
        }

        eventBus.publish(event(SwarmEvent.SWARM_CREATED, swarmId, null, Map.of(
                "name", plan.name(),
                "agents", agents.size(),
                "tasks", tasks.size())));
        log.info("Created swarm {} '{}' with {} agents and {} tasks", swarmId, plan.name(), agents.size(), tasks.size());
        return swarmId;
    }

    /**
     * Agent and task ids are store-wide keys, so a plan may not reuse ids owned by an
     * existing swarm.
     */
    private void rejectTakenIds(SwarmPlan plan) {
        var problems = new ArrayList<String>();
        for (var agent : plan.agents()) {
            store.findAgent(agent.id()).ifPresent(existing -> problems.add(
                    "Agent id %s is already used by swarm %s".formatted(agent.id(), existing.swarmId())));
        }
        for (var task : plan.tasks()) {
            store.findTask(task.id()).ifPresent(existing -> problems.add(
                    "Task id %s is already used by swarm %s".formatted(task.id(), existing.swarmId())));
        }
        if (!problems.isEmpty()) {
            throw new InvalidPlanException(problems);
        }
    }

    private void enlist(String swarmId, List<AgentRecord> agents) {
        for (var agent : agents) {
            coordinator.register(agent.id(), agent.role(), swarmId);
            if (properties.getEngine().isDryRunAgents() && registry.registerIfAbsent(agent.id(), new DryRunAgent(agent.id()))) {
                log.debug("Agent {} has no implementation; using dry run", agent.id());
            }
        }
    }

    public String generateSwarmId() {
        return "HIVE-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }

    // ── Lifecycle ────────────────────────────────────────────────────────

    /**
     * Starts {@link #run} on a background thread. A swarm that is already running
     * returns its existing future.
     */
    public CompletableFuture<SwarmRunResult> runAsync(String swarmId) {
        store.getSwarmStatus(swarmId);
        return activeRuns.computeIfAbsent(swarmId, id -> {
            CompletableFuture<SwarmRunResult> future = CompletableFuture.supplyAsync(() -> run(id), runners);
            future.whenComplete((r, e) -> {
                activeRuns.remove(id);
                if (e != null) {
                    log.error("Swarm {} run failed: {}", id, e.getMessage(), e);
                }
            });
            return future;
        });
    }

    public boolean isRunning(String swarmId) {
        return activeRuns.containsKey(swarmId);
    }

    public void pause(String swarmId) {
        store.setPaused(swarmId, true);
        log.info("Swarm {} paused", swarmId);
    }

    public void resume(String swarmId) {
        store.setPaused(swarmId, false);
        log.info("Swarm {} resumed", swarmId);
    }

    /**
     * Runs a registered swarm until no task can make progress, then evaluates its SLO.
     *
     * @throws com.hivemind.core.store.SwarmNotFoundException for an unknown swarm
     */
    public SwarmRunResult run(String swarmId) {
        MdcContext.setSwarm(swarmId);
        try {
            Instant start = clock.instant();
            SwarmSnapshot initial = store.getSwarmStatus(swarmId);
            log.info("Starting swarm {} '{}'", swarmId, initial.swarm().name());
            enlist(swarmId, initial.agents());
            try {
                return execute(swarmId, start);
            } finally {
                coordinator.unregisterSwarm(swarmId);
            }
        } finally {
            MdcContext.clear();
        }
    }

    private SwarmRunResult execute(String swarmId, Instant start) {
        Optional<List<String>> cycle = scheduler.detectCycle(swarmId);
        if (cycle.isPresent()) {
            log.error("Swarm {} has a dependency cycle {}; refusing to schedule", swarmId, cycle.get());
            eventBus.publish(event(SwarmEvent.SWARM_CYCLE_DETECTED, swarmId, null,
                    Map.of("cycle", cycle.get())));
            metrics.recordSwarmResult(SwarmStatus.ERROR.name());
            return new SwarmRunResult(swarmId, SwarmStatus.ERROR, scheduler.progress(swarmId),
                    null, cycle.get(), false);
        }

        var results = new ConcurrentLinkedQueue<TaskResult>();
        Instant deadline = start.plus(properties.getEngine().getRunTimeout());
        boolean timedOut = false;
        while (true) {
            if (clock.instant().isAfter(deadline)) {
                log.warn("Swarm {} did not settle within {}; abandoning run", swarmId,
                        properties.getEngine().getRunTimeout());
                timedOut = true;
                break;
            }
            SwarmSnapshot snapshot = store.getSwarmStatus(swarmId);
            if (snapshot.swarm().paused()) {
                idle();
                continue;
            }
            List<Task> ready = scheduler.readyTasks(swarmId);
            if (!ready.isEmpty()) {
                dispatchWave(ready, results);
            } else if (awaitingProgress(snapshot)) {
                idle();
            } else {
                break;
            }
        }

        SwarmSnapshot finalSnapshot = store.getSwarmStatus(swarmId);
        SwarmStatus status = finalSnapshot.status(properties.getMaxRetries());
        double seconds = Duration.between(start, clock.instant()).toMillis() / 1000.0;
        SloResult slo = sloGate.evaluateAndRecord(measure(results, seconds, finalSnapshot.swarm()), swarmId);
        eventBus.publish(event(SwarmEvent.SLO_EVALUATED, swarmId, null,
                Map.of("compliant", slo.compliant())));

        metrics.recordSwarmResult(status.name());
        eventBus.publish(event(SwarmEvent.SWARM_COMPLETED, swarmId, null, Map.of(
                "status", status.name(),
                "duration_seconds", seconds)));
        log.info("Swarm {} finished with status {} in {}s", swarmId, status, seconds);
        return new SwarmRunResult(swarmId, status, scheduler.progress(swarmId), slo, List.of(), timedOut);
    }

    // ── Dispatch ─────────────────────────────────────────────────────────

    private void dispatchWave(List<Task> ready, ConcurrentLinkedQueue<TaskResult> results) {
        var semaphore = new Semaphore(Math.max(1, properties.getMaxParallel()));
        var futures = new ArrayList<CompletableFuture<Void>>();
        for (Task task : ready) {
            futures.add(CompletableFuture.runAsync(() -> {
                try {
                    semaphore.acquire();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                try {
                    MdcContext.setTask(task.swarmId(), task.id(), task.agentId());
                    dispatch(task).ifPresent(results::add);
                } finally {
                    MdcContext.clear();
                    semaphore.release();
                }
            }, workers));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    }

    private Optional<TaskResult> dispatch(Task task) {
        Task claimed;
        try {
            claimed = store.updateTask(task.withStatus(TaskStatus.IN_PROGRESS));
        } catch (StaleRecordException e) {
            log.debug("Task {} was claimed elsewhere; skipping", task.id());
            return Optional.empty();
        }
        eventBus.publish(event(SwarmEvent.TASK_STARTED, task.swarmId(), task.id(),
                Map.of("kind", task.kind().name(), "attempt", task.attempts())));

        TaskResult result = coordinator.executeSwarmTask(claimed, registry);
        TaskStatus outcome = result.succeeded() ? TaskStatus.COMPLETED : TaskStatus.FAILED;
        store.modifyTask(task.id(), t -> t.withStatus(outcome));
        if (result.agentId() != null) {
            coordinator.release(result.agentId());
        }

        var payload = new HashMap<String, Object>();
        payload.put("elapsed_ms", result.elapsedMs());
        if (result.agentId() != null) {
            payload.put("agent_id", result.agentId());
        }
        if (result.error() != null) {
            payload.put("error", result.error());
        }
        eventBus.publish(event(result.succeeded() ? SwarmEvent.TASK_COMPLETED : SwarmEvent.TASK_FAILED,
                task.swarmId(), task.id(), payload));
        return Optional.of(result);
    }

    /**
     * True while some task can still change state: one is running, or a failed one
     * still has retries left.
     */
    private boolean awaitingProgress(SwarmSnapshot snapshot) {
        int maxRetries = properties.getMaxRetries();
        return snapshot.tasks().stream().anyMatch(t ->
                t.status() == TaskStatus.IN_PROGRESS
                        || (t.status() == TaskStatus.FAILED && t.attempts() < maxRetries));
    }

    private SloMeasurements measure(Iterable<TaskResult> results, double seconds, Swarm swarm) {
        long tokens = 0;
        double coverageSum = 0;
        int coverageCount = 0;
        for (TaskResult r : results) {
            tokens += r.tokensUsed();
            if (r.succeeded() && r.coverage() != null) {
                coverageSum += r.coverage();
                coverageCount++;
            }
        }
        double coverage = coverageCount == 0 ? 0.0 : coverageSum / coverageCount;
        return new SloMeasurements(tokens, seconds, coverage, swarm.inferenceConfidence());
    }

    private SwarmEvent event(String type, String swarmId, String taskId, Map<String, Object> payload) {
        return SwarmEvent.of(type, swarmId, taskId, payload, clock.instant());
    }

    private void idle() {
        try {
            Thread.sleep(properties.getEngine().getIdleWait().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for swarm progress", e);
        }
    }

    @PreDestroy
    void shutdown() {
        runners.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
