package com.hivemind.core.engine;

import com.hivemind.core.config.HivemindProperties;
import com.hivemind.core.coordinator.AgentRegistry;
import com.hivemind.core.coordinator.SwarmCoordinator;
import com.hivemind.core.events.EventBus;
import com.hivemind.core.events.SwarmEvent;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.model.AgentRole;
import com.hivemind.core.model.AgentStatus;
import com.hivemind.core.model.Swarm;
import com.hivemind.core.model.SwarmStatus;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskPayload;
import com.hivemind.core.model.TaskResult;
import com.hivemind.core.model.TaskStatus;
import com.hivemind.core.planner.CyclicDependencyException;
import com.hivemind.core.planner.InvalidPlanException;
import com.hivemind.core.planner.PlanValidator;
import com.hivemind.core.planner.ProjectScope;
import com.hivemind.core.planner.ScopeBreakdownPlanner;
import com.hivemind.core.planner.SwarmPlan;
import com.hivemind.core.recovery.RecoveryMonitor;
import com.hivemind.core.scheduler.DependencyScheduler;
import com.hivemind.core.slo.SloGate;
import com.hivemind.core.store.InMemoryTaskStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SwarmEngineTest {

    private HivemindProperties properties;
    private InMemoryTaskStore store;
    private EventBus eventBus;
    private HivemindMetrics metrics;
    private AgentRegistry registry;
    private SwarmCoordinator coordinator;
    private SwarmEngine engine;
    private List<SwarmEvent> events;

    @BeforeEach
    void setUp() {
        properties = new HivemindProperties();
        properties.getEngine().setIdleWait(Duration.ofMillis(10));
        properties.getEngine().setRunTimeout(Duration.ofSeconds(10));
        properties.getRecovery().setEnabled(false);
        engine = newEngine();
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private SwarmEngine newEngine() {
        Clock clock = Clock.systemUTC();
        store = new InMemoryTaskStore(clock);
        eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(events::add);
        metrics = new HivemindMetrics(new SimpleMeterRegistry());
        registry = new AgentRegistry();
        var scheduler = new DependencyScheduler(store);
        coordinator = new SwarmCoordinator(store, properties, metrics, clock);
        var sloGate = new SloGate(properties, store, metrics, clock);
        return new SwarmEngine(store, scheduler, coordinator, registry, sloGate, new ScopeBreakdownPlanner(),
                new PlanValidator(scheduler), eventBus, metrics, properties, clock);
    }

    private static SwarmPlan.PlannedTask code(String id, int priority, String... deps) {
        return new SwarmPlan.PlannedTask(id, "coder", "Implement " + id, priority, List.of(deps),
                new TaskPayload.Code(List.of(), List.of()));
    }

    private static SwarmPlan codePlan(SwarmPlan.PlannedTask... tasks) {
        return new SwarmPlan("plan", Map.of(Swarm.CONFIDENCE_KEY, 0.9),
                List.of(new SwarmPlan.PlannedAgent("coder", AgentRole.CODER)), List.of(tasks));
    }

    private List<String> eventTypes() {
        return events.stream().map(SwarmEvent::eventType).toList();
    }

    @Nested
    @DisplayName("happy path")
    class HappyPathTests {

        @Test
        @DisplayName("dry-run swarm from a scope completes with a compliant SLO")
        void dryRunScopeCompletes() {
            String swarmId = engine.submit(new ProjectScope("Todo app", "MVP", List.of("auth"),
                    Map.of(), List.of(), 0.9, null));

            SwarmRunResult result = engine.run(swarmId);

            assertTrue(swarmId.startsWith("HIVE-"));
            assertEquals(SwarmStatus.COMPLETED, result.status());
            assertEquals(100.0, result.progress().percent());
            assertFalse(result.timedOut());
            assertNotNull(result.slo());
            assertTrue(result.slo().compliant());
            assertEquals(95.0, result.slo().coverage().value());
            assertEquals(1, store.findSloResults(swarmId).size());

            var types = eventTypes();
            assertEquals(SwarmEvent.SWARM_CREATED, types.get(0));
            assertEquals(5, types.stream().filter(SwarmEvent.TASK_COMPLETED::equals).count());
            assertEquals(SwarmEvent.SWARM_COMPLETED, types.get(types.size() - 1));
        }

        @Test
        @DisplayName("diamond graph runs dependents only after their dependencies")
        void diamondOrder() {
            var order = new CopyOnWriteArrayList<String>();
            registry.register("coder", task -> {
                order.add(task.id());
                return TaskResult.completed(task.id(), "coder", "ok", 1_000, null);
            });
            String swarmId = engine.createSwarm(codePlan(
                    code("A", 5), code("B", 5, "A"), code("C", 5, "A"), code("D", 5, "B", "C")));

            SwarmRunResult result = engine.run(swarmId);

            assertEquals(SwarmStatus.COMPLETED, result.status());
            assertEquals("A", order.get(0));
            assertEquals("D", order.get(3));
            assertEquals(4_000, result.slo().cost().tokens());
        }

        @Test
        @DisplayName("higher priority ready tasks are dispatched first")
        void priorityOrder() {
            properties.getEngine().setMaxParallel(1);
            var order = new CopyOnWriteArrayList<String>();
            registry.register("coder", task -> {
                order.add(task.id());
                return TaskResult.completed(task.id(), "coder", "ok", 0, null);
            });
            String swarmId = engine.createSwarm(codePlan(code("LOW", 1), code("HIGH", 9), code("MID", 5)));

            engine.run(swarmId);

            assertEquals(List.of("HIGH", "MID", "LOW"), order);
        }

        @Test
        @DisplayName("no more than max-parallel tasks run at once")
        void respectsMaxParallel() {
            properties.getEngine().setMaxParallel(2);
            var running = new AtomicInteger();
            var peak = new AtomicInteger();
            registry.register("coder", task -> {
                int now = running.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                Thread.sleep(50);
                running.decrementAndGet();
                return TaskResult.completed(task.id(), "coder", "ok", 0, null);
            });
            String swarmId = engine.createSwarm(codePlan(code("A", 5), code("B", 5), code("C", 5), code("D", 5)));

            assertEquals(SwarmStatus.COMPLETED, engine.run(swarmId).status());
            assertTrue(peak.get() <= 2, "peak concurrency was " + peak.get());
        }
    }

    @Nested
    @DisplayName("failure handling")
    class FailureTests {

        @Test
        @DisplayName("cyclic swarm is refused before any task runs")
        void cycleRefused() {
            var executed = new AtomicInteger();
            registry.register("coder", task -> {
                executed.incrementAndGet();
                return TaskResult.completed(task.id(), "coder", "ok", 0, null);
            });
            store.createSwarm(new Swarm("HIVE-CYCLE", "cyclic", Map.of(), Instant.now(), false), List.of(), List.of(
                    Task.pending("A", null, "coder", "a", 5, List.of("C"), null),
                    Task.pending("B", null, "coder", "b", 5, List.of("A"), null),
                    Task.pending("C", null, "coder", "c", 5, List.of("B"), null)));

            SwarmRunResult result = engine.run("HIVE-CYCLE");

            assertEquals(SwarmStatus.ERROR, result.status());
            assertEquals(3, result.cyclePath().size());
            assertNull(result.slo());
            assertEquals(0, executed.get());
            assertTrue(eventTypes().contains(SwarmEvent.SWARM_CYCLE_DETECTED));
        }

        @Test
        @DisplayName("cyclic plan is rejected at registration")
        void cyclicPlanRejected() {
            assertThrows(CyclicDependencyException.class,
                    () -> engine.createSwarm(codePlan(code("A", 5, "B"), code("B", 5, "A"))));
            assertTrue(store.listSwarms().isEmpty());
        }

        @Test
        @DisplayName("plan reusing another swarm's agent or task ids is rejected without writes")
        void reusedIdsRejected() {
            String first = engine.createSwarm(codePlan(code("A", 5)));
            var reusedAgent = codePlan(code("B", 5));
            var reusedTask = new SwarmPlan("plan", Map.of(),
                    List.of(new SwarmPlan.PlannedAgent("coder-2", AgentRole.CODER)),
                    List.of(new SwarmPlan.PlannedTask("A", "coder-2", "Implement A", 5, List.of(),
                            new TaskPayload.Code(List.of(), List.of()))));

            var agentProblem = assertThrows(InvalidPlanException.class, () -> engine.createSwarm(reusedAgent));
            var taskProblem = assertThrows(InvalidPlanException.class, () -> engine.createSwarm(reusedTask));

            assertTrue(agentProblem.getProblems().get(0).contains("Agent id coder"));
            assertTrue(taskProblem.getProblems().get(0).contains("Task id A"));
            assertEquals(1, store.listSwarms().size());
            assertEquals(first, store.findAgent("coder").orElseThrow().swarmId());
            assertTrue(store.findAgent("coder-2").isEmpty());
            assertTrue(store.findTask("B").isEmpty());
        }

        @Test
        @DisplayName("permanent failure blocks dependents and ends in ERROR")
        void permanentFailure() {
            properties.getRecovery().setMaxRetries(0);
            registry.register("coder", task -> {
                if (task.id().equals("A")) {
                    throw new IllegalStateException("build broke");
                }
                return TaskResult.completed(task.id(), "coder", "ok", 0, null);
            });
            String swarmId = engine.createSwarm(codePlan(code("A", 5), code("B", 5, "A"), code("C", 1)));

            SwarmRunResult result = engine.run(swarmId);

            assertEquals(SwarmStatus.ERROR, result.status());
            assertEquals(TaskStatus.FAILED, store.findTask("A").orElseThrow().status());
            assertEquals(TaskStatus.PENDING, store.findTask("B").orElseThrow().status());
            assertEquals(TaskStatus.COMPLETED, store.findTask("C").orElseThrow().status());
            assertTrue(eventTypes().contains(SwarmEvent.TASK_FAILED));
            assertFalse(result.slo().compliant());
        }

        @Test
        @DisplayName("failed task re-queued by the recovery monitor completes on retry")
        void recoversThroughRetry() {
            properties.getRecovery().setBackoffBase(Duration.ZERO);
            var monitor = new RecoveryMonitor(store, properties, metrics, eventBus, Clock.systemUTC());
            var calls = new AtomicInteger();
            registry.register("coder", task -> {
                if (calls.incrementAndGet() == 1) {
                    throw new IllegalStateException("flaky");
                }
                return TaskResult.completed(task.id(), "coder", "ok", 0, null);
            });
            String swarmId = engine.createSwarm(codePlan(code("A", 5)));

            ScheduledExecutorService poller = Executors.newSingleThreadScheduledExecutor();
            poller.scheduleWithFixedDelay(monitor::pollOnce, 10, 10, TimeUnit.MILLISECONDS);
            try {
                SwarmRunResult result = engine.run(swarmId);

                assertEquals(SwarmStatus.COMPLETED, result.status());
                assertEquals(1, store.findTask("A").orElseThrow().attempts());
                assertEquals(2, calls.get());
                assertTrue(eventTypes().contains(SwarmEvent.TASK_RETRIED));
            } finally {
                poller.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("finished run returns agents to IDLE and drops them from the coordinator")
        void finishedRunReleasesAgents() {
            registry.register("coder", task -> TaskResult.completed(task.id(), "coder", "ok", 0, null));
            String swarmId = engine.createSwarm(codePlan(code("A", 5), code("B", 5, "A")));
            assertTrue(coordinator.isRegistered("coder"));

            SwarmRunResult result = engine.run(swarmId);

            assertEquals(SwarmStatus.COMPLETED, result.status());
            assertFalse(coordinator.isRegistered("coder"));
            var agent = store.findAgent("coder").orElseThrow();
            assertEquals(AgentStatus.IDLE, agent.status());
            assertEquals(2, agent.tasksCompleted());
        }

        @Test
        @DisplayName("a later swarm's handshake does not reach a finished swarm's agents")
        void handshakeSkipsFinishedSwarm() throws Exception {
            registry.register("coder", task -> TaskResult.completed(task.id(), "coder", "ok", 0, null));
            engine.run(engine.createSwarm(codePlan(code("A", 5))));

            engine.createSwarm(new SwarmPlan("next", Map.of(),
                    List.of(new SwarmPlan.PlannedAgent("coder-2", AgentRole.CODER),
                            new SwarmPlan.PlannedAgent("tester-2", AgentRole.TESTER)),
                    List.of(new SwarmPlan.PlannedTask("X", "coder-2", "Implement X", 5, List.of(),
                            new TaskPayload.Code(List.of(), List.of())))));

            assertEquals(List.of("coder-2", "tester-2"), coordinator.registeredAgents());
            assertTrue(coordinator.receive("tester-2", Duration.ZERO).isPresent());
            assertTrue(coordinator.receive("tester-2", Duration.ZERO).isEmpty());
        }

        @Test
        @DisplayName("paused swarm dispatches nothing until resumed")
        void pauseAndResume() throws Exception {
            registry.register("coder", task -> TaskResult.completed(task.id(), "coder", "ok", 0, null));
            String swarmId = engine.createSwarm(codePlan(code("A", 5)));
            engine.pause(swarmId);

            var future = engine.runAsync(swarmId);
            assertTrue(engine.isRunning(swarmId));
            Thread.sleep(100);
            assertEquals(TaskStatus.PENDING, store.findTask("A").orElseThrow().status());

            engine.resume(swarmId);
            SwarmRunResult result = future.get(5, TimeUnit.SECONDS);

            assertEquals(SwarmStatus.COMPLETED, result.status());
        }

        @Test
        @DisplayName("runAsync returns the same future while a run is active")
        void runAsyncDeduplicates() throws Exception {
            registry.register("coder", task -> TaskResult.completed(task.id(), "coder", "ok", 0, null));
            String swarmId = engine.createSwarm(codePlan(code("A", 5)));
            engine.pause(swarmId);

            var first = engine.runAsync(swarmId);
            var second = engine.runAsync(swarmId);
            assertSame(first, second);

            engine.resume(swarmId);
            first.get(5, TimeUnit.SECONDS);
        }
    }
}
