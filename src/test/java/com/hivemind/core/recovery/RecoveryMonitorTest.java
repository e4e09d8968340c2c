package com.hivemind.core.recovery;

import com.hivemind.core.config.HivemindProperties;
import com.hivemind.core.events.EventBus;
import com.hivemind.core.events.SwarmEvent;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.model.InterventionEvent;
import com.hivemind.core.model.InterventionType;
import com.hivemind.core.model.Swarm;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskStatus;
import com.hivemind.core.store.InMemoryTaskStore;
import com.hivemind.core.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecoveryMonitorTest {

    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    private MutableClock clock;
    private InMemoryTaskStore store;
    private SimpleMeterRegistry meterRegistry;
    private List<SwarmEvent> published;
    private RecoveryMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new InMemoryTaskStore(clock);
        meterRegistry = new SimpleMeterRegistry();
        published = new ArrayList<>();
        var eventBus = new EventBus();
        eventBus.subscribeAll(published::add);

        var properties = new HivemindProperties();
        properties.getRecovery().setEnabled(false);
        // constructed directly; start() is never called so no background thread polls
        monitor = new RecoveryMonitor(store, properties, new HivemindMetrics(meterRegistry), eventBus, clock);

        store.createSwarm(new Swarm("S-1", "test", Map.of(), START, false), List.of(), List.of(
                Task.pending("T-1", null, "agent-1", "flaky", 5, List.of(), null)));
    }

    private void fail(String taskId) {
        store.modifyTask(taskId, t -> t.withStatus(TaskStatus.FAILED));
    }

    private Task task(String taskId) {
        return store.findTask(taskId).orElseThrow();
    }

    @Nested
    @DisplayName("backoff")
    class BackoffTests {

        @Test
        @DisplayName("first retry waits 10s, second waits 20s")
        void exponentialBackoff() {
            fail("T-1");

            clock.advance(Duration.ofSeconds(9));
            assertTrue(monitor.pollOnce().isEmpty(), "not due before 10s");

            clock.advance(Duration.ofSeconds(1));
            var first = monitor.pollOnce();
            assertEquals(1, first.size());
            assertEquals(InterventionType.RETRY, first.get(0).type());
            assertEquals(1, first.get(0).attempt());
            assertEquals(Duration.ofSeconds(10), first.get(0).backoff());
            assertEquals("Retry 1/3 after 10s backoff", first.get(0).details());
            assertEquals(TaskStatus.PENDING, task("T-1").status());
            assertEquals(1, task("T-1").attempts());

            fail("T-1");
            clock.advance(Duration.ofSeconds(10));
            assertTrue(monitor.pollOnce().isEmpty(), "second retry is not due after 10s");

            clock.advance(Duration.ofSeconds(10));
            var second = monitor.pollOnce();
            assertEquals(1, second.size());
            assertEquals(2, second.get(0).attempt());
            assertEquals(Duration.ofSeconds(20), second.get(0).backoff());
            assertTrue(second.get(0).backoff().compareTo(first.get(0).backoff()) > 0);
        }

        @Test
        @DisplayName("backoff policy doubles from the configured base")
        void policyDoubles() {
            var policy = monitor.backoffPolicy();
            assertEquals(Duration.ofSeconds(10), policy.delayFor(0));
            assertEquals(Duration.ofSeconds(20), policy.delayFor(1));
            assertEquals(Duration.ofSeconds(40), policy.delayFor(2));
            assertFalse(policy.exhausted(2));
            assertTrue(policy.exhausted(3));
        }

        @Test
        @DisplayName("pending and completed tasks are left alone")
        void nonFailedIgnored() {
            clock.advance(Duration.ofMinutes(5));
            assertTrue(monitor.pollOnce().isEmpty());
            assertEquals(TaskStatus.PENDING, task("T-1").status());
        }
    }

    @Nested
    @DisplayName("retry cap")
    class RetryCapTests {

        @Test
        @DisplayName("after three retries the task stays FAILED with one MAX_RETRIES_EXCEEDED event")
        void capsAtMaxRetries() {
            for (int attempt = 1; attempt <= 3; attempt++) {
                fail("T-1");
                clock.advance(Duration.ofSeconds(10L << (attempt - 1)));
                var events = monitor.pollOnce();
                assertEquals(1, events.size());
                assertEquals(InterventionType.RETRY, events.get(0).type());
            }
            fail("T-1");

            var terminal = monitor.pollOnce();
            assertEquals(1, terminal.size());
            assertEquals(InterventionType.MAX_RETRIES_EXCEEDED, terminal.get(0).type());
            assertEquals(Duration.ZERO, terminal.get(0).backoff());

            clock.advance(Duration.ofMinutes(10));
            assertTrue(monitor.pollOnce().isEmpty());
            assertTrue(monitor.pollOnce().isEmpty());

            assertEquals(TaskStatus.FAILED, task("T-1").status());
            assertEquals(3, task("T-1").attempts());
            var history = store.findEventsForTask("T-1").stream().map(InterventionEvent::type).toList();
            assertEquals(List.of(InterventionType.RETRY, InterventionType.RETRY, InterventionType.RETRY,
                    InterventionType.MAX_RETRIES_EXCEEDED), history);
        }

        @Test
        @DisplayName("retries and escalations are published and counted")
        void publishesAndCounts() {
            for (int attempt = 1; attempt <= 3; attempt++) {
                fail("T-1");
                clock.advance(Duration.ofSeconds(10L << (attempt - 1)));
                monitor.pollOnce();
            }
            fail("T-1");
            monitor.pollOnce();

            assertEquals(3, published.stream().filter(e -> e.eventType().equals(SwarmEvent.TASK_RETRIED)).count());
            assertEquals(1, published.stream()
                    .filter(e -> e.eventType().equals(SwarmEvent.TASK_RETRIES_EXHAUSTED)).count());
            assertEquals(clock.instant(), published.get(published.size() - 1).timestamp());
            assertEquals(START.plusSeconds(10), published.get(0).timestamp());
            assertEquals(3.0, meterRegistry.counter("hivemind.recovery.retries").count());
            assertEquals(1.0, meterRegistry.counter("hivemind.escalations.total",
                    "reason", "max_retries_exceeded").count());
        }
    }

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("no retried tasks means a 100% success rate")
        void noRetries() {
            var health = monitor.healthSnapshot();
            assertEquals(100.0, health.retrySuccessRate());
            assertEquals(1L, health.statusCounts().get(TaskStatus.PENDING));
            assertEquals(0, health.recentRetries());
        }

        @Test
        @DisplayName("counts recent retries and completed retried tasks")
        void countsRetries() {
            fail("T-1");
            clock.advance(Duration.ofSeconds(10));
            monitor.pollOnce();
            store.modifyTask("T-1", t -> t.withStatus(TaskStatus.COMPLETED));

            var health = monitor.healthSnapshot();
            assertEquals(1, health.recentRetries());
            assertEquals(100.0, health.retrySuccessRate());
            assertEquals(1, health.cycles());
            assertFalse(monitor.isRunning());
        }
    }
}
