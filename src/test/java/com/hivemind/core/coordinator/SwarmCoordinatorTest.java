package com.hivemind.core.coordinator;

import com.hivemind.core.config.HivemindProperties;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.model.AgentRole;
import com.hivemind.core.model.AgentStatus;
import com.hivemind.core.model.Message;
import com.hivemind.core.model.MessageKind;
import com.hivemind.core.model.MessagePayload;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskPayload;
import com.hivemind.core.model.TaskResult;
import com.hivemind.core.model.TaskStatus;
import com.hivemind.core.store.InMemoryTaskStore;
import com.hivemind.core.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SwarmCoordinatorTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private SimpleMeterRegistry meterRegistry;
    private SwarmCoordinator coordinator;
    private AgentRegistry registry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        coordinator = new SwarmCoordinator(new InMemoryTaskStore(clock), new HivemindProperties(),
                new HivemindMetrics(meterRegistry), clock);
        registry = new AgentRegistry();
    }

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
    }

    private static Task codeTask(String id, String assignee) {
        return Task.pending(id, "S-1", assignee, "Implement " + id, 5, List.of(),
                new TaskPayload.Code(List.of(), List.of("login")));
    }

    private static Task testTask(String id, String assignee) {
        return Task.pending(id, "S-1", assignee, "Verify " + id, 5, List.of(), new TaskPayload.Test(90.0));
    }

    private List<Message> drain(String agentId) throws InterruptedException {
        var messages = new ArrayList<Message>();
        while (true) {
            var next = coordinator.receive(agentId, Duration.ZERO);
            if (next.isEmpty()) {
                return messages;
            }
            messages.add(next.get());
        }
    }

    @Nested
    @DisplayName("registration and messaging")
    class MessagingTests {

        @Test
        @DisplayName("register is idempotent and returns the same inbox")
        void registerIdempotent() {
            var first = coordinator.register("a", AgentRole.CODER);
            var second = coordinator.register("a", AgentRole.TESTER);
            assertSame(first, second);
            assertEquals(List.of("a"), coordinator.registeredAgents());
            assertEquals(AgentRole.CODER, coordinator.getAgentHealth("a").orElseThrow().role());
        }

        @Test
        @DisplayName("send delivers FIFO to the target inbox")
        void sendFifo() throws Exception {
            coordinator.register("a");
            coordinator.register("b");
            assertTrue(coordinator.send(Message.of("a", "b", new MessagePayload.Query("one"), null)));
            assertTrue(coordinator.send(Message.of("a", "b", new MessagePayload.Query("two"), null)));

            var received = drain("b");
            assertEquals(2, received.size());
            assertEquals("one", ((MessagePayload.Query) received.get(0).payload()).question());
            assertEquals("two", ((MessagePayload.Query) received.get(1).payload()).question());
        }

        @Test
        @DisplayName("send to an unknown agent is dropped and counted")
        void sendUnknownTarget() {
            coordinator.register("a");
            assertFalse(coordinator.send(Message.of("a", "ghost", new MessagePayload.Query("?"), null)));
            assertEquals(1.0, meterRegistry.counter("hivemind.messages.undelivered").count());
        }

        @Test
        @DisplayName("receive on an empty inbox times out empty")
        void receiveTimesOut() throws Exception {
            coordinator.register("a");
            assertTrue(coordinator.receive("a", Duration.ofMillis(10)).isEmpty());
            assertTrue(coordinator.receive("ghost", Duration.ofMillis(10)).isEmpty());
        }

        @Test
        @DisplayName("broadcast skips the sender")
        void broadcastSkipsSender() throws Exception {
            coordinator.register("a");
            coordinator.register("b");
            coordinator.register("c");

            int delivered = coordinator.broadcast("a", new MessagePayload.Query("hello"), "S-1");

            assertEquals(2, delivered);
            assertTrue(drain("a").isEmpty());
            assertEquals("S-1", drain("b").get(0).correlationId());
            assertEquals(1, drain("c").size());
        }

        @Test
        @DisplayName("handshake among three agents delivers exactly two HANDSHAKE messages")
        void handshakeDelivery() throws Exception {
            coordinator.register("a");
            coordinator.register("b");
            coordinator.register("c");

            assertTrue(coordinator.handshake("a", Map.of("specialization", "code")));

            var toB = drain("b");
            var toC = drain("c");
            assertEquals(1, toB.size());
            assertEquals(1, toC.size());
            assertEquals(MessageKind.HANDSHAKE, toB.get(0).kind());
            assertEquals(Map.of("specialization", "code"),
                    ((MessagePayload.Handshake) toC.get(0).payload()).capabilities());
            assertTrue(drain("a").isEmpty());
        }

        @Test
        @DisplayName("broadcast and handshake stay within the sender's swarm")
        void broadcastScopedToSwarm() throws Exception {
            coordinator.register("old-coder", AgentRole.CODER, "S-OLD");
            coordinator.register("coder", AgentRole.CODER, "S-1");
            coordinator.register("tester", AgentRole.TESTER, "S-1");

            coordinator.handshake("coder", Map.of("role", "code_generation"));

            assertEquals(1, drain("tester").size());
            assertTrue(drain("old-coder").isEmpty());
        }

        @Test
        @DisplayName("messages are stamped with the coordinator's clock")
        void messagesUseClock() throws Exception {
            coordinator.register("a");
            coordinator.register("b");

            coordinator.broadcast("a", new MessagePayload.Query("now?"));
            coordinator.pingAll();

            assertEquals(NOW, drain("b").get(0).timestamp());
            assertEquals(NOW, drain("a").get(0).timestamp());
        }

        @Test
        @DisplayName("unregisterSwarm drops only that swarm's agents and inboxes")
        void unregisterSwarm() {
            coordinator.register("done-1", AgentRole.CODER, "S-DONE");
            coordinator.register("done-2", AgentRole.TESTER, "S-DONE");
            coordinator.register("live", AgentRole.CODER, "S-1");

            assertEquals(2, coordinator.unregisterSwarm("S-DONE"));

            assertEquals(List.of("live"), coordinator.registeredAgents());
            assertFalse(coordinator.isRegistered("done-1"));
            assertTrue(coordinator.getAgentHealth("done-2").isEmpty());
            assertFalse(coordinator.send(Message.of("live", "done-1", new MessagePayload.Query("?"), null)));
        }
    }

    @Nested
    @DisplayName("routeTask")
    class RoutingTests {

        @Test
        @DisplayName("idle agent with the task's role is chosen and marked WORKING")
        void idleMappedAgent() {
            coordinator.register("research", AgentRole.RESEARCHER, "S-1");
            coordinator.register("coder", AgentRole.CODER, "S-1");

            assertEquals("coder", coordinator.routeTask(codeTask("T-1", "coder")));
            assertEquals(AgentStatus.WORKING, coordinator.getAgentHealth("coder").orElseThrow().status());
        }

        @Test
        @DisplayName("mapped agent that just completed a task yields to an idle agent")
        void completedMappedAgentFallsBack() {
            coordinator.register("coder", AgentRole.CODER, "S-1");
            coordinator.register("reviewer", AgentRole.REVIEWER, "S-1");
            registry.register("coder", new DryRunAgent("coder"));
            coordinator.executeSwarmTask(codeTask("T-1", "coder"), registry);
            assertEquals(AgentStatus.COMPLETED, coordinator.getAgentHealth("coder").orElseThrow().status());

            assertEquals("reviewer", coordinator.routeTask(codeTask("T-2", "coder")));
        }

        @Test
        @DisplayName("fallback skips a FAILED agent in favour of a later IDLE one")
        void fallbackSkipsFailedAgent() {
            coordinator.register("coder", AgentRole.CODER, "S-1");
            coordinator.register("tester", AgentRole.TESTER, "S-1");
            coordinator.register("reviewer", AgentRole.REVIEWER, "S-1");
            registry.register("tester", task -> {
                throw new IllegalStateException("flaky suite");
            });
            coordinator.executeSwarmTask(testTask("T-0", "tester"), registry);
            coordinator.routeTask(codeTask("T-1", "coder"));
            assertEquals(AgentStatus.FAILED, coordinator.getAgentHealth("tester").orElseThrow().status());
            assertEquals(AgentStatus.WORKING, coordinator.getAgentHealth("coder").orElseThrow().status());

            assertEquals("reviewer", coordinator.routeTask(codeTask("T-2", "coder")));
        }

        @Test
        @DisplayName("busy mapped agent falls back to the first idle agent")
        void busyMappedAgentFallsBack() {
            coordinator.register("coder", AgentRole.CODER, "S-1");
            coordinator.register("tester", AgentRole.TESTER, "S-1");
            coordinator.routeTask(codeTask("T-1", "coder"));

            assertEquals("tester", coordinator.routeTask(codeTask("T-2", "coder")));
        }

        @Test
        @DisplayName("when every agent is busy the mapped agent is returned")
        void allBusyKeepsMapped() {
            coordinator.register("coder", AgentRole.CODER, "S-1");
            coordinator.register("tester", AgentRole.TESTER, "S-1");
            coordinator.routeTask(codeTask("T-1", "coder"));
            coordinator.routeTask(codeTask("T-2", "coder"));

            assertEquals("coder", coordinator.routeTask(codeTask("T-3", "coder")));
        }

        @Test
        @DisplayName("agents of another swarm are never chosen")
        void otherSwarmIgnored() {
            coordinator.register("foreign-coder", AgentRole.CODER, "S-2");
            coordinator.register("local-tester", AgentRole.TESTER, "S-1");

            assertEquals("local-tester", coordinator.routeTask(codeTask("T-1", "local-tester")));
        }

        @Test
        @DisplayName("no candidate and no assignee throws")
        void noCandidateThrows() {
            assertThrows(IllegalStateException.class, () -> coordinator.routeTask(codeTask("T-1", null)));
        }
    }

    @Nested
    @DisplayName("executeSwarmTask")
    class ExecutionTests {

        @Test
        @DisplayName("successful execution updates health and caches the result")
        void successfulExecution() {
            coordinator.register("coder", AgentRole.CODER, "S-1");
            registry.register("coder", task -> TaskResult.completed(task.id(), "coder", "done", 1200, null));

            TaskResult result = coordinator.executeSwarmTask(codeTask("T-1", "coder"), registry);

            assertEquals(TaskStatus.COMPLETED, result.status());
            assertEquals("coder", result.agentId());
            var health = coordinator.getAgentHealth("coder").orElseThrow();
            assertEquals(AgentStatus.COMPLETED, health.status());
            assertEquals(1, health.tasksCompleted());
            assertSame(result, coordinator.getResult("T-1").orElseThrow());
            assertEquals(1.0, meterRegistry.counter("hivemind.tasks.total", "status", "COMPLETED").count());
        }

        @Test
        @DisplayName("agent exception becomes a FAILED result")
        void exceptionBecomesFailed() {
            coordinator.register("coder", AgentRole.CODER, "S-1");
            registry.register("coder", task -> {
                throw new IllegalStateException("compiler crashed");
            });

            TaskResult result = coordinator.executeSwarmTask(codeTask("T-1", "coder"), registry);

            assertEquals(TaskStatus.FAILED, result.status());
            assertEquals("compiler crashed", result.error());
            var health = coordinator.getAgentHealth("coder").orElseThrow();
            assertEquals(AgentStatus.FAILED, health.status());
            assertEquals(1, health.tasksFailed());
        }

        @Test
        @DisplayName("missing implementation becomes a FAILED result")
        void missingImplementationFails() {
            coordinator.register("coder", AgentRole.CODER, "S-1");
            TaskResult result = coordinator.executeSwarmTask(codeTask("T-1", "coder"), registry);
            assertEquals(TaskStatus.FAILED, result.status());
            assertTrue(result.error().contains("No implementation"));
        }

        @Test
        @DisplayName("released agent is IDLE and routable again")
        void releasedAgentRoutableAgain() {
            coordinator.register("coder", AgentRole.CODER, "S-1");
            coordinator.register("reviewer", AgentRole.REVIEWER, "S-1");
            registry.register("coder", new DryRunAgent("coder"));
            coordinator.executeSwarmTask(codeTask("T-1", "coder"), registry);

            coordinator.release("coder");

            var health = coordinator.getAgentHealth("coder").orElseThrow();
            assertEquals(AgentStatus.IDLE, health.status());
            assertEquals(1, health.tasksCompleted());
            assertEquals("coder", coordinator.routeTask(codeTask("T-2", "coder")));
        }

        @Test
        @DisplayName("release leaves a WORKING agent alone")
        void releaseKeepsWorkingAgent() {
            coordinator.register("coder", AgentRole.CODER, "S-1");
            coordinator.routeTask(codeTask("T-1", "coder"));

            coordinator.release("coder");
            coordinator.release("ghost");

            assertEquals(AgentStatus.WORKING, coordinator.getAgentHealth("coder").orElseThrow().status());
        }
    }

    @Nested
    @DisplayName("liveness")
    class LivenessTests {

        @Test
        @DisplayName("pingAll reports fresh agents alive and sends each a PING")
        void pingAllFresh() throws Exception {
            coordinator.register("a");
            coordinator.register("b");

            var alive = coordinator.pingAll();

            assertEquals(Map.of("a", true, "b", true), alive);
            assertEquals(MessageKind.PING, drain("a").get(0).kind());
            assertEquals(SwarmCoordinator.COORDINATOR_ID, drain("b").get(0).fromAgent());
        }

        @Test
        @DisplayName("repeated pingAll keeps at most one unread PING per inbox")
        void pingAllDoesNotPileUp() throws Exception {
            coordinator.register("a");
            coordinator.register("b");

            for (int i = 0; i < 1000; i++) {
                coordinator.pingAll();
            }

            assertEquals(1, drain("a").size());
            coordinator.pingAll();
            assertEquals(1, drain("a").size());
            assertEquals(1, drain("b").size());
        }

        @Test
        @DisplayName("pingAll reports agents with stale heartbeats as not alive")
        void pingAllStale() {
            var clock = new MutableClock(NOW);
            var timed = new SwarmCoordinator(new InMemoryTaskStore(clock), new HivemindProperties(),
                    new HivemindMetrics(meterRegistry), clock);
            try {
                timed.register("quiet");
                timed.register("chatty");
                clock.advance(Duration.ofSeconds(45));
                assertTrue(timed.heartbeat("chatty"));

                var alive = timed.pingAll();

                assertFalse(alive.get("quiet"));
                assertTrue(alive.get("chatty"));
                assertFalse(timed.heartbeat("ghost"));
            } finally {
                timed.shutdown();
            }
        }

        @Test
        @DisplayName("swarm stats list agents in registration order")
        void swarmStats() {
            coordinator.register("b");
            coordinator.register("a");
            var stats = coordinator.getSwarmStats();
            assertEquals(2, stats.totalAgents());
            assertEquals(List.of("b", "a"), new ArrayList<>(stats.agents().keySet()));
        }
    }
}
