package com.hivemind.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("Message")
    class MessageTests {

        @Test
        @DisplayName("kind defaults to the payload kind")
        void kindFromPayload() {
            var message = new Message("a", "b", null, new MessagePayload.Query("status?"), null, null);
            assertEquals(MessageKind.QUERY, message.kind());
            assertNotNull(message.timestamp());
        }

        @Test
        @DisplayName("kind that disagrees with the payload is rejected")
        void kindMismatchRejected() {
            assertThrows(IllegalArgumentException.class, () -> new Message("a", "b", MessageKind.PING,
                    new MessagePayload.Query("status?"), Instant.now(), null));
        }
    }

    @Nested
    @DisplayName("TaskPayload")
    class TaskPayloadTests {

        @Test
        @DisplayName("test coverage target outside 0..100 is rejected")
        void coverageRange() {
            assertThrows(IllegalArgumentException.class, () -> new TaskPayload.Test(101));
            assertThrows(IllegalArgumentException.class, () -> new TaskPayload.Test(-1));
            assertEquals(95.0, new TaskPayload.Test(95).coverageTarget());
        }

        @Test
        @DisplayName("task kind follows the payload; no payload means CODE")
        void kindFollowsPayload() {
            var deploy = Task.pending("T", "S", "a", "d", 1, List.of(), new TaskPayload.Deploy("vercel"));
            var bare = Task.pending("T", "S", "a", "d", 1, List.of(), null);
            assertEquals(TaskKind.DEPLOY, deploy.kind());
            assertEquals(AgentRole.DEPLOYER, deploy.kind().role());
            assertEquals(TaskKind.CODE, bare.kind());
        }

        @Test
        @DisplayName("payload JSON carries a kind discriminator")
        void jsonDiscriminator() throws Exception {
            var mapper = new ObjectMapper().registerModule(new JavaTimeModule());
            String json = mapper.writeValueAsString(new TaskPayload.Test(90));
            assertTrue(json.contains("\"kind\":\"test\""));
            assertTrue(json.contains("\"coverage_target\":90.0"));

            TaskPayload parsed = mapper.readValue("{\"kind\":\"research\",\"comparables\":[\"Trello\"]}",
                    TaskPayload.class);
            assertInstanceOf(TaskPayload.Research.class, parsed);
            assertEquals(List.of("Trello"), ((TaskPayload.Research) parsed).comparables());
        }
    }

    @Nested
    @DisplayName("SwarmStatus.aggregate")
    class AggregateTests {

        private Task task(String id, TaskStatus status, int attempts) {
            return Task.pending(id, "S", "a", "d", 1, List.of(), null).withStatus(status).withAttempts(attempts);
        }

        @Test
        @DisplayName("no tasks is IDLE")
        void emptyIsIdle() {
            assertEquals(SwarmStatus.IDLE, SwarmStatus.aggregate(List.of(), false, 3));
        }

        @Test
        @DisplayName("all completed is COMPLETED even when paused")
        void allCompleted() {
            var tasks = List.of(task("A", TaskStatus.COMPLETED, 0), task("B", TaskStatus.COMPLETED, 2));
            assertEquals(SwarmStatus.COMPLETED, SwarmStatus.aggregate(tasks, true, 3));
        }

        @Test
        @DisplayName("failed task with retries left keeps the swarm RUNNING")
        void retryableFailureIsRunning() {
            var tasks = List.of(task("A", TaskStatus.COMPLETED, 0), task("B", TaskStatus.FAILED, 1));
            assertEquals(SwarmStatus.RUNNING, SwarmStatus.aggregate(tasks, false, 3));
        }

        @Test
        @DisplayName("failed task that spent its retries is ERROR")
        void exhaustedFailureIsError() {
            var tasks = List.of(task("A", TaskStatus.PENDING, 0), task("B", TaskStatus.FAILED, 3));
            assertEquals(SwarmStatus.ERROR, SwarmStatus.aggregate(tasks, false, 3));
        }

        @Test
        @DisplayName("paused swarm with open work is PAUSED")
        void pausedIsPaused() {
            var tasks = List.of(task("A", TaskStatus.IN_PROGRESS, 0));
            assertEquals(SwarmStatus.PAUSED, SwarmStatus.aggregate(tasks, true, 3));
        }
    }

    @Nested
    @DisplayName("Swarm")
    class SwarmTests {

        @Test
        @DisplayName("reads inference confidence from metadata as number or string")
        void inferenceConfidence() {
            assertEquals(0.85, new Swarm("S", "n", Map.of(Swarm.CONFIDENCE_KEY, 0.85), Instant.now(), false)
                    .inferenceConfidence());
            assertEquals(0.7, new Swarm("S", "n", Map.of(Swarm.CONFIDENCE_KEY, "0.7"), Instant.now(), false)
                    .inferenceConfidence());
            assertEquals(0.0, new Swarm("S", "n", Map.of(), Instant.now(), false).inferenceConfidence());
        }
    }

    @Test
    @DisplayName("AgentRole resolves from name or capability tag")
    void agentRoleFromValue() {
        assertEquals(AgentRole.CODER, AgentRole.fromValue("code_agent").orElseThrow());
        assertEquals(AgentRole.TESTER, AgentRole.fromValue("tester").orElseThrow());
        assertTrue(AgentRole.fromValue("janitor").isEmpty());
    }
}
