package com.hivemind.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Typed body of a {@link Message}, one variant per {@link MessageKind}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MessagePayload.TaskAssignment.class, name = "task"),
        @JsonSubTypes.Type(value = MessagePayload.Result.class, name = "result"),
        @JsonSubTypes.Type(value = MessagePayload.Query.class, name = "query"),
        @JsonSubTypes.Type(value = MessagePayload.Handshake.class, name = "handshake"),
        @JsonSubTypes.Type(value = MessagePayload.Ping.class, name = "ping")
})
public interface MessagePayload extends Serializable {

    @JsonIgnore
    MessageKind kind();

    record TaskAssignment(@JsonProperty("task_id") String taskId, String description) implements MessagePayload {
        @Override
        public MessageKind kind() { return MessageKind.TASK; }
    }

    record Result(@JsonProperty("task_id") String taskId, TaskStatus status, String output) implements MessagePayload {
        @Override
        public MessageKind kind() { return MessageKind.RESULT; }
    }

    record Query(String question) implements MessagePayload {
        @Override
        public MessageKind kind() { return MessageKind.QUERY; }
    }

    /**
     * Capability announcement sent once by an agent joining a swarm,
     * e.g. {@code {"model": "grok-4-fast", "specialization": "code"}}.
     */
    record Handshake(Map<String, String> capabilities) implements MessagePayload {
        public Handshake {
            capabilities = capabilities != null ? Map.copyOf(capabilities) : Map.of();
        }

        @Override
        public MessageKind kind() { return MessageKind.HANDSHAKE; }
    }

    record Ping(@JsonProperty("sent_at") Instant sentAt) implements MessagePayload {
        @Override
        public MessageKind kind() { return MessageKind.PING; }
    }
}
