package com.hivemind.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A message between two agents. Consumed once from the receiver's inbox; never persisted.
 *
 * @param fromAgent     sender agent id
 * @param toAgent       receiver agent id
 * @param kind          message kind; must match {@code payload.kind()}
 * @param payload       typed body
 * @param timestamp     when the message was created
 * @param correlationId optional swarm or conversation id (nullable)
 */
public record Message(
    String fromAgent,
    String toAgent,
    MessageKind kind,
    MessagePayload payload,
    Instant timestamp,
    String correlationId
) implements Serializable {

    public Message {
        Objects.requireNonNull(toAgent, "toAgent must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        if (kind == null) {
            kind = payload.kind();
        } else if (kind != payload.kind()) {
            throw new IllegalArgumentException(
                    "Message kind " + kind + " does not match payload kind " + payload.kind());
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static Message of(String fromAgent, String toAgent, MessagePayload payload, String correlationId) {
        return of(fromAgent, toAgent, payload, correlationId, Instant.now());
    }

    public static Message of(String fromAgent, String toAgent, MessagePayload payload, String correlationId,
                             Instant timestamp) {
        return new Message(fromAgent, toAgent, payload.kind(), payload, timestamp, correlationId);
    }
}
