package com.hivemind.core.model;

/**
 * Kind of an inter-agent message. Each kind has exactly one {@link MessagePayload} variant.
 */
public enum MessageKind {
    TASK,
    RESULT,
    QUERY,
    HANDSHAKE,
    PING
}
