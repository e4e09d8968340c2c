package com.hivemind.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Specialization of a swarm agent. Each role carries the capability tag
 * that agents of that role announce during the handshake.
 */
public enum AgentRole {
    RESEARCHER("research_agent"),
    DESIGNER("design_agent"),
    PLANNER("planner_agent"),
    CODER("code_agent"),
    TESTER("test_agent"),
    REVIEWER("review_agent"),
    DEPLOYER("deploy_agent");

    private final String capabilityTag;

    AgentRole(String capabilityTag) {
        this.capabilityTag = capabilityTag;
    }

    public String capabilityTag() {
        return capabilityTag;
    }

    /**
     * Resolves a role from either its enum name ("CODER") or its capability tag ("code_agent").
     */
    public static Optional<AgentRole> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(r -> r.name().equalsIgnoreCase(normalized) || r.capabilityTag.equalsIgnoreCase(normalized))
                .findFirst();
    }
}
