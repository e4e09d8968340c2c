package com.hivemind.core.model;

/**
 * Kind of work a task represents. The kind decides which {@link AgentRole} the
 * coordinator routes the task to.
 */
public enum TaskKind {
    RESEARCH(AgentRole.RESEARCHER),
    DESIGN(AgentRole.DESIGNER),
    PLAN(AgentRole.PLANNER),
    CODE(AgentRole.CODER),
    TEST(AgentRole.TESTER),
    REVIEW(AgentRole.REVIEWER),
    DEPLOY(AgentRole.DEPLOYER);

    private final AgentRole role;

    TaskKind(AgentRole role) {
        this.role = role;
    }

    public AgentRole role() {
        return role;
    }
}
