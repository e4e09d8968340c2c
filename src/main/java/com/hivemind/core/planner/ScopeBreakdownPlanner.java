package com.hivemind.core.planner;

import com.hivemind.core.model.AgentRole;
import com.hivemind.core.model.TaskPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Default planner. Turns a project scope into one agent per stage and a linear
 * chain of tasks: research, design, code, test, deploy, with priorities 10 down to 6.
 */
@Service
public class ScopeBreakdownPlanner implements SwarmPlanner {

    private static final Logger log = LoggerFactory.getLogger(ScopeBreakdownPlanner.class);

    static final List<AgentRole> STAGES = List.of(
            AgentRole.RESEARCHER, AgentRole.DESIGNER, AgentRole.CODER, AgentRole.TESTER, AgentRole.DEPLOYER);

    private static final int TOP_PRIORITY = 10;

    @Override
    public SwarmPlan plan(ProjectScope scope) {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        var agents = new ArrayList<SwarmPlan.PlannedAgent>();
        var tasks = new ArrayList<SwarmPlan.PlannedTask>();

        String previous = null;
        for (int i = 0; i < STAGES.size(); i++) {
            AgentRole role = STAGES.get(i);
            String agentId = "agent-" + role.name().toLowerCase(Locale.ROOT) + "-" + suffix;
            String taskId = "TASK-%s-%03d".formatted(suffix, i + 1);
            agents.add(new SwarmPlan.PlannedAgent(agentId, role));
            tasks.add(new SwarmPlan.PlannedTask(taskId, agentId, describe(role, scope), TOP_PRIORITY - i,
                    previous != null ? List.of(previous) : List.of(), payloadFor(role, scope)));
            previous = taskId;
        }

        log.info("Planned swarm '{}' with {} tasks", scope.project(), tasks.size());
        return new SwarmPlan(scope.project(), scope.toMetadata(), agents, tasks);
    }

    private String describe(AgentRole role, ProjectScope scope) {
        String project = scope.project();
        return switch (role) {
            case RESEARCHER -> "Research comparables for " + project;
            case DESIGNER -> "Design wireframes and data schema for " + project;
            case CODER -> "Implement core features for " + project;
            case TESTER -> "Run end-to-end tests for " + project;
            case DEPLOYER -> "Deploy MVP of " + project;
            default -> role.name() + " work for " + project;
        };
    }

    private TaskPayload payloadFor(AgentRole role, ProjectScope scope) {
        return switch (role) {
            case RESEARCHER -> new TaskPayload.Research(scope.comparables());
            case DESIGNER -> new TaskPayload.Design(scope.techStack());
            case CODER -> new TaskPayload.Code(List.of(), scope.features());
            case TESTER -> new TaskPayload.Test(scope.coverageTarget());
            case DEPLOYER -> new TaskPayload.Deploy(scope.techStack().getOrDefault("hosting", "default"));
            case PLANNER -> new TaskPayload.Plan(scope.goal(), scope.features());
            case REVIEWER -> new TaskPayload.Review(scope.features());
        };
    }
}
