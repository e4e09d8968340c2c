package com.hivemind.core.planner;

import com.hivemind.core.model.AgentRole;
import com.hivemind.core.model.Task;
import com.hivemind.core.scheduler.DependencyScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Checks a {@link SwarmPlan} before it is stored: ids are unique, every dependency
 * and assignee exists, each assignee's role can do the task's kind, and the
 * dependencies form a DAG.
 */
@Component
public class PlanValidator {

    private static final Logger log = LoggerFactory.getLogger(PlanValidator.class);

    private final DependencyScheduler scheduler;

    public PlanValidator(DependencyScheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * @throws InvalidPlanException       listing every structural problem found
     * @throws CyclicDependencyException  when the plan is otherwise valid but cyclic
     */
    public void validate(SwarmPlan plan) {
        var problems = new ArrayList<String>();
        if (plan.name() == null || plan.name().isBlank()) {
            problems.add("Plan has no name");
        }

        Map<String, AgentRole> roles = new HashMap<>();
        for (var agent : plan.agents()) {
            if (agent.id() == null || agent.id().isBlank()) {
                problems.add("Agent without id");
            } else if (roles.containsKey(agent.id())) {
                problems.add("Duplicate agent id " + agent.id());
            } else {
                roles.put(agent.id(), agent.role());
            }
        }

        Set<String> taskIds = new HashSet<>();
        for (var task : plan.tasks()) {
            if (task.id() == null || task.id().isBlank()) {
                problems.add("Task without id");
            } else if (!taskIds.add(task.id())) {
                problems.add("Duplicate task id " + task.id());
            }
        }

        for (var task : plan.tasks()) {
            for (String dep : task.dependencies()) {
                if (!taskIds.contains(dep)) {
                    problems.add("Task " + task.id() + " depends on unknown task " + dep);
                }
                if (dep.equals(task.id())) {
                    problems.add("Task " + task.id() + " depends on itself");
                }
            }
            if (!roles.containsKey(task.agentId())) {
                problems.add("Task " + task.id() + " is assigned to unknown agent " + task.agentId());
                continue;
            }
            AgentRole required = task.payload() != null ? task.payload().kind().role() : AgentRole.CODER;
            AgentRole actual = roles.get(task.agentId());
            if (actual != null && actual != required) {
                problems.add("Task " + task.id() + " needs a " + required + " but " + task.agentId() + " is a " + actual);
            }
        }

        if (!problems.isEmpty()) {
            log.warn("Rejected plan '{}': {}", plan.name(), problems);
            throw new InvalidPlanException(problems);
        }

        List<Task> tasks = plan.tasks().stream()
                .map(t -> Task.pending(t.id(), null, t.agentId(), t.description(), t.priority(),
                        t.dependencies(), t.payload()))
                .toList();
        Optional<List<String>> cycle = scheduler.detectCycle(tasks);
        if (cycle.isPresent()) {
            throw new CyclicDependencyException(cycle.get());
        }
        log.debug("Plan '{}' is valid ({} agents, {} tasks)", plan.name(), plan.agents().size(), plan.tasks().size());
    }
}
