package com.hivemind.core.scheduler;

import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskStatus;
import com.hivemind.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Computes schedulability and progress over a swarm's task graph and detects
 * dependency cycles.
 * <p>
 * Holds no state of its own: every answer is recomputed from the {@link TaskStore},
 * so dependency edges mutated after submission are always taken into account.
 */
@Service
public class DependencyScheduler {

    private static final Logger log = LoggerFactory.getLogger(DependencyScheduler.class);

    private final TaskStore store;

    public DependencyScheduler(TaskStore store) {
        this.store = store;
    }

    /**
     * True iff every dependency of {@code task} is COMPLETED. A FAILED dependency
     * short-circuits to false.
     */
    public boolean dependenciesMet(Task task) {
        return readiness(task) == Readiness.READY;
    }

    public Readiness readiness(Task task) {
        Readiness result = Readiness.READY;
        for (String depId : task.dependencies()) {
            Optional<Task> dep = store.findTask(depId);
            if (dep.isEmpty()) {
                log.debug("  {} waiting: dependency {} is unknown", task.id(), depId);
                result = Readiness.WAITING;
                continue;
            }
            TaskStatus status = dep.get().status();
            if (status == TaskStatus.FAILED) {
                log.debug("  {} blocked: dependency {} failed", task.id(), depId);
                return Readiness.BLOCKED;
            }
            if (status != TaskStatus.COMPLETED) {
                result = Readiness.WAITING;
            }
        }
        return result;
    }

    /**
     * PENDING tasks whose dependencies are met, highest priority first. Ties keep
     * registration order.
     */
    public List<Task> readyTasks(String swarmId) {
        var ready = new ArrayList<Task>();
        for (Task task : store.findTasks(swarmId)) {
            if (task.status() == TaskStatus.PENDING && dependenciesMet(task)) {
                ready.add(task);
            }
        }
        // List.sort is stable
        ready.sort(Comparator.comparingInt(Task::priority).reversed());
        log.debug("readyTasks({}): {}", swarmId, ready.stream().map(Task::id).toList());
        return ready;
    }

    public Optional<List<String>> detectCycle(String swarmId) {
        return detectCycle(store.findTasks(swarmId));
    }

    /**
     * Depth-first search with a recursion stack over the task → dependency edges.
     * Dependencies on ids outside {@code tasks} are ignored.
     *
     * @return the ids forming the first cycle found, starting at the revisited task,
     *         or empty when the graph is acyclic
     */
    public Optional<List<String>> detectCycle(Collection<Task> tasks) {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        for (Task task : tasks) {
            graph.put(task.id(), task.dependencies());
        }
        Set<String> visited = new HashSet<>();
        for (String id : graph.keySet()) {
            if (!visited.contains(id)) {
                List<String> stack = new ArrayList<>();
                Set<String> onStack = new HashSet<>();
                List<String> cycle = visit(id, graph, visited, stack, onStack);
                if (cycle != null) {
                    log.warn("Dependency cycle detected: {}", cycle);
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    private List<String> visit(String id, Map<String, List<String>> graph, Set<String> visited,
                               List<String> stack, Set<String> onStack) {
        visited.add(id);
        stack.add(id);
        onStack.add(id);
        for (String dep : graph.getOrDefault(id, List.of())) {
            if (!graph.containsKey(dep)) {
                continue;
            }
            if (onStack.contains(dep)) {
                return List.copyOf(stack.subList(stack.indexOf(dep), stack.size()));
            }
            if (!visited.contains(dep)) {
                List<String> cycle = visit(dep, graph, visited, stack, onStack);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        stack.remove(stack.size() - 1);
        onStack.remove(id);
        return null;
    }

    public SwarmProgress progress(String swarmId) {
        var counts = new HashMap<TaskStatus, Integer>();
        for (Task task : store.findTasks(swarmId)) {
            counts.merge(task.status(), 1, Integer::sum);
        }
        return SwarmProgress.of(
                counts.getOrDefault(TaskStatus.COMPLETED, 0),
                counts.getOrDefault(TaskStatus.IN_PROGRESS, 0),
                counts.getOrDefault(TaskStatus.PENDING, 0),
                counts.getOrDefault(TaskStatus.FAILED, 0));
    }

    /**
     * Checks that {@code taskId} belongs to {@code swarmId}, is assigned to {@code agentId}
     * and has its dependencies met.
     */
    public StartCheck canAgentStart(String agentId, String taskId, String swarmId) {
        Optional<Task> found = store.findTask(taskId);
        if (found.isEmpty() || !found.get().swarmId().equals(swarmId)) {
            return StartCheck.deny("Task " + taskId + " not found in swarm " + swarmId);
        }
        Task task = found.get();
        if (!agentId.equals(task.agentId())) {
            return StartCheck.deny("Task " + taskId + " is assigned to " + task.agentId() + ", not " + agentId);
        }
        return switch (readiness(task)) {
            case READY -> StartCheck.allow();
            case BLOCKED -> StartCheck.deny("Blocked: a dependency of " + taskId + " failed " + failedDependencies(task));
            case WAITING -> StartCheck.deny("Waiting for dependencies of " + taskId + " " + unfinishedDependencies(task));
        };
    }

    public SchedulerStats getStats(String swarmId) {
        Optional<List<String>> cycle = detectCycle(swarmId);
        return new SchedulerStats(progress(swarmId), readyTasks(swarmId).size(),
                cycle.isPresent(), cycle.orElse(List.of()));
    }

    private List<String> failedDependencies(Task task) {
        return task.dependencies().stream()
                .filter(id -> store.findTask(id).map(t -> t.status() == TaskStatus.FAILED).orElse(false))
                .toList();
    }

    private List<String> unfinishedDependencies(Task task) {
        return task.dependencies().stream()
                .filter(id -> store.findTask(id).map(t -> t.status() != TaskStatus.COMPLETED).orElse(true))
                .toList();
    }
}
