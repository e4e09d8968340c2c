package com.hivemind.core.store;

import com.hivemind.core.model.AgentRecord;
import com.hivemind.core.model.InterventionEvent;
import com.hivemind.core.model.SloResult;
import com.hivemind.core.model.Swarm;
import com.hivemind.core.model.SwarmSnapshot;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Single source of truth for swarms, agents, tasks, intervention events and SLO results.
 * <p>
 * Task and agent writes use optimistic versioning: {@link #updateTask} and
 * {@link #updateAgent} succeed only when the passed record carries the version
 * currently stored, and throw {@link StaleRecordException} otherwise. Tasks of a
 * swarm are always returned in registration order.
 */
public interface TaskStore {

    /** Number of re-read attempts used by {@link #modifyTask} and {@link #modifyAgent}. */
    int MAX_MODIFY_ATTEMPTS = 5;

    void createSwarm(Swarm swarm, List<AgentRecord> agents, List<Task> tasks);

    Optional<Swarm> findSwarm(String swarmId);

    List<Swarm> listSwarms();

    void setPaused(String swarmId, boolean paused);

    /**
     * Full view of a swarm: the swarm row, its tasks in registration order, and its agents.
     *
     * @throws SwarmNotFoundException if the swarm does not exist
     */
    SwarmSnapshot getSwarmStatus(String swarmId);

    List<Task> findTasks(String swarmId);

    Optional<Task> findTask(String taskId);

    /** Tasks in the given status across all swarms, highest priority first. */
    List<Task> findTasksByStatus(TaskStatus status);

    /**
     * Compare-and-set write of a task. Status, attempts and dependencies are taken from
     * {@code task}; the store stamps {@code updatedAt} and bumps the version.
     *
     * @return the stored task
     * @throws StaleRecordException if {@code task.version()} is not the stored version
     */
    Task updateTask(Task task);

    Optional<AgentRecord> findAgent(String agentId);

    List<AgentRecord> findAgents(String swarmId);

    /**
     * Compare-and-set write of an agent's health fields.
     *
     * @throws StaleRecordException if {@code agent.version()} is not the stored version
     */
    AgentRecord updateAgent(AgentRecord agent);

    void appendEvent(InterventionEvent event);

    List<InterventionEvent> findEvents(String swarmId);

    List<InterventionEvent> findEventsForTask(String taskId);

    List<InterventionEvent> findEventsSince(Instant since);

    void appendSloResult(SloResult result);

    List<SloResult> findSloResults(String swarmId);

    /**
     * Read-modify-write of a task that re-reads on optimistic conflicts.
     *
     * @return the stored task, or empty if the task does not exist
     */
    default Optional<Task> modifyTask(String taskId, UnaryOperator<Task> change) {
        StaleRecordException last = null;
        for (int attempt = 0; attempt < MAX_MODIFY_ATTEMPTS; attempt++) {
            Optional<Task> current = findTask(taskId);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            try {
                return Optional.of(updateTask(change.apply(current.get())));
            } catch (StaleRecordException e) {
                last = e;
            }
        }
        throw last;
    }

    /**
     * Read-modify-write of an agent that re-reads on optimistic conflicts.
     *
     * @return the stored agent, or empty if the agent does not exist
     */
    default Optional<AgentRecord> modifyAgent(String agentId, UnaryOperator<AgentRecord> change) {
        StaleRecordException last = null;
        for (int attempt = 0; attempt < MAX_MODIFY_ATTEMPTS; attempt++) {
            Optional<AgentRecord> current = findAgent(agentId);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            try {
                return Optional.of(updateAgent(change.apply(current.get())));
            } catch (StaleRecordException e) {
                last = e;
            }
        }
        throw last;
    }
}
