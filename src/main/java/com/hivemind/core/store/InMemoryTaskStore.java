package com.hivemind.core.store;

import com.hivemind.core.model.AgentRecord;
import com.hivemind.core.model.InterventionEvent;
import com.hivemind.core.model.SloResult;
import com.hivemind.core.model.Swarm;
import com.hivemind.core.model.SwarmSnapshot;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local {@link TaskStore}. Per-record compare-and-set is done with
 * {@link ConcurrentHashMap#compute}, so concurrent writers to the same task or
 * agent are serialized. State is lost on restart.
 */
public class InMemoryTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskStore.class);

    private final Clock clock;

    private final ConcurrentHashMap<String, Swarm> swarms = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<String> swarmOrder = new CopyOnWriteArrayList<>();
    private final ConcurrentHashMap<String, Task> tasks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<String>> taskIdsBySwarm = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AgentRecord> agents = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<String>> agentIdsBySwarm = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<InterventionEvent> events = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<SloResult> sloResults = new CopyOnWriteArrayList<>();

    public InMemoryTaskStore() {
        this(Clock.systemUTC());
    }

    public InMemoryTaskStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void createSwarm(Swarm swarm, List<AgentRecord> newAgents, List<Task> newTasks) {
        Objects.requireNonNull(swarm, "swarm must not be null");
        if (swarms.containsKey(swarm.id())) {
            throw new IllegalArgumentException("Swarm already exists: " + swarm.id());
        }
        for (var agent : newAgents) {
            AgentRecord existing = agents.get(agent.id());
            if (existing != null) {
                throw new IllegalArgumentException("Agent already exists: " + agent.id() + " (swarm " + existing.swarmId() + ")");
            }
        }
        for (var task : newTasks) {
            if (tasks.containsKey(task.id())) {
                throw new IllegalArgumentException("Task already exists: " + task.id());
            }
        }
        Instant now = clock.instant();
        var agentIds = new ArrayList<String>();
        for (var agent : newAgents) {
            agents.put(agent.id(), new AgentRecord(agent.id(), swarm.id(), agent.role(), agent.capabilities(),
                    agent.status(), agent.lastHeartbeat() != null ? agent.lastHeartbeat() : now,
                    agent.tasksCompleted(), agent.tasksFailed(), agent.avgExecutionMs(), 1L));
            agentIds.add(agent.id());
        }
        var taskIds = new ArrayList<String>();
        for (var task : newTasks) {
            tasks.put(task.id(), new Task(task.id(), swarm.id(), task.agentId(), task.description(), task.status(),
                    task.priority(), task.dependencies(), task.payload(), task.attempts(), now, 1L));
            taskIds.add(task.id());
        }
        swarms.put(swarm.id(), swarm);
        swarmOrder.add(swarm.id());
        agentIdsBySwarm.put(swarm.id(), new CopyOnWriteArrayList<>(agentIds));
        taskIdsBySwarm.put(swarm.id(), new CopyOnWriteArrayList<>(taskIds));
        log.debug("Stored swarm {} with {} agents and {} tasks", swarm.id(), agentIds.size(), taskIds.size());
    }

    @Override
    public Optional<Swarm> findSwarm(String swarmId) {
        return Optional.ofNullable(swarms.get(swarmId));
    }

    @Override
    public List<Swarm> listSwarms() {
        return swarmOrder.stream().map(swarms::get).filter(Objects::nonNull).toList();
    }

    @Override
    public void setPaused(String swarmId, boolean paused) {
        if (swarms.computeIfPresent(swarmId, (id, s) -> s.withPaused(paused)) == null) {
            throw new SwarmNotFoundException(swarmId);
        }
    }

    @Override
    public SwarmSnapshot getSwarmStatus(String swarmId) {
        Swarm swarm = swarms.get(swarmId);
        if (swarm == null) {
            throw new SwarmNotFoundException(swarmId);
        }
        return new SwarmSnapshot(swarm, findTasks(swarmId), findAgents(swarmId));
    }

    @Override
    public List<Task> findTasks(String swarmId) {
        return taskIdsBySwarm.getOrDefault(swarmId, List.of()).stream()
                .map(tasks::get)
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    public Optional<Task> findTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public List<Task> findTasksByStatus(TaskStatus status) {
        var result = new ArrayList<Task>();
        for (String swarmId : swarmOrder) {
            for (Task task : findTasks(swarmId)) {
                if (task.status() == status) {
                    result.add(task);
                }
            }
        }
        result.sort(Comparator.comparingInt(Task::priority).reversed());
        return result;
    }

    @Override
    public Task updateTask(Task task) {
        Instant now = clock.instant();
        Task stored = tasks.compute(task.id(), (id, current) -> {
            if (current == null) {
                throw new IllegalArgumentException("Unknown task: " + id);
            }
            if (current.version() != task.version()) {
                throw new StaleRecordException("Task", id, task.version(), current.version());
            }
            return new Task(current.id(), current.swarmId(), current.agentId(), current.description(),
                    task.status(), current.priority(), task.dependencies(), current.payload(),
                    task.attempts(), now, current.version() + 1);
        });
        log.debug("Task {} -> {} (attempts={}, version={})", stored.id(), stored.status(),
                stored.attempts(), stored.version());
        return stored;
    }

    @Override
    public Optional<AgentRecord> findAgent(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    @Override
    public List<AgentRecord> findAgents(String swarmId) {
        return agentIdsBySwarm.getOrDefault(swarmId, List.of()).stream()
                .map(agents::get)
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    public AgentRecord updateAgent(AgentRecord agent) {
        return agents.compute(agent.id(), (id, current) -> {
            if (current == null) {
                throw new IllegalArgumentException("Unknown agent: " + id);
            }
            if (current.version() != agent.version()) {
                throw new StaleRecordException("Agent", id, agent.version(), current.version());
            }
            return new AgentRecord(current.id(), current.swarmId(), current.role(), current.capabilities(),
                    agent.status(), agent.lastHeartbeat(), agent.tasksCompleted(), agent.tasksFailed(),
                    agent.avgExecutionMs(), current.version() + 1);
        });
    }

    @Override
    public void appendEvent(InterventionEvent event) {
        events.add(event);
    }

    @Override
    public List<InterventionEvent> findEvents(String swarmId) {
        return events.stream().filter(e -> Objects.equals(swarmId, e.swarmId())).toList();
    }

    @Override
    public List<InterventionEvent> findEventsForTask(String taskId) {
        return events.stream().filter(e -> Objects.equals(taskId, e.taskId())).toList();
    }

    @Override
    public List<InterventionEvent> findEventsSince(Instant since) {
        return events.stream().filter(e -> !e.timestamp().isBefore(since)).toList();
    }

    @Override
    public void appendSloResult(SloResult result) {
        sloResults.add(result);
    }

    @Override
    public List<SloResult> findSloResults(String swarmId) {
        return sloResults.stream().filter(r -> Objects.equals(swarmId, r.swarmId())).toList();
    }
}
