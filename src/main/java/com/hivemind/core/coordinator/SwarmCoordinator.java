package com.hivemind.core.coordinator;

import com.hivemind.core.config.HivemindProperties;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.model.AgentRole;
import com.hivemind.core.model.AgentStatus;
import com.hivemind.core.model.Message;
import com.hivemind.core.model.MessageKind;
import com.hivemind.core.model.MessagePayload;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskResult;
import com.hivemind.core.store.StaleRecordException;
import com.hivemind.core.store.TaskStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

/**
 * Owns the per-agent inboxes and the health view of every registered agent, routes
 * tasks to agents and executes them.
 * <p>
 * Inboxes are unbounded FIFO queues; {@link #send} and {@link #broadcast} return
 * once messages are enqueued. Health changes are written through to the
 * {@link TaskStore} for agents it knows, so the store stays the source of truth.
 */
@Service
public class SwarmCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SwarmCoordinator.class);

    /** Sender id used for messages originating from the coordinator itself. */
    public static final String COORDINATOR_ID = "coordinator";

    private static final int BROADCAST_THREADS = 4;

    private final TaskStore store;
    private final HivemindProperties properties;
    private final HivemindMetrics metrics;
    private final Clock clock;

    private final ConcurrentHashMap<String, BlockingQueue<Message>> inboxes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AgentHealth> health = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<String> registrationOrder = new CopyOnWriteArrayList<>();
    private final ConcurrentHashMap<String, TaskResult> results = new ConcurrentHashMap<>();

    private final ExecutorService broadcastExecutor = Executors.newFixedThreadPool(BROADCAST_THREADS, r -> {
        Thread t = new Thread(r, "hivemind-broadcast");
        t.setDaemon(true);
        return t;
    });

    public SwarmCoordinator(TaskStore store, HivemindProperties properties, HivemindMetrics metrics, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ── Registration and messaging ───────────────────────────────────────

    public BlockingQueue<Message> register(String agentId) {
        return register(agentId, null, null);
    }

    public BlockingQueue<Message> register(String agentId, AgentRole role) {
        return register(agentId, role, null);
    }

    /**
     * Registers an agent. Idempotent: a second call returns the existing inbox and
     * leaves the health record untouched.
     */
    public synchronized BlockingQueue<Message> register(String agentId, AgentRole role, String swarmId) {
        BlockingQueue<Message> existing = inboxes.get(agentId);
        if (existing != null) {
            return existing;
        }
        var inbox = new LinkedBlockingQueue<Message>();
        inboxes.put(agentId, inbox);
        health.put(agentId, AgentHealth.idle(agentId, swarmId, role, clock.instant()));
        registrationOrder.add(agentId);
        log.info("Registered agent {} (role={}, swarm={})", agentId, role, swarmId);
        return inbox;
    }

    /**
     * Drops the inboxes and health records of every agent registered for {@code swarmId}.
     * Undelivered messages are discarded.
     *
     * @return number of agents removed
     */
    public synchronized int unregisterSwarm(String swarmId) {
        var removed = new ArrayList<String>();
        for (String agentId : registrationOrder) {
            AgentHealth h = health.get(agentId);
            if (h != null && swarmId.equals(h.swarmId())) {
                removed.add(agentId);
            }
        }
        for (String agentId : removed) {
            inboxes.remove(agentId);
            health.remove(agentId);
            registrationOrder.remove(agentId);
        }
        if (!removed.isEmpty()) {
            log.info("Unregistered {} agent(s) of swarm {}", removed.size(), swarmId);
        }
        return removed.size();
    }

    public boolean isRegistered(String agentId) {
        return inboxes.containsKey(agentId);
    }

    public List<String> registeredAgents() {
        return List.copyOf(registrationOrder);
    }

    /**
     * Enqueues {@code message} on the target's inbox.
     *
     * @return false when the target is not registered; the message is dropped
     */
    public boolean send(Message message) {
        BlockingQueue<Message> inbox = inboxes.get(message.toAgent());
        if (inbox == null) {
            log.warn("Dropping {} message from {}: agent {} is not registered",
                    message.kind(), message.fromAgent(), message.toAgent());
            metrics.recordUndeliveredMessage();
            return false;
        }
        inbox.offer(message);
        log.debug("Enqueued {} message {} -> {}", message.kind(), message.fromAgent(), message.toAgent());
        return true;
    }

    public int broadcast(String fromAgent, MessagePayload payload) {
        return broadcast(fromAgent, payload, null);
    }

    /**
     * Sends {@code payload} to every agent of the sender's swarm except the sender,
     * concurrently. A sender registered outside any swarm reaches every agent. Returns
     * once every message has been enqueued.
     *
     * @return number of messages enqueued
     */
    public int broadcast(String fromAgent, MessagePayload payload, String correlationId) {
        AgentHealth sender = health.get(fromAgent);
        String senderSwarm = sender != null ? sender.swarmId() : null;
        Instant now = clock.instant();
        var futures = new ArrayList<CompletableFuture<Boolean>>();
        for (String agentId : registrationOrder) {
            AgentHealth recipient = health.get(agentId);
            if (agentId.equals(fromAgent) || recipient == null || !inSwarm(recipient, senderSwarm)) {
                continue;
            }
            futures.add(CompletableFuture.supplyAsync(
                    () -> send(Message.of(fromAgent, agentId, payload, correlationId, now)), broadcastExecutor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        int delivered = (int) futures.stream().filter(CompletableFuture::join).count();
        log.debug("Broadcast {} from {} to {} agent(s)", payload.kind(), fromAgent, delivered);
        return delivered;
    }

    /**
     * Announces an agent's capabilities to the other agents of its swarm. Does not wait
     * for acknowledgements.
     */
    public boolean handshake(String agentId, Map<String, String> capabilities) {
        register(agentId);
        int delivered = broadcast(agentId, new MessagePayload.Handshake(capabilities));
        log.info("Agent {} completed handshake ({} peer(s) notified): {}", agentId, delivered, capabilities);
        return true;
    }

    /**
     * Polls the agent's inbox, waiting up to {@code timeout}.
     *
     * @return the next message, or empty on timeout or for an unknown agent
     */
    public Optional<Message> receive(String agentId, Duration timeout) throws InterruptedException {
        BlockingQueue<Message> inbox = inboxes.get(agentId);
        if (inbox == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(inbox.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    // ── Routing and execution ────────────────────────────────────────────

    /**
     * Picks the agent that should execute {@code task} and marks it WORKING. Only agents
     * of the task's swarm, or agents registered outside any swarm, are candidates.
     * <p>
     * The mapped agent is the first registered agent whose role matches the task
     * kind, or the task's assigned agent when no agent has that role. A mapped agent
     * that is not IDLE is replaced by the first IDLE agent in registration order; when
     * no agent is IDLE the mapped agent is returned anyway.
     */
    public synchronized String routeTask(Task task) {
        AgentRole role = task.kind().role();
        List<String> candidates = registrationOrder.stream()
                .filter(id -> inSwarm(health.get(id), task.swarmId()))
                .toList();
        String mapped = candidates.stream()
                .filter(id -> health.get(id).role() == role)
                .findFirst()
                .orElse(task.agentId());

        String chosen = mapped;
        AgentHealth mappedHealth = mapped != null ? health.get(mapped) : null;
        if (mappedHealth == null || mappedHealth.status() != AgentStatus.IDLE) {
            Optional<String> idle = candidates.stream()
                    .filter(id -> health.get(id).status() == AgentStatus.IDLE)
                    .findFirst();
            if (idle.isPresent()) {
                chosen = idle.get();
                AgentRole chosenRole = health.get(chosen).role();
                if (chosenRole != role) {
                    log.warn("Routing {} task {} to {} (role {}): no idle {} agent",
                            task.kind(), task.id(), chosen, chosenRole, role);
                }
            } else {
                log.debug("No idle agent for {}; keeping mapped agent {}", task.id(), mapped);
            }
        }
        if (chosen == null) {
            throw new IllegalStateException("No agent can be routed task " + task.id());
        }
        updateHealth(chosen, h -> h.withStatus(AgentStatus.WORKING));
        log.debug("Routed task {} ({}) to {}", task.id(), task.kind(), chosen);
        return chosen;
    }

    /**
     * Routes and executes {@code task}, blocking for the agent's work. Never throws
     * for agent failures: any exception, or a missing agent implementation, becomes a
     * {@code FAILED} result.
     */
    public TaskResult executeSwarmTask(Task task, AgentRegistry registry) {
        long start = System.nanoTime();
        String agentId = null;
        TaskResult result;
        try {
            agentId = routeTask(task);
            String target = agentId;
            SwarmAgent agent = registry.find(agentId)
                    .orElseThrow(() -> new IllegalStateException("No implementation registered for agent " + target));
            TaskResult raw = agent.execute(task);
            if (raw == null) {
                throw new IllegalStateException("Agent " + agentId + " returned no result for " + task.id());
            }
            result = raw.withAgent(agentId, elapsedMs(start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = TaskResult.failed(task.id(), agentId, "Interrupted").withAgent(agentId, elapsedMs(start));
        } catch (Exception e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("Task {} failed on agent {}: {}", task.id(), agentId, error);
            result = TaskResult.failed(task.id(), agentId, error).withAgent(agentId, elapsedMs(start));
        }

        if (agentId != null) {
            boolean succeeded = result.succeeded();
            long elapsed = result.elapsedMs();
            updateHealth(agentId, h -> h.withOutcome(succeeded, elapsed, clock.instant()));
        }
        results.put(task.id(), result);
        metrics.recordTaskExecution(task.kind().role().name(), result.elapsedMs());
        metrics.recordTaskOutcome(result.status().name());
        log.info("Task {} finished on {} with {} in {}ms", task.id(), agentId, result.status(), result.elapsedMs());
        return result;
    }

    /**
     * Returns an agent to IDLE once its last outcome has been consumed. Agents that are
     * WORKING again are left alone.
     */
    public void release(String agentId) {
        AgentHealth current = health.get(agentId);
        if (current == null) {
            return;
        }
        if (current.status() == AgentStatus.COMPLETED || current.status() == AgentStatus.FAILED) {
            updateHealth(agentId, h -> h.status() == AgentStatus.WORKING ? h : h.withStatus(AgentStatus.IDLE));
        }
    }

    public Optional<TaskResult> getResult(String taskId) {
        return Optional.ofNullable(results.get(taskId));
    }

    // ── Liveness ─────────────────────────────────────────────────────────

    /** Refreshes an agent's heartbeat. Returns false for unknown agents. */
    public boolean heartbeat(String agentId) {
        if (!health.containsKey(agentId)) {
            return false;
        }
        Instant now = clock.instant();
        updateHealth(agentId, h -> h.withHeartbeat(now));
        return true;
    }

    /**
     * Sends a PING to every agent and reports which ones are alive. An agent is alive
     * when its last heartbeat is younger than the configured staleness. An agent that
     * has not consumed its previous PING is not sent another one.
     */
    public Map<String, Boolean> pingAll() {
        Instant now = clock.instant();
        Duration staleness = properties.getHeartbeatStaleness();
        var alive = new LinkedHashMap<String, Boolean>();
        for (String agentId : registrationOrder) {
            AgentHealth h = health.get(agentId);
            BlockingQueue<Message> inbox = inboxes.get(agentId);
            if (h == null || inbox == null) {
                continue;
            }
            if (inbox.stream().noneMatch(m -> m.kind() == MessageKind.PING)) {
                send(Message.of(COORDINATOR_ID, agentId, new MessagePayload.Ping(now), null, now));
            }
            boolean fresh = h.lastHeartbeat() != null
                    && Duration.between(h.lastHeartbeat(), now).compareTo(staleness) < 0;
            alive.put(agentId, fresh);
            if (!fresh) {
                log.warn("Agent {} missed heartbeat (last seen {})", agentId, h.lastHeartbeat());
            }
        }
        return alive;
    }

    public Optional<AgentHealth> getAgentHealth(String agentId) {
        return Optional.ofNullable(health.get(agentId));
    }

    public SwarmStats getSwarmStats() {
        var agents = new LinkedHashMap<String, AgentHealth>();
        for (String agentId : registrationOrder) {
            agents.put(agentId, health.get(agentId));
        }
        return new SwarmStats(agents.size(), agents);
    }

    @PreDestroy
    void shutdown() {
        broadcastExecutor.shutdown();
        try {
            if (!broadcastExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                broadcastExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            broadcastExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ── Internals ────────────────────────────────────────────────────────

    private void updateHealth(String agentId, UnaryOperator<AgentHealth> change) {
        AgentHealth updated = health.computeIfPresent(agentId, (id, h) -> change.apply(h));
        if (updated == null) {
            return;
        }
        try {
            store.modifyAgent(agentId, r -> r.withHealth(updated.status(), updated.lastHeartbeat(),
                    updated.tasksCompleted(), updated.tasksFailed(), updated.avgExecutionMs()));
        } catch (StaleRecordException e) {
            log.warn("Could not persist health of agent {}: {}", agentId, e.getMessage());
        }
    }

    private static boolean inSwarm(AgentHealth h, String swarmId) {
        return h.swarmId() == null || swarmId == null || h.swarmId().equals(swarmId);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
