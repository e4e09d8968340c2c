package com.hivemind.core.recovery;

import com.hivemind.core.config.HivemindProperties;
import com.hivemind.core.events.EventBus;
import com.hivemind.core.events.SwarmEvent;
import com.hivemind.core.logging.MdcContext;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.model.InterventionEvent;
import com.hivemind.core.model.InterventionType;
import com.hivemind.core.model.Swarm;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskStatus;
import com.hivemind.core.store.StaleRecordException;
import com.hivemind.core.store.TaskStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Self-healing loop that re-queues failed tasks with bounded exponential backoff.
 * <p>
 * Each poll cycle scans FAILED tasks. A task whose backoff has elapsed since it
 * failed is moved back to PENDING and its attempt counter is incremented in the
 * store; a task that spent its retry budget stays FAILED and gets exactly one
 * terminal {@link InterventionType#MAX_RETRIES_EXCEEDED} event. Every action is
 * appended to the store as an {@link InterventionEvent}.
 * <p>
 * The loop never sleeps on a backoff; a task that is not due yet is simply
 * revisited on a later cycle.
 */
@Service
public class RecoveryMonitor {

    private static final Logger log = LoggerFactory.getLogger(RecoveryMonitor.class);

    static final Duration RECENT_WINDOW = Duration.ofMinutes(10);

    private final TaskStore store;
    private final HivemindProperties properties;
    private final HivemindMetrics metrics;
    private final EventBus eventBus;
    private final Clock clock;
    private final BackoffPolicy backoff;

    private final AtomicLong cycles = new AtomicLong();
    private volatile ScheduledExecutorService scheduler;

    public RecoveryMonitor(TaskStore store, HivemindProperties properties, HivemindMetrics metrics,
                           EventBus eventBus, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.clock = clock;
        this.backoff = new BackoffPolicy(properties.getBackoffBase(), properties.getMaxRetries());
    }

    @PostConstruct
    void start() {
        if (!properties.getRecovery().isEnabled()) {
            log.info("Recovery monitor disabled");
            return;
        }
        long intervalMs = properties.getPollInterval().toMillis();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "hivemind-recovery");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::safePoll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Recovery monitor started (interval={}, maxRetries={}, backoffBase={})",
                properties.getPollInterval(), backoff.maxRetries(), backoff.base());
    }

    @PreDestroy
    void stop() {
        ScheduledExecutorService s = scheduler;
        if (s == null) {
            return;
        }
        s.shutdown();
        try {
            if (!s.awaitTermination(5, TimeUnit.SECONDS)) {
                s.shutdownNow();
            }
        } catch (InterruptedException e) {
            s.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Recovery monitor stopped");
    }

    public boolean isRunning() {
        ScheduledExecutorService s = scheduler;
        return s != null && !s.isShutdown();
    }

    public BackoffPolicy backoffPolicy() {
        return backoff;
    }

    /**
     * Runs one poll cycle.
     *
     * @return the interventions recorded during this cycle
     */
    public List<InterventionEvent> pollOnce() {
        long cycle = cycles.incrementAndGet();
        var interventions = new ArrayList<InterventionEvent>();
        List<Task> failed = store.findTasksByStatus(TaskStatus.FAILED);
        if (!failed.isEmpty()) {
            log.debug("Recovery cycle {}: {} failed task(s)", cycle, failed.size());
        }
        for (Task task : failed) {
            MdcContext.setTask(task.swarmId(), task.id(), task.agentId());
            try {
                if (backoff.exhausted(task.attempts())) {
                    escalate(task).ifPresent(interventions::add);
                } else {
                    retryIfDue(task).ifPresent(interventions::add);
                }
            } catch (StaleRecordException e) {
                log.info("Task {} changed concurrently; revisiting next cycle", task.id());
            } finally {
                MdcContext.clear();
            }
        }
        int every = Math.max(1, properties.getRecovery().getHealthLogEvery());
        if (cycle % every == 0) {
            RecoveryHealth health = healthSnapshot();
            log.info("Swarm health (cycle {}): tasks by status {}, recent retries {}, retry success rate {}%",
                    cycle, health.statusCounts(), health.recentRetries(),
                    String.format("%.1f", health.retrySuccessRate()));
        }
        return interventions;
    }

    private Optional<InterventionEvent> retryIfDue(Task task) {
        Duration delay = backoff.delayFor(task.attempts());
        Instant now = clock.instant();
        Instant failedAt = task.updatedAt() != null ? task.updatedAt() : now;
        if (now.isBefore(failedAt.plus(delay))) {
            log.debug("Task {} not due for retry until {}", task.id(), failedAt.plus(delay));
            return Optional.empty();
        }
        int attempt = task.attempts() + 1;
        Task requeued = store.updateTask(task.withStatus(TaskStatus.PENDING).withAttempts(attempt));
        var event = new InterventionEvent(UUID.randomUUID().toString(), task.id(), task.swarmId(),
                InterventionType.RETRY, attempt, delay,
                "Retry %d/%d after %ds backoff".formatted(attempt, backoff.maxRetries(), delay.toSeconds()),
                now);
        store.appendEvent(event);
        metrics.recordRetry(attempt);
        eventBus.publish(SwarmEvent.of(SwarmEvent.TASK_RETRIED, task.swarmId(), task.id(),
                Map.of("attempt", attempt, "backoff_seconds", delay.toSeconds()), now));
        log.info("Re-queued task {} (attempt {}/{}, backoff {}s, version {})",
                task.id(), attempt, backoff.maxRetries(), delay.toSeconds(), requeued.version());
        return Optional.of(event);
    }

    private Optional<InterventionEvent> escalate(Task task) {
        boolean alreadyEscalated = store.findEventsForTask(task.id()).stream()
                .anyMatch(e -> e.type() == InterventionType.MAX_RETRIES_EXCEEDED);
        if (alreadyEscalated) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        var event = new InterventionEvent(UUID.randomUUID().toString(), task.id(), task.swarmId(),
                InterventionType.MAX_RETRIES_EXCEEDED, task.attempts(), Duration.ZERO,
                "Max retries (%d) exceeded; task stays failed".formatted(backoff.maxRetries()),
                now);
        store.appendEvent(event);
        metrics.incrementEscalations("max_retries_exceeded");
        eventBus.publish(SwarmEvent.of(SwarmEvent.TASK_RETRIES_EXHAUSTED, task.swarmId(), task.id(),
                Map.of("attempts", task.attempts()), now));
        log.warn("Task {} exhausted its {} retries and stays FAILED", task.id(), backoff.maxRetries());
        return Optional.of(event);
    }

    public RecoveryHealth healthSnapshot() {
        var counts = new EnumMap<TaskStatus, Long>(TaskStatus.class);
        long retried = 0;
        long retriedCompleted = 0;
        for (Swarm swarm : store.listSwarms()) {
            for (Task task : store.findTasks(swarm.id())) {
                counts.merge(task.status(), 1L, Long::sum);
                if (task.attempts() > 0) {
                    retried++;
                    if (task.status() == TaskStatus.COMPLETED) {
                        retriedCompleted++;
                    }
                }
            }
        }
        long recent = store.findEventsSince(clock.instant().minus(RECENT_WINDOW)).stream()
                .filter(e -> e.type() == InterventionType.RETRY)
                .count();
        double successRate = retried == 0 ? 100.0 : retriedCompleted * 100.0 / retried;
        return new RecoveryHealth(counts, recent, successRate, cycles.get());
    }

    private void safePoll() {
        try {
            pollOnce();
        } catch (Exception e) {
            log.error("Recovery cycle failed: {}", e.getMessage(), e);
        }
    }
}
