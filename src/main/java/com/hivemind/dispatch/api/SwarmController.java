package com.hivemind.dispatch.api;

import com.hivemind.core.config.HivemindProperties;
import com.hivemind.core.engine.SwarmEngine;
import com.hivemind.core.model.InterventionEvent;
import com.hivemind.core.model.SloResult;
import com.hivemind.core.model.SwarmSnapshot;
import com.hivemind.core.planner.InvalidPlanException;
import com.hivemind.core.scheduler.DependencyScheduler;
import com.hivemind.core.scheduler.SchedulerStats;
import com.hivemind.core.store.SwarmNotFoundException;
import com.hivemind.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for swarm lifecycle operations.
 */
@RestController
@RequestMapping("/api/v1/swarms")
public class SwarmController {

    private static final Logger log = LoggerFactory.getLogger(SwarmController.class);

    private final SwarmEngine engine;
    private final TaskStore store;
    private final DependencyScheduler scheduler;
    private final HivemindProperties properties;

    public SwarmController(SwarmEngine engine, TaskStore store, DependencyScheduler scheduler,
                           HivemindProperties properties) {
        this.engine = engine;
        this.store = store;
        this.scheduler = scheduler;
        this.properties = properties;
    }

    /**
     * POST /api/v1/swarms — Plan, register and (by default) start a swarm. Runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> createSwarm(@RequestBody SwarmRequest request) {
        String swarmId;
        try {
            swarmId = request.plan() != null
                    ? engine.createSwarm(request.plan())
                    : engine.submit(request.toScope());
        } catch (InvalidPlanException e) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", e.getMessage(),
                    "problems", e.getProblems()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        if (request.shouldRun()) {
            engine.runAsync(swarmId);
            log.info("Accepted swarm {}, launching async execution", swarmId);
        }

        var body = new LinkedHashMap<String, Object>();
        body.put("swarm_id", swarmId);
        body.put("status", request.shouldRun() ? "RUNNING" : "IDLE");
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    /**
     * GET /api/v1/swarms — List swarms in creation order.
     */
    @GetMapping
    public List<SwarmResponse.Summary> listSwarms() {
        return store.listSwarms().stream()
                .map(s -> {
                    SwarmSnapshot snapshot = store.getSwarmStatus(s.id());
                    return new SwarmResponse.Summary(s.id(), s.name(),
                            snapshot.status(properties.getMaxRetries()).name(),
                            scheduler.progress(s.id()).percent(), s.createdAt());
                })
                .toList();
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getSwarm(@PathVariable String id) {
        try {
            SwarmSnapshot snapshot = store.getSwarmStatus(id);
            return ResponseEntity.ok(SwarmResponse.from(snapshot, properties.getMaxRetries(),
                    scheduler.progress(id), engine.isRunning(id)));
        } catch (SwarmNotFoundException e) {
            return notFound(e);
        }
    }

    /**
     * GET /api/v1/swarms/{id}/stats — Scheduler snapshot (progress, ready count, cycle).
     */
    @GetMapping("/{id}/stats")
    public ResponseEntity<?> getStats(@PathVariable String id) {
        if (store.findSwarm(id).isEmpty()) {
            return notFound(new SwarmNotFoundException(id));
        }
        SchedulerStats stats = scheduler.getStats(id);
        return ResponseEntity.ok(stats);
    }

    /**
     * GET /api/v1/swarms/{id}/events — Recovery interventions, oldest first.
     */
    @GetMapping("/{id}/events")
    public ResponseEntity<?> getEvents(@PathVariable String id) {
        if (store.findSwarm(id).isEmpty()) {
            return notFound(new SwarmNotFoundException(id));
        }
        List<InterventionEvent> events = store.findEvents(id);
        return ResponseEntity.ok(events);
    }

    /**
     * GET /api/v1/swarms/{id}/slo — SLO reports recorded for the swarm, oldest first.
     */
    @GetMapping("/{id}/slo")
    public ResponseEntity<?> getSlo(@PathVariable String id) {
        if (store.findSwarm(id).isEmpty()) {
            return notFound(new SwarmNotFoundException(id));
        }
        List<SloResult> results = store.findSloResults(id);
        return ResponseEntity.ok(results);
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<?> pause(@PathVariable String id) {
        try {
            engine.pause(id);
            return ResponseEntity.ok(Map.of("swarm_id", id, "paused", true));
        } catch (SwarmNotFoundException e) {
            return notFound(e);
        }
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<?> resume(@PathVariable String id) {
        try {
            engine.resume(id);
            return ResponseEntity.ok(Map.of("swarm_id", id, "paused", false));
        } catch (SwarmNotFoundException e) {
            return notFound(e);
        }
    }

    private static ResponseEntity<Map<String, String>> notFound(SwarmNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }
}
