package com.hivemind.core.health;

import com.hivemind.core.config.HivemindProperties;
import com.hivemind.core.coordinator.SwarmCoordinator;
import com.hivemind.core.recovery.RecoveryHealth;
import com.hivemind.core.recovery.RecoveryMonitor;
import com.hivemind.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final TaskStore store;
    private final SwarmCoordinator coordinator;
    private final RecoveryMonitor recoveryMonitor;
    private final HivemindProperties properties;

    public HealthCheckService(TaskStore store, SwarmCoordinator coordinator,
                              RecoveryMonitor recoveryMonitor, HivemindProperties properties) {
        this.store = store;
        this.coordinator = coordinator;
        this.recoveryMonitor = recoveryMonitor;
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStore());
        results.add(checkAgents());
        results.add(checkRecovery());
        return results;
    }

    private HealthStatus checkStore() {
        String type = store.getClass().getSimpleName();
        try {
            int swarms = store.listSwarms().size();
            return new HealthStatus("store", HealthStatus.Status.UP,
                    type + " reachable", Map.of("type", type, "swarms", String.valueOf(swarms)));
        } catch (Exception e) {
            log.warn("Task store health check failed: {}", e.getMessage());
            return new HealthStatus("store", HealthStatus.Status.DOWN,
                    "Store error: " + e.getMessage(), Map.of("type", type));
        }
    }

    private HealthStatus checkAgents() {
        Map<String, Boolean> alive = coordinator.pingAll();
        if (alive.isEmpty()) {
            return new HealthStatus("agents", HealthStatus.Status.UP,
                    "No agents registered", Map.of());
        }
        long stale = alive.values().stream().filter(a -> !a).count();
        var metadata = Map.of(
                "registered", String.valueOf(alive.size()),
                "stale", String.valueOf(stale));
        if (stale == 0) {
            return new HealthStatus("agents", HealthStatus.Status.UP,
                    "All agents sent a heartbeat within " + properties.getHeartbeatStaleness(), metadata);
        }
        return new HealthStatus("agents", HealthStatus.Status.DEGRADED,
                stale + " of " + alive.size() + " agent(s) missed their heartbeat", metadata);
    }

    private HealthStatus checkRecovery() {
        if (!properties.getRecovery().isEnabled()) {
            return new HealthStatus("recovery", HealthStatus.Status.DEGRADED,
                    "Recovery monitor disabled; failed tasks will not be retried", Map.of());
        }
        if (!recoveryMonitor.isRunning()) {
            return new HealthStatus("recovery", HealthStatus.Status.DOWN,
                    "Recovery monitor is not running", Map.of());
        }
        RecoveryHealth health = recoveryMonitor.healthSnapshot();
        return new HealthStatus("recovery", HealthStatus.Status.UP,
                "Polling every " + properties.getPollInterval(),
                Map.of("cycles", String.valueOf(health.cycles()),
                        "recent_retries", String.valueOf(health.recentRetries()),
                        "retry_success_rate", String.format("%.1f", health.retrySuccessRate())));
    }
}
