package com.hivemind.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator view of {@link HealthCheckService}. DOWN if any component is down,
 * DEGRADED if any is degraded, UP otherwise.
 */
@Component("swarmHealthIndicator")
public class SwarmHealthIndicator implements HealthIndicator {

    private final HealthCheckService healthCheckService;

    public SwarmHealthIndicator(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Health health() {
        boolean anyDown = false;
        boolean anyDegraded = false;
        var builder = Health.up();
        for (HealthStatus check : healthCheckService.checkAll()) {
            builder.withDetail(check.component(), check.status().name() + ": " + check.detail());
            anyDown |= check.status() == HealthStatus.Status.DOWN;
            anyDegraded |= check.status() == HealthStatus.Status.DEGRADED;
        }
        if (anyDown) {
            return builder.down().build();
        }
        return anyDegraded ? builder.status("DEGRADED").build() : builder.build();
    }
}
