package com.hivemind.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "hivemind")
public class HivemindProperties {

    private Coordinator coordinator = new Coordinator();
    private Recovery recovery = new Recovery();
    private Slo slo = new Slo();
    private Engine engine = new Engine();
    private Store store = new Store();

    // -- Flattened accessors (delegate to nested) --
    public Duration getHeartbeatStaleness() { return coordinator.heartbeatStaleness; }
    public Duration getPollInterval() { return recovery.pollInterval; }
    public int getMaxRetries() { return recovery.maxRetries; }
    public Duration getBackoffBase() { return recovery.backoffBase; }
    public int getMaxParallel() { return engine.maxParallel; }

    public Coordinator getCoordinator() { return coordinator; }
    public void setCoordinator(Coordinator coordinator) { this.coordinator = coordinator; }
    public Recovery getRecovery() { return recovery; }
    public void setRecovery(Recovery recovery) { this.recovery = recovery; }
    public Slo getSlo() { return slo; }
    public void setSlo(Slo slo) { this.slo = slo; }
    public Engine getEngine() { return engine; }
    public void setEngine(Engine engine) { this.engine = engine; }
    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }

    public static class Coordinator {
        /** Heartbeats older than this make {@code pingAll} report an agent as not alive. */
        private Duration heartbeatStaleness = Duration.ofSeconds(30);

        public Duration getHeartbeatStaleness() { return heartbeatStaleness; }
        public void setHeartbeatStaleness(Duration heartbeatStaleness) { this.heartbeatStaleness = heartbeatStaleness; }
    }

    public static class Recovery {
        private boolean enabled = true;
        private Duration pollInterval = Duration.ofSeconds(10);
        private int maxRetries = 3;
        /** First retry waits this long; each further retry doubles it. */
        private Duration backoffBase = Duration.ofSeconds(10);
        /** Health statistics are logged every this many poll cycles. */
        private int healthLogEvery = 10;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public Duration getBackoffBase() { return backoffBase; }
        public void setBackoffBase(Duration backoffBase) { this.backoffBase = backoffBase; }
        public int getHealthLogEvery() { return healthLogEvery; }
        public void setHealthLogEvery(int healthLogEvery) { this.healthLogEvery = healthLogEvery; }
    }

    public static class Slo {
        private double maxCostUsd = 5.00;
        private double pricePerThousandTokens = 0.01;
        private Duration maxDuration = Duration.ofSeconds(720);
        private double minCoveragePercent = 95.0;
        private double minConfidence = 0.8;

        public double getMaxCostUsd() { return maxCostUsd; }
        public void setMaxCostUsd(double maxCostUsd) { this.maxCostUsd = maxCostUsd; }
        public double getPricePerThousandTokens() { return pricePerThousandTokens; }
        public void setPricePerThousandTokens(double pricePerThousandTokens) { this.pricePerThousandTokens = pricePerThousandTokens; }
        public Duration getMaxDuration() { return maxDuration; }
        public void setMaxDuration(Duration maxDuration) { this.maxDuration = maxDuration; }
        public double getMinCoveragePercent() { return minCoveragePercent; }
        public void setMinCoveragePercent(double minCoveragePercent) { this.minCoveragePercent = minCoveragePercent; }
        public double getMinConfidence() { return minConfidence; }
        public void setMinConfidence(double minConfidence) { this.minConfidence = minConfidence; }
    }

    public static class Engine {
        private int maxParallel = 3;
        /** How often the engine re-checks the store while it waits for retries. */
        private Duration idleWait = Duration.ofSeconds(1);
        /** A run that has not terminated after this long is abandoned. */
        private Duration runTimeout = Duration.ofMinutes(30);
        /** Agents without a registered implementation complete their tasks as dry runs. */
        private boolean dryRunAgents = true;

        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
        public Duration getIdleWait() { return idleWait; }
        public void setIdleWait(Duration idleWait) { this.idleWait = idleWait; }
        public Duration getRunTimeout() { return runTimeout; }
        public void setRunTimeout(Duration runTimeout) { this.runTimeout = runTimeout; }
        public boolean isDryRunAgents() { return dryRunAgents; }
        public void setDryRunAgents(boolean dryRunAgents) { this.dryRunAgents = dryRunAgents; }
    }

    public static class Store {
        /** "memory" (default) or "jdbc". */
        private String type = "memory";
        private String jdbcUrl;
        private String username;
        private String password;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getJdbcUrl() { return jdbcUrl; }
        public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
    }
}
