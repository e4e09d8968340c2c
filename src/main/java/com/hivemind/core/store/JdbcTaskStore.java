package com.hivemind.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hivemind.core.model.AgentRecord;
import com.hivemind.core.model.AgentRole;
import com.hivemind.core.model.AgentStatus;
import com.hivemind.core.model.InterventionEvent;
import com.hivemind.core.model.InterventionType;
import com.hivemind.core.model.SloResult;
import com.hivemind.core.model.Swarm;
import com.hivemind.core.model.SwarmSnapshot;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskPayload;
import com.hivemind.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC-backed {@link TaskStore} for PostgreSQL.
 * <p>
 * Tasks and agents carry a {@code version} column; updates are issued as
 * {@code UPDATE ... WHERE id = ? AND version = ?} so concurrent writers from the
 * coordinator, engine and recovery monitor are serialized per row. Payloads,
 * metadata and SLO reports are stored as JSON text.
 * <p>
 * The tables are created by {@link #createTables()}.
 */
public class JdbcTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskStore.class);

    private static final List<String> CREATE_TABLES_SQL = List.of(
            """
            CREATE TABLE IF NOT EXISTS hm_swarms (
                id          VARCHAR(64) PRIMARY KEY,
                seq         BIGSERIAL,
                name        VARCHAR(255) NOT NULL,
                metadata    TEXT,
                paused      BOOLEAN NOT NULL DEFAULT FALSE,
                created_at  TIMESTAMP NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS hm_agents (
                id               VARCHAR(128) PRIMARY KEY,
                swarm_id         VARCHAR(64) NOT NULL REFERENCES hm_swarms (id) ON DELETE CASCADE,
                seq              BIGSERIAL,
                role             VARCHAR(32),
                capabilities     TEXT,
                status           VARCHAR(16) NOT NULL,
                last_heartbeat   TIMESTAMP,
                tasks_completed  INTEGER NOT NULL DEFAULT 0,
                tasks_failed     INTEGER NOT NULL DEFAULT 0,
                avg_execution_ms DOUBLE PRECISION NOT NULL DEFAULT 0,
                version          BIGINT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS hm_tasks (
                id           VARCHAR(128) PRIMARY KEY,
                swarm_id     VARCHAR(64) NOT NULL REFERENCES hm_swarms (id) ON DELETE CASCADE,
                seq          BIGSERIAL,
                agent_id     VARCHAR(128),
                description  TEXT NOT NULL,
                status       VARCHAR(16) NOT NULL,
                priority     INTEGER NOT NULL DEFAULT 5,
                dependencies TEXT NOT NULL,
                payload      TEXT,
                attempts     INTEGER NOT NULL DEFAULT 0,
                updated_at   TIMESTAMP NOT NULL,
                version      BIGINT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS hm_intervention_events (
                id          VARCHAR(64) PRIMARY KEY,
                seq         BIGSERIAL,
                task_id     VARCHAR(128) NOT NULL,
                swarm_id    VARCHAR(64),
                event_type  VARCHAR(32) NOT NULL,
                attempt     INTEGER NOT NULL,
                backoff_ms  BIGINT NOT NULL,
                details     TEXT,
                created_at  TIMESTAMP NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS hm_slo_results (
                seq          BIGSERIAL PRIMARY KEY,
                swarm_id     VARCHAR(64) NOT NULL,
                compliant    BOOLEAN NOT NULL,
                report       TEXT NOT NULL,
                evaluated_at TIMESTAMP NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_hm_tasks_status ON hm_tasks (status)",
            "CREATE INDEX IF NOT EXISTS idx_hm_events_task ON hm_intervention_events (task_id)"
    );

    private static final String INSERT_SWARM_SQL =
            "INSERT INTO hm_swarms (id, name, metadata, paused, created_at) VALUES (?, ?, ?, ?, ?)";
    private static final String INSERT_AGENT_SQL = """
            INSERT INTO hm_agents (id, swarm_id, role, capabilities, status, last_heartbeat,
                                   tasks_completed, tasks_failed, avg_execution_ms, version)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, 1)
            """;
    private static final String INSERT_TASK_SQL = """
            INSERT INTO hm_tasks (id, swarm_id, agent_id, description, status, priority,
                                  dependencies, payload, attempts, updated_at, version)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 1)
            """;
    private static final String SELECT_SWARM_SQL =
            "SELECT id, name, metadata, paused, created_at FROM hm_swarms WHERE id = ?";
    private static final String SELECT_ALL_SWARMS_SQL =
            "SELECT id, name, metadata, paused, created_at FROM hm_swarms ORDER BY seq";
    private static final String UPDATE_PAUSED_SQL = "UPDATE hm_swarms SET paused = ? WHERE id = ?";

    private static final String TASK_COLUMNS =
            "id, swarm_id, agent_id, description, status, priority, dependencies, payload, attempts, updated_at, version";
    private static final String SELECT_TASKS_BY_SWARM_SQL =
            "SELECT " + TASK_COLUMNS + " FROM hm_tasks WHERE swarm_id = ? ORDER BY seq";
    private static final String SELECT_TASK_SQL =
            "SELECT " + TASK_COLUMNS + " FROM hm_tasks WHERE id = ?";
    private static final String SELECT_TASKS_BY_STATUS_SQL =
            "SELECT " + TASK_COLUMNS + " FROM hm_tasks WHERE status = ? ORDER BY priority DESC, seq";
    private static final String UPDATE_TASK_SQL = """
            UPDATE hm_tasks
            SET status = ?, dependencies = ?, attempts = ?, updated_at = ?, version = version + 1
            WHERE id = ? AND version = ?
            """;
    private static final String SELECT_TASK_VERSION_SQL = "SELECT version FROM hm_tasks WHERE id = ?";

    private static final String AGENT_COLUMNS =
            "id, swarm_id, role, capabilities, status, last_heartbeat, tasks_completed, tasks_failed, avg_execution_ms, version";
    private static final String SELECT_AGENT_SQL =
            "SELECT " + AGENT_COLUMNS + " FROM hm_agents WHERE id = ?";
    private static final String SELECT_AGENTS_BY_SWARM_SQL =
            "SELECT " + AGENT_COLUMNS + " FROM hm_agents WHERE swarm_id = ? ORDER BY seq";
    private static final String UPDATE_AGENT_SQL = """
            UPDATE hm_agents
            SET status = ?, last_heartbeat = ?, tasks_completed = ?, tasks_failed = ?,
                avg_execution_ms = ?, version = version + 1
            WHERE id = ? AND version = ?
            """;
    private static final String SELECT_AGENT_VERSION_SQL = "SELECT version FROM hm_agents WHERE id = ?";

    private static final String INSERT_EVENT_SQL = """
            INSERT INTO hm_intervention_events (id, task_id, swarm_id, event_type, attempt, backoff_ms, details, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;
    private static final String EVENT_COLUMNS =
            "id, task_id, swarm_id, event_type, attempt, backoff_ms, details, created_at";
    private static final String SELECT_EVENTS_BY_SWARM_SQL =
            "SELECT " + EVENT_COLUMNS + " FROM hm_intervention_events WHERE swarm_id = ? ORDER BY seq";
    private static final String SELECT_EVENTS_BY_TASK_SQL =
            "SELECT " + EVENT_COLUMNS + " FROM hm_intervention_events WHERE task_id = ? ORDER BY seq";
    private static final String SELECT_EVENTS_SINCE_SQL =
            "SELECT " + EVENT_COLUMNS + " FROM hm_intervention_events WHERE created_at >= ? ORDER BY seq";

    private static final String INSERT_SLO_SQL =
            "INSERT INTO hm_slo_results (swarm_id, compliant, report, evaluated_at) VALUES (?, ?, ?, ?)";
    private static final String SELECT_SLO_SQL =
            "SELECT report FROM hm_slo_results WHERE swarm_id = ? ORDER BY seq";

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcTaskStore(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    public JdbcTaskStore(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Creates the hivemind tables if they do not already exist.
     * Called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            for (String ddl : CREATE_TABLES_SQL) {
                try (PreparedStatement stmt = conn.prepareStatement(ddl)) {
                    stmt.execute();
                }
            }
            log.info("Task store tables ensured");
        }
    }

    // ── Swarms ───────────────────────────────────────────────────────────

    @Override
    public void createSwarm(Swarm swarm, List<AgentRecord> agents, List<Task> tasks) {
        Timestamp now = Timestamp.from(clock.instant());
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_SWARM_SQL)) {
                    stmt.setString(1, swarm.id());
                    stmt.setString(2, swarm.name());
                    stmt.setString(3, toJson(swarm.metadata()));
                    stmt.setBoolean(4, swarm.paused());
                    stmt.setTimestamp(5, Timestamp.from(swarm.createdAt() != null ? swarm.createdAt() : clock.instant()));
                    stmt.executeUpdate();
                }
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_AGENT_SQL)) {
                    for (var agent : agents) {
                        stmt.setString(1, agent.id());
                        stmt.setString(2, swarm.id());
                        stmt.setString(3, agent.role() != null ? agent.role().name() : null);
                        stmt.setString(4, toJson(agent.capabilities()));
                        stmt.setString(5, agent.status().name());
                        stmt.setTimestamp(6, agent.lastHeartbeat() != null ? Timestamp.from(agent.lastHeartbeat()) : now);
                        stmt.setInt(7, agent.tasksCompleted());
                        stmt.setInt(8, agent.tasksFailed());
                        stmt.setDouble(9, agent.avgExecutionMs());
                        stmt.addBatch();
                    }
                    stmt.executeBatch();
                }
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_TASK_SQL)) {
                    for (var task : tasks) {
                        stmt.setString(1, task.id());
                        stmt.setString(2, swarm.id());
                        stmt.setString(3, task.agentId());
                        stmt.setString(4, task.description());
                        stmt.setString(5, task.status().name());
                        stmt.setInt(6, task.priority());
                        stmt.setString(7, toJson(task.dependencies()));
                        stmt.setString(8, task.payload() != null ? toJson(task.payload()) : null);
                        stmt.setInt(9, task.attempts());
                        stmt.setTimestamp(10, now);
                        stmt.addBatch();
                    }
                    stmt.executeBatch();
                }
                conn.commit();
                log.debug("Stored swarm {} with {} agents and {} tasks", swarm.id(), agents.size(), tasks.size());
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to create swarm " + swarm.id(), e);
        }
    }

    @Override
    public Optional<Swarm> findSwarm(String swarmId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SWARM_SQL)) {
            stmt.setString(1, swarmId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(swarmFrom(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to read swarm " + swarmId, e);
        }
    }

    @Override
    public List<Swarm> listSwarms() {
        var swarms = new ArrayList<Swarm>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_SWARMS_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                swarms.add(swarmFrom(rs));
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to list swarms", e);
        }
        return swarms;
    }

    @Override
    public void setPaused(String swarmId, boolean paused) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_PAUSED_SQL)) {
            stmt.setBoolean(1, paused);
            stmt.setString(2, swarmId);
            if (stmt.executeUpdate() == 0) {
                throw new SwarmNotFoundException(swarmId);
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to update swarm " + swarmId, e);
        }
    }

    @Override
    public SwarmSnapshot getSwarmStatus(String swarmId) {
        Swarm swarm = findSwarm(swarmId).orElseThrow(() -> new SwarmNotFoundException(swarmId));
        return new SwarmSnapshot(swarm, findTasks(swarmId), findAgents(swarmId));
    }

    // ── Tasks ────────────────────────────────────────────────────────────

    @Override
    public List<Task> findTasks(String swarmId) {
        return queryTasks(SELECT_TASKS_BY_SWARM_SQL, swarmId);
    }

    @Override
    public Optional<Task> findTask(String taskId) {
        return queryTasks(SELECT_TASK_SQL, taskId).stream().findFirst();
    }

    @Override
    public List<Task> findTasksByStatus(TaskStatus status) {
        return queryTasks(SELECT_TASKS_BY_STATUS_SQL, status.name());
    }

    @Override
    public Task updateTask(Task task) {
        Timestamp now = Timestamp.from(clock.instant());
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_TASK_SQL)) {
            stmt.setString(1, task.status().name());
            stmt.setString(2, toJson(task.dependencies()));
            stmt.setInt(3, task.attempts());
            stmt.setTimestamp(4, now);
            stmt.setString(5, task.id());
            stmt.setLong(6, task.version());
            if (stmt.executeUpdate() == 0) {
                long actual = currentVersion(conn, SELECT_TASK_VERSION_SQL, task.id(), "task");
                throw new StaleRecordException("Task", task.id(), task.version(), actual);
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to update task " + task.id(), e);
        }
        return findTask(task.id()).orElseThrow(() -> new TaskStoreException("Task vanished: " + task.id()));
    }

    // ── Agents ───────────────────────────────────────────────────────────

    @Override
    public Optional<AgentRecord> findAgent(String agentId) {
        return queryAgents(SELECT_AGENT_SQL, agentId).stream().findFirst();
    }

    @Override
    public List<AgentRecord> findAgents(String swarmId) {
        return queryAgents(SELECT_AGENTS_BY_SWARM_SQL, swarmId);
    }

    @Override
    public AgentRecord updateAgent(AgentRecord agent) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_AGENT_SQL)) {
            stmt.setString(1, agent.status().name());
            stmt.setTimestamp(2, agent.lastHeartbeat() != null ? Timestamp.from(agent.lastHeartbeat()) : null);
            stmt.setInt(3, agent.tasksCompleted());
            stmt.setInt(4, agent.tasksFailed());
            stmt.setDouble(5, agent.avgExecutionMs());
            stmt.setString(6, agent.id());
            stmt.setLong(7, agent.version());
            if (stmt.executeUpdate() == 0) {
                long actual = currentVersion(conn, SELECT_AGENT_VERSION_SQL, agent.id(), "agent");
                throw new StaleRecordException("Agent", agent.id(), agent.version(), actual);
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to update agent " + agent.id(), e);
        }
        return findAgent(agent.id()).orElseThrow(() -> new TaskStoreException("Agent vanished: " + agent.id()));
    }

    // ── Events and SLO results ───────────────────────────────────────────

    @Override
    public void appendEvent(InterventionEvent event) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_EVENT_SQL)) {
            stmt.setString(1, event.id());
            stmt.setString(2, event.taskId());
            stmt.setString(3, event.swarmId());
            stmt.setString(4, event.type().name());
            stmt.setInt(5, event.attempt());
            stmt.setLong(6, event.backoff() != null ? event.backoff().toMillis() : 0L);
            stmt.setString(7, event.details());
            stmt.setTimestamp(8, Timestamp.from(event.timestamp()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to append event for task " + event.taskId(), e);
        }
    }

    @Override
    public List<InterventionEvent> findEvents(String swarmId) {
        return queryEvents(SELECT_EVENTS_BY_SWARM_SQL, stmt -> stmt.setString(1, swarmId));
    }

    @Override
    public List<InterventionEvent> findEventsForTask(String taskId) {
        return queryEvents(SELECT_EVENTS_BY_TASK_SQL, stmt -> stmt.setString(1, taskId));
    }

    @Override
    public List<InterventionEvent> findEventsSince(Instant since) {
        return queryEvents(SELECT_EVENTS_SINCE_SQL, stmt -> stmt.setTimestamp(1, Timestamp.from(since)));
    }

    @Override
    public void appendSloResult(SloResult result) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SLO_SQL)) {
            stmt.setString(1, result.swarmId());
            stmt.setBoolean(2, result.compliant());
            stmt.setString(3, toJson(result));
            stmt.setTimestamp(4, Timestamp.from(result.evaluatedAt()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to append SLO result for swarm " + result.swarmId(), e);
        }
    }

    @Override
    public List<SloResult> findSloResults(String swarmId) {
        var results = new ArrayList<SloResult>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SLO_SQL)) {
            stmt.setString(1, swarmId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(fromJson(rs.getString("report"), new TypeReference<SloResult>() {}));
                }
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to read SLO results for swarm " + swarmId, e);
        }
        return results;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement stmt) throws SQLException;
    }

    private List<Task> queryTasks(String sql, String param) {
        var tasks = new ArrayList<Task>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, param);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    tasks.add(taskFrom(rs));
                }
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to query tasks (" + param + ")", e);
        }
        return tasks;
    }

    private List<AgentRecord> queryAgents(String sql, String param) {
        var agents = new ArrayList<AgentRecord>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, param);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    agents.add(agentFrom(rs));
                }
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to query agents (" + param + ")", e);
        }
        return agents;
    }

    private List<InterventionEvent> queryEvents(String sql, Binder binder) {
        var events = new ArrayList<InterventionEvent>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            binder.bind(stmt);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    events.add(new InterventionEvent(
                            rs.getString("id"),
                            rs.getString("task_id"),
                            rs.getString("swarm_id"),
                            InterventionType.valueOf(rs.getString("event_type")),
                            rs.getInt("attempt"),
                            Duration.ofMillis(rs.getLong("backoff_ms")),
                            rs.getString("details"),
                            rs.getTimestamp("created_at").toInstant()));
                }
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to query intervention events", e);
        }
        return events;
    }

    private long currentVersion(Connection conn, String sql, String id, String type) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new IllegalArgumentException("Unknown " + type + ": " + id);
                }
                return rs.getLong("version");
            }
        }
    }

    private Swarm swarmFrom(ResultSet rs) throws SQLException {
        String metadataJson = rs.getString("metadata");
        Map<String, Object> metadata = metadataJson != null
                ? fromJson(metadataJson, new TypeReference<Map<String, Object>>() {})
                : Map.of();
        return new Swarm(
                rs.getString("id"),
                rs.getString("name"),
                metadata,
                rs.getTimestamp("created_at").toInstant(),
                rs.getBoolean("paused"));
    }

    private Task taskFrom(ResultSet rs) throws SQLException {
        String payloadJson = rs.getString("payload");
        return new Task(
                rs.getString("id"),
                rs.getString("swarm_id"),
                rs.getString("agent_id"),
                rs.getString("description"),
                TaskStatus.valueOf(rs.getString("status")),
                rs.getInt("priority"),
                fromJson(rs.getString("dependencies"), new TypeReference<List<String>>() {}),
                payloadJson != null ? fromJson(payloadJson, new TypeReference<TaskPayload>() {}) : null,
                rs.getInt("attempts"),
                rs.getTimestamp("updated_at").toInstant(),
                rs.getLong("version"));
    }

    private AgentRecord agentFrom(ResultSet rs) throws SQLException {
        String role = rs.getString("role");
        String capabilities = rs.getString("capabilities");
        Timestamp heartbeat = rs.getTimestamp("last_heartbeat");
        return new AgentRecord(
                rs.getString("id"),
                rs.getString("swarm_id"),
                role != null ? AgentRole.valueOf(role) : null,
                capabilities != null ? fromJson(capabilities, new TypeReference<Set<String>>() {}) : Set.of(),
                AgentStatus.valueOf(rs.getString("status")),
                heartbeat != null ? heartbeat.toInstant() : null,
                rs.getInt("tasks_completed"),
                rs.getInt("tasks_failed"),
                rs.getDouble("avg_execution_ms"),
                rs.getLong("version"));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new TaskStoreException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException e) {
            throw new TaskStoreException("Failed to deserialize stored JSON", e);
        }
    }
}
