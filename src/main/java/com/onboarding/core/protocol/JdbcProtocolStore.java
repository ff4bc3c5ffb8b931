package com.onboarding.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onboarding.core.model.MissionContext;
import com.onboarding.core.model.Protocol;
import com.onboarding.core.model.StepSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-based {@link ProtocolStore} that keeps every protocol version as a row.
 * <p>
 * Rows are keyed by {@code (project_id, version)}; the primary key enforces
 * first-writer-wins for version 1, so a concurrent creation surfaces as an
 * integrity violation and is reported as {@link ProtocolAlreadyExistsException}.
 * Steps are stored as a JSON array. Works against PostgreSQL and H2.
 * <p>
 * The table {@code onboarding_protocols} is created by {@link #createTables()}.
 */
public class JdbcProtocolStore implements ProtocolStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcProtocolStore.class);

    private static final String TABLE_NAME = "onboarding_protocols";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                project_id  VARCHAR(100) NOT NULL,
                version     INTEGER      NOT NULL,
                steps       TEXT         NOT NULL,
                created_by  VARCHAR(255),
                created_at  TIMESTAMP    NOT NULL,
                PRIMARY KEY (project_id, version)
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (project_id, version, steps, created_by, created_at)
            VALUES (?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_LATEST_SQL = """
            SELECT project_id, version, steps, created_by, created_at
            FROM %s
            WHERE project_id = ?
            ORDER BY version DESC
            LIMIT 1
            """.formatted(TABLE_NAME);

    private static final String SELECT_MAX_VERSION_SQL = """
            SELECT MAX(version) FROM %s WHERE project_id = ?
            """.formatted(TABLE_NAME);

    private static final TypeReference<List<StepSpec>> STEP_LIST = new TypeReference<>() {};

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ProtocolValidator validator;

    public JdbcProtocolStore(DataSource dataSource) {
        this(dataSource, new ProtocolValidator());
    }

    public JdbcProtocolStore(DataSource dataSource, ProtocolValidator validator) {
        this(dataSource, new ObjectMapper(), Clock.systemUTC(), validator);
    }

    public JdbcProtocolStore(DataSource dataSource, ObjectMapper objectMapper, Clock clock) {
        this(dataSource, objectMapper, clock, new ProtocolValidator());
    }

    public JdbcProtocolStore(DataSource dataSource, ObjectMapper objectMapper, Clock clock,
                             ProtocolValidator validator) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.validator = validator;
    }

    /**
     * Creates the protocol table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Protocol table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Optional<Protocol> get(String projectId, MissionContext context) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_LATEST_SQL)) {
            stmt.setString(1, projectId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromResultSet(rs));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            log.error("[{}] Failed to read protocol for project '{}'", context.traceId(), projectId, e);
            throw new ProtocolStoreUnavailableException(
                    "Protocol store read failed for " + projectId, context.traceId(), e);
        }
    }

    @Override
    public Protocol create(String projectId, List<StepSpec> steps, MissionContext context) {
        validator.validate(projectId, steps);
        var protocol = new Protocol(projectId, steps, 1, context.employeeId(), clock.instant());
        try (Connection conn = dataSource.getConnection()) {
            insert(conn, protocol);
            log.info("[{}] Created protocol v1 for {} with {} steps", context.traceId(), projectId, steps.size());
            return protocol;
        } catch (SQLException e) {
            if (isIntegrityViolation(e)) {
                log.info("[{}] Protocol for {} was created concurrently", context.traceId(), projectId);
                throw new ProtocolAlreadyExistsException(projectId);
            }
            log.error("[{}] Failed to create protocol for project '{}'", context.traceId(), projectId, e);
            throw new ProtocolStoreUnavailableException(
                    "Protocol store write failed for " + projectId, context.traceId(), e);
        }
    }

    @Override
    public Protocol replace(String projectId, List<StepSpec> steps, MissionContext context) {
        validator.validate(projectId, steps);
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                int current = currentVersion(conn, projectId);
                if (current == 0) {
                    conn.rollback();
                    throw new ProtocolNotFoundException(projectId);
                }
                var protocol = new Protocol(projectId, steps, current + 1, context.employeeId(), clock.instant());
                insert(conn, protocol);
                conn.commit();
                log.info("[{}] Replaced protocol for {} with v{}", context.traceId(), projectId, protocol.version());
                return protocol;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            if (isIntegrityViolation(e)) {
                log.warn("[{}] Concurrent replacement of protocol for {}", context.traceId(), projectId);
                throw new ProtocolConflictException(projectId, e);
            }
            log.error("[{}] Failed to replace protocol for project '{}'", context.traceId(), projectId, e);
            throw new ProtocolStoreUnavailableException(
                    "Protocol store write failed for " + projectId, context.traceId(), e);
        }
    }

    private int currentVersion(Connection conn, String projectId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_MAX_VERSION_SQL)) {
            stmt.setString(1, projectId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    private void insert(Connection conn, Protocol protocol) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, protocol.projectId());
            stmt.setInt(2, protocol.version());
            stmt.setString(3, serializeSteps(protocol.steps()));
            stmt.setString(4, protocol.createdBy());
            stmt.setTimestamp(5, Timestamp.from(protocol.createdAt()));
            stmt.executeUpdate();
        }
    }

    private Protocol fromResultSet(ResultSet rs) throws SQLException {
        return new Protocol(
                rs.getString("project_id"),
                deserializeSteps(rs.getString("steps")),
                rs.getInt("version"),
                rs.getString("created_by"),
                rs.getTimestamp("created_at").toInstant());
    }

    private String serializeSteps(List<StepSpec> steps) throws SQLException {
        try {
            return objectMapper.writeValueAsString(steps);
        } catch (JsonProcessingException e) {
            throw new SQLException("Failed to serialize protocol steps", e);
        }
    }

    private List<StepSpec> deserializeSteps(String json) throws SQLException {
        try {
            return objectMapper.readValue(json, STEP_LIST);
        } catch (JsonProcessingException e) {
            throw new SQLException("Failed to deserialize protocol steps", e);
        }
    }

    private static boolean isIntegrityViolation(SQLException e) {
        String state = e.getSQLState();
        return state != null && state.startsWith("23");
    }
}
