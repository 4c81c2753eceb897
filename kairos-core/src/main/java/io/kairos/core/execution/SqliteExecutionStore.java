package io.kairos.core.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.kairos.core.error.NotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class SqliteExecutionStore implements ExecutionStore {
    private final String jdbcUrl;
    private final ObjectMapper mapper;

    public SqliteExecutionStore(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        init();
    }

    @Override
    public synchronized String append(JobExecution execution) throws IOException {
        Objects.requireNonNull(execution, "execution must not be null");
        String sql = """
            INSERT INTO job_executions (id, job_id, status, created_at, started_at, body_json)
            VALUES (?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, execution.id());
            statement.setString(2, execution.jobId());
            statement.setString(3, execution.status().name());
            statement.setLong(4, execution.createdAt().toEpochMilli());
            setInstant(statement, 5, execution.startedAt());
            statement.setString(6, mapper.writeValueAsString(execution));
            statement.executeUpdate();
            return execution.id();
        } catch (SQLException e) {
            throw new IOException("Failed to append execution " + execution.id(), e);
        }
    }

    @Override
    public synchronized JobExecution update(String id, ExecutionPatch patch) throws IOException {
        Objects.requireNonNull(patch, "patch must not be null");
        JobExecution current = get(id).orElseThrow(() -> NotFoundException.execution(id));
        JobExecution updated = patch.applyTo(current);
        String sql = """
            UPDATE job_executions
            SET status = ?, started_at = ?, body_json = ?
            WHERE id = ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, updated.status().name());
            setInstant(statement, 2, updated.startedAt());
            statement.setString(3, mapper.writeValueAsString(updated));
            statement.setString(4, id);
            statement.executeUpdate();
            return updated;
        } catch (SQLException e) {
            throw new IOException("Failed to update execution " + id, e);
        }
    }

    @Override
    public synchronized Optional<JobExecution> get(String id) throws IOException {
        if (id == null) {
            return Optional.empty();
        }
        List<JobExecution> found = query("SELECT body_json FROM job_executions WHERE id = ?", id);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public synchronized List<JobExecution> listByJob(String jobId, int limit) throws IOException {
        String sql = """
            SELECT body_json
            FROM job_executions
            WHERE job_id = ?
            ORDER BY created_at DESC, id ASC
            LIMIT ?
            """;
        return query(sql, jobId, limit <= 0 ? -1 : limit);
    }

    @Override
    public synchronized List<JobExecution> listStartedSince(Instant since) throws IOException {
        String sql = """
            SELECT body_json
            FROM job_executions
            WHERE started_at IS NOT NULL AND started_at >= ?
            ORDER BY created_at DESC, id ASC
            """;
        return query(sql, since.toEpochMilli());
    }

    @Override
    public synchronized List<JobExecution> listUnfinished() throws IOException {
        String sql = """
            SELECT body_json
            FROM job_executions
            WHERE status IN ('PENDING', 'RUNNING', 'RETRYING')
            ORDER BY created_at ASC, id ASC
            """;
        return query(sql);
    }

    private List<JobExecution> query(String sql, Object... args) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < args.length; i++) {
                statement.setObject(i + 1, args[i]);
            }
            List<JobExecution> executions = new ArrayList<>();
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    executions.add(mapper.readValue(resultSet.getString("body_json"), JobExecution.class));
                }
            }
            return executions;
        } catch (SQLException e) {
            throw new IOException("Failed to query executions", e);
        }
    }

    private static void setInstant(PreparedStatement statement, int index, Instant value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setLong(index, value.toEpochMilli());
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        }
        return connection;
    }

    private void init() throws IOException {
        String ddl = """
            CREATE TABLE IF NOT EXISTS job_executions (
                id TEXT PRIMARY KEY,
                job_id TEXT NOT NULL,
                status TEXT NOT NULL,
                created_at INTEGER NOT NULL,
                started_at INTEGER,
                body_json TEXT NOT NULL
            )
            """;
        String jobIdx = """
            CREATE INDEX IF NOT EXISTS idx_job_executions_job_id
            ON job_executions(job_id, created_at DESC)
            """;
        String startedIdx = """
            CREATE INDEX IF NOT EXISTS idx_job_executions_started_at
            ON job_executions(started_at)
            """;
        String statusIdx = """
            CREATE INDEX IF NOT EXISTS idx_job_executions_status
            ON job_executions(status)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            statement.execute(jobIdx);
            statement.execute(startedIdx);
            statement.execute(statusIdx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite execution store", e);
        }
    }
}
