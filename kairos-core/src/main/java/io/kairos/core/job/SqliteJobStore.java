package io.kairos.core.job;

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
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SQLite-backed job store. The job body is kept as JSON; the columns the dispatcher filters on
 * ({@code enabled}, {@code next_run}) are stored alongside it as epoch milliseconds so the claim
 * can run as a single conditional {@code UPDATE}.
 */
public final class SqliteJobStore implements JobStore {
    private final String jdbcUrl;
    private final ObjectMapper mapper;
    private final Clock clock;

    public SqliteJobStore(Path dbPath) throws IOException {
        this(dbPath, Clock.systemUTC());
    }

    public SqliteJobStore(Path dbPath, Clock clock) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        init();
    }

    @Override
    public synchronized List<Job> find(JobFilter filter) throws IOException {
        JobFilter effective = filter == null ? JobFilter.all() : filter;
        StringBuilder sql = new StringBuilder("SELECT body_json, enabled, last_run, next_run, updated_at FROM jobs WHERE 1=1");
        List<Object> args = new ArrayList<>();
        if (effective.ownerId() != null) {
            sql.append(" AND owner_id = ?");
            args.add(effective.ownerId());
        }
        if (effective.enabled() != null) {
            sql.append(" AND enabled = ?");
            args.add(effective.enabled() ? 1 : 0);
        }
        if (effective.dueAt() != null) {
            sql.append(" AND next_run IS NOT NULL AND next_run <= ?");
            args.add(effective.dueAt().toEpochMilli());
            sql.append(" ORDER BY next_run ASC, id ASC");
        } else {
            sql.append(" ORDER BY created_at DESC, id ASC");
        }

        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql.toString())) {
            for (int i = 0; i < args.size(); i++) {
                statement.setObject(i + 1, args.get(i));
            }
            List<Job> jobs = new ArrayList<>();
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next() && jobs.size() < effective.limit()) {
                    Job job = read(resultSet);
                    // type, action type and creation range are matched on the decoded body
                    if (effective.matches(job)) {
                        jobs.add(job);
                    }
                }
            }
            return jobs;
        } catch (SQLException e) {
            throw new IOException("Failed to query jobs", e);
        }
    }

    @Override
    public synchronized Optional<Job> get(String id) throws IOException {
        if (id == null) {
            return Optional.empty();
        }
        String sql = """
            SELECT body_json, enabled, last_run, next_run, updated_at
            FROM jobs
            WHERE id = ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, id);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(read(resultSet)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load job " + id, e);
        }
    }

    @Override
    public synchronized Job create(Job job) throws IOException {
        Objects.requireNonNull(job, "job must not be null");
        String sql = """
            INSERT INTO jobs (id, owner_id, created_at, enabled, last_run, next_run, updated_at, body_json)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, job.id());
            statement.setString(2, job.ownerId());
            statement.setLong(3, job.createdAt().toEpochMilli());
            statement.setInt(4, job.enabled() ? 1 : 0);
            setInstant(statement, 5, job.lastRun());
            setInstant(statement, 6, job.nextRun());
            statement.setLong(7, job.updatedAt().toEpochMilli());
            statement.setString(8, mapper.writeValueAsString(job));
            statement.executeUpdate();
            return job;
        } catch (SQLException e) {
            throw new IOException("Failed to create job " + job.id(), e);
        }
    }

    /**
     * Writes the body plus only the state columns the patch sets, so a concurrent claim by another
     * store instance on the same file is never overwritten with a stale {@code next_run}.
     */
    @Override
    public synchronized Job update(String id, JobPatch patch) throws IOException {
        Objects.requireNonNull(patch, "patch must not be null");
        Job current = get(id).orElseThrow(() -> NotFoundException.job(id));
        Job updated = patch.applyTo(current, clock.instant());
        StringBuilder sql = new StringBuilder("UPDATE jobs SET updated_at = ?, body_json = ?");
        if (patch.setsEnabled()) {
            sql.append(", enabled = ?");
        }
        if (patch.setsLastRun()) {
            sql.append(", last_run = ?");
        }
        if (patch.setsNextRun()) {
            sql.append(", next_run = ?");
        }
        sql.append(" WHERE id = ?");
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql.toString())) {
            int index = 1;
            statement.setLong(index++, updated.updatedAt().toEpochMilli());
            statement.setString(index++, mapper.writeValueAsString(updated));
            if (patch.setsEnabled()) {
                statement.setInt(index++, updated.enabled() ? 1 : 0);
            }
            if (patch.setsLastRun()) {
                setInstant(statement, index++, updated.lastRun());
            }
            if (patch.setsNextRun()) {
                setInstant(statement, index++, updated.nextRun());
            }
            statement.setString(index, id);
            if (statement.executeUpdate() == 0) {
                throw NotFoundException.job(id);
            }
        } catch (SQLException e) {
            throw new IOException("Failed to update job " + id, e);
        }
        return get(id).orElseThrow(() -> NotFoundException.job(id));
    }

    @Override
    public synchronized boolean delete(String id) throws IOException {
        if (id == null) {
            return false;
        }
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement("DELETE FROM jobs WHERE id = ?")) {
            statement.setString(1, id);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to delete job " + id, e);
        }
    }

    @Override
    public synchronized boolean tryClaim(String id, Instant expectedNextRun, Instant newNextRun) throws IOException {
        if (id == null || expectedNextRun == null) {
            return false;
        }
        String sql = """
            UPDATE jobs
            SET next_run = ?, updated_at = ?
            WHERE id = ? AND enabled = 1 AND next_run = ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            setInstant(statement, 1, newNextRun);
            statement.setLong(2, clock.instant().toEpochMilli());
            statement.setString(3, id);
            statement.setLong(4, expectedNextRun.toEpochMilli());
            return statement.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new IOException("Failed to claim job " + id, e);
        }
    }

    private Job read(ResultSet resultSet) throws SQLException, IOException {
        Job body = mapper.readValue(resultSet.getString("body_json"), Job.class);
        return body.withState(
            resultSet.getInt("enabled") == 1,
            instant(resultSet, "last_run"),
            instant(resultSet, "next_run"),
            Instant.ofEpochMilli(resultSet.getLong("updated_at"))
        );
    }

    private static Instant instant(ResultSet resultSet, String column) throws SQLException {
        long value = resultSet.getLong(column);
        return resultSet.wasNull() ? null : Instant.ofEpochMilli(value);
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
            CREATE TABLE IF NOT EXISTS jobs (
                id TEXT PRIMARY KEY,
                owner_id TEXT,
                created_at INTEGER NOT NULL,
                enabled INTEGER NOT NULL,
                last_run INTEGER,
                next_run INTEGER,
                updated_at INTEGER NOT NULL,
                body_json TEXT NOT NULL
            )
            """;
        String dueIdx = """
            CREATE INDEX IF NOT EXISTS idx_jobs_enabled_next_run
            ON jobs(enabled, next_run)
            """;
        String ownerIdx = """
            CREATE INDEX IF NOT EXISTS idx_jobs_owner_created_at
            ON jobs(owner_id, created_at DESC)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            statement.execute(dueIdx);
            statement.execute(ownerIdx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite job store", e);
        }
    }
}
