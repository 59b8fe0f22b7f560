package io.kitchensync.core.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kitchensync.core.job.Cadence;
import io.kitchensync.core.job.JobDefinition;
import io.kitchensync.core.job.JobStatus;
import io.kitchensync.core.job.RunStatus;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

public final class SqliteJobStore implements JobStore {
    private static final String JOB_COLUMNS = """
        id, owner_id, name, source_endpoint_id, destination_endpoint_id, status, cadence,
        options_json, last_run_at, next_run_at, created_at
        """;

    private final SqliteDatabase database;
    private final ObjectMapper mapper;

    public SqliteJobStore(SqliteDatabase database) {
        this.database = Objects.requireNonNull(database, "database must not be null");
        this.mapper = new ObjectMapper();
    }

    @Override
    public JobDefinition create(JobDefinition job) throws IOException {
        String id = job.id() == null || job.id().isBlank() ? UUID.randomUUID().toString() : job.id();
        Instant createdAt = job.createdAt() == null ? Instant.now() : job.createdAt();
        JobDefinition stored = new JobDefinition(
            id,
            job.ownerId(),
            job.name(),
            job.sourceEndpointId(),
            job.destinationEndpointId(),
            job.cadence(),
            job.status() == null ? JobStatus.ACTIVE : job.status(),
            job.options(),
            job.lastRunAt(),
            job.nextRunAt(),
            createdAt
        );
        String sql = "INSERT INTO sync_jobs (" + JOB_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        database.inTransaction(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, stored.id());
                statement.setString(2, stored.ownerId());
                statement.setString(3, stored.name());
                statement.setString(4, stored.sourceEndpointId());
                statement.setString(5, stored.destinationEndpointId());
                statement.setString(6, stored.status().name());
                statement.setString(7, stored.cadence().name());
                statement.setString(8, writeOptions(stored.options()));
                SqliteDatabase.bindInstant(statement, 9, stored.lastRunAt());
                SqliteDatabase.bindInstant(statement, 10, stored.nextRunAt());
                SqliteDatabase.bindInstant(statement, 11, stored.createdAt());
                statement.executeUpdate();
            }
            return null;
        });
        return stored;
    }

    @Override
    public Optional<JobDefinition> find(String id) throws IOException {
        try (Connection connection = database.openConnection()) {
            return Optional.ofNullable(selectJob(connection, id));
        } catch (SQLException e) {
            throw new IOException("Failed to load sync job " + id, e);
        }
    }

    @Override
    public List<JobDefinition> list() throws IOException {
        String sql = "SELECT " + JOB_COLUMNS + " FROM sync_jobs ORDER BY created_at ASC";
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            List<JobDefinition> jobs = new ArrayList<>();
            while (resultSet.next()) {
                jobs.add(readJob(resultSet));
            }
            return jobs;
        } catch (SQLException e) {
            throw new IOException("Failed to list sync jobs", e);
        }
    }

    @Override
    public boolean update(JobDefinition job) throws IOException {
        String sql = """
            UPDATE sync_jobs
            SET name = ?, status = ?, cadence = ?, options_json = ?
            WHERE id = ?
            """;
        return database.inTransaction(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, job.name());
                statement.setString(2, job.status().name());
                statement.setString(3, job.cadence().name());
                statement.setString(4, writeOptions(job.options()));
                statement.setString(5, job.id());
                return statement.executeUpdate() == 1;
            }
        });
    }

    @Override
    public boolean delete(String id) throws IOException {
        return database.inTransaction(connection -> {
            try (PreparedStatement statement = connection.prepareStatement("DELETE FROM sync_jobs WHERE id = ?")) {
                statement.setString(1, id);
                return statement.executeUpdate() == 1;
            }
        });
    }

    @Override
    public List<String> findDueJobIds(Instant now) throws IOException {
        String sql = """
            SELECT id FROM sync_jobs
            WHERE status = ? AND (next_run_at IS NULL OR next_run_at <= ?)
            ORDER BY created_at ASC
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, JobStatus.ACTIVE.name());
            SqliteDatabase.bindInstant(statement, 2, now);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<String> ids = new ArrayList<>();
                while (resultSet.next()) {
                    ids.add(resultSet.getString("id"));
                }
                return ids;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to find due sync jobs", e);
        }
    }

    @Override
    public EnqueueOutcome enqueueIfDue(String jobId, Instant now, Function<JobDefinition, Instant> nextRunAt)
        throws IOException {
        return database.inTransaction(connection -> {
            JobDefinition job = selectJob(connection, jobId);
            if (job == null) {
                return EnqueueOutcome.MISSING;
            }
            if (!job.active()) {
                return EnqueueOutcome.NOT_ACTIVE;
            }
            if (!job.dueAt(now)) {
                return EnqueueOutcome.NOT_DUE;
            }

            Instant next = nextRunAt.apply(job);
            boolean outstanding = hasOutstandingRun(connection, jobId);
            if (!outstanding) {
                insertPendingRun(connection, jobId, now);
            }
            try (PreparedStatement statement = connection.prepareStatement(
                "UPDATE sync_jobs SET next_run_at = ? WHERE id = ?"
            )) {
                SqliteDatabase.bindInstant(statement, 1, next);
                statement.setString(2, jobId);
                statement.executeUpdate();
            }
            return outstanding ? EnqueueOutcome.OUTSTANDING : EnqueueOutcome.ENQUEUED;
        });
    }

    private boolean hasOutstandingRun(Connection connection, String jobId) throws SQLException {
        String sql = "SELECT 1 FROM job_runs WHERE job_id = ? AND status IN (?, ?) LIMIT 1";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, jobId);
            statement.setString(2, RunStatus.PENDING.name());
            statement.setString(3, RunStatus.RUNNING.name());
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next();
            }
        }
    }

    private void insertPendingRun(Connection connection, String jobId, Instant createdAt) throws SQLException {
        String sql = "INSERT INTO job_runs (id, job_id, status, created_at) VALUES (?, ?, ?, ?)";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, UUID.randomUUID().toString());
            statement.setString(2, jobId);
            statement.setString(3, RunStatus.PENDING.name());
            SqliteDatabase.bindInstant(statement, 4, createdAt);
            statement.executeUpdate();
        }
    }

    private JobDefinition selectJob(Connection connection, String id) throws SQLException, IOException {
        String sql = "SELECT " + JOB_COLUMNS + " FROM sync_jobs WHERE id = ?";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, id);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? readJob(resultSet) : null;
            }
        }
    }

    private JobDefinition readJob(ResultSet resultSet) throws SQLException, IOException {
        return new JobDefinition(
            resultSet.getString("id"),
            resultSet.getString("owner_id"),
            resultSet.getString("name"),
            resultSet.getString("source_endpoint_id"),
            resultSet.getString("destination_endpoint_id"),
            Cadence.valueOf(resultSet.getString("cadence")),
            JobStatus.valueOf(resultSet.getString("status")),
            readOptions(resultSet.getString("options_json")),
            SqliteDatabase.instant(resultSet, "last_run_at"),
            SqliteDatabase.instant(resultSet, "next_run_at"),
            SqliteDatabase.instant(resultSet, "created_at")
        );
    }

    private JsonNode readOptions(String json) throws IOException {
        if (json == null || json.isBlank()) {
            return mapper.createObjectNode();
        }
        return mapper.readTree(json);
    }

    private String writeOptions(JsonNode options) throws IOException {
        return options == null ? null : mapper.writeValueAsString(options);
    }
}
