package io.kitchensync.core.store;

import io.kitchensync.core.job.JobRun;
import io.kitchensync.core.job.RunStatus;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

public final class SqliteRunQueue implements RunQueue {
    private static final String RUN_COLUMNS =
        "id, job_id, status, created_at, started_at, finished_at, message, log_location";

    private final SqliteDatabase database;

    public SqliteRunQueue(SqliteDatabase database) {
        this.database = Objects.requireNonNull(database, "database must not be null");
    }

    @Override
    public Optional<JobRun> findOldestPending(Set<String> excludedRunIds) throws IOException {
        Set<String> excluded = excludedRunIds == null ? Set.of() : excludedRunIds;
        StringBuilder sql = new StringBuilder("SELECT " + RUN_COLUMNS + " FROM job_runs WHERE status = ?");
        if (!excluded.isEmpty()) {
            sql.append(" AND id NOT IN (")
                .append(String.join(", ", Collections.nCopies(excluded.size(), "?")))
                .append(')');
        }
        sql.append(" ORDER BY created_at ASC, rowid ASC LIMIT 1");

        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql.toString())) {
            int index = 1;
            statement.setString(index++, RunStatus.PENDING.name());
            for (String runId : excluded) {
                statement.setString(index++, runId);
            }
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(readRun(resultSet)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to look up pending job runs", e);
        }
    }

    @Override
    public boolean tryClaim(String runId, Instant startedAt) throws IOException {
        String sql = "UPDATE job_runs SET status = ?, started_at = ? WHERE id = ? AND status = ?";
        return database.inTransaction(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, RunStatus.RUNNING.name());
                SqliteDatabase.bindInstant(statement, 2, startedAt);
                statement.setString(3, runId);
                statement.setString(4, RunStatus.PENDING.name());
                return statement.executeUpdate() == 1;
            }
        });
    }

    @Override
    public boolean complete(String runId, RunStatus status, Instant finishedAt, String message, String logLocation)
        throws IOException {
        if (!status.terminal()) {
            throw new IllegalArgumentException("status must be terminal: " + status);
        }
        String updateRun = """
            UPDATE job_runs
            SET status = ?, finished_at = ?, message = ?, log_location = ?
            WHERE id = ? AND status = ?
            """;
        String updateJob = """
            UPDATE sync_jobs SET last_run_at = ?
            WHERE id = (SELECT job_id FROM job_runs WHERE id = ?)
            """;
        return database.inTransaction(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(updateRun)) {
                statement.setString(1, status.name());
                SqliteDatabase.bindInstant(statement, 2, finishedAt);
                statement.setString(3, message);
                statement.setString(4, logLocation);
                statement.setString(5, runId);
                statement.setString(6, RunStatus.RUNNING.name());
                if (statement.executeUpdate() == 0) {
                    return false;
                }
            }
            try (PreparedStatement statement = connection.prepareStatement(updateJob)) {
                SqliteDatabase.bindInstant(statement, 1, finishedAt);
                statement.setString(2, runId);
                statement.executeUpdate();
            }
            return true;
        });
    }

    @Override
    public boolean cancelPending(String runId, Instant finishedAt, String message) throws IOException {
        String sql = "UPDATE job_runs SET status = ?, finished_at = ?, message = ? WHERE id = ? AND status = ?";
        return database.inTransaction(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, RunStatus.CANCELLED.name());
                SqliteDatabase.bindInstant(statement, 2, finishedAt);
                statement.setString(3, message);
                statement.setString(4, runId);
                statement.setString(5, RunStatus.PENDING.name());
                return statement.executeUpdate() == 1;
            }
        });
    }

    @Override
    public Optional<JobRun> find(String runId) throws IOException {
        String sql = "SELECT " + RUN_COLUMNS + " FROM job_runs WHERE id = ?";
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, runId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(readRun(resultSet)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load job run " + runId, e);
        }
    }

    @Override
    public List<JobRun> listByJob(String jobId) throws IOException {
        String sql = "SELECT " + RUN_COLUMNS + " FROM job_runs WHERE job_id = ? ORDER BY created_at DESC, rowid DESC";
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, jobId);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<JobRun> runs = new ArrayList<>();
                while (resultSet.next()) {
                    runs.add(readRun(resultSet));
                }
                return runs;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list runs for job " + jobId, e);
        }
    }

    private JobRun readRun(ResultSet resultSet) throws SQLException {
        return new JobRun(
            resultSet.getString("id"),
            resultSet.getString("job_id"),
            RunStatus.valueOf(resultSet.getString("status")),
            SqliteDatabase.instant(resultSet, "created_at"),
            SqliteDatabase.instant(resultSet, "started_at"),
            SqliteDatabase.instant(resultSet, "finished_at"),
            resultSet.getString("message"),
            resultSet.getString("log_location")
        );
    }
}
