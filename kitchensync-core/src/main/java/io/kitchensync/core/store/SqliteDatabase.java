package io.kitchensync.core.store;

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
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.sqlite.SQLiteConfig;

/**
 * Shared SQLite handle for the job, run and account stores.
 *
 * <p>Write transactions open with {@code BEGIN IMMEDIATE}, which takes the database write lock up
 * front. Two processes that read the same row inside such a transaction are therefore serialized,
 * and the busy timeout makes the loser wait instead of failing.
 */
public final class SqliteDatabase {
    private static final Duration BUSY_TIMEOUT = Duration.ofSeconds(10);

    private static final List<String> SCHEMA = List.of(
        """
        CREATE TABLE IF NOT EXISTS accounts (
            id TEXT PRIMARY KEY,
            user_id TEXT NOT NULL,
            provider_account_id TEXT NOT NULL,
            email TEXT,
            access_token TEXT,
            refresh_token TEXT,
            expires_at INTEGER,
            token_type TEXT,
            auth_bundle TEXT
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS endpoints (
            id TEXT PRIMARY KEY,
            account_id TEXT NOT NULL REFERENCES accounts(id) ON DELETE CASCADE,
            external_id TEXT NOT NULL,
            time_zone TEXT NOT NULL,
            UNIQUE (account_id, external_id)
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS sync_jobs (
            id TEXT PRIMARY KEY,
            owner_id TEXT NOT NULL,
            name TEXT NOT NULL,
            source_endpoint_id TEXT NOT NULL REFERENCES endpoints(id) ON DELETE RESTRICT,
            destination_endpoint_id TEXT NOT NULL REFERENCES endpoints(id) ON DELETE RESTRICT,
            status TEXT NOT NULL,
            cadence TEXT NOT NULL,
            options_json TEXT,
            last_run_at INTEGER,
            next_run_at INTEGER,
            created_at INTEGER NOT NULL
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS job_runs (
            id TEXT PRIMARY KEY,
            job_id TEXT NOT NULL REFERENCES sync_jobs(id) ON DELETE CASCADE,
            status TEXT NOT NULL,
            created_at INTEGER NOT NULL,
            started_at INTEGER,
            finished_at INTEGER,
            message TEXT,
            log_location TEXT
        )
        """,
        "CREATE INDEX IF NOT EXISTS idx_sync_jobs_status_next_run ON sync_jobs(status, next_run_at)",
        "CREATE INDEX IF NOT EXISTS idx_job_runs_status_created ON job_runs(status, created_at)",
        "CREATE INDEX IF NOT EXISTS idx_job_runs_job_created ON job_runs(job_id, created_at DESC)",
        """
        CREATE UNIQUE INDEX IF NOT EXISTS uq_job_runs_outstanding
        ON job_runs(job_id) WHERE status IN ('PENDING', 'RUNNING')
        """
    );

    private final String jdbcUrl;
    private final SQLiteConfig config;

    public SqliteDatabase(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.config = new SQLiteConfig();
        this.config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        this.config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        this.config.setBusyTimeout((int) BUSY_TIMEOUT.toMillis());
        this.config.enforceForeignKeys(true);
        this.config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        init();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, config.toProperties());
    }

    public <T> T inTransaction(SqlWork<T> work) throws IOException {
        try (Connection connection = openConnection()) {
            connection.setTransactionIsolation(Connection.TRANSACTION_SERIALIZABLE);
            connection.setAutoCommit(false);
            try {
                T result = work.apply(connection);
                connection.commit();
                return result;
            } catch (SQLException | IOException | RuntimeException e) {
                rollbackQuietly(connection, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new IOException("SQLite transaction failed", e);
        }
    }

    private void rollbackQuietly(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    private void init() throws IOException {
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            for (String ddl : SCHEMA) {
                statement.execute(ddl);
            }
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite database at " + jdbcUrl, e);
        }
    }

    static Instant instant(ResultSet resultSet, String column) throws SQLException {
        long value = resultSet.getLong(column);
        return resultSet.wasNull() ? null : Instant.ofEpochMilli(value);
    }

    static void bindInstant(PreparedStatement statement, int index, Instant value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setLong(index, value.toEpochMilli());
        }
    }

    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection connection) throws SQLException, IOException;
    }
}
