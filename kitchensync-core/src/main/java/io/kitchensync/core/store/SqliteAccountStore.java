package io.kitchensync.core.store;

import io.kitchensync.core.job.LinkedAccount;
import io.kitchensync.core.job.SyncEndpoint;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class SqliteAccountStore implements AccountStore {
    private final SqliteDatabase database;

    public SqliteAccountStore(SqliteDatabase database) {
        this.database = Objects.requireNonNull(database, "database must not be null");
    }

    @Override
    public void saveAccount(LinkedAccount account) throws IOException {
        String sql = """
            INSERT INTO accounts (
                id, user_id, provider_account_id, email, access_token, refresh_token,
                expires_at, token_type, auth_bundle
            )
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
                user_id = excluded.user_id,
                provider_account_id = excluded.provider_account_id,
                email = excluded.email,
                access_token = excluded.access_token,
                refresh_token = excluded.refresh_token,
                expires_at = excluded.expires_at,
                token_type = excluded.token_type,
                auth_bundle = excluded.auth_bundle
            """;
        database.inTransaction(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, account.id());
                statement.setString(2, account.userId());
                statement.setString(3, account.providerAccountId());
                statement.setString(4, account.email());
                statement.setString(5, account.accessToken());
                statement.setString(6, account.refreshToken());
                if (account.expiresAt() == null) {
                    statement.setNull(7, Types.INTEGER);
                } else {
                    statement.setLong(7, account.expiresAt());
                }
                statement.setString(8, account.tokenType());
                statement.setString(9, account.authBundle());
                statement.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public Optional<LinkedAccount> findAccount(String accountId) throws IOException {
        String sql = """
            SELECT id, user_id, provider_account_id, email, access_token, refresh_token,
                   expires_at, token_type, auth_bundle
            FROM accounts WHERE id = ?
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, accountId);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                long expiresAt = resultSet.getLong("expires_at");
                Long expires = resultSet.wasNull() ? null : expiresAt;
                return Optional.of(new LinkedAccount(
                    resultSet.getString("id"),
                    resultSet.getString("user_id"),
                    resultSet.getString("provider_account_id"),
                    resultSet.getString("email"),
                    resultSet.getString("access_token"),
                    resultSet.getString("refresh_token"),
                    expires,
                    resultSet.getString("token_type"),
                    resultSet.getString("auth_bundle")
                ));
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load account " + accountId, e);
        }
    }

    @Override
    public boolean saveAuthBundle(String accountId, String authBundle) throws IOException {
        return database.inTransaction(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                "UPDATE accounts SET auth_bundle = ? WHERE id = ?"
            )) {
                statement.setString(1, authBundle);
                statement.setString(2, accountId);
                return statement.executeUpdate() == 1;
            }
        });
    }

    @Override
    public void saveEndpoint(SyncEndpoint endpoint) throws IOException {
        String sql = """
            INSERT INTO endpoints (id, account_id, external_id, time_zone)
            VALUES (?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
                account_id = excluded.account_id,
                external_id = excluded.external_id,
                time_zone = excluded.time_zone
            """;
        database.inTransaction(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, endpoint.id());
                statement.setString(2, endpoint.accountId());
                statement.setString(3, endpoint.externalId());
                statement.setString(4, endpoint.timeZone());
                statement.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public Optional<SyncEndpoint> findEndpoint(String endpointId) throws IOException {
        String sql = "SELECT id, account_id, external_id, time_zone FROM endpoints WHERE id = ?";
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, endpointId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(readEndpoint(resultSet)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load endpoint " + endpointId, e);
        }
    }

    @Override
    public List<SyncEndpoint> listEndpoints(String accountId) throws IOException {
        String sql = """
            SELECT id, account_id, external_id, time_zone FROM endpoints
            WHERE account_id = ? ORDER BY external_id ASC
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, accountId);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<SyncEndpoint> endpoints = new ArrayList<>();
                while (resultSet.next()) {
                    endpoints.add(readEndpoint(resultSet));
                }
                return endpoints;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list endpoints for account " + accountId, e);
        }
    }

    private SyncEndpoint readEndpoint(ResultSet resultSet) throws SQLException {
        return new SyncEndpoint(
            resultSet.getString("id"),
            resultSet.getString("account_id"),
            resultSet.getString("external_id"),
            resultSet.getString("time_zone")
        );
    }
}
