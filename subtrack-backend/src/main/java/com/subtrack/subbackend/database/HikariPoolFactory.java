package com.subtrack.subbackend.database;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.sql.SQLException;
import java.time.Duration;

/**
 * Builds HikariCP pools. Construction opens no connection; the first borrow happens
 * in {@link ConnectionPool#ping(Duration)}.
 *
 * <p>{@code borrowTimeout} caps how long any caller waits for a free connection. It should not
 * exceed the liveness-check timeout or the per-request budget, since both include the borrow.
 */
public class HikariPoolFactory implements PoolFactory {

    private final Duration borrowTimeout;

    public HikariPoolFactory(Duration borrowTimeout) {
        this.borrowTimeout = borrowTimeout;
    }

    @Override
    public ConnectionPool create(ConnectionDescriptor descriptor, int maxConnections) throws SQLException {
        HikariConfig config = new HikariConfig();
        config.setPoolName("subtrack-pool");
        config.setJdbcUrl(descriptor.jdbcUrl());
        if (descriptor.username() != null) config.setUsername(descriptor.username());
        if (descriptor.password() != null) config.setPassword(descriptor.password());
        config.setMaximumPoolSize(maxConnections);
        config.setMinimumIdle(0);
        config.setConnectionTimeout(borrowTimeout.toMillis());
        config.setInitializationFailTimeout(-1);

        try {
            return new HikariConnectionPool(new HikariDataSource(config));
        } catch (RuntimeException e) {
            // bad driver class, invalid pool settings
            throw new SQLException("Could not construct connection pool", e);
        }
    }
}
