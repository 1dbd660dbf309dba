package com.subtrack.subbackend.database;

import com.subtrack.subbackend.error.ConfigurationException;
import com.subtrack.subbackend.error.ConnectivityException;
import lombok.extern.slf4j.Slf4j;

import java.sql.SQLException;
import java.time.Duration;

/**
 * Turns a storage descriptor into a verified, bounded connection pool.
 *
 * <p>Each attempt constructs a pool and pings it. The first attempt where both succeed wins.
 * A pool that fails its ping is closed before the next attempt. After every failed attempt the
 * manager waits {@link BackoffPolicy#delayAfter(int)}; once the attempts run out it throws
 * {@link ConnectivityException}. A malformed descriptor fails straight away with
 * {@link ConfigurationException}.
 */
@Slf4j
public class ConnectionManager {

    public static final int DEFAULT_ATTEMPTS = 10;
    public static final Duration DEFAULT_ATTEMPT_TIMEOUT = Duration.ofSeconds(5);

    private final PoolFactory poolFactory;
    private final BackoffPolicy backoff;
    private final Sleeper sleeper;
    private final int maxAttempts;
    private final Duration attemptTimeout;

    private volatile AttemptState state;

    public ConnectionManager(PoolFactory poolFactory, BackoffPolicy backoff, Sleeper sleeper,
                             int maxAttempts, Duration attemptTimeout) {
        if (maxAttempts < 1) {
            throw new ConfigurationException("Connect attempts must be at least 1, got " + maxAttempts);
        }
        this.poolFactory = poolFactory;
        this.backoff = backoff;
        this.sleeper = sleeper;
        this.maxAttempts = maxAttempts;
        this.attemptTimeout = attemptTimeout;
    }

    public ConnectionPool acquire(String descriptor, int maxConnections) {
        ConnectionDescriptor parsed = ConnectionDescriptor.parse(descriptor);
        if (maxConnections < 1) {
            throw new ConfigurationException("Max connections must be at least 1, got " + maxConnections);
        }

        Exception lastConstructFailure = null;
        Exception lastPingFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            enter(AttemptState.CONSTRUCTING, attempt);
            ConnectionPool pool;
            try {
                pool = poolFactory.create(parsed, maxConnections);
            } catch (SQLException | RuntimeException e) {
                lastConstructFailure = e;
                log.warn("Pool construction failed (attempt {}/{}): {}", attempt, maxAttempts, e.getMessage());
                backOff(attempt);
                continue;
            }

            enter(AttemptState.CHECKING_LIVENESS, attempt);
            try {
                pool.ping(attemptTimeout);
                enter(AttemptState.SUCCEEDED, attempt);
                log.info("✅ Connection pool ready on attempt {} ({}, max {} connections)",
                        attempt, parsed.jdbcUrl(), maxConnections);
                return pool;
            } catch (SQLException | RuntimeException e) {
                lastPingFailure = e;
                log.warn("Liveness check failed (attempt {}/{}): {}", attempt, maxAttempts, e.getMessage());
                release(pool);
                backOff(attempt);
            }
        }

        enter(AttemptState.EXHAUSTED, maxAttempts);
        Exception cause = lastPingFailure != null ? lastPingFailure : lastConstructFailure;
        log.error("❌ Storage unreachable after {} attempts ({})", maxAttempts, parsed.jdbcUrl());
        throw new ConnectivityException("Storage unreachable after " + maxAttempts + " attempts", cause);
    }

    /** Closes every connection held by {@code pool}. Safe to call more than once. */
    public void release(ConnectionPool pool) {
        if (pool == null || pool.isClosed()) {
            return;
        }
        pool.close();
        log.info("Connection pool released");
    }

    public AttemptState state() {
        return state;
    }

    private void enter(AttemptState next, int attempt) {
        state = next;
        log.debug("Connection attempt {}: {}", attempt, next);
    }

    private void backOff(int attempt) {
        Duration wait = backoff.delayAfter(attempt);
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectivityException("Interrupted while waiting to reconnect", e);
        }
    }
}
