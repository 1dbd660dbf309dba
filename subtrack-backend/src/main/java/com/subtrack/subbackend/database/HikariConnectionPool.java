package com.subtrack.subbackend.database;

import com.zaxxer.hikari.HikariDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

public class HikariConnectionPool implements ConnectionPool {

    private final HikariDataSource dataSource;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public HikariConnectionPool(HikariDataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public DataSource dataSource() {
        return dataSource;
    }

    @Override
    public void ping(Duration timeout) throws SQLException {
        Deadline deadline = Deadline.after(timeout);
        // the borrow is capped by the pool's connectionTimeout, which is no longer than an attempt
        try (Connection conn = dataSource.getConnection()) {
            int seconds = deadline.remainingSeconds("liveness check");
            if (!conn.isValid(seconds)) {
                throw new SQLException("Connection did not answer liveness check within " + seconds + "s");
            }
        }
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            dataSource.close();
        }
    }
}
