package com.subtrack.subbackend.database;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Duration;

/**
 * A bounded set of reusable connections. Borrow/return safety and the connection cap
 * are the implementation's job; callers add no locking of their own.
 */
public interface ConnectionPool extends AutoCloseable {

    DataSource dataSource();

    /** Borrows a connection and checks it is alive, all within {@code timeout}. */
    void ping(Duration timeout) throws SQLException;

    boolean isClosed();

    /** Closes every held connection. Calling it again is a no-op. */
    @Override
    void close();
}
