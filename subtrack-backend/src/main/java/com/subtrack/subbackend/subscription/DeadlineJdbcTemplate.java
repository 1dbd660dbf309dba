package com.subtrack.subbackend.subscription;

import com.subtrack.subbackend.database.Deadline;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Single-use template bound to one {@link Deadline}. Time spent waiting for a connection comes
 * out of the same budget, so each statement only gets what is left as its query timeout.
 */
class DeadlineJdbcTemplate extends JdbcTemplate {

    private final Deadline deadline;

    DeadlineJdbcTemplate(DataSource dataSource, Deadline deadline) {
        super(dataSource);
        this.deadline = deadline;
    }

    @Override
    protected void applyStatementSettings(Statement stmt) throws SQLException {
        super.applyStatementSettings(stmt);
        stmt.setQueryTimeout(deadline.remainingSeconds("statement"));
    }
}
