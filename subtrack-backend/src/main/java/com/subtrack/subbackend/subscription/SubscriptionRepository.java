package com.subtrack.subbackend.subscription;

import com.subtrack.subbackend.config.StorageProperties;
import com.subtrack.subbackend.database.ConnectionPool;
import com.subtrack.subbackend.database.Deadline;
import com.subtrack.subbackend.error.StorageException;
import com.subtrack.subbackend.error.StorageTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.sql.Types;
import java.time.Duration;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to the {@code subscriptions} table. Works on the pool handed to it and never
 * opens or closes that pool itself. Each call must finish within the configured query timeout,
 * counted from entry; running out surfaces as {@link StorageTimeoutException}.
 */
@Slf4j
@Repository
public class SubscriptionRepository {

    private static final String COLUMNS = "id, user_id, service_name, price, start_date, end_date";

    // Postgres and H2 both report a cancelled statement with this SQLState
    private static final String QUERY_CANCELED = "57014";

    private static final RowMapper<Subscription> ROW_MAPPER = (rs, rowNum) -> new Subscription(
            rs.getObject("id", UUID.class),
            rs.getString("user_id"),
            rs.getString("service_name"),
            rs.getInt("price"),
            toMonth(rs.getObject("start_date", LocalDate.class)),
            toMonth(rs.getObject("end_date", LocalDate.class))
    );

    private final DataSource dataSource;
    private final Duration requestTimeout;

    public SubscriptionRepository(ConnectionPool connectionPool, StorageProperties props) {
        this.dataSource = connectionPool.dataSource();
        this.requestTimeout = props.getQueryTimeout();
    }

    // One template per call: its deadline starts here and covers the borrow and the statement.
    private NamedParameterJdbcTemplate jdbc() {
        return new NamedParameterJdbcTemplate(new DeadlineJdbcTemplate(dataSource, Deadline.after(requestTimeout)));
    }

    public void insert(Subscription s) {
        String sql = "INSERT INTO subscriptions (" + COLUMNS + ") "
                + "VALUES (:id, :userId, :serviceName, :price, :startDate, :endDate)";
        try {
            jdbc().update(sql, params(s));
        } catch (DataAccessException e) {
            log.error("Failed to insert subscription id={} user={} service={} price={} start={} end={}",
                    s.id(), s.userId(), s.serviceName(), s.price(), s.startDate(), s.endDate(), e);
            throw translate("insert", s.id(), e);
        }
    }

    public Optional<Subscription> findById(UUID id) {
        String sql = "SELECT " + COLUMNS + " FROM subscriptions WHERE id = :id";
        try {
            return jdbc().query(sql, new MapSqlParameterSource("id", id), ROW_MAPPER).stream().findFirst();
        } catch (DataAccessException e) {
            log.error("Failed to load subscription {}", id, e);
            throw translate("load", id, e);
        }
    }

    /** Overwrites every column of the row. Returns the number of rows touched (0 or 1). */
    public int update(Subscription s) {
        String sql = """
                UPDATE subscriptions
                SET user_id = :userId, service_name = :serviceName, price = :price,
                    start_date = :startDate, end_date = :endDate
                WHERE id = :id
                """;
        try {
            return jdbc().update(sql, params(s));
        } catch (DataAccessException e) {
            log.error("Failed to update subscription {}", s.id(), e);
            throw translate("update", s.id(), e);
        }
    }

    public int deleteById(UUID id) {
        try {
            return jdbc().update("DELETE FROM subscriptions WHERE id = :id", new MapSqlParameterSource("id", id));
        } catch (DataAccessException e) {
            log.error("Failed to delete subscription {}", id, e);
            throw translate("delete", id, e);
        }
    }

    /** No ORDER BY: rows come back in storage order. */
    public List<Subscription> findAll(PeriodFilter filter) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String sql = "SELECT " + COLUMNS + " FROM subscriptions" + filter.toSql(params);
        try {
            return jdbc().query(sql, params, ROW_MAPPER);
        } catch (DataAccessException e) {
            log.error("Failed to list subscriptions (from={}, to={})", filter.from(), filter.to(), e);
            throw translate("list", null, e);
        }
    }

    private static MapSqlParameterSource params(Subscription s) {
        return new MapSqlParameterSource()
                .addValue("id", s.id())
                .addValue("userId", s.userId())
                .addValue("serviceName", s.serviceName())
                .addValue("price", s.price())
                .addValue("startDate", s.startDate().atDay(1), Types.DATE)
                .addValue("endDate", s.isOngoing() ? null : s.endDate().atDay(1), Types.DATE);
    }

    private static YearMonth toMonth(LocalDate date) {
        return date == null ? null : YearMonth.from(date);
    }

    private static StorageException translate(String operation, UUID id, DataAccessException e) {
        String sid = id == null ? null : id.toString();
        if (isTimeout(e)) {
            return new StorageTimeoutException(operation, sid, e);
        }
        return new StorageException(operation, sid, e);
    }

    // Hikari reports an expired borrow as SQLTransientConnectionException, which Spring wraps
    // in CannotGetJdbcConnectionException; the driver error it chains may sit underneath.
    static boolean isTimeout(DataAccessException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof QueryTimeoutException
                    || t instanceof SQLTimeoutException
                    || t instanceof SQLTransientConnectionException) {
                return true;
            }
            if (t instanceof SQLException sql && QUERY_CANCELED.equals(sql.getSQLState())) {
                return true;
            }
        }
        return false;
    }
}
