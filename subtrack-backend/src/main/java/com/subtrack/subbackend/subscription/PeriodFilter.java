package com.subtrack.subbackend.subscription;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.sql.Types;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * Optional month bounds for listing.
 *
 * <p>A row passes when ({@code from} absent or {@code start_date >= from}) and
 * ({@code to} absent or {@code end_date <= to}). Ongoing subscriptions have no end date,
 * so they only pass when {@code to} is absent.
 */
public record PeriodFilter(YearMonth from, YearMonth to) {

    public static final PeriodFilter NONE = new PeriodFilter(null, null);

    /** Null means the bound is absent; any other value must be {@code MM-YYYY}. */
    public static PeriodFilter parse(String from, String to) {
        return new PeriodFilter(
                from == null ? null : MonthFormat.parse(from, "from"),
                to == null ? null : MonthFormat.parse(to, "to")
        );
    }

    /** In-memory form of {@link #toSql}, kept in step with it. */
    boolean matches(Subscription s) {
        if (from != null && s.startDate().isBefore(from)) {
            return false;
        }
        if (to == null) {
            return true;
        }
        if (s.isOngoing()) {
            // no end month, so it never falls on or before an upper bound
            return false;
        }
        return !s.endDate().isAfter(to);
    }

    /** Builds the WHERE clause (empty when unbounded) and binds its parameters into {@code params}. */
    String toSql(MapSqlParameterSource params) {
        List<String> clauses = new ArrayList<>();
        if (from != null) {
            clauses.add("start_date >= :from");
            params.addValue("from", from.atDay(1), Types.DATE);
        }
        if (to != null) {
            // ongoing rows carry no end_date and are left out explicitly
            clauses.add("end_date IS NOT NULL AND end_date <= :to");
            params.addValue("to", to.atDay(1), Types.DATE);
        }
        return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
    }
}
