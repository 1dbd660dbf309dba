package com.subtrack.subbackend.database;

import java.sql.SQLTimeoutException;
import java.time.Duration;

/**
 * A fixed point in time shared by every step of one unit of storage work, so that borrowing a
 * connection and using it draw on the same budget.
 */
public final class Deadline {

    private final long expiresAtNanos;

    private Deadline(long expiresAtNanos) {
        this.expiresAtNanos = expiresAtNanos;
    }

    public static Deadline after(Duration budget) {
        return new Deadline(System.nanoTime() + budget.toNanos());
    }

    public Duration remaining() {
        return Duration.ofNanos(expiresAtNanos - System.nanoTime());
    }

    /**
     * Whole seconds left, for JDBC calls that only take seconds. Rounds down, but never below 1
     * while any time is left, since 0 means "no limit" to JDBC.
     *
     * @throws SQLTimeoutException if the deadline has already passed
     */
    public int remainingSeconds(String step) throws SQLTimeoutException {
        Duration left = remaining();
        if (left.isZero() || left.isNegative()) {
            throw new SQLTimeoutException("Deadline passed before " + step);
        }
        return (int) Math.max(1, left.toSeconds());
    }
}
