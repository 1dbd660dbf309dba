package com.subtrack.subbackend.error;

/** A schema migration failed. Partial schema state is surfaced, never re-attempted. */
public class MigrationException extends StoreException {

    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.MIGRATION;
    }
}
