package com.subtrack.subbackend.error;

/**
 * Stable error signal handed to callers of the store, independent of the JDBC driver in use.
 */
public enum ErrorKind {
    CONFIGURATION,
    CONNECTIVITY,
    MIGRATION,
    VALIDATION,
    NOT_FOUND,
    STORAGE,
    TIMEOUT
}
