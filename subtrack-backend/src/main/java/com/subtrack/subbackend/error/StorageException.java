package com.subtrack.subbackend.error;

import lombok.Getter;

/**
 * Unexpected failure while talking to the database during a request.
 * Carries the operation name and, where there is one, the subscription id.
 */
@Getter
public class StorageException extends StoreException {

    private final String operation;
    private final String subscriptionId;

    public StorageException(String operation, String subscriptionId, Throwable cause) {
        super(describe(operation, subscriptionId), cause);
        this.operation = operation;
        this.subscriptionId = subscriptionId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.STORAGE;
    }

    private static String describe(String operation, String subscriptionId) {
        return subscriptionId == null
                ? "Failed to " + operation + " subscriptions"
                : "Failed to " + operation + " subscription " + subscriptionId;
    }
}
