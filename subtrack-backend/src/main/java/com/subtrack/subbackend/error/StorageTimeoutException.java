package com.subtrack.subbackend.error;

public class StorageTimeoutException extends StorageException {

    public StorageTimeoutException(String operation, String subscriptionId, Throwable cause) {
        super(operation, subscriptionId, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TIMEOUT;
    }
}
