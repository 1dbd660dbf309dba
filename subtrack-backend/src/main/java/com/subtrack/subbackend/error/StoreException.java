package com.subtrack.subbackend.error;

public abstract class StoreException extends RuntimeException {

    protected StoreException(String message) {
        super(message);
    }

    protected StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
