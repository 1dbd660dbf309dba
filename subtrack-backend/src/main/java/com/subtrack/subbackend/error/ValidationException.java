package com.subtrack.subbackend.error;

/** Caller supplied malformed input; raised before storage is touched. */
public class ValidationException extends StoreException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
