package com.subtrack.subbackend.error;

/** The pool could not be verified within the retry budget. Fatal at startup. */
public class ConnectivityException extends StoreException {

    public ConnectivityException(String message) {
        super(message);
    }

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONNECTIVITY;
    }
}
