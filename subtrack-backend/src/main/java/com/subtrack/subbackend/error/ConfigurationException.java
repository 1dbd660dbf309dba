package com.subtrack.subbackend.error;

/** Connection descriptor or store settings are malformed. Never retried. */
public class ConfigurationException extends StoreException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONFIGURATION;
    }
}
