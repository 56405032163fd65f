package com.github.dimitryivaniuta.linkorganizer.error;

/**
 * A storage operation failed. The underlying persistence exception is kept as the cause.
 */
public class DatabaseException extends RuntimeException {

    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
