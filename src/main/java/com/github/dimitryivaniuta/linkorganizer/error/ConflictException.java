package com.github.dimitryivaniuta.linkorganizer.error;

/**
 * The request collides with existing data, e.g. a duplicate category name or link URL.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
