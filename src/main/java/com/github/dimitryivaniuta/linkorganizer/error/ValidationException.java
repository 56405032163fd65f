package com.github.dimitryivaniuta.linkorganizer.error;

/**
 * Input failed validation: missing required audit fields, bad filter values, an invalid retention window, or invalid category/link data.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
