package com.bbthechange.seatwatch.exception;

/**
 * Exception thrown for invalid command input.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
