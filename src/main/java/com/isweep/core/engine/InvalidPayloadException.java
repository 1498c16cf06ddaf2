package com.isweep.core.engine;

/**
 * Thrown when a decision request body is missing a field or carries a value
 * of the wrong shape.
 */
public class InvalidPayloadException extends RuntimeException {
    public InvalidPayloadException(String message) {
        super(message);
    }
}
