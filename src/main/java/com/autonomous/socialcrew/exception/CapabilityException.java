package com.autonomous.socialcrew.exception;

/**
 * Thrown by an agent capability to report that it could not produce a result.
 */
public class CapabilityException extends Exception {

    public CapabilityException(String message) {
        super(message);
    }

    public CapabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
