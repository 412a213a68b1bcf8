package com.autonomous.socialcrew.exception;

/**
 * Base of all errors the coordinator reports synchronously to its callers.
 */
public abstract class CrewException extends RuntimeException {

    protected CrewException(String message) {
        super(message);
    }
}
