package com.autonomous.socialcrew.exception;

public class InvalidTransitionException extends CrewException {

    public InvalidTransitionException(String message) {
        super(message);
    }
}
