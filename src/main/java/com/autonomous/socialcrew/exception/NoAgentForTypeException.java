package com.autonomous.socialcrew.exception;

public class NoAgentForTypeException extends CrewException {

    public NoAgentForTypeException(String message) {
        super(message);
    }
}
