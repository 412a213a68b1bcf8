package com.autonomous.socialcrew.exception;

public class TaskNotFoundException extends CrewException {

    public TaskNotFoundException(String message) {
        super(message);
    }
}
