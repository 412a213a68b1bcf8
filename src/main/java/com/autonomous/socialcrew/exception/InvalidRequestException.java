package com.autonomous.socialcrew.exception;

public class InvalidRequestException extends CrewException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
