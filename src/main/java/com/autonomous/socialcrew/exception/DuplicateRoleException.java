package com.autonomous.socialcrew.exception;

public class DuplicateRoleException extends CrewException {

    public DuplicateRoleException(String message) {
        super(message);
    }
}
