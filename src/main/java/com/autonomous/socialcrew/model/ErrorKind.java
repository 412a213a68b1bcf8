package com.autonomous.socialcrew.model;

public enum ErrorKind {
    TIMEOUT_ERROR,
    CAPABILITY_ERROR
}
