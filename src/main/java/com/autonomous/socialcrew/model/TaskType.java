package com.autonomous.socialcrew.model;

import com.autonomous.socialcrew.exception.InvalidRequestException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskType {
    CONTENT_GENERATION("content_generation"),
    TREND_ANALYSIS("trend_analysis"),
    VIDEO_PLANNING("video_planning"),
    SCRIPT_WRITING("script_writing");

    private final String wireName;

    TaskType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static TaskType fromWireName(String value) {
        for (TaskType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new InvalidRequestException("Unknown task type: " + value);
    }
}
