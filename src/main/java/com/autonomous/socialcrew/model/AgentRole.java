package com.autonomous.socialcrew.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The closed set of specialist agents the coordinator delegates to.
 */
public enum AgentRole {
    CONTENT_WRITER("content_writer"),
    TRAFFIC_ANALYST("traffic_analyst"),
    VIDEO_CREATOR("video_creator"),
    SCRIPT_WRITER("script_writer");

    private final String wireName;

    AgentRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static AgentRole fromWireName(String value) {
        for (AgentRole role : values()) {
            if (role.wireName.equalsIgnoreCase(value) || role.name().equalsIgnoreCase(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown agent role: " + value);
    }
}
