package com.autonomous.socialcrew.model;

import lombok.Data;

@Data
public class AgentProfile {
    private AgentRole role;
    private String description;

    // Overrides orchestrator.task-timeout-ms for this agent when set
    private Long timeoutMs;
    private boolean enabled = true;
}
