package com.autonomous.socialcrew.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentStatus {
    private AgentRole role;
    private String description;
    private boolean healthy;
    private int activeTaskCount;
    private long completedTaskCount;
    private long errorCount;
    private Instant lastActivity;
}
