package com.autonomous.socialcrew.agent;

import com.autonomous.socialcrew.model.AgentRole;
import com.autonomous.socialcrew.model.TaskType;
import lombok.Value;

import java.time.Duration;
import java.util.Set;

@Value
public class AgentDescriptor {
    AgentRole role;
    Set<TaskType> acceptedTaskTypes;
    AgentCapability capability;
    String description;

    // Null means the orchestrator-wide timeout applies
    Duration timeout;
}
