package com.autonomous.socialcrew.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One state change of one task. Creation is published with a null {@code oldState}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskEvent {
    private String taskId;
    private String ownerId;
    private TaskType taskType;
    private AgentRole agentRole;
    private TaskState oldState;
    private TaskState newState;
    private long sequence;
    private Instant timestamp;

    public static TaskEvent of(Task task, TaskState oldState) {
        return TaskEvent.builder()
            .taskId(task.getId())
            .ownerId(task.getOwnerId())
            .taskType(task.getType())
            .agentRole(task.getAgentRole())
            .oldState(oldState)
            .newState(task.getState())
            .sequence(task.getEventSequence())
            .timestamp(Instant.now())
            .build();
    }
}
