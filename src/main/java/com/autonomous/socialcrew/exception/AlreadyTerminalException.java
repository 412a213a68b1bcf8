package com.autonomous.socialcrew.exception;

import com.autonomous.socialcrew.model.TaskState;

/**
 * Cancellation of a task that already finished. Non-fatal; the task is left untouched.
 */
public class AlreadyTerminalException extends CrewException {

    private final String taskId;
    private final TaskState state;

    public AlreadyTerminalException(String taskId, TaskState state) {
        super(String.format("Task %s is already %s", taskId, state));
        this.taskId = taskId;
        this.state = state;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskState getState() {
        return state;
    }
}
