package com.autonomous.socialcrew.service;

import com.autonomous.socialcrew.model.Task;
import com.autonomous.socialcrew.model.TaskGraph;
import com.autonomous.socialcrew.model.TaskState;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Authoritative record of every task. Callers only ever receive detached snapshots;
 * all changes go through {@link #transition} or {@link #transitionIf}.
 */
public interface TaskStore {

    void persistAll(TaskGraph graph);

    Optional<Task> find(String taskId);

    /**
     * @throws com.autonomous.socialcrew.exception.TaskNotFoundException if the id is unknown
     */
    Task get(String taskId);

    /**
     * Tasks of one owner, newest first. A null state matches every state.
     */
    List<Task> findByOwner(String ownerId, TaskState state);

    List<Task> findAll();

    /**
     * Direct dependents of a task, in creation order.
     */
    List<String> dependentsOf(String taskId);

    /**
     * Moves a task to {@code to}. The update callback may set result, error or cancel reason
     * on a working copy; state, timestamps and sequence are maintained by the store.
     *
     * @throws com.autonomous.socialcrew.exception.InvalidTransitionException if the edge is not allowed
     */
    Task transition(String taskId, TaskState to, Consumer<Task> update);

    /**
     * Same as {@link #transition} but only when the task is currently in {@code expected};
     * otherwise nothing changes and the result is empty.
     */
    Optional<Task> transitionIf(String taskId, TaskState expected, TaskState to, Consumer<Task> update);

    /**
     * Raises the progress of a running task. Ignored for other states and for values that
     * would lower it. Progress is not a state change and publishes no event.
     */
    void recordProgress(String taskId, int percent);

    /**
     * Removes terminal tasks that finished before the cutoff.
     */
    int purgeFinishedBefore(Instant cutoff);

    /**
     * Loads previously journaled tasks without publishing events.
     */
    void restore(Collection<Task> tasks);
}
