package com.autonomous.socialcrew.service;

import com.autonomous.socialcrew.exception.InvalidTransitionException;
import com.autonomous.socialcrew.exception.TaskNotFoundException;
import com.autonomous.socialcrew.model.Task;
import com.autonomous.socialcrew.model.TaskEvent;
import com.autonomous.socialcrew.model.TaskGraph;
import com.autonomous.socialcrew.model.TaskState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Task store kept in memory. Each task is guarded by its own monitor; there is no
 * store-wide lock, so unrelated tasks never contend.
 */
@Slf4j
@Service
public class InMemoryTaskStore implements TaskStore {

    private final List<TaskTransitionListener> listeners;

    private final Map<String, TaskRecord> records = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> tasksByOwner = new ConcurrentHashMap<>();
    private final Map<String, List<String>> dependents = new ConcurrentHashMap<>();
    private final AtomicLong creationCounter = new AtomicLong();

    public InMemoryTaskStore(List<TaskTransitionListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    @Override
    public void persistAll(TaskGraph graph) {
        List<TaskRecord> created = new ArrayList<>();
        for (Task planned : graph.getTasks()) {
            Task task = planned.snapshot();
            task.setState(TaskState.PENDING);
            task.setCreationOrder(creationCounter.incrementAndGet());
            task.setEventSequence(1);

            TaskRecord record = new TaskRecord(task);
            if (records.putIfAbsent(task.getId(), record) != null) {
                throw new IllegalStateException("Task id already stored: " + task.getId());
            }
            index(task);
            created.add(record);
        }

        for (TaskRecord record : created) {
            synchronized (record) {
                notifyListeners(record.task, null);
            }
        }
    }

    @Override
    public Optional<Task> find(String taskId) {
        TaskRecord record = taskId == null ? null : records.get(taskId);
        if (record == null) {
            return Optional.empty();
        }
        synchronized (record) {
            return Optional.of(record.task.snapshot());
        }
    }

    @Override
    public Task get(String taskId) {
        return find(taskId).orElseThrow(() -> new TaskNotFoundException("Task not found: " + taskId));
    }

    @Override
    public List<Task> findByOwner(String ownerId, TaskState state) {
        Set<String> ids = tasksByOwner.getOrDefault(ownerId, Set.of());
        return ids.stream()
            .map(this::find)
            .flatMap(Optional::stream)
            .filter(task -> state == null || task.getState() == state)
            .sorted(Comparator.comparingLong(Task::getCreationOrder).reversed())
            .toList();
    }

    @Override
    public List<Task> findAll() {
        return records.keySet().stream()
            .map(this::find)
            .flatMap(Optional::stream)
            .sorted(Comparator.comparingLong(Task::getCreationOrder))
            .toList();
    }

    @Override
    public List<String> dependentsOf(String taskId) {
        return List.copyOf(dependents.getOrDefault(taskId, List.of()));
    }

    @Override
    public Task transition(String taskId, TaskState to, Consumer<Task> update) {
        TaskRecord record = requireRecord(taskId);
        synchronized (record) {
            return apply(record, to, update);
        }
    }

    @Override
    public Optional<Task> transitionIf(String taskId, TaskState expected, TaskState to, Consumer<Task> update) {
        if (!expected.canTransitionTo(to)) {
            throw new InvalidTransitionException(String.format("%s -> %s is never allowed", expected, to));
        }
        TaskRecord record = requireRecord(taskId);
        synchronized (record) {
            if (record.task.getState() != expected) {
                return Optional.empty();
            }
            return Optional.of(apply(record, to, update));
        }
    }

    @Override
    public void recordProgress(String taskId, int percent) {
        TaskRecord record = requireRecord(taskId);
        int clamped = Math.max(0, Math.min(100, percent));
        synchronized (record) {
            Task current = record.task;
            if (current.getState() != TaskState.RUNNING || clamped <= current.getProgress()) {
                return;
            }
            Task next = current.snapshot();
            next.setProgress(clamped);
            record.task = next;
        }
        log.debug("Task {} at {}%", taskId, clamped);
    }

    @Override
    public int purgeFinishedBefore(Instant cutoff) {
        int purged = 0;
        for (TaskRecord record : records.values()) {
            Task task;
            synchronized (record) {
                task = record.task;
                if (!task.getState().isTerminal() || task.getFinishedAt() == null
                    || !task.getFinishedAt().isBefore(cutoff)) {
                    continue;
                }
            }
            records.remove(task.getId());
            unindex(task);
            purged++;
        }
        return purged;
    }

    @Override
    public void restore(Collection<Task> tasks) {
        for (Task journaled : tasks) {
            Task task = journaled.snapshot();
            records.put(task.getId(), new TaskRecord(task));
            index(task);
            creationCounter.accumulateAndGet(task.getCreationOrder(), Math::max);
        }
    }

    private Task apply(TaskRecord record, TaskState to, Consumer<Task> update) {
        Task current = record.task;
        TaskState from = current.getState();
        if (!from.canTransitionTo(to)) {
            throw new InvalidTransitionException(
                String.format("Task %s cannot move from %s to %s", current.getId(), from, to));
        }

        Task updated = current.snapshot();
        update.accept(updated);
        // the update may hand over maps the caller still holds
        Task next = updated.snapshot();
        if (!Objects.equals(current.getPayload(), next.getPayload())) {
            throw new InvalidTransitionException("Task " + current.getId() + ": payload is immutable");
        }
        checkOutcome(current, next, to);

        Instant now = Instant.now();
        next.setState(to);
        next.setEventSequence(current.getEventSequence() + 1);
        if (to == TaskState.RUNNING) {
            next.setStartedAt(now);
        }
        if (to.isTerminal()) {
            next.setFinishedAt(now);
        }
        if (to == TaskState.SUCCEEDED) {
            next.setProgress(100);
        }

        record.task = next;
        log.debug("Task {} {} -> {}", next.getId(), from, to);
        notifyListeners(next, from);
        return next.snapshot();
    }

    // result and error are write-once and only accompany SUCCEEDED and FAILED respectively
    private void checkOutcome(Task current, Task next, TaskState to) {
        boolean resultOk = to == TaskState.SUCCEEDED
            ? next.getResult() != null
            : Objects.equals(current.getResult(), next.getResult());
        boolean errorOk = to == TaskState.FAILED
            ? next.getError() != null
            : Objects.equals(current.getError(), next.getError());
        if (!resultOk || !errorOk || (next.getResult() != null && next.getError() != null)) {
            throw new InvalidTransitionException(
                String.format("Task %s: %s requires %s", current.getId(), to,
                    to == TaskState.SUCCEEDED ? "a result" : to == TaskState.FAILED ? "an error" : "no outcome"));
        }
    }

    private void notifyListeners(Task task, TaskState oldState) {
        TaskEvent event = TaskEvent.of(task, oldState);
        Task snapshot = task.snapshot();
        for (TaskTransitionListener listener : listeners) {
            try {
                listener.onTaskEvent(snapshot, event);
            } catch (RuntimeException e) {
                log.error("Listener {} failed for task {}: {}",
                    listener.getClass().getSimpleName(), task.getId(), e.getMessage(), e);
            }
        }
    }

    // Index maps are only changed through compute so an emptied entry is never removed under a concurrent add
    private void index(Task task) {
        tasksByOwner.compute(task.getOwnerId(), (owner, ids) -> {
            Set<String> owned = ids == null ? ConcurrentHashMap.newKeySet() : ids;
            owned.add(task.getId());
            return owned;
        });
        for (String dependency : task.getDependencies()) {
            dependents.compute(dependency, (id, ids) -> {
                List<String> waiting = ids == null ? new CopyOnWriteArrayList<>() : ids;
                waiting.add(task.getId());
                return waiting;
            });
        }
    }

    private void unindex(Task task) {
        tasksByOwner.computeIfPresent(task.getOwnerId(), (owner, ids) -> {
            ids.remove(task.getId());
            return ids.isEmpty() ? null : ids;
        });
        for (String dependency : task.getDependencies()) {
            dependents.computeIfPresent(dependency, (id, ids) -> {
                ids.remove(task.getId());
                return ids.isEmpty() ? null : ids;
            });
        }
        dependents.remove(task.getId());
    }

    int indexedOwnerCount() {
        return tasksByOwner.size();
    }

    int indexedDependencyCount() {
        return dependents.size();
    }

    private TaskRecord requireRecord(String taskId) {
        TaskRecord record = records.get(taskId);
        if (record == null) {
            throw new TaskNotFoundException("Task not found: " + taskId);
        }
        return record;
    }

    private static final class TaskRecord {
        private Task task;

        private TaskRecord(Task task) {
            this.task = task;
        }
    }
}
