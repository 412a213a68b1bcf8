package com.autonomous.socialcrew.service;

import com.autonomous.socialcrew.agent.AgentDescriptor;
import com.autonomous.socialcrew.agent.AgentInvocation;
import com.autonomous.socialcrew.exception.AlreadyTerminalException;
import com.autonomous.socialcrew.exception.CapabilityException;
import com.autonomous.socialcrew.exception.InvalidTransitionException;
import com.autonomous.socialcrew.model.AgentRole;
import com.autonomous.socialcrew.model.AgentStatus;
import com.autonomous.socialcrew.model.ErrorKind;
import com.autonomous.socialcrew.model.Task;
import com.autonomous.socialcrew.model.TaskError;
import com.autonomous.socialcrew.model.TaskGraph;
import com.autonomous.socialcrew.model.TaskState;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs tasks against their agents in the background.
 *
 * <p>At most {@code orchestrator.concurrency} tasks run at once. When a slot frees up the
 * oldest pending task whose dependencies have all succeeded is started next. Every state
 * change is written through the {@link TaskStore}; this class keeps no task state of its own
 * beyond the queue of ids and the slots in use.
 */
@Slf4j
@Service
public class TaskExecutorService {

    @Value("${orchestrator.concurrency:4}")
    private int concurrency = 4;

    @Value("${orchestrator.task-timeout-ms:300000}")
    private long taskTimeoutMs = 300_000;

    private final TaskStore taskStore;
    private final AgentRegistry agentRegistry;

    // creation order -> task id, guarded by schedulerLock
    private final NavigableMap<Long, String> pendingQueue = new TreeMap<>();
    private final Object schedulerLock = new Object();

    private final Map<String, RunningTask> runningTasks = new ConcurrentHashMap<>();
    private final Map<AgentRole, AgentActivity> activity = new ConcurrentHashMap<>();
    private final ExecutorService executor = Executors.newCachedThreadPool();

    public TaskExecutorService(TaskStore taskStore, AgentRegistry agentRegistry) {
        this.taskStore = taskStore;
        this.agentRegistry = agentRegistry;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public void setTaskTimeout(Duration timeout) {
        this.taskTimeoutMs = timeout.toMillis();
    }

    /**
     * Queues every task of the graph and returns without waiting for any of them.
     */
    public void submit(TaskGraph graph) {
        synchronized (schedulerLock) {
            for (String taskId : graph.taskIds()) {
                Task task = taskStore.get(taskId);
                if (task.getState() == TaskState.PENDING) {
                    pendingQueue.put(task.getCreationOrder(), taskId);
                }
            }
        }
        dispatchEligible();
    }

    /**
     * Cancels a task that has not finished yet, together with everything depending on it.
     * A running capability is asked to stop at its next checkpoint; it is not interrupted.
     *
     * @throws AlreadyTerminalException if the task already finished
     */
    public Task cancel(String taskId, String reason) {
        Task current = taskStore.get(taskId);
        Optional<Task> cancelled = cancelIfActive(taskId, reason);
        if (cancelled.isEmpty()) {
            throw new AlreadyTerminalException(taskId, taskStore.find(taskId).map(Task::getState).orElse(current.getState()));
        }
        cascadeCancel(taskId, "dependency " + taskId + " was cancelled");
        dispatchEligible();
        return cancelled.get();
    }

    public int runningCount() {
        return runningTasks.size();
    }

    public int queuedCount() {
        synchronized (schedulerLock) {
            return pendingQueue.size();
        }
    }

    public List<AgentStatus> agentStatuses() {
        List<AgentStatus> statuses = new ArrayList<>();
        for (AgentDescriptor descriptor : agentRegistry.descriptors()) {
            AgentActivity stats = activityOf(descriptor.getRole());
            statuses.add(AgentStatus.builder()
                .role(descriptor.getRole())
                .description(descriptor.getDescription())
                .healthy(isHealthy(descriptor))
                .activeTaskCount(stats.active.get())
                .completedTaskCount(stats.completed.get())
                .errorCount(stats.errors.get())
                .lastActivity(stats.lastActivity)
                .build());
        }
        return statuses;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private void dispatchEligible() {
        List<Task> toLaunch = new ArrayList<>();
        List<String> blocked = new ArrayList<>();

        synchronized (schedulerLock) {
            Iterator<Map.Entry<Long, String>> queued = pendingQueue.entrySet().iterator();
            while (queued.hasNext() && runningTasks.size() < concurrency) {
                String taskId = queued.next().getValue();
                Optional<Task> task = taskStore.find(taskId);
                if (task.isEmpty() || task.get().getState() != TaskState.PENDING) {
                    queued.remove();
                    continue;
                }

                Readiness readiness = readiness(task.get());
                if (readiness == Readiness.WAITING) {
                    continue;
                }
                queued.remove();
                if (readiness == Readiness.BLOCKED) {
                    blocked.add(taskId);
                    continue;
                }

                // The slot is taken before the transition so a concurrent cancel can always find it
                runningTasks.put(taskId, new RunningTask(taskId, task.get().getAgentRole()));
                Optional<Task> started = taskStore.transitionIf(taskId, TaskState.PENDING, TaskState.RUNNING, t -> { });
                if (started.isPresent()) {
                    toLaunch.add(started.get());
                } else {
                    runningTasks.remove(taskId);
                }
            }
        }

        for (String taskId : blocked) {
            cancelIfActive(taskId, "a dependency did not succeed");
            cascadeCancel(taskId, "dependency " + taskId + " was cancelled");
        }
        for (Task task : toLaunch) {
            launch(task);
        }
    }

    private Readiness readiness(Task task) {
        for (String dependencyId : task.getDependencies()) {
            Optional<Task> dependency = taskStore.find(dependencyId);
            if (dependency.isEmpty()) {
                return Readiness.BLOCKED;
            }
            TaskState state = dependency.get().getState();
            if (state == TaskState.FAILED || state == TaskState.CANCELLED) {
                return Readiness.BLOCKED;
            }
            if (state != TaskState.SUCCEEDED) {
                return Readiness.WAITING;
            }
        }
        return Readiness.READY;
    }

    private void launch(Task task) {
        RunningTask running = runningTasks.get(task.getId());
        AgentActivity stats = activityOf(task.getAgentRole());
        stats.active.incrementAndGet();
        stats.lastActivity = Instant.now();

        try {
            AgentDescriptor descriptor = agentRegistry.descriptor(task.getAgentRole());
            long timeoutMs = descriptor.getTimeout() != null ? descriptor.getTimeout().toMillis() : taskTimeoutMs;
            AgentInvocation invocation = AgentInvocation.builder()
                .taskId(task.getId())
                .taskType(task.getType())
                .ownerId(task.getOwnerId())
                .payload(task.getPayload())
                .dependencyResults(dependencyResults(task))
                .cancellation(running::isCancelled)
                .progressListener(percent -> taskStore.recordProgress(task.getId(), percent))
                .build();

            CompletableFuture<Map<String, Object>> outcome = new CompletableFuture<>();
            running.worker = executor.submit(() -> {
                try {
                    outcome.complete(descriptor.getCapability().execute(invocation));
                } catch (Throwable e) {
                    outcome.completeExceptionally(e);
                }
            });

            log.debug("Started task {} on {} with timeout {}ms", task.getId(), task.getAgentRole().getWireName(), timeoutMs);
            // Completion runs on the pool, not on the JDK's shared timeout thread
            outcome.orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .whenCompleteAsync((result, error) -> finish(running, result, error, timeoutMs), executor);
        } catch (RuntimeException e) {
            log.error("Could not start task {}: {}", task.getId(), e.getMessage(), e);
            finish(running, null, e, taskTimeoutMs);
        }
    }

    private void finish(RunningTask running, Map<String, Object> result, Throwable error, long timeoutMs) {
        String taskId = running.taskId;
        AgentActivity stats = activityOf(running.role);
        try {
            Throwable cause = unwrap(error);
            if (cause == null && result != null) {
                Optional<Task> succeeded = taskStore.transitionIf(taskId, TaskState.RUNNING, TaskState.SUCCEEDED,
                    t -> t.setResult(new LinkedHashMap<>(result)));
                if (succeeded.isPresent()) {
                    stats.completed.incrementAndGet();
                    log.info("Task {} ({}) succeeded", taskId, succeeded.get().getType().getWireName());
                } else {
                    log.debug("Discarding result of task {} which is no longer running", taskId);
                }
                return;
            }

            if (cause instanceof CancellationException && running.isCancelled()) {
                log.debug("Task {} stopped after cancellation", taskId);
                return;
            }

            TaskError taskError;
            if (cause instanceof TimeoutException) {
                if (running.worker != null) {
                    running.worker.cancel(true);
                }
                taskError = new TaskError(ErrorKind.TIMEOUT_ERROR, "Task timed out after " + timeoutMs + "ms");
            } else {
                taskError = new TaskError(ErrorKind.CAPABILITY_ERROR, describe(cause));
            }

            Optional<Task> failed = taskStore.transitionIf(taskId, TaskState.RUNNING, TaskState.FAILED,
                t -> t.setError(taskError));
            if (failed.isPresent()) {
                stats.errors.incrementAndGet();
                log.warn("Task {} failed with {}: {}", taskId, taskError.getKind(), taskError.getMessage());
                cascadeCancel(taskId, "dependency " + taskId + " failed");
            }
        } catch (InvalidTransitionException e) {
            log.error("Invalid transition while finishing task {}: {}", taskId, e.getMessage(), e);
        } finally {
            stats.active.decrementAndGet();
            stats.lastActivity = Instant.now();
            runningTasks.remove(taskId);
            dispatchEligible();
        }
    }

    private Optional<Task> cancelIfActive(String taskId, String reason) {
        Optional<Task> cancelled = taskStore.transitionIf(taskId, TaskState.PENDING, TaskState.CANCELLED,
            t -> t.setCancelReason(reason));
        if (cancelled.isEmpty()) {
            cancelled = taskStore.transitionIf(taskId, TaskState.RUNNING, TaskState.CANCELLED,
                t -> t.setCancelReason(reason));
            RunningTask running = runningTasks.get(taskId);
            if (cancelled.isPresent() && running != null) {
                running.cancelled = true;
            }
        }
        cancelled.ifPresent(task -> log.info("Task {} cancelled: {}", taskId, reason));
        return cancelled;
    }

    private void cascadeCancel(String rootId, String reason) {
        Deque<String> toVisit = new ArrayDeque<>(taskStore.dependentsOf(rootId));
        Set<String> visited = new HashSet<>();
        while (!toVisit.isEmpty()) {
            String dependentId = toVisit.poll();
            if (!visited.add(dependentId)) {
                continue;
            }
            cancelIfActive(dependentId, reason);
            toVisit.addAll(taskStore.dependentsOf(dependentId));
        }
    }

    private Map<String, Map<String, Object>> dependencyResults(Task task) {
        Map<String, Map<String, Object>> results = new LinkedHashMap<>();
        for (String dependencyId : task.getDependencies()) {
            taskStore.find(dependencyId)
                .filter(dependency -> dependency.getResult() != null)
                .ifPresent(dependency -> results.put(dependencyId, dependency.getResult()));
        }
        return results;
    }

    private boolean isHealthy(AgentDescriptor descriptor) {
        try {
            return descriptor.getCapability().isHealthy();
        } catch (RuntimeException e) {
            log.warn("Health check of {} failed: {}", descriptor.getRole().getWireName(), e.getMessage());
            return false;
        }
    }

    private AgentActivity activityOf(AgentRole role) {
        return activity.computeIfAbsent(role, r -> new AgentActivity());
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "Agent returned no result";
        }
        if (cause instanceof CapabilityException) {
            return cause.getMessage();
        }
        return cause.getClass().getSimpleName() + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
    }

    private enum Readiness {
        READY,
        WAITING,
        BLOCKED
    }

    private static final class RunningTask {
        private final String taskId;
        private final AgentRole role;
        private volatile boolean cancelled;
        private volatile Future<?> worker;

        private RunningTask(String taskId, AgentRole role) {
            this.taskId = taskId;
            this.role = role;
        }

        private boolean isCancelled() {
            return cancelled;
        }
    }

    private static final class AgentActivity {
        private final AtomicInteger active = new AtomicInteger();
        private final AtomicLong completed = new AtomicLong();
        private final AtomicLong errors = new AtomicLong();
        private volatile Instant lastActivity;
    }
}
