package com.autonomous.socialcrew.service;

import com.autonomous.socialcrew.exception.AlreadyTerminalException;
import com.autonomous.socialcrew.exception.InvalidRequestException;
import com.autonomous.socialcrew.model.AgentStatus;
import com.autonomous.socialcrew.model.ContentRequest;
import com.autonomous.socialcrew.model.SubscriptionFilter;
import com.autonomous.socialcrew.model.Task;
import com.autonomous.socialcrew.model.TaskEvent;
import com.autonomous.socialcrew.model.TaskGraph;
import com.autonomous.socialcrew.model.TaskHandle;
import com.autonomous.socialcrew.model.TaskState;
import com.autonomous.socialcrew.model.TaskStatistics;
import com.autonomous.socialcrew.model.TaskType;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for content requests: plan, persist, enqueue, and hand back the task ids
 * before any agent has run.
 */
@Slf4j
@Service
public class CoordinatorService {

    @Value("${orchestrator.retention-hours:24}")
    private long retentionHours = 24;

    @Value("${orchestrator.max-retries:3}")
    private int maxRetries = 3;

    private final Dispatcher dispatcher;
    private final TaskStore taskStore;
    private final TaskExecutorService taskExecutor;
    private final StatusBroadcaster broadcaster;

    @Autowired(required = false)
    private TaskJournal taskJournal;

    public CoordinatorService(Dispatcher dispatcher, TaskStore taskStore,
                              TaskExecutorService taskExecutor, StatusBroadcaster broadcaster) {
        this.dispatcher = dispatcher;
        this.taskStore = taskStore;
        this.taskExecutor = taskExecutor;
        this.broadcaster = broadcaster;
    }

    public void setTaskJournal(TaskJournal taskJournal) {
        this.taskJournal = taskJournal;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    @PostConstruct
    public void recover() {
        if (taskJournal == null) return;

        List<Task> journaled = taskJournal.replay();
        taskStore.restore(journaled);

        int interrupted = 0;
        for (Task task : journaled) {
            if (task.getState().isTerminal()) continue;
            if (taskStore.transitionIf(task.getId(), task.getState(), TaskState.CANCELLED,
                t -> t.setCancelReason("interrupted by restart")).isPresent()) {
                interrupted++;
            }
        }
        log.info("Recovered {} tasks from journal, {} interrupted by restart", journaled.size(), interrupted);
    }

    public TaskHandle submitRequest(ContentRequest request) {
        return admit(request, dispatcher.plan(request));
    }

    private TaskHandle admit(ContentRequest request, TaskGraph graph) {
        taskStore.persistAll(graph);
        taskExecutor.submit(graph);

        log.info("Accepted {} request for {}: {}", request.getType().getWireName(), request.getOwnerId(), graph.taskIds());
        return new TaskHandle(graph.rootTaskIds(), graph.taskIds());
    }

    public Task getStatus(String taskId) {
        return taskStore.get(taskId);
    }

    /**
     * @throws AlreadyTerminalException if the task already finished; its state is left as is
     */
    public Task cancel(String taskId) {
        try {
            return taskExecutor.cancel(taskId, "cancelled by request");
        } catch (AlreadyTerminalException e) {
            log.warn("Ignoring cancel of task {}: already {}", taskId, e.getState());
            throw e;
        }
    }

    /**
     * Submits the same request again for a task that failed or was cancelled. Retries are
     * counted from the first task of the chain, so retrying an earlier attempt does not
     * reset the budget of {@code orchestrator.max-retries}.
     */
    public synchronized TaskHandle retry(String taskId) {
        Task task = taskStore.get(taskId);
        if (task.getState() != TaskState.FAILED && task.getState() != TaskState.CANCELLED) {
            throw new InvalidRequestException(
                String.format("Task %s is %s; only failed or cancelled tasks can be retried", taskId, task.getState()));
        }

        String firstAttempt = task.getRetryOf() != null ? task.getRetryOf() : taskId;
        long attempts = taskStore.findByOwner(task.getOwnerId(), null).stream()
            .filter(t -> firstAttempt.equals(t.getRetryOf()) && t.getType() == task.getType())
            .count();
        if (attempts >= maxRetries) {
            throw new InvalidRequestException(
                String.format("Task %s was already retried %d times (limit %d)", firstAttempt, attempts, maxRetries));
        }

        ContentRequest request = ContentRequest.builder()
            .type(task.getType())
            .ownerId(task.getOwnerId())
            .payload(new HashMap<>(task.getPayload()))
            .build();
        TaskGraph graph = dispatcher.plan(request);
        int retryCount = (int) attempts + 1;
        for (Task planned : graph.getTasks()) {
            planned.setRetryOf(firstAttempt);
            planned.setRetryCount(retryCount);
        }
        log.info("Retrying task {} (attempt {} of {})", firstAttempt, retryCount, maxRetries);
        return admit(request, graph);
    }

    public List<Task> listTasks(String ownerId, TaskState state, int limit, int offset) {
        if (limit < 1 || offset < 0) {
            throw new InvalidRequestException("limit must be positive and offset non-negative");
        }
        return taskStore.findByOwner(ownerId, state).stream()
            .skip(offset)
            .limit(limit)
            .toList();
    }

    public Flux<TaskEvent> subscribe(SubscriptionFilter filter) {
        return broadcaster.subscribe(filter);
    }

    public List<AgentStatus> listAgentsStatus() {
        return taskExecutor.agentStatuses();
    }

    public TaskStatistics statistics() {
        List<Task> tasks = taskStore.findAll();
        Map<TaskState, Long> byState = new EnumMap<>(TaskState.class);
        Map<TaskType, Long> byType = new EnumMap<>(TaskType.class);
        for (TaskState state : TaskState.values()) byState.put(state, 0L);
        for (Task task : tasks) {
            byState.merge(task.getState(), 1L, Long::sum);
            byType.merge(task.getType(), 1L, Long::sum);
        }

        long finished = byState.get(TaskState.SUCCEEDED) + byState.get(TaskState.FAILED) + byState.get(TaskState.CANCELLED);
        return TaskStatistics.builder()
            .totalTasks(tasks.size())
            .stateCounts(byState)
            .typeCounts(byType)
            .runningTasks(taskExecutor.runningCount())
            .queuedTasks(taskExecutor.queuedCount())
            .successRate(finished == 0 ? 0.0 : (double) byState.get(TaskState.SUCCEEDED) / finished)
            .build();
    }

    @Scheduled(fixedDelayString = "${orchestrator.purge-interval-ms:3600000}")
    public void purgeExpiredOnSchedule() {
        purgeExpired();
    }

    public int purgeExpired() {
        Instant cutoff = Instant.now().minus(Duration.ofHours(retentionHours));
        int purged = taskStore.purgeFinishedBefore(cutoff);
        if (purged > 0) {
            log.info("Purged {} tasks finished before {}", purged, cutoff);
        }
        return purged;
    }
}
