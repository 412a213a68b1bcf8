package com.autonomous.socialcrew.service;

import com.autonomous.socialcrew.model.AgentRole;
import com.autonomous.socialcrew.model.ErrorKind;
import com.autonomous.socialcrew.model.Task;
import com.autonomous.socialcrew.model.TaskError;
import com.autonomous.socialcrew.model.TaskEvent;
import com.autonomous.socialcrew.model.TaskState;
import com.autonomous.socialcrew.model.TaskType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SlackStatusNotifierTest {

    @Mock
    private SlackService slackService;

    @Mock
    private TaskStore taskStore;

    private StatusBroadcaster broadcaster;
    private SlackStatusNotifier notifier;

    @BeforeEach
    void setUp() {
        broadcaster = new StatusBroadcaster();
        notifier = new SlackStatusNotifier(broadcaster, taskStore, slackService);
    }

    @AfterEach
    void tearDown() {
        notifier.stop();
        broadcaster.shutdown();
    }

    private TaskEvent event(TaskState oldState, TaskState newState) {
        return TaskEvent.builder()
            .taskId("task-42")
            .ownerId("alice")
            .taskType(TaskType.VIDEO_PLANNING)
            .agentRole(AgentRole.VIDEO_CREATOR)
            .oldState(oldState)
            .newState(newState)
            .sequence(3)
            .timestamp(Instant.now())
            .build();
    }

    @Test
    void shouldFormatSucceededTask() {
        String message = notifier.formatEvent(event(TaskState.RUNNING, TaskState.SUCCEEDED));

        assertEquals("*video_planning* task `task-42` for alice: *succeeded*", message);
        verifyNoInteractions(taskStore);
    }

    @Test
    void shouldIncludeErrorOfFailedTask() {
        Task failed = Task.builder().id("task-42").state(TaskState.FAILED)
            .error(new TaskError(ErrorKind.TIMEOUT_ERROR, "Task timed out after 300000ms")).build();
        when(taskStore.find("task-42")).thenReturn(Optional.of(failed));

        String message = notifier.formatEvent(event(TaskState.RUNNING, TaskState.FAILED));

        assertTrue(message.contains("*failed*"));
        assertTrue(message.contains("Task timed out after 300000ms (TIMEOUT_ERROR)"));
    }

    @Test
    void shouldIncludeCancelReason() {
        Task cancelled = Task.builder().id("task-42").state(TaskState.CANCELLED).cancelReason("cancelled by request").build();
        when(taskStore.find("task-42")).thenReturn(Optional.of(cancelled));

        String message = notifier.formatEvent(event(TaskState.PENDING, TaskState.CANCELLED));

        assertTrue(message.endsWith("*Reason:* cancelled by request"));
    }

    @Test
    void shouldStayIdleWithoutChannel() {
        notifier.setNotifyChannel("");
        notifier.start();

        broadcaster.publish(event(TaskState.RUNNING, TaskState.SUCCEEDED));

        assertEquals(0, broadcaster.subscriberCount());
        verifyNoInteractions(slackService);
    }

    @Test
    void shouldRelayOnlyTerminalEvents() {
        notifier.setNotifyChannel("C0STATUS");
        notifier.start();

        broadcaster.publish(event(null, TaskState.PENDING));
        broadcaster.publish(event(TaskState.PENDING, TaskState.RUNNING));
        broadcaster.publish(event(TaskState.RUNNING, TaskState.SUCCEEDED));

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
            verify(slackService).postMessage(eq("C0STATUS"), contains("*succeeded*")));
        verify(slackService, times(1)).postMessage(anyString(), anyString());
    }
}
