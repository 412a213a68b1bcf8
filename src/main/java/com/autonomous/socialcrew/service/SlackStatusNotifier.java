package com.autonomous.socialcrew.service;

import com.autonomous.socialcrew.model.SubscriptionFilter;
import com.autonomous.socialcrew.model.Task;
import com.autonomous.socialcrew.model.TaskEvent;
import com.autonomous.socialcrew.model.TaskState;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;

/**
 * Relays finished tasks to a Slack channel. Disabled while {@code slack.notify.channel} is blank.
 */
@Slf4j
@Service
public class SlackStatusNotifier {

    @Value("${slack.notify.channel:}")
    private String notifyChannel;

    private final StatusBroadcaster broadcaster;
    private final TaskStore taskStore;
    private final SlackService slackService;

    private volatile Disposable subscription;

    public SlackStatusNotifier(StatusBroadcaster broadcaster, TaskStore taskStore, SlackService slackService) {
        this.broadcaster = broadcaster;
        this.taskStore = taskStore;
        this.slackService = slackService;
    }

    public void setNotifyChannel(String channel) {
        this.notifyChannel = channel;
    }

    @PostConstruct
    public void start() {
        if (notifyChannel == null || notifyChannel.isBlank()) {
            log.info("Slack status relay disabled");
            return;
        }
        subscription = broadcaster.subscribe(SubscriptionFilter.all())
            .filter(event -> event.getNewState().isTerminal())
            .subscribe(this::relay, error -> {
                log.warn("Slack status relay lost its subscription: {}; re-subscribing", error.getMessage());
                start();
            });
        log.info("Relaying task status to Slack channel {}", notifyChannel);
    }

    @PreDestroy
    public void stop() {
        Disposable current = subscription;
        if (current != null) {
            current.dispose();
        }
    }

    public void relay(TaskEvent event) {
        slackService.postMessage(notifyChannel, formatEvent(event));
    }

    public String formatEvent(TaskEvent event) {
        StringBuilder message = new StringBuilder();
        message.append(String.format("*%s* task `%s` for %s: *%s*",
            event.getTaskType().getWireName(), event.getTaskId(), event.getOwnerId(),
            event.getNewState().name().toLowerCase()));

        if (event.getNewState() == TaskState.FAILED || event.getNewState() == TaskState.CANCELLED) {
            taskStore.find(event.getTaskId()).ifPresent(task -> message.append("\n").append(reasonOf(task)));
        }
        return message.toString();
    }

    private String reasonOf(Task task) {
        if (task.getError() != null) {
            return String.format("*Error:* %s (%s)", task.getError().getMessage(), task.getError().getKind());
        }
        return "*Reason:* " + task.getCancelReason();
    }
}
