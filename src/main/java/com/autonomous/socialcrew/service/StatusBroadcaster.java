package com.autonomous.socialcrew.service;

import com.autonomous.socialcrew.exception.SubscriberOverflowException;
import com.autonomous.socialcrew.model.SubscriptionFilter;
import com.autonomous.socialcrew.model.Task;
import com.autonomous.socialcrew.model.TaskEvent;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans task events out to subscribers.
 *
 * <p>Each subscriber gets its own bounded buffer. Publishing never waits on a subscriber:
 * when a buffer is full the subscriber is dropped and receives a
 * {@link SubscriberOverflowException} after the events it already buffered. Events of one
 * task reach a subscriber in publication order; nothing is promised across tasks.
 */
@Slf4j
@Service
public class StatusBroadcaster implements TaskTransitionListener {

    @Value("${orchestrator.subscriber-buffer:256}")
    private int bufferSize = 256;

    private final Map<Long, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final AtomicLong subscriptionIds = new AtomicLong();

    public void setBufferSize(int bufferSize) {
        this.bufferSize = bufferSize;
    }

    /**
     * Lazy stream of matching events, starting when subscribed and ending when cancelled
     * or dropped.
     */
    public Flux<TaskEvent> subscribe(SubscriptionFilter filter) {
        SubscriptionFilter effective = filter == null ? SubscriptionFilter.all() : filter;
        return Flux.defer(() -> {
            Subscription subscription = new Subscription(subscriptionIds.incrementAndGet(), effective,
                Sinks.many().unicast().onBackpressureBuffer(new ArrayBlockingQueue<>(bufferSize)));
            subscriptions.put(subscription.id, subscription);
            log.debug("Subscriber {} attached with {}", subscription.id, effective);

            return subscription.sink.asFlux()
                .doFinally(signal -> {
                    subscriptions.remove(subscription.id);
                    log.debug("Subscriber {} detached ({})", subscription.id, signal);
                })
                .publishOn(Schedulers.boundedElastic(), 1);
        });
    }

    public void publish(TaskEvent event) {
        for (Subscription subscription : subscriptions.values()) {
            if (!subscription.filter.matches(event)) {
                continue;
            }
            synchronized (subscription) {
                if (subscription.dropped) {
                    continue;
                }
                Sinks.EmitResult result = subscription.sink.tryEmitNext(event);
                if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
                    drop(subscription);
                } else if (result.isFailure()) {
                    subscription.dropped = true;
                    subscriptions.remove(subscription.id);
                }
            }
        }
    }

    @Override
    public void onTaskEvent(Task snapshot, TaskEvent event) {
        publish(event);
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    @PreDestroy
    public void shutdown() {
        for (Subscription subscription : subscriptions.values()) {
            synchronized (subscription) {
                subscription.dropped = true;
                subscription.sink.tryEmitComplete();
            }
        }
        subscriptions.clear();
    }

    private void drop(Subscription subscription) {
        subscription.dropped = true;
        subscriptions.remove(subscription.id);
        subscription.sink.tryEmitError(new SubscriberOverflowException(bufferSize));
        log.warn("Dropped subscriber {} after its buffer of {} events overflowed", subscription.id, bufferSize);
    }

    private static final class Subscription {
        private final long id;
        private final SubscriptionFilter filter;
        private final Sinks.Many<TaskEvent> sink;
        private boolean dropped;

        private Subscription(long id, SubscriptionFilter filter, Sinks.Many<TaskEvent> sink) {
            this.id = id;
            this.filter = filter;
            this.sink = sink;
        }
    }
}
