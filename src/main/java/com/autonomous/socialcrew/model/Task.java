package com.autonomous.socialcrew.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Task {
    private String id;
    private TaskType type;
    private String ownerId;
    private AgentRole agentRole;
    private TaskState state;
    private Map<String, Object> payload;
    private Map<String, Object> result;
    private TaskError error;
    private String cancelReason;
    private Instant createdAt;
    private Instant startedAt;
    private Instant finishedAt;
    @Builder.Default
    private List<String> dependencies = new ArrayList<>();

    // 0..100 while running, reported by the agent; not a state change
    private int progress;

    // Set on tasks created by a retry: the task the retries started from, and which attempt this is
    private String retryOf;
    private int retryCount;

    // Store bookkeeping: FIFO position and per-task event counter
    private long creationOrder;
    private long eventSequence;

    /**
     * Detached copy safe to hand out of the store.
     */
    public Task snapshot() {
        return toBuilder()
            .payload(immutableCopy(payload))
            .result(immutableCopy(result))
            .error(error == null ? null : new TaskError(error.getKind(), error.getMessage()))
            .dependencies(dependencies == null ? new ArrayList<>() : new ArrayList<>(dependencies))
            .build();
    }

    /**
     * Deep copy in which every nested map and list is unmodifiable. Null entries are kept.
     */
    public static Map<String, Object> immutableCopy(Map<String, Object> map) {
        if (map == null) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(key, immutableValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object immutableValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(key, immutableValue(nested)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object nested : collection) {
                copy.add(immutableValue(nested));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
