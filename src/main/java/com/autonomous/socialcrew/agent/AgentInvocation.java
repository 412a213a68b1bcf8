package com.autonomous.socialcrew.agent;

import com.autonomous.socialcrew.model.TaskType;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import java.util.function.IntConsumer;

/**
 * Input handed to a capability: the task payload plus the results of its dependencies.
 */
@Value
@Builder
public class AgentInvocation {
    String taskId;
    TaskType taskType;
    String ownerId;
    Map<String, Object> payload;
    @Builder.Default
    Map<String, Map<String, Object>> dependencyResults = Collections.emptyMap();
    @Builder.Default
    BooleanSupplier cancellation = () -> false;
    @Builder.Default
    IntConsumer progressListener = percent -> { };

    public boolean isCancelled() {
        return cancellation.getAsBoolean();
    }

    public void checkpoint() {
        if (isCancelled()) {
            throw new CancellationException("Task " + taskId + " was cancelled");
        }
    }

    /**
     * Reports how far the agent got, 0 to 100. Lower values than already reported are ignored.
     */
    public void reportProgress(int percent) {
        progressListener.accept(percent);
    }

    public String text(String key) {
        Object value = payload.get(key);
        return value == null ? null : value.toString();
    }
}
