package com.autonomous.socialcrew.model;

import lombok.Value;

/**
 * Null fields match everything.
 */
@Value
public class SubscriptionFilter {
    String ownerId;
    TaskType taskType;

    public static SubscriptionFilter all() {
        return new SubscriptionFilter(null, null);
    }

    public static SubscriptionFilter forOwner(String ownerId) {
        return new SubscriptionFilter(ownerId, null);
    }

    public boolean matches(TaskEvent event) {
        if (ownerId != null && !ownerId.equals(event.getOwnerId())) {
            return false;
        }
        return taskType == null || taskType == event.getTaskType();
    }
}
