package com.autonomous.socialcrew.agent;

import com.autonomous.socialcrew.exception.CapabilityException;
import com.autonomous.socialcrew.model.AgentRole;
import com.autonomous.socialcrew.model.TaskType;

import java.util.Map;
import java.util.Set;

/**
 * What an agent can do. Implementations are discovered as beans and registered at startup.
 */
public interface AgentCapability {

    AgentRole role();

    Set<TaskType> acceptedTaskTypes();

    /**
     * Produces the result for one task. Long running implementations should call
     * {@link AgentInvocation#checkpoint()} between steps so cancellation is observed.
     */
    Map<String, Object> execute(AgentInvocation invocation) throws CapabilityException, InterruptedException;

    default boolean isHealthy() {
        return true;
    }
}
