package com.autonomous.socialcrew.service;

import com.autonomous.socialcrew.exception.InvalidRequestException;
import com.autonomous.socialcrew.model.AgentRole;
import com.autonomous.socialcrew.model.ContentRequest;
import com.autonomous.socialcrew.model.Task;
import com.autonomous.socialcrew.model.TaskGraph;
import com.autonomous.socialcrew.model.TaskState;
import com.autonomous.socialcrew.model.TaskType;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Turns a content request into the tasks that fulfil it. Has no side effects.
 */
@Service
public class Dispatcher {

    private final AgentRegistry agentRegistry;

    public Dispatcher(AgentRegistry agentRegistry) {
        this.agentRegistry = agentRegistry;
    }

    public TaskGraph plan(ContentRequest request) {
        if (request == null || request.getType() == null) {
            throw new InvalidRequestException("Request type is required");
        }
        if (request.getOwnerId() == null || request.getOwnerId().isBlank()) {
            throw new InvalidRequestException("owner_id is required");
        }

        Map<String, Object> payload = request.getPayload() == null
            ? Collections.emptyMap()
            : Task.immutableCopy(request.getPayload());
        PayloadValidator.validate(request.getType(), payload);

        AgentRole primaryRole = agentRegistry.resolve(request.getType());
        Instant now = Instant.now();

        List<Task> tasks = new ArrayList<>();
        Task primary = newTask(request.getType(), request.getOwnerId(), primaryRole, payload, List.of(), now);
        tasks.add(primary);

        // Video requests carry their script unless the caller opts out
        if (request.getType() == TaskType.VIDEO_PLANNING && !Boolean.FALSE.equals(payload.get("include_script"))) {
            AgentRole scriptRole = agentRegistry.resolve(TaskType.SCRIPT_WRITING);
            tasks.add(newTask(TaskType.SCRIPT_WRITING, request.getOwnerId(), scriptRole, payload,
                List.of(primary.getId()), now));
        }

        return new TaskGraph(tasks);
    }

    private Task newTask(TaskType type, String ownerId, AgentRole role, Map<String, Object> payload,
                         List<String> dependencies, Instant createdAt) {
        return Task.builder()
            .id(UUID.randomUUID().toString())
            .type(type)
            .ownerId(ownerId)
            .agentRole(role)
            .state(TaskState.PENDING)
            .payload(payload)
            .dependencies(new ArrayList<>(dependencies))
            .createdAt(createdAt)
            .build();
    }
}
