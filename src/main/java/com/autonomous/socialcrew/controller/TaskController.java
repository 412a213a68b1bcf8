package com.autonomous.socialcrew.controller;

import com.autonomous.socialcrew.model.AgentStatus;
import com.autonomous.socialcrew.model.ContentRequest;
import com.autonomous.socialcrew.model.SubscriptionFilter;
import com.autonomous.socialcrew.model.Task;
import com.autonomous.socialcrew.model.TaskEvent;
import com.autonomous.socialcrew.model.TaskHandle;
import com.autonomous.socialcrew.model.TaskState;
import com.autonomous.socialcrew.model.TaskStatistics;
import com.autonomous.socialcrew.model.TaskType;
import com.autonomous.socialcrew.service.CoordinatorService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class TaskController {

    @Autowired
    private CoordinatorService coordinator;

    @PostMapping("/requests")
    public ResponseEntity<TaskHandle> submitRequest(@RequestBody ContentRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(coordinator.submitRequest(request));
    }

    @GetMapping("/tasks/{taskId}")
    public Task getStatus(@PathVariable String taskId) {
        return coordinator.getStatus(taskId);
    }

    @GetMapping("/tasks")
    public Map<String, Object> listTasks(@RequestParam String owner,
                                         @RequestParam(required = false) TaskState state,
                                         @RequestParam(defaultValue = "10") int limit,
                                         @RequestParam(defaultValue = "0") int offset) {
        List<Task> tasks = coordinator.listTasks(owner, state, limit, offset);
        return Map.of("tasks", tasks, "count", tasks.size());
    }

    @DeleteMapping("/tasks/{taskId}")
    public Map<String, Object> cancel(@PathVariable String taskId) {
        Task task = coordinator.cancel(taskId);
        return Map.of("task_id", task.getId(), "state", task.getState());
    }

    @PostMapping("/tasks/{taskId}/retry")
    public ResponseEntity<TaskHandle> retry(@PathVariable String taskId) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(coordinator.retry(taskId));
    }

    @GetMapping("/tasks/stats")
    public TaskStatistics statistics() {
        return coordinator.statistics();
    }

    @GetMapping("/agents/status")
    public List<AgentStatus> agentsStatus() {
        return coordinator.listAgentsStatus();
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<TaskEvent> events(@RequestParam(required = false) String owner,
                                  @RequestParam(required = false) String type) {
        TaskType taskType = type == null ? null : TaskType.fromWireName(type);
        return coordinator.subscribe(new SubscriptionFilter(owner, taskType));
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        boolean agentsHealthy = coordinator.listAgentsStatus().stream().allMatch(AgentStatus::isHealthy);
        return ResponseEntity.ok(Map.of("status", agentsHealthy ? "healthy" : "degraded"));
    }
}
