package com.autonomous.socialcrew.model;

import lombok.Value;

import java.util.List;

/**
 * Tasks planned for one request, in creation order. Edges live in each task's dependencies.
 */
@Value
public class TaskGraph {
    List<Task> tasks;

    public TaskGraph(List<Task> tasks) {
        this.tasks = List.copyOf(tasks);
    }

    public List<String> rootTaskIds() {
        return tasks.stream()
            .filter(task -> task.getDependencies().isEmpty())
            .map(Task::getId)
            .toList();
    }

    public List<String> taskIds() {
        return tasks.stream().map(Task::getId).toList();
    }
}
