package com.autonomous.socialcrew.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskStatistics {
    private long totalTasks;
    private Map<TaskState, Long> stateCounts;
    private Map<TaskType, Long> typeCounts;
    private int runningTasks;
    private int queuedTasks;
    private double successRate;
}
