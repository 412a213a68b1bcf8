package com.autonomous.socialcrew.service;

import com.autonomous.socialcrew.model.Task;
import com.autonomous.socialcrew.model.TaskEvent;

/**
 * Notified by the task store inside the same critical section that applied the change,
 * so every stored transition is seen by listeners in per-task order.
 */
public interface TaskTransitionListener {

    void onTaskEvent(Task snapshot, TaskEvent event);
}
