package com.agentboard.core.store;

import com.agentboard.core.BoardException;

/**
 * Thrown when no status directory holds a record for the requested task id.
 */
public class TaskNotFoundException extends BoardException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("Task " + taskId + " not found");
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
