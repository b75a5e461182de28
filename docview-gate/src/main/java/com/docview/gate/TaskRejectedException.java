package com.docview.gate;

/**
 * The gate's queue was full when the task was admitted.
 */
public class TaskRejectedException extends RuntimeException {

    private final String taskName;

    public TaskRejectedException(String taskName, int maxQueueSize) {
        super("Task '" + taskName + "' rejected: queue already holds " + maxQueueSize + " tasks");
        this.taskName = taskName;
    }

    public String taskName() {
        return taskName;
    }
}
