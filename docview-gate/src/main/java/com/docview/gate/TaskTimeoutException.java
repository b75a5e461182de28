package com.docview.gate;

/**
 * The task did not complete within the gate's watchdog timeout.
 */
public class TaskTimeoutException extends RuntimeException {

    private final String taskName;
    private final long timeoutMs;

    public TaskTimeoutException(String taskName, long timeoutMs) {
        super("Task '" + taskName + "' timed out after " + timeoutMs + " ms");
        this.taskName = taskName;
        this.timeoutMs = timeoutMs;
    }

    public String taskName() {
        return taskName;
    }

    public long timeoutMs() {
        return timeoutMs;
    }
}
