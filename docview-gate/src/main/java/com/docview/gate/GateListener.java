package com.docview.gate;

/**
 * Receives gate events. All callbacks run on the gate thread, so they must return quickly.
 */
public interface GateListener {

    default void taskStarted(String taskName) {
    }

    /**
     * @param success {@code false} when the task's stage completed exceptionally
     */
    default void taskCompleted(String taskName, boolean success) {
    }

    /**
     * The task overran the watchdog. No {@link #taskCompleted} follows for this run.
     */
    default void taskTimedOut(String taskName) {
    }

    default void queueLengthChanged(int length) {
    }

    default void queueLengthWarning(int length) {
    }

    default void taskRejected(String taskName) {
    }
}
